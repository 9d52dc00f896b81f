package edu.uw.easysva.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The analysis of one clause of a compound sentence. Clauses are numbered from 1.
 */
@JsonPropertyOrder({ "clauseNumber", "text", "analysis" })
public class ClauseResult {
	private final int clauseNumber;
	private final String text;
	private final AnalysisResult analysis;

	public ClauseResult(final int clauseNumber, final String text, final AnalysisResult analysis) {
		this.clauseNumber = clauseNumber;
		this.text = text;
		this.analysis = analysis;
	}

	@JsonProperty("clauseNumber")
	public int getClauseNumber() {
		return clauseNumber;
	}

	@JsonProperty("text")
	public String getText() {
		return text;
	}

	@JsonProperty("analysis")
	public AnalysisResult getAnalysis() {
		return analysis;
	}
}
