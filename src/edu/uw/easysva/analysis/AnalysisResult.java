package edu.uw.easysva.analysis;

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;

import edu.uw.easysva.grammar.DerivationStep;
import edu.uw.easysva.lexicon.GrammaticalNumber;

/**
 * The outcome of analysing one sentence. Single clauses and compound sentences share this shape; the compound fields
 * (isCompound, clauseCount, clauseAnalyses, originalSentence) are only set for the latter.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "status", "message", "problemSpans", "parseTree", "derivation", "csgAnalysis",
		"suggestedCorrection", "originalSentence", "isCompound", "clauseCount", "clauseAnalyses" })
public class AnalysisResult {
	static final String UNPARSABLE_MESSAGE = "Unable to parse sentence (too short or not supported).";

	private final Status status;
	private final String message;
	private final List<ProblemSpan> problemSpans;
	private final ParseTreeNode parseTree;
	private final List<DerivationStep> derivation;
	private final CsgAnalysis csgAnalysis;
	private final String suggestedCorrection;
	private final String originalSentence;
	private final List<ClauseResult> clauseAnalyses;

	private final String subject;
	private final String verb;
	private final GrammaticalNumber subjectNumber;
	private final GrammaticalNumber verbNumber;

	private AnalysisResult(final Builder builder) {
		this.status = builder.status;
		this.message = builder.message;
		this.problemSpans = ImmutableList.copyOf(builder.problemSpans);
		this.parseTree = builder.parseTree;
		this.derivation = ImmutableList.copyOf(builder.derivation);
		this.csgAnalysis = builder.csgAnalysis;
		this.suggestedCorrection = builder.suggestedCorrection;
		this.originalSentence = builder.originalSentence;
		this.clauseAnalyses = builder.clauseAnalyses == null ? null : ImmutableList.copyOf(builder.clauseAnalyses);
		this.subject = builder.subject;
		this.verb = builder.verb;
		this.subjectNumber = builder.subjectNumber;
		this.verbNumber = builder.verbNumber;
	}

	static AnalysisResult failure(final String message) {
		return new Builder(Status.ERROR, message).build();
	}

	@JsonProperty("status")
	public Status getStatus() {
		return status;
	}

	@JsonIgnore
	public boolean isOk() {
		return status == Status.OK;
	}

	@JsonProperty("message")
	public String getMessage() {
		return message;
	}

	/**
	 * Empty unless the status is error.
	 */
	@JsonProperty("problemSpans")
	public List<ProblemSpan> getProblemSpans() {
		return problemSpans;
	}

	/**
	 * Null if the sentence could not be parsed.
	 */
	@JsonProperty("parseTree")
	public ParseTreeNode getParseTree() {
		return parseTree;
	}

	@JsonProperty("derivation")
	public List<DerivationStep> getDerivation() {
		return derivation;
	}

	@JsonProperty("csgAnalysis")
	public CsgAnalysis getCsgAnalysis() {
		return csgAnalysis;
	}

	@JsonProperty("suggestedCorrection")
	public String getSuggestedCorrection() {
		return suggestedCorrection;
	}

	@JsonProperty("originalSentence")
	public String getOriginalSentence() {
		return originalSentence;
	}

	@JsonProperty("isCompound")
	@JsonInclude(Include.NON_DEFAULT)
	public boolean isCompound() {
		return clauseAnalyses != null;
	}

	@JsonProperty("clauseCount")
	public Integer getClauseCount() {
		return clauseAnalyses == null ? null : clauseAnalyses.size();
	}

	@JsonProperty("clauseAnalyses")
	public List<ClauseResult> getClauseAnalyses() {
		return clauseAnalyses;
	}

	/**
	 * The subject as displayed in messages, or null for compound sentences and unparsable input.
	 */
	@JsonIgnore
	public String getSubject() {
		return subject;
	}

	@JsonIgnore
	public String getVerb() {
		return verb;
	}

	@JsonIgnore
	public GrammaticalNumber getSubjectNumber() {
		return subjectNumber;
	}

	@JsonIgnore
	public GrammaticalNumber getVerbNumber() {
		return verbNumber;
	}

	@Override
	public String toString() {
		return status + ": " + message;
	}

	static class Builder {
		private final Status status;
		private final String message;
		private List<ProblemSpan> problemSpans = Collections.emptyList();
		private ParseTreeNode parseTree;
		private List<DerivationStep> derivation = Collections.emptyList();
		private CsgAnalysis csgAnalysis;
		private String suggestedCorrection;
		private String originalSentence;
		private List<ClauseResult> clauseAnalyses;
		private String subject;
		private String verb;
		private GrammaticalNumber subjectNumber;
		private GrammaticalNumber verbNumber;

		Builder(final Status status, final String message) {
			this.status = status;
			this.message = message;
		}

		Builder problemSpans(final List<ProblemSpan> problemSpans) {
			this.problemSpans = problemSpans;
			return this;
		}

		Builder parseTree(final ParseTreeNode parseTree) {
			this.parseTree = parseTree;
			return this;
		}

		Builder derivation(final List<DerivationStep> derivation) {
			this.derivation = derivation;
			return this;
		}

		Builder csgAnalysis(final CsgAnalysis csgAnalysis) {
			this.csgAnalysis = csgAnalysis;
			return this;
		}

		Builder suggestedCorrection(final String suggestedCorrection) {
			this.suggestedCorrection = suggestedCorrection;
			return this;
		}

		Builder compound(final String originalSentence, final List<ClauseResult> clauseAnalyses) {
			this.originalSentence = originalSentence;
			this.clauseAnalyses = clauseAnalyses;
			return this;
		}

		Builder agreement(final ClauseAnalysis clause) {
			this.subject = clause.getSubjectText();
			this.verb = clause.getVerbText();
			this.subjectNumber = clause.getSubjectNumber();
			this.verbNumber = clause.getVerbNumber();
			return this;
		}

		AnalysisResult build() {
			return new AnalysisResult(this);
		}
	}
}
