package edu.uw.easysva.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import edu.uw.easysva.lexicon.GrammaticalNumber;

/**
 * Marks the subject of a clause whose verb disagrees with it.
 */
@JsonPropertyOrder({ "type", "text", "start", "end", "features", "subjectFeatures", "verbFeatures" })
public class ProblemSpan {
	private final String type;
	private final String text;
	private final int start;
	private final int end;
	private final Features subjectFeatures;
	private final Features verbFeatures;

	public ProblemSpan(final String text, final int start, final int end, final GrammaticalNumber subjectNumber,
			final GrammaticalNumber verbNumber) {
		this.type = "subject";
		this.text = text;
		this.start = start;
		this.end = end;
		this.subjectFeatures = new Features(subjectNumber);
		this.verbFeatures = new Features(verbNumber);
	}

	/**
	 * The same span moved by a number of characters, e.g. from clause offsets to sentence offsets.
	 */
	ProblemSpan shift(final int offset) {
		return offset == 0 ? this
				: new ProblemSpan(text, start + offset, end + offset, subjectFeatures.getNumber(),
						verbFeatures.getNumber());
	}

	@JsonProperty("type")
	public String getType() {
		return type;
	}

	@JsonProperty("text")
	public String getText() {
		return text;
	}

	@JsonProperty("start")
	public int getStart() {
		return start;
	}

	@JsonProperty("end")
	public int getEnd() {
		return end;
	}

	/**
	 * The features of the marked span itself, i.e. of the subject.
	 */
	@JsonProperty("features")
	public Features getFeatures() {
		return subjectFeatures;
	}

	@JsonProperty("subjectFeatures")
	public Features getSubjectFeatures() {
		return subjectFeatures;
	}

	@JsonProperty("verbFeatures")
	public Features getVerbFeatures() {
		return verbFeatures;
	}
}
