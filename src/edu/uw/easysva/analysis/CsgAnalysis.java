package edu.uw.easysva.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import edu.uw.easysva.grammar.Derivation;

/**
 * Summary of the derivation run for a single clause.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "initialString", "finalString", "expectedString", "rulesApplied", "derivedAgreement" })
public class CsgAnalysis {
	private final String initialString;
	private final String finalString;
	private final String expectedString;
	private final int rulesApplied;
	private final boolean derivedAgreement;

	CsgAnalysis(final Derivation derivation, final String expectedString, final boolean derivedAgreement) {
		this.initialString = derivation.getInitialString().toString();
		this.finalString = derivation.getFinalString().toString();
		this.expectedString = expectedString;
		this.rulesApplied = derivation.getRulesApplied();
		this.derivedAgreement = derivedAgreement;
	}

	@JsonProperty("initialString")
	public String getInitialString() {
		return initialString;
	}

	@JsonProperty("finalString")
	public String getFinalString() {
		return finalString;
	}

	/**
	 * NP[n] VP[n] for the subject's number; only present when the clause disagrees.
	 */
	@JsonProperty("expectedString")
	public String getExpectedString() {
		return expectedString;
	}

	@JsonProperty("rulesApplied")
	public int getRulesApplied() {
		return rulesApplied;
	}

	/**
	 * Whether the derived string carries a verb phrase with the subject's number.
	 */
	@JsonProperty("derivedAgreement")
	public boolean isDerivedAgreement() {
		return derivedAgreement;
	}
}
