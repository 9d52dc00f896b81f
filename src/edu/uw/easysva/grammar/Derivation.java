package edu.uw.easysva.grammar;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The trace of rewriting one initial tagged string.
 */
public class Derivation {
	private final TaggedString initialString;
	private final TaggedString finalString;
	private final List<DerivationStep> steps;

	Derivation(final TaggedString initialString, final TaggedString finalString, final List<DerivationStep> steps) {
		this.initialString = initialString;
		this.finalString = finalString;
		this.steps = ImmutableList.copyOf(steps);
	}

	public TaggedString getInitialString() {
		return initialString;
	}

	public TaggedString getFinalString() {
		return finalString;
	}

	public List<DerivationStep> getSteps() {
		return steps;
	}

	public int getRulesApplied() {
		return (int) steps.stream().filter(step -> step.getRule() != null).count();
	}

	/**
	 * Does the derived string carry a verb phrase with the given number feature?
	 */
	public boolean derivesVerbNumber(final String number) {
		return finalString.contains(TaggedSymbol.of(TaggedSymbol.VP, number));
	}
}
