package edu.uw.easysva.grammar;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of a derivation trace. Step 0 is the initial string and has no rule.
 */
@JsonInclude(Include.NON_NULL)
public class DerivationStep {
	private final int step;
	private final String string;
	private final String rule;
	private final String description;
	private final Integer svaRule;
	private final String production;

	private DerivationStep(final int step, final String string, final String rule, final String description,
			final Integer svaRule, final String production) {
		this.step = step;
		this.string = string;
		this.rule = rule;
		this.description = description;
		this.svaRule = svaRule;
		this.production = production;
	}

	public static DerivationStep initial(final TaggedString string) {
		return new DerivationStep(0, string.toString(), null, "Initial parse string", null, null);
	}

	public static DerivationStep rewrite(final int step, final TaggedString result, final ProductionRule rule) {
		return new DerivationStep(step, result.toString(), rule.getId(), rule.getDescription(), rule.getRuleNumber(),
				rule.getProduction());
	}

	/**
	 * A copy of this step with a new index and a prefix on its description, for merging traces of several clauses.
	 */
	public DerivationStep renumber(final int newStep, final String descriptionPrefix) {
		return new DerivationStep(newStep, string, rule, descriptionPrefix + description, svaRule, production);
	}

	@JsonProperty("step")
	public int getStep() {
		return step;
	}

	@JsonProperty("string")
	public String getString() {
		return string;
	}

	/**
	 * The id of the applied rule, or null for the initial string.
	 */
	@JsonProperty("rule")
	public String getRule() {
		return rule;
	}

	@JsonProperty("description")
	public String getDescription() {
		return description;
	}

	@JsonProperty("svaRule")
	public Integer getSvaRule() {
		return svaRule;
	}

	@JsonProperty("production")
	public String getProduction() {
		return production;
	}

	@Override
	public String toString() {
		return step + ": " + string + (rule == null ? "" : "  (" + rule + ")");
	}
}
