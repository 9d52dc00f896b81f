package edu.uw.easysva.grammar;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The fixed, ordered rule table for subject-verb agreement. Each rule propagates the number a subject imposes onto
 * the verb phrase that follows it.
 */
public class ProductionRules {

	private ProductionRules() {
	}

	private static final TaggedSymbol ANY_VP = TaggedSymbol.of(TaggedSymbol.VP, TaggedSymbol.WILDCARD_FEATURE);
	private static final TaggedSymbol SINGULAR_VP = TaggedSymbol.of(TaggedSymbol.VP, "singular");
	private static final TaggedSymbol PLURAL_VP = TaggedSymbol.of(TaggedSymbol.VP, "plural");

	public final static List<ProductionRule> STANDARD_RULES = ImmutableList.of(
			// Rule 1: basic agreement
			subjectRule("R1.1", np("singular"), SINGULAR_VP, "Singular subject requires singular verb", 1),
			subjectRule("R1.2", np("plural"), PLURAL_VP, "Plural subject requires plural verb", 1),
			// Rule 2: "I" and "you" take the plural form
			subjectRule("R2.1", np("i"), PLURAL_VP, "Pronoun 'I' takes plural verb form", 2),
			subjectRule("R2.2", np("you"), PLURAL_VP, "Pronoun 'you' takes plural verb form", 2),
			// Rule 3: X and Y
			subjectRule("R3", np("compound", "and", TaggedSymbol.WILDCARD_FEATURE), PLURAL_VP,
					"Subjects joined by 'and' require plural verb", 3),
			// Rule 4: X or/nor Y agree with Y
			subjectRule("R4.1", np("compound", "or", "singular"), SINGULAR_VP,
					"With 'or', verb agrees with nearest (singular) subject", 4),
			subjectRule("R4.2", np("compound", "or", "plural"), PLURAL_VP,
					"With 'or', verb agrees with nearest (plural) subject", 4),
			subjectRule("R4.3", np("compound", "nor", "singular"), SINGULAR_VP,
					"With 'nor', verb agrees with nearest (singular) subject", 4),
			subjectRule("R4.4", np("compound", "nor", "plural"), PLURAL_VP,
					"With 'nor', verb agrees with nearest (plural) subject", 4),
			subjectRule("R5", np("indefinite"), SINGULAR_VP,
					"Indefinite pronouns (everyone, somebody, each) take singular verbs", 5),
			subjectRule("R6", np("collective"), SINGULAR_VP,
					"Collective nouns (team, group, class) take singular verbs", 6),
			subjectRule("R8", np("unit"), SINGULAR_VP, "Amounts, time, and money expressions take singular verbs", 8),
			subjectRule("R9", np("singular_plural"), SINGULAR_VP,
					"Titles, countries, and special subjects (mathematics, Philippines) take singular verbs", 9));

	public static ProductionRule fromId(final String id) {
		for (final ProductionRule rule : STANDARD_RULES) {
			if (rule.getId().equals(id)) {
				return rule;
			}
		}
		throw new IllegalArgumentException("Unknown rule: " + id);
	}

	/**
	 * NP[...] VP[X] → NP[...] VP[number]
	 */
	private static ProductionRule subjectRule(final String id, final TaggedSymbol subject, final TaggedSymbol verb,
			final String description, final int ruleNumber) {
		return new ProductionRule(id, ImmutableList.of(subject), ANY_VP, Collections.emptyList(),
				ImmutableList.of(verb), description, ruleNumber);
	}

	private static TaggedSymbol np(final String... features) {
		return TaggedSymbol.of(TaggedSymbol.NP, features);
	}
}
