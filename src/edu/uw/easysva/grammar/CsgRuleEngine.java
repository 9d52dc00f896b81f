package edu.uw.easysva.grammar;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import edu.uw.easysva.lexicon.GrammaticalNumber;
import edu.uw.easysva.lexicon.NounClass;
import edu.uw.easysva.lexicon.NounClassification;
import edu.uw.easysva.syntax.CompoundInfo;

/**
 * Rewrites tagged strings with an ordered table of context-sensitive rules.
 *
 * A derivation performs a single rewrite: the first rule in table order that matches at any position is applied once
 * and the derivation stops. The trace explains the agreement decision; it does not make it.
 */
public class CsgRuleEngine {
	private static final Logger LOG = LoggerFactory.getLogger(CsgRuleEngine.class);

	private final List<ProductionRule> rules;

	public CsgRuleEngine() {
		this(ProductionRules.STANDARD_RULES);
	}

	public CsgRuleEngine(final List<ProductionRule> rules) {
		this.rules = ImmutableList.copyOf(rules);
	}

	/**
	 * Builds NP[...] VP[...] for a clause. Compound subjects become NP[compound+coordinator+number], "I" and "you"
	 * keep their own word as the feature, regular nouns use their number and everything else its noun class.
	 */
	public static TaggedString buildInitialString(final String subject, final NounClassification subjectClass,
			final GrammaticalNumber verbNumber, final CompoundInfo compound) {
		final TaggedSymbol np;
		if (compound != null) {
			np = TaggedSymbol.of(TaggedSymbol.NP, NounClass.COMPOUND.toString(), compound.getCoordinator().toString(),
					compound.getResultNumber().toString());
		} else if (subjectClass.getNounClass() == NounClass.PRONOUN
				&& (subject.equalsIgnoreCase("i") || subject.equalsIgnoreCase("you"))) {
			np = TaggedSymbol.of(TaggedSymbol.NP, subject.toLowerCase());
		} else if (subjectClass.getNounClass() == NounClass.REGULAR) {
			np = TaggedSymbol.of(TaggedSymbol.NP, subjectClass.getNumber().toString());
		} else {
			np = TaggedSymbol.of(TaggedSymbol.NP, subjectClass.getNounClass().toString());
		}

		return TaggedString.of(np, TaggedSymbol.of(TaggedSymbol.VP, verbNumber.toString()));
	}

	public Derivation derive(final TaggedString initial) {
		final List<DerivationStep> steps = new ArrayList<>();
		steps.add(DerivationStep.initial(initial));

		TaggedString current = initial;
		for (final ProductionRule rule : rules) {
			final int position = findMatch(rule, current);
			if (position > -1) {
				current = rule.apply(current, position);
				steps.add(DerivationStep.rewrite(steps.size(), current, rule));
				LOG.debug("{} => {} by {}", initial, current, rule.getId());
				break;
			}
		}

		return new Derivation(initial, current, steps);
	}

	private static int findMatch(final ProductionRule rule, final TaggedString string) {
		for (int position = 0; position < string.size(); position++) {
			if (rule.matches(string, position)) {
				return position;
			}
		}
		return -1;
	}
}
