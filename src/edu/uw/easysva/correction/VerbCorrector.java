package edu.uw.easysva.correction;

import com.google.common.base.Preconditions;

import edu.uw.easysva.lexicon.GrammaticalNumber;
import edu.uw.easysva.lexicon.LexicalClassifier;
import edu.uw.easysva.lexicon.Lexicon;
import edu.uw.easysva.lexicon.Lexicon.IrregularVerb;
import edu.uw.easysva.util.Util;

/**
 * Produces the form of a verb that agrees with a given number, e.g. runs -> run, watch -> watches, doesn't -> don't.
 * Corrections keep the leading capitalization of the original word.
 */
public class VerbCorrector {
	private final LexicalClassifier classifier;

	public VerbCorrector(final LexicalClassifier classifier) {
		this.classifier = Preconditions.checkNotNull(classifier);
	}

	public String correctVerb(final String verb, final GrammaticalNumber targetNumber) {
		Preconditions.checkNotNull(targetNumber);
		if (verb == null || verb.isEmpty()) {
			return verb;
		}

		final Lexicon lexicon = classifier.getLexicon();
		final String lower = verb.toLowerCase();

		if (lexicon.isContraction(lower)) {
			return Util.matchCapitalization(verb, correctContraction(verb, lower, targetNumber));
		}

		final IrregularVerb irregular = lexicon.getIrregularVerb(lower);
		if (irregular != null) {
			return irregular.getNumber() == targetNumber ? verb
					: Util.matchCapitalization(verb, irregular.getCounterpart());
		}

		// is, has, does, was: only the irregular table can correct these.
		if (LexicalClassifier.isInvariantForm(lower) || classifier.classifyVerb(lower) == targetNumber) {
			return verb;
		}

		return targetNumber == GrammaticalNumber.SINGULAR ? singularize(verb, lower)
				: pluralize(lexicon, verb, lower);
	}

	/**
	 * Contractions are matched on the auxiliary they contain. Unrecognised ones ("won't", "can't") are returned
	 * unchanged.
	 */
	private static String correctContraction(final String verb, final String lower, final GrammaticalNumber target) {
		final boolean singular = target == GrammaticalNumber.SINGULAR;
		if (lower.contains("do")) {
			return singular ? "doesn't" : "don't";
		} else if (lower.contains("is") || lower.contains("are")) {
			return singular ? "isn't" : "aren't";
		} else if (lower.contains("was") || lower.contains("were")) {
			return singular ? "wasn't" : "weren't";
		} else if (lower.contains("has") || lower.contains("have")) {
			return singular ? "hasn't" : "haven't";
		}
		return verb;
	}

	/**
	 * run -> runs, watch -> watches, go -> goes, try -> tries
	 */
	private static String singularize(final String verb, final String lower) {
		if (lower.endsWith("s") || lower.endsWith("sh") || lower.endsWith("ch") || lower.endsWith("x")
				|| lower.endsWith("z") || (lower.endsWith("o") && !endsWithVowelO(lower))) {
			return verb + "es";
		}
		if (lower.length() > 1 && lower.endsWith("y") && !isVowel(lower.charAt(lower.length() - 2))) {
			return verb.substring(0, verb.length() - 1) + "ies";
		}
		return verb + "s";
	}

	/**
	 * runs -> run, watches -> watch, goes -> go, tries -> try, uses -> use. Known verbs win over the suffix rules, so
	 * dies -> die.
	 */
	private static String pluralize(final Lexicon lexicon, final String verb, final String lower) {
		if (!lower.endsWith("s")) {
			return verb;
		}
		if (lexicon.isCommonVerb(lower.substring(0, lower.length() - 1))) {
			return verb.substring(0, verb.length() - 1);
		}
		if (lower.endsWith("es") && lexicon.isCommonVerb(lower.substring(0, lower.length() - 2))) {
			return verb.substring(0, verb.length() - 2);
		}
		if (lower.endsWith("ies") && lower.length() > 3) {
			return verb.substring(0, verb.length() - 3) + "y";
		}
		if (lower.endsWith("es")) {
			final String base = lower.substring(0, lower.length() - 2);
			// A single "s" belongs to the stem: causes -> cause, but passes -> pass.
			if (base.endsWith("ss") || base.endsWith("sh") || base.endsWith("ch") || base.endsWith("x")
					|| base.endsWith("z") || base.endsWith("o")) {
				return verb.substring(0, verb.length() - 2);
			}
		}
		return verb.substring(0, verb.length() - 1);
	}

	private static boolean endsWithVowelO(final String lower) {
		return lower.endsWith("oo") || lower.endsWith("eo") || lower.endsWith("io");
	}

	private static boolean isVowel(final char c) {
		return "aeiou".indexOf(c) > -1;
	}
}
