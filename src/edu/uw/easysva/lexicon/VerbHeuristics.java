package edu.uw.easysva.lexicon;

import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;

import edu.uw.easysva.util.Util;

/**
 * Surface-form guesses about whether a word is acting as a verb. These are approximate: there is no
 * part-of-speech tagger behind them, only the lexicon and word endings.
 */
public class VerbHeuristics {
	private static final List<String> NON_VERB_SUFFIXES = Arrays.asList("ly", "tion", "ness", "ment");
	private static final List<String> VERB_SUFFIXES = Arrays.asList("ed", "ing", "ize", "izes", "ise", "ises", "ify",
			"ifies", "ate", "ates");

	private final Lexicon lexicon;

	public VerbHeuristics(final Lexicon lexicon) {
		this.lexicon = Preconditions.checkNotNull(lexicon);
	}

	/**
	 * True for auxiliaries, contractions, irregular verbs, inflections of common verbs, and words with a verb-forming
	 * suffix that are not determiners or pronouns.
	 */
	public boolean looksLikeVerb(final String word) {
		final String w = Lexicon.normalize(word);
		if (w.isEmpty()) {
			return false;
		}

		if (lexicon.isAuxiliary(w) || lexicon.isContraction(w) || lexicon.isIrregularVerb(w)) {
			return true;
		}

		if (isInflectionOfCommonVerb(w)) {
			return true;
		}

		if (isFunctionWord(w)) {
			return false;
		}

		return w.length() > 3 && VERB_SUFFIXES.stream().anyMatch(w::endsWith);
	}

	/**
	 * Whether the word in front of a coordinator suggests the coordinator joins two clauses rather than two subjects,
	 * as in "she sings and he dances".
	 */
	public boolean endsClause(final String word) {
		final String w = Lexicon.normalize(word);
		if (lexicon.isAuxiliary(w) || lexicon.isIrregularVerb(w) || lexicon.isContraction(w)) {
			return true;
		}
		return (w.endsWith("s") || w.endsWith("ed") || w.endsWith("ing")) && !lexicon.isPronoun(w) && w.length() > 3;
	}

	/**
	 * Words ending in "ly", "tion", "ness" or "ment" are not taken as the main verb.
	 */
	public static boolean hasNonVerbSuffix(final String word) {
		final String w = Lexicon.normalize(word);
		return NON_VERB_SUFFIXES.stream().anyMatch(w::endsWith);
	}

	/**
	 * Could this word open a new clause as its subject?
	 */
	public boolean looksLikeSubject(final String word) {
		final String w = Lexicon.normalize(word);
		if (isFunctionWord(w)) {
			return true;
		}
		return Util.isCapitalized(word) || !looksLikeVerb(w);
	}

	private boolean isFunctionWord(final String w) {
		return Lexicon.isDeterminer(w) || Lexicon.isPossessive(w) || lexicon.isPronoun(w)
				|| lexicon.isIndefinitePronoun(w);
	}

	private boolean isInflectionOfCommonVerb(final String w) {
		if (lexicon.isCommonVerb(w)) {
			return true;
		}

		if (w.endsWith("ies") && lexicon.isCommonVerb(strip(w, 3) + "y")) {
			return true;
		}
		if (w.endsWith("ing") && (lexicon.isCommonVerb(strip(w, 3)) || lexicon.isCommonVerb(strip(w, 3) + "e"))) {
			return true;
		}
		if (w.endsWith("ed") && (lexicon.isCommonVerb(strip(w, 2)) || lexicon.isCommonVerb(strip(w, 1)))) {
			return true;
		}
		if (w.endsWith("es") && lexicon.isCommonVerb(strip(w, 2))) {
			return true;
		}
		return w.endsWith("s") && lexicon.isCommonVerb(strip(w, 1));
	}

	private static String strip(final String word, final int suffixLength) {
		return word.substring(0, word.length() - suffixLength);
	}
}
