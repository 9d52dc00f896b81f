package edu.uw.easysva.lexicon;

import com.google.common.base.Preconditions;

import edu.uw.easysva.lexicon.Lexicon.IrregularVerb;

/**
 * Assigns grammatical number to nouns and verbs from closed lexicon lookups and surface endings. Both methods are
 * case-insensitive and total: any string, including the empty string, gets a classification.
 */
public class LexicalClassifier {
	private final Lexicon lexicon;

	public LexicalClassifier(final Lexicon lexicon) {
		this.lexicon = Preconditions.checkNotNull(lexicon);
	}

	/**
	 * Classifies a subject word. The checks are ordered and the first match wins.
	 */
	public NounClassification classifyNoun(final String noun) {
		final String word = Lexicon.normalize(noun);

		if (lexicon.isIndefinitePronoun(word)) {
			return new NounClassification(NounClass.INDEFINITE, GrammaticalNumber.SINGULAR);
		}

		// "I" and "you" are listed as plural: they take the bare verb form.
		final GrammaticalNumber pronounNumber = lexicon.getPronounNumber(word);
		if (pronounNumber != null) {
			return new NounClassification(NounClass.PRONOUN, pronounNumber);
		}

		if (lexicon.isSingularPlural(word)) {
			return new NounClassification(NounClass.SINGULAR_PLURAL, GrammaticalNumber.SINGULAR);
		}

		if (lexicon.isCollectiveNoun(word)) {
			return new NounClassification(NounClass.COLLECTIVE, GrammaticalNumber.SINGULAR);
		}

		if (lexicon.isUnitWord(word)) {
			return new NounClassification(NounClass.UNIT, GrammaticalNumber.SINGULAR);
		}

		if (lexicon.isIrregularPlural(word)) {
			return new NounClassification(NounClass.REGULAR, GrammaticalNumber.PLURAL);
		}

		if (word.endsWith("s") && !word.endsWith("'s")) {
			return new NounClassification(NounClass.REGULAR, GrammaticalNumber.PLURAL);
		}

		return new NounClassification(NounClass.REGULAR, GrammaticalNumber.SINGULAR);
	}

	public GrammaticalNumber classifyVerb(final String verb) {
		final String word = Lexicon.normalize(verb);

		final GrammaticalNumber contractionNumber = lexicon.getContractionNumber(word);
		if (contractionNumber != null) {
			return contractionNumber;
		}

		final IrregularVerb irregular = lexicon.getIrregularVerb(word);
		if (irregular != null) {
			return irregular.getNumber();
		}

		if (word.endsWith("s") && !isInvariantForm(word)) {
			return GrammaticalNumber.SINGULAR;
		}

		return GrammaticalNumber.PLURAL;
	}

	/**
	 * Singular forms ending in "s" that the "-s" heuristic must not touch.
	 */
	public static boolean isInvariantForm(final String word) {
		return word.equals("was") || word.equals("is") || word.equals("has") || word.equals("does");
	}

	public Lexicon getLexicon() {
		return lexicon;
	}
}
