package edu.uw.easysva.lexicon;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@Tag("unit")
class LexicalClassifierTest {
	private static final LexicalClassifier CLASSIFIER = new LexicalClassifier(Lexicon.loadDefault());

	@ParameterizedTest(name = "{0} -> {1} {2}")
	@CsvSource(quoteCharacter = '"', value = { "everyone, INDEFINITE, SINGULAR", "Nobody, INDEFINITE, SINGULAR",
			"I, PRONOUN, PLURAL", "you, PRONOUN, PLURAL", "she, PRONOUN, SINGULAR", "They, PRONOUN, PLURAL",
			"mathematics, SINGULAR_PLURAL, SINGULAR", "Philippines, SINGULAR_PLURAL, SINGULAR",
			"team, COLLECTIVE, SINGULAR", "dollars, UNIT, SINGULAR", "children, REGULAR, PLURAL",
			"cats, REGULAR, PLURAL", "cat, REGULAR, SINGULAR", "cat's, REGULAR, SINGULAR" })
	@DisplayName("Nouns are classified by the first matching lexicon check")
	void classifyNoun_shouldApplyPriorityOrder(final String noun, final NounClass nounClass,
			final GrammaticalNumber number) {
		assertThat(CLASSIFIER.classifyNoun(noun)).isEqualTo(new NounClassification(nounClass, number));
	}

	@Test
	@DisplayName("Unit words win over the irregular plural list")
	void classifyNoun_shouldPreferUnitOverIrregularPlural() {
		assertThat(CLASSIFIER.classifyNoun("feet").getNounClass()).isEqualTo(NounClass.UNIT);
		assertThat(CLASSIFIER.classifyNoun("teeth").getNumber()).isEqualTo(GrammaticalNumber.PLURAL);
	}

	@ParameterizedTest(name = "{0} -> {1}")
	@CsvSource(quoteCharacter = '"', value = { "don't, PLURAL", "Doesn't, SINGULAR", "won't, SINGULAR",
			"can't, PLURAL", "is, SINGULAR", "are, PLURAL", "Were, PLURAL", "has, SINGULAR", "runs, SINGULAR",
			"run, PLURAL", "watches, SINGULAR", "walked, PLURAL" })
	@DisplayName("Verbs are classified by contraction, irregular table, then the -s ending")
	void classifyVerb_shouldUseLexiconThenEnding(final String verb, final GrammaticalNumber number) {
		assertThat(CLASSIFIER.classifyVerb(verb)).isEqualTo(number);
	}

	@Test
	@DisplayName("Classification is total over odd input")
	void classify_shouldHandleEmptyAndNull() {
		assertThat(CLASSIFIER.classifyNoun("")).isEqualTo(
				new NounClassification(NounClass.REGULAR, GrammaticalNumber.SINGULAR));
		assertThat(CLASSIFIER.classifyNoun(null).getNumber()).isEqualTo(GrammaticalNumber.SINGULAR);
		assertThat(CLASSIFIER.classifyVerb("")).isEqualTo(GrammaticalNumber.PLURAL);
		assertThat(CLASSIFIER.classifyVerb("123")).isEqualTo(GrammaticalNumber.PLURAL);
	}

	@Test
	@DisplayName("Invariant forms are exactly was, is, has and does")
	void isInvariantForm_shouldRecogniseFourForms() {
		assertThat(LexicalClassifier.isInvariantForm("was")).isTrue();
		assertThat(LexicalClassifier.isInvariantForm("does")).isTrue();
		assertThat(LexicalClassifier.isInvariantForm("runs")).isFalse();
	}
}
