package edu.uw.easysva.correction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import edu.uw.easysva.lexicon.GrammaticalNumber;
import edu.uw.easysva.lexicon.LexicalClassifier;
import edu.uw.easysva.lexicon.Lexicon;

@Tag("unit")
class VerbCorrectorTest {
	private static final LexicalClassifier CLASSIFIER = new LexicalClassifier(Lexicon.loadDefault());
	private static final VerbCorrector CORRECTOR = new VerbCorrector(CLASSIFIER);

	@ParameterizedTest(name = "{0} -> {1}")
	@CsvSource({ "run, runs", "watch, watches", "wish, wishes", "fix, fixes", "buzz, buzzes",
			"go, goes", "echo, echoes", "boo, boos", "try, tries", "play, plays", "love, loves" })
	@DisplayName("Regular verbs are singularized by their ending")
	void correctVerb_shouldSingularize(final String verb, final String expected) {
		assertThat(CORRECTOR.correctVerb(verb, GrammaticalNumber.SINGULAR)).isEqualTo(expected);
	}

	@ParameterizedTest(name = "{0} -> {1}")
	@CsvSource({ "runs, run", "watches, watch", "wishes, wish", "fixes, fix", "buzzes, buzz", "passes, pass",
			"goes, go", "tries, try", "plays, play", "loves, love", "barks, bark", "uses, use", "loses, lose",
			"causes, cause", "raises, raise", "closes, close", "dies, die", "Uses, Use" })
	@DisplayName("Regular verbs are pluralized by stripping their ending")
	void correctVerb_shouldPluralize(final String verb, final String expected) {
		assertThat(CORRECTOR.correctVerb(verb, GrammaticalNumber.PLURAL)).isEqualTo(expected);
	}

	@ParameterizedTest(name = "{0} -> {1} ({2})")
	@CsvSource({ "is, are, PLURAL", "are, is, SINGULAR", "was, were, PLURAL", "were, was, SINGULAR",
			"has, have, PLURAL", "have, has, SINGULAR", "does, do, PLURAL", "do, does, SINGULAR", "Is, Are, PLURAL" })
	@DisplayName("Irregular verbs are swapped for their counterpart")
	void correctVerb_shouldUseIrregularTable(final String verb, final String expected,
			final GrammaticalNumber target) {
		assertThat(CORRECTOR.correctVerb(verb, target)).isEqualTo(expected);
	}

	@ParameterizedTest(name = "{0} -> {1} ({2})")
	@CsvSource(quoteCharacter = '"', value = { "doesn't, don't, PLURAL", "don't, doesn't, SINGULAR",
			"isn't, aren't, PLURAL", "aren't, isn't, SINGULAR", "wasn't, weren't, PLURAL",
			"weren't, wasn't, SINGULAR", "hasn't, haven't, PLURAL", "haven't, hasn't, SINGULAR",
			"Doesn't, Don't, PLURAL", "won't, won't, PLURAL", "can't, can't, SINGULAR" })
	@DisplayName("Contractions are swapped for the sibling contraction")
	void correctVerb_shouldSwapContractions(final String verb, final String expected,
			final GrammaticalNumber target) {
		assertThat(CORRECTOR.correctVerb(verb, target)).isEqualTo(expected);
	}

	@Test
	@DisplayName("Verbs that already agree are returned unchanged")
	void correctVerb_shouldLeaveAgreeingVerbs() {
		assertThat(CORRECTOR.correctVerb("runs", GrammaticalNumber.SINGULAR)).isEqualTo("runs");
		assertThat(CORRECTOR.correctVerb("run", GrammaticalNumber.PLURAL)).isEqualTo("run");
		assertThat(CORRECTOR.correctVerb("is", GrammaticalNumber.SINGULAR)).isEqualTo("is");
		assertThat(CORRECTOR.correctVerb("", GrammaticalNumber.SINGULAR)).isEmpty();
	}

	@Test
	@DisplayName("Capitalization of the original verb is kept")
	void correctVerb_shouldKeepCapitalization() {
		assertThat(CORRECTOR.correctVerb("Runs", GrammaticalNumber.PLURAL)).isEqualTo("Run");
		assertThat(CORRECTOR.correctVerb("Try", GrammaticalNumber.SINGULAR)).isEqualTo("Tries");
	}

	@ParameterizedTest
	@ValueSource(strings = { "run", "watch", "go", "try", "play", "fix", "bark", "study", "dance", "runs",
			"watches", "goes", "tries", "plays", "fixes", "barks", "studies", "dances", "buzzes", "uses", "loses", "causes", "raises",
			"closes", "dies", "passes" })
	@DisplayName("A corrected regular verb is classified with the target number")
	void correctVerb_shouldConverge(final String verb) {
		final GrammaticalNumber target = CLASSIFIER.classifyVerb(verb).opposite();

		assertThat(CLASSIFIER.classifyVerb(CORRECTOR.correctVerb(verb, target))).isEqualTo(target);
	}

	@Test
	@DisplayName("A target number is required")
	void correctVerb_shouldRejectNullTarget() {
		assertThatThrownBy(() -> CORRECTOR.correctVerb("run", null)).isInstanceOf(NullPointerException.class);
	}
}
