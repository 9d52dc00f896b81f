package edu.uw.easysva.grammar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import edu.uw.easysva.lexicon.GrammaticalNumber;
import edu.uw.easysva.lexicon.LexicalClassifier;
import edu.uw.easysva.lexicon.Lexicon;
import edu.uw.easysva.lexicon.NounClass;
import edu.uw.easysva.lexicon.NounClassification;
import edu.uw.easysva.lexicon.VerbHeuristics;
import edu.uw.easysva.syntax.CompoundInfo;
import edu.uw.easysva.syntax.CompoundSubjectDetector;
import edu.uw.easysva.syntax.Tokenizer;

@Tag("unit")
class CsgRuleEngineTest {
	private static final CsgRuleEngine ENGINE = new CsgRuleEngine();

	private static TaggedString parse(final String string) {
		final String[] parts = string.split(" ");
		final TaggedSymbol[] symbols = new TaggedSymbol[parts.length];
		for (int i = 0; i < parts.length; i++) {
			final String label = parts[i].substring(0, parts[i].indexOf('['));
			final String features = parts[i].substring(parts[i].indexOf('[') + 1, parts[i].length() - 1);
			symbols[i] = TaggedSymbol.of(label, features.split("\\+"));
		}
		return TaggedString.of(symbols);
	}

	@ParameterizedTest(name = "{0} => {1} by {2}")
	@CsvSource({ "NP[singular] VP[plural], NP[singular] VP[singular], R1.1",
			"NP[plural] VP[singular], NP[plural] VP[plural], R1.2", "NP[i] VP[singular], NP[i] VP[plural], R2.1",
			"NP[you] VP[plural], NP[you] VP[plural], R2.2",
			"NP[compound+and+plural] VP[singular], NP[compound+and+plural] VP[plural], R3",
			"NP[compound+or+singular] VP[plural], NP[compound+or+singular] VP[singular], R4.1",
			"NP[compound+or+plural] VP[singular], NP[compound+or+plural] VP[plural], R4.2",
			"NP[compound+nor+singular] VP[plural], NP[compound+nor+singular] VP[singular], R4.3",
			"NP[compound+nor+plural] VP[singular], NP[compound+nor+plural] VP[plural], R4.4",
			"NP[indefinite] VP[plural], NP[indefinite] VP[singular], R5",
			"NP[collective] VP[plural], NP[collective] VP[singular], R6",
			"NP[unit] VP[plural], NP[unit] VP[singular], R8",
			"NP[singular_plural] VP[plural], NP[singular_plural] VP[singular], R9" })
	@DisplayName("Each subject kind is rewritten by its own rule")
	void derive_shouldApplyMatchingRule(final String initial, final String expected, final String ruleId) {
		final Derivation derivation = ENGINE.derive(parse(initial));

		assertThat(derivation.getFinalString().toString()).isEqualTo(expected);
		assertThat(derivation.getRulesApplied()).isEqualTo(1);
		assertThat(derivation.getSteps().get(1).getRule()).isEqualTo(ruleId);
	}

	@Test
	@DisplayName("A derivation records the initial string and one rewrite")
	void derive_shouldRecordSingleStep() {
		final Derivation derivation = ENGINE.derive(parse("NP[plural] VP[singular]"));

		assertThat(derivation.getSteps()).hasSize(2);
		final DerivationStep initial = derivation.getSteps().get(0);
		assertThat(initial.getStep()).isEqualTo(0);
		assertThat(initial.getString()).isEqualTo("NP[plural] VP[singular]");
		assertThat(initial.getRule()).isNull();
		assertThat(initial.getDescription()).isEqualTo("Initial parse string");

		final DerivationStep rewrite = derivation.getSteps().get(1);
		assertThat(rewrite.getStep()).isEqualTo(1);
		assertThat(rewrite.getDescription()).isEqualTo("Plural subject requires plural verb");
		assertThat(rewrite.getSvaRule()).isEqualTo(1);
		assertThat(rewrite.getProduction()).isEqualTo("NP[plural] VP[X] → NP[plural] VP[plural]");
		assertThat(derivation.derivesVerbNumber("plural")).isTrue();
		assertThat(derivation.derivesVerbNumber("singular")).isFalse();
	}

	@Test
	@DisplayName("Strings no rule matches are left as they are")
	void derive_shouldStopWithoutMatch() {
		final Derivation derivation = ENGINE.derive(parse("VP[singular] NP[plural]"));

		assertThat(derivation.getSteps()).hasSize(1);
		assertThat(derivation.getRulesApplied()).isZero();
		assertThat(derivation.getFinalString()).isEqualTo(derivation.getInitialString());
	}

	@Test
	@DisplayName("Only the first rule in table order is applied")
	void derive_shouldApplyFirstRuleInTableOrder() {
		final CsgRuleEngine reversed = new CsgRuleEngine(Arrays.asList(ProductionRules.fromId("R1.2"),
				ProductionRules.fromId("R1.1")));

		final Derivation derivation = reversed.derive(parse("NP[singular] VP[plural] NP[plural] VP[singular]"));

		assertThat(derivation.getRulesApplied()).isEqualTo(1);
		assertThat(derivation.getFinalString().toString()).isEqualTo(
				"NP[singular] VP[plural] NP[plural] VP[plural]");
	}

	@Test
	@DisplayName("Right context restricts where a rule applies")
	void matches_shouldCheckRightContext() {
		final ProductionRule rule = new ProductionRule("T", Collections.<TaggedSymbol> emptyList(),
				TaggedSymbol.of("NP", "X"), Collections.singletonList(TaggedSymbol.of("VP", "X")),
				Collections.singletonList(TaggedSymbol.of("NP", "seen")), "test", 0);
		final TaggedString string = parse("NP[a] NP[b] VP[c]");

		assertThat(rule.matches(string, 0)).isFalse();
		assertThat(rule.matches(string, 1)).isTrue();
		assertThat(rule.apply(string, 1).toString()).isEqualTo("NP[a] NP[seen] VP[c]");
		assertThatThrownBy(() -> rule.apply(string, 0)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("Rules may not erase their symbol")
	void productionRule_shouldRejectEmptyReplacement() {
		assertThatThrownBy(() -> new ProductionRule("T", Collections.<TaggedSymbol> emptyList(),
				TaggedSymbol.of("NP", "X"), Collections.<TaggedSymbol> emptyList(),
				Collections.<TaggedSymbol> emptyList(), "test", 0)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("Unknown rule ids are rejected")
	void fromId_shouldRejectUnknownRule() {
		assertThat(ProductionRules.fromId("R3").getRuleNumber()).isEqualTo(3);
		assertThatThrownBy(() -> ProductionRules.fromId("R7")).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("Initial strings encode the kind of subject")
	void buildInitialString_shouldEncodeSubjectKind() {
		assertThat(CsgRuleEngine.buildInitialString("cats",
				new NounClassification(NounClass.REGULAR, GrammaticalNumber.PLURAL), GrammaticalNumber.SINGULAR, null)
				.toString()).isEqualTo("NP[plural] VP[singular]");
		assertThat(CsgRuleEngine.buildInitialString("I",
				new NounClassification(NounClass.PRONOUN, GrammaticalNumber.PLURAL), GrammaticalNumber.PLURAL, null)
				.toString()).isEqualTo("NP[i] VP[plural]");
		assertThat(CsgRuleEngine.buildInitialString("she",
				new NounClassification(NounClass.PRONOUN, GrammaticalNumber.SINGULAR), GrammaticalNumber.SINGULAR,
				null).toString()).isEqualTo("NP[pronoun] VP[singular]");
		assertThat(CsgRuleEngine.buildInitialString("team",
				new NounClassification(NounClass.COLLECTIVE, GrammaticalNumber.SINGULAR), GrammaticalNumber.PLURAL,
				null).toString()).isEqualTo("NP[collective] VP[plural]");

		final Lexicon lexicon = Lexicon.loadDefault();
		final CompoundInfo compound = new CompoundSubjectDetector(new LexicalClassifier(lexicon), new VerbHeuristics(
				lexicon)).detect(Tokenizer.words(Tokenizer.tokenize("John or the boys play")));
		assertThat(CsgRuleEngine.buildInitialString("John",
				new NounClassification(NounClass.COMPOUND, GrammaticalNumber.PLURAL), GrammaticalNumber.PLURAL,
				compound).toString()).isEqualTo("NP[compound+or+plural] VP[plural]");
	}
}
