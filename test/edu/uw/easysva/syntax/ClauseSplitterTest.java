package edu.uw.easysva.syntax;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import edu.uw.easysva.lexicon.Lexicon;
import edu.uw.easysva.lexicon.VerbHeuristics;

@Tag("unit")
class ClauseSplitterTest {
	private static final ClauseSplitter SPLITTER = new ClauseSplitter(new VerbHeuristics(Lexicon.loadDefault()));

	@Test
	@DisplayName("Two clauses with determiner subjects are split at 'and'")
	void split_shouldSplitDeterminerClauses() {
		final SplitSentence split = SPLITTER.split("The cat runs and the dog barks.");

		assertThat(split.isCompound()).isTrue();
		assertThat(split.getClauses()).extracting(Clause::getText).containsExactly("The cat runs", "the dog barks");
		assertThat(split.getCoordinators()).extracting(Token::getText).containsExactly("and");
		assertThat(split.getTerminalPunctuation()).isEqualTo(".");
		assertThat(split.getClauses()).extracting(Clause::getStartOffset).containsExactly(0, 17);
	}

	@Test
	@DisplayName("Pronoun subjects start a new clause")
	void split_shouldSplitPronounClauses() {
		final SplitSentence split = SPLITTER.split("She sings and he dances!");

		assertThat(split.getClauses()).extracting(Clause::getText).containsExactly("She sings", "he dances");
		assertThat(split.getTerminalPunctuation()).isEqualTo("!");
	}

	@Test
	@DisplayName("Any clause coordinator can split")
	void split_shouldSplitAtBut() {
		final SplitSentence split = SPLITTER.split("I like tea but you like coffee");

		assertThat(split.getClauses()).extracting(Clause::getText).containsExactly("I like tea", "you like coffee");
		assertThat(split.getCoordinators()).extracting(Token::getText).containsExactly("but");
		assertThat(split.getTerminalPunctuation()).isEmpty();
	}

	@Test
	@DisplayName("Three clauses keep their coordinators in order")
	void split_shouldKeepCoordinatorOrder() {
		final SplitSentence split = SPLITTER.split("The cat runs and the dog barks or the bird sings.");

		assertThat(split.getClauses()).hasSize(3);
		assertThat(split.getCoordinators()).extracting(Token::getText).containsExactly("and", "or");
		assertThat(split.join(Arrays.asList("A", "B", "C"))).isEqualTo("A and B or C.");
	}

	@Test
	@DisplayName("Joining the unchanged clauses rebuilds the sentence")
	void join_shouldRebuildSentence() {
		final String sentence = "The cat runs and the dog barks.";
		final SplitSentence split = SPLITTER.split(sentence);

		assertThat(split.join(Arrays.asList(split.getClauses().get(0).getText(), split.getClauses().get(1)
				.getText()))).isEqualTo(sentence);
	}

	@Test
	@DisplayName("A compound subject does not split the sentence")
	void split_shouldNotSplitCompoundSubject() {
		final SplitSentence split = SPLITTER.split("Mark and Anna play guitar.");

		assertThat(split.isCompound()).isFalse();
		assertThat(split.getClauses()).extracting(Clause::getText).containsExactly("Mark and Anna play guitar.");
		assertThat(split.getTerminalPunctuation()).isEmpty();
	}

	@Test
	@DisplayName("Coordinated objects and verbs do not split the sentence")
	void split_shouldNotSplitWithoutNewSubjectAndVerb() {
		assertThat(SPLITTER.split("I eat bread and butter.").isCompound()).isFalse();
		assertThat(SPLITTER.split("He runs and jumps high.").isCompound()).isFalse();
	}

	@Test
	@DisplayName("Empty input is a single empty clause")
	void split_shouldHandleEmptyInput() {
		final SplitSentence split = SPLITTER.split(null);

		assertThat(split.getClauses()).hasSize(1);
		assertThat(split.getClauses().get(0).getText()).isEmpty();
		assertThat(split.getCoordinators()).isEmpty();
	}
}
