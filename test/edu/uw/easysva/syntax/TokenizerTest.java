package edu.uw.easysva.syntax;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class TokenizerTest {

	@Test
	@DisplayName("Contractions stay whole and punctuation is split off")
	void tokenize_shouldKeepContractionsTogether() {
		final List<Token> tokens = Tokenizer.tokenize("Don't stop!");

		assertThat(tokens).containsExactly(new Token("Don't", 0, 5), new Token("stop", 6, 10), new Token("!", 10, 11));
	}

	@Test
	@DisplayName("Offsets point back into the original text")
	void tokenize_shouldRecordOffsets() {
		final String text = "The  cats, sadly, run.";
		final List<Token> tokens = Tokenizer.tokenize(text);

		assertThat(tokens).extracting(Token::getText).containsExactly("The", "cats", ",", "sadly", ",", "run", ".");
		for (final Token token : tokens) {
			assertThat(text.substring(token.getStartOffset(), token.getEndOffset())).isEqualTo(token.getText());
		}
		for (int i = 1; i < tokens.size(); i++) {
			assertThat(tokens.get(i).getStartOffset()).isGreaterThanOrEqualTo(tokens.get(i - 1).getEndOffset());
		}
	}

	@Test
	@DisplayName("Only word tokens survive the word filter")
	void words_shouldDropPunctuation() {
		final List<Token> words = Tokenizer.words(Tokenizer.tokenize("Well... it's 5 o'clock?"));

		assertThat(words.stream().map(Token::getText).collect(Collectors.toList())).containsExactly("Well", "it's",
				"5", "o'clock");
		assertThat(words).allMatch(Token::isWord);
	}

	@Test
	@DisplayName("Empty, blank and null input give no tokens")
	void tokenize_shouldHandleEmptyInput() {
		assertThat(Tokenizer.tokenize(null)).isEmpty();
		assertThat(Tokenizer.tokenize("")).isEmpty();
		assertThat(Tokenizer.tokenize(" \t ")).isEmpty();
		assertThat(Tokenizer.words(Tokenizer.tokenize("?!."))).isEmpty();
	}

	@Test
	@DisplayName("A trailing apostrophe is its own token")
	void tokenize_shouldSplitTrailingApostrophe() {
		assertThat(Tokenizer.tokenize("dogs' bowls")).extracting(Token::getText).containsExactly("dogs", "'",
				"bowls");
	}
}
