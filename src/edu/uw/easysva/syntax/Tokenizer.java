package edu.uw.easysva.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits text into word tokens and single-character punctuation tokens. A word may contain one internal apostrophe,
 * so contractions such as "don't" stay whole. Whitespace is skipped.
 */
public class Tokenizer {
	private static final Pattern TOKEN = Pattern.compile("\\w+(?:'\\w+)?|[^\\s\\w]", Pattern.UNICODE_CHARACTER_CLASS);
	private static final Pattern WORD = Pattern.compile("\\w+(?:'\\w+)?", Pattern.UNICODE_CHARACTER_CLASS);

	private Tokenizer() {
	}

	public static List<Token> tokenize(final String text) {
		final List<Token> result = new ArrayList<>();
		if (text == null) {
			return result;
		}

		final Matcher matcher = TOKEN.matcher(text);
		while (matcher.find()) {
			result.add(new Token(matcher.group(), matcher.start(), matcher.end()));
		}
		return result;
	}

	public static List<Token> words(final List<Token> tokens) {
		return tokens.stream().filter(Token::isWord).collect(Collectors.toList());
	}

	static boolean isWord(final String text) {
		return WORD.matcher(text).lookingAt();
	}
}
