package edu.uw.easysva.syntax;

import java.util.Objects;

/**
 * A word or a single punctuation character, with its character offsets in the text it was read from.
 */
public class Token {
	private final String text;
	private final int startOffset;
	private final int endOffset;

	public Token(final String text, final int startOffset, final int endOffset) {
		this.text = text;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
	}

	public String getText() {
		return text;
	}

	public String getLowerCase() {
		return text.toLowerCase();
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	/**
	 * False for punctuation tokens.
	 */
	public boolean isWord() {
		return Tokenizer.isWord(text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text, startOffset, endOffset);
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof Token)) {
			return false;
		}
		final Token other = (Token) obj;
		return text.equals(other.text) && startOffset == other.startOffset && endOffset == other.endOffset;
	}

	@Override
	public String toString() {
		return text + "[" + startOffset + "," + endOffset + ")";
	}
}
