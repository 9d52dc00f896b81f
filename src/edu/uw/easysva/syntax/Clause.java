package edu.uw.easysva.syntax;

import java.util.List;

/**
 * An independent clause of a sentence. The text is the span of the original sentence from the clause's first token
 * to its last, so it keeps the original spacing.
 */
public class Clause {
	private final int startOffset;
	private final String text;

	Clause(final List<Token> tokens, final String sentence) {
		this.startOffset = tokens.isEmpty() ? 0 : tokens.get(0).getStartOffset();
		this.text = tokens.isEmpty() ? ""
				: sentence.substring(tokens.get(0).getStartOffset(), tokens.get(tokens.size() - 1).getEndOffset());
	}

	/**
	 * Character offset of the clause text in the sentence.
	 */
	public int getStartOffset() {
		return startOffset;
	}

	public String getText() {
		return text;
	}

	@Override
	public String toString() {
		return text;
	}
}
