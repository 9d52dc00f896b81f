package edu.uw.easysva.syntax;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A sentence broken into independent clauses. There is always one fewer coordinator than clauses.
 */
public class SplitSentence {
	private final List<Clause> clauses;
	private final List<Token> coordinators;
	private final String terminalPunctuation;

	SplitSentence(final List<Clause> clauses, final List<Token> coordinators, final String terminalPunctuation) {
		this.clauses = ImmutableList.copyOf(clauses);
		this.coordinators = ImmutableList.copyOf(coordinators);
		this.terminalPunctuation = terminalPunctuation;
	}

	public List<Clause> getClauses() {
		return clauses;
	}

	/**
	 * The coordinators found between clauses, in order.
	 */
	public List<Token> getCoordinators() {
		return coordinators;
	}

	/**
	 * Sentence-final ".", "!" or "?" characters, or the empty string.
	 */
	public String getTerminalPunctuation() {
		return terminalPunctuation;
	}

	public boolean isCompound() {
		return clauses.size() > 1;
	}

	/**
	 * Rebuilds a sentence from one text per clause, joined by the original coordinators.
	 */
	public String join(final List<String> clauseTexts) {
		final StringBuilder result = new StringBuilder();
		for (int i = 0; i < clauseTexts.size(); i++) {
			if (i > 0) {
				result.append(" ").append(coordinators.get(i - 1).getText()).append(" ");
			}
			result.append(clauseTexts.get(i));
		}
		result.append(terminalPunctuation);
		return result.toString();
	}
}
