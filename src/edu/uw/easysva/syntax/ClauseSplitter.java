package edu.uw.easysva.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import edu.uw.easysva.lexicon.Lexicon;
import edu.uw.easysva.lexicon.VerbHeuristics;

/**
 * Breaks compound sentences such as "A runs and B barks" into independent clauses.
 *
 * A coordinator ("and", "or", "but", "yet", "so", "for", "nor") ends a clause if the clause already has a verb and
 * the next words look like a fresh subject followed by a verb. Coordinators that split the sentence belong to neither
 * clause.
 */
public class ClauseSplitter {
	private static final Logger LOG = LoggerFactory.getLogger(ClauseSplitter.class);

	private static final int LOOKAHEAD = 3;
	private static final String TERMINAL_PUNCTUATION = ".!?";

	private final VerbHeuristics verbHeuristics;

	public ClauseSplitter(final VerbHeuristics verbHeuristics) {
		this.verbHeuristics = Preconditions.checkNotNull(verbHeuristics);
	}

	public SplitSentence split(final String sentence) {
		final String text = sentence == null ? "" : sentence;
		final List<Token> tokens = Tokenizer.tokenize(text);

		final List<List<Token>> clauseTokens = new ArrayList<>();
		final List<Token> coordinators = new ArrayList<>();
		List<Token> current = new ArrayList<>();
		boolean verbSeen = false;

		for (int i = 0; i < tokens.size(); i++) {
			final Token token = tokens.get(i);
			if (token.isWord() && Lexicon.CLAUSE_COORDINATORS.contains(token.getLowerCase()) && verbSeen
					&& current.size() > 1 && startsNewClause(nextWords(tokens, i + 1))) {
				LOG.debug("Splitting \"{}\" at '{}' (offset {})", text, token.getText(), token.getStartOffset());
				clauseTokens.add(current);
				coordinators.add(token);
				current = new ArrayList<>();
				verbSeen = false;
				continue;
			}

			current.add(token);
			if (token.isWord() && verbHeuristics.looksLikeVerb(token.getText())) {
				verbSeen = true;
			}
		}
		clauseTokens.add(current);

		if (clauseTokens.size() < 2) {
			return new SplitSentence(Collections.singletonList(new Clause(tokens, text)), Collections.emptyList(),
					"");
		}

		// Sentence-final punctuation is re-attached when the clauses are joined back together.
		final List<Token> last = clauseTokens.get(clauseTokens.size() - 1);
		final StringBuilder terminal = new StringBuilder();
		while (!last.isEmpty() && isTerminalPunctuation(last.get(last.size() - 1))) {
			terminal.insert(0, last.remove(last.size() - 1).getText());
		}

		final List<Clause> clauses = new ArrayList<>();
		for (final List<Token> clause : clauseTokens) {
			clauses.add(new Clause(clause, text));
		}
		return new SplitSentence(clauses, coordinators, terminal.toString());
	}

	/**
	 * A new clause needs a subject-like word followed by a verb-like one. After a determiner or possessive, the noun
	 * is the subject and the verb comes one word later.
	 */
	private boolean startsNewClause(final List<Token> following) {
		if (following.size() < 2) {
			return false;
		}

		final String first = following.get(0).getText();
		if (!verbHeuristics.looksLikeSubject(first)) {
			return false;
		}

		final int verbPosition = Lexicon.isDeterminer(first) || Lexicon.isPossessive(first) ? 2 : 1;
		return verbPosition < following.size()
				&& verbHeuristics.looksLikeVerb(following.get(verbPosition).getText());
	}

	private static List<Token> nextWords(final List<Token> tokens, final int start) {
		final List<Token> result = new ArrayList<>(LOOKAHEAD);
		for (int i = start; i < tokens.size() && result.size() < LOOKAHEAD; i++) {
			if (tokens.get(i).isWord()) {
				result.add(tokens.get(i));
			}
		}
		return result;
	}

	private static boolean isTerminalPunctuation(final Token token) {
		return token.getText().length() == 1 && TERMINAL_PUNCTUATION.contains(token.getText());
	}
}
