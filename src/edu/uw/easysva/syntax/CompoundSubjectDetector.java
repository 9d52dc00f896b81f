package edu.uw.easysva.syntax;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import edu.uw.easysva.lexicon.GrammaticalNumber;
import edu.uw.easysva.lexicon.LexicalClassifier;
import edu.uw.easysva.lexicon.Lexicon;
import edu.uw.easysva.lexicon.VerbHeuristics;

/**
 * Finds subjects of the form "X and/or/nor Y".
 *
 * Subjects joined by "and" take a plural verb. With "or" and "nor" the verb agrees with the nearer subject, i.e. the
 * second one. A coordinator that joins two clauses ("she sings and he dances") is not a compound subject.
 */
public class CompoundSubjectDetector {
	private static final Logger LOG = LoggerFactory.getLogger(CompoundSubjectDetector.class);

	private final LexicalClassifier classifier;
	private final VerbHeuristics verbHeuristics;

	public CompoundSubjectDetector(final LexicalClassifier classifier, final VerbHeuristics verbHeuristics) {
		this.classifier = Preconditions.checkNotNull(classifier);
		this.verbHeuristics = Preconditions.checkNotNull(verbHeuristics);
	}

	/**
	 * @param words
	 *            word tokens only, without punctuation
	 * @return the first compound subject, or null if there is none
	 */
	public CompoundInfo detect(final List<Token> words) {
		final Lexicon lexicon = classifier.getLexicon();
		for (int i = 1; i < words.size() - 1; i++) {
			final Coordinator coordinator = Coordinator.fromWord(words.get(i).getText());
			if (coordinator == null) {
				continue;
			}

			final Token before = words.get(i - 1);
			if (Lexicon.isDeterminer(before.getText()) || verbHeuristics.endsClause(before.getText())) {
				continue;
			}

			int afterIndex = i + 1;
			while (afterIndex < words.size() && Lexicon.isDeterminer(words.get(afterIndex).getText())) {
				afterIndex++;
			}
			if (afterIndex >= words.size()) {
				continue;
			}

			// "... and he dances": a pronoun followed by a verb starts a new clause.
			if (lexicon.isPronoun(words.get(i + 1).getText()) && i + 2 < words.size()
					&& verbHeuristics.looksLikeVerb(words.get(i + 2).getText())) {
				LOG.debug("'{}' at {} joins clauses, not subjects", coordinator, i);
				continue;
			}

			final Token after = words.get(afterIndex);
			final GrammaticalNumber number = coordinator == Coordinator.AND ? GrammaticalNumber.PLURAL : classifier
					.classifyNoun(after.getText()).getNumber();
			return new CompoundInfo(coordinator, before, i - 1, i, after, afterIndex, number);
		}

		return null;
	}
}
