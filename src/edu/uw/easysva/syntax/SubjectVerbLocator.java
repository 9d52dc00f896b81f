package edu.uw.easysva.syntax;

import java.util.List;

import com.google.common.base.Preconditions;

import edu.uw.easysva.lexicon.Lexicon;
import edu.uw.easysva.lexicon.VerbHeuristics;

/**
 * Picks the head subject and the verb that carries number marking.
 *
 * Contractions and auxiliaries are preferred over main verbs: in "they don't run" the number is marked on "don't".
 */
public class SubjectVerbLocator {
	private final Lexicon lexicon;

	public SubjectVerbLocator(final Lexicon lexicon) {
		this.lexicon = Preconditions.checkNotNull(lexicon);
	}

	/**
	 * @param words
	 *            word tokens of the clause
	 * @param compound
	 *            the compound subject of the clause, or null
	 * @return null if there are no words
	 */
	public SubjectAndVerb locate(final List<Token> words, final CompoundInfo compound) {
		if (words.isEmpty()) {
			return null;
		}

		final String subjectText;
		final int subjectIndex;
		final int verbSearchStart;
		if (compound != null) {
			subjectText = compound.getDisplayText();
			subjectIndex = compound.getFirstIndex();
			verbSearchStart = compound.getSecondIndex() + 1;
		} else {
			subjectIndex = findSubject(words);
			subjectText = words.get(subjectIndex).getText();
			verbSearchStart = subjectIndex + 1;
		}

		for (int i = 0; i < words.size(); i++) {
			if (lexicon.isContraction(words.get(i).getText())) {
				return new SubjectAndVerb(subjectText, words.get(subjectIndex), subjectIndex, words.get(i), i, true,
						compound);
			}
		}

		for (int i = 0; i < words.size(); i++) {
			if (lexicon.isAuxiliary(words.get(i).getText())) {
				return new SubjectAndVerb(subjectText, words.get(subjectIndex), subjectIndex, words.get(i), i, true,
						compound);
			}
		}

		int verbIndex = words.size() - 1;
		for (int i = verbSearchStart; i < words.size(); i++) {
			final String word = words.get(i).getText();
			if (Lexicon.SUBJECT_COORDINATORS.contains(word.toLowerCase()) || Lexicon.isDeterminer(word)
					|| VerbHeuristics.hasNonVerbSuffix(word)) {
				continue;
			}
			verbIndex = i;
			break;
		}

		return new SubjectAndVerb(subjectText, words.get(subjectIndex), subjectIndex, words.get(verbIndex), verbIndex,
				false, compound);
	}

	/**
	 * First word that is not a determiner, possessive, auxiliary or contraction. Falls back to the first
	 * non-determiner, and then to the first word.
	 */
	private int findSubject(final List<Token> words) {
		for (int i = 0; i < words.size(); i++) {
			final String word = words.get(i).getText();
			if (Lexicon.isDeterminer(word) || Lexicon.isPossessive(word)) {
				continue;
			}
			if (!lexicon.isAuxiliary(word) && !lexicon.isContraction(word)) {
				return i;
			}
		}

		for (int i = 0; i < words.size(); i++) {
			final String word = words.get(i).getText();
			if (!Lexicon.isDeterminer(word) && !Lexicon.isPossessive(word)) {
				return i;
			}
		}

		return 0;
	}
}
