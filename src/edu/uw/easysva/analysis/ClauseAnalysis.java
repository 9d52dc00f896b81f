package edu.uw.easysva.analysis;

import java.util.List;

import com.google.common.collect.ImmutableList;

import edu.uw.easysva.lexicon.GrammaticalNumber;
import edu.uw.easysva.lexicon.Lexicon;
import edu.uw.easysva.lexicon.NounClassification;
import edu.uw.easysva.syntax.CompoundInfo;
import edu.uw.easysva.syntax.SubjectAndVerb;
import edu.uw.easysva.syntax.Token;

/**
 * The agreement decision for one clause: where its subject and verb are, what number each carries, and the corrected
 * clause text when they disagree.
 */
public class ClauseAnalysis {
	private final String text;
	private final List<Token> words;
	private final SubjectAndVerb subjectAndVerb;
	private final NounClassification subjectClass;
	private final GrammaticalNumber verbNumber;
	private final String suggestedCorrection;

	ClauseAnalysis(final String text, final List<Token> words, final SubjectAndVerb subjectAndVerb,
			final NounClassification subjectClass, final GrammaticalNumber verbNumber,
			final String suggestedCorrection) {
		this.text = text;
		this.words = ImmutableList.copyOf(words);
		this.subjectAndVerb = subjectAndVerb;
		this.subjectClass = subjectClass;
		this.verbNumber = verbNumber;
		this.suggestedCorrection = suggestedCorrection;
	}

	public String getText() {
		return text;
	}

	public SubjectAndVerb getSubjectAndVerb() {
		return subjectAndVerb;
	}

	public String getSubjectText() {
		return subjectAndVerb.getSubjectText();
	}

	public String getVerbText() {
		return subjectAndVerb.getVerb().getText();
	}

	public NounClassification getSubjectClass() {
		return subjectClass;
	}

	public GrammaticalNumber getSubjectNumber() {
		return subjectClass.getNumber();
	}

	public GrammaticalNumber getVerbNumber() {
		return verbNumber;
	}

	public boolean agrees() {
		return subjectClass.getNumber() == verbNumber;
	}

	/**
	 * The clause text with its verb replaced by the agreeing form, or null if the clause agrees.
	 */
	public String getSuggestedCorrection() {
		return suggestedCorrection;
	}

	/**
	 * Character offset of the subject in the clause text. Compound subjects span both nouns.
	 */
	public int getSubjectStart() {
		return subjectAndVerb.getSubject().getStartOffset();
	}

	public int getSubjectEnd() {
		final CompoundInfo compound = subjectAndVerb.getCompound();
		return compound == null ? subjectAndVerb.getSubject().getEndOffset()
				: compound.getSecondSubject().getEndOffset();
	}

	/**
	 * The first word of the clause if it is a determiner, otherwise null.
	 */
	public String getLeadingDeterminer() {
		final String first = words.get(0).getText();
		return Lexicon.isDeterminer(first) ? first : null;
	}
}
