package edu.uw.easysva.syntax;

/**
 * The located subject and agreement-bearing verb of one clause.
 */
public class SubjectAndVerb {
	private final String subjectText;
	private final Token subject;
	private final int subjectIndex;
	private final Token verb;
	private final int verbIndex;
	private final boolean auxiliary;
	private final CompoundInfo compound;

	SubjectAndVerb(final String subjectText, final Token subject, final int subjectIndex, final Token verb,
			final int verbIndex, final boolean auxiliary, final CompoundInfo compound) {
		this.subjectText = subjectText;
		this.subject = subject;
		this.subjectIndex = subjectIndex;
		this.verb = verb;
		this.verbIndex = verbIndex;
		this.auxiliary = auxiliary;
		this.compound = compound;
	}

	/**
	 * The subject as shown to users: a single word, or "X and Y" for compounds.
	 */
	public String getSubjectText() {
		return subjectText;
	}

	/**
	 * The (first) subject word.
	 */
	public Token getSubject() {
		return subject;
	}

	public int getSubjectIndex() {
		return subjectIndex;
	}

	public Token getVerb() {
		return verb;
	}

	public int getVerbIndex() {
		return verbIndex;
	}

	/**
	 * True if the verb was found as an auxiliary or a contraction rather than as a main verb.
	 */
	public boolean isAuxiliary() {
		return auxiliary;
	}

	public boolean isCompound() {
		return compound != null;
	}

	public CompoundInfo getCompound() {
		return compound;
	}

	@Override
	public String toString() {
		return subjectText + " / " + verb.getText();
	}
}
