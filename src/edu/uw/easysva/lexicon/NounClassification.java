package edu.uw.easysva.lexicon;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * The lexical class of a subject word and the number it imposes on its verb.
 */
public class NounClassification {
	private final NounClass nounClass;
	private final GrammaticalNumber number;

	public NounClassification(final NounClass nounClass, final GrammaticalNumber number) {
		this.nounClass = Preconditions.checkNotNull(nounClass);
		this.number = Preconditions.checkNotNull(number);
	}

	public NounClass getNounClass() {
		return nounClass;
	}

	public GrammaticalNumber getNumber() {
		return number;
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof NounClassification)) {
			return false;
		}
		final NounClassification other = (NounClassification) obj;
		return nounClass == other.nounClass && number == other.number;
	}

	@Override
	public int hashCode() {
		return Objects.hash(nounClass, number);
	}

	@Override
	public String toString() {
		return "(" + nounClass + ", " + number + ")";
	}
}
