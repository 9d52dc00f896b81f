package edu.uw.easysva.analysis;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;

import edu.uw.easysva.lexicon.GrammaticalNumber;

/**
 * Agreement features of a word or phrase. Number is the only one.
 */
public class Features {
	private final GrammaticalNumber number;

	public Features(final GrammaticalNumber number) {
		this.number = number;
	}

	@JsonProperty("number")
	public GrammaticalNumber getNumber() {
		return number;
	}

	@Override
	public boolean equals(final Object obj) {
		return obj instanceof Features && ((Features) obj).number == number;
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(number);
	}

	@Override
	public String toString() {
		return "{number=" + number + "}";
	}
}
