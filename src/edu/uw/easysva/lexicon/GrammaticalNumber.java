package edu.uw.easysva.lexicon;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The only agreement feature tracked: singular or plural.
 */
public enum GrammaticalNumber {
	SINGULAR, PLURAL;

	public GrammaticalNumber opposite() {
		return this == SINGULAR ? PLURAL : SINGULAR;
	}

	public static GrammaticalNumber fromString(final String text) {
		if (text != null) {
			for (final GrammaticalNumber number : values()) {
				if (text.trim().equalsIgnoreCase(number.toString())) {
					return number;
				}
			}
		}
		throw new IllegalArgumentException("Invalid grammatical number: " + text);
	}

	@JsonValue
	@Override
	public String toString() {
		return name().toLowerCase();
	}
}
