package edu.uw.easysva.lexicon;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NounClass {
	PRONOUN, INDEFINITE, COLLECTIVE, UNIT, SINGULAR_PLURAL, REGULAR,
	// Two subjects joined by a coordinator
	COMPOUND;

	@JsonValue
	@Override
	public String toString() {
		return name().toLowerCase();
	}
}
