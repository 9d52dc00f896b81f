package edu.uw.easysva.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Status {
	OK, ERROR;

	@JsonValue
	@Override
	public String toString() {
		return name().toLowerCase();
	}
}
