package edu.uw.easysva.syntax;

/**
 * Conjunctions that can join two subjects.
 */
public enum Coordinator {
	AND, OR, NOR;

	/**
	 * Returns null if the word is not a subject coordinator.
	 */
	public static Coordinator fromWord(final String word) {
		if (word != null) {
			for (final Coordinator coordinator : values()) {
				if (word.equalsIgnoreCase(coordinator.toString())) {
					return coordinator;
				}
			}
		}
		return null;
	}

	@Override
	public String toString() {
		return name().toLowerCase();
	}
}
