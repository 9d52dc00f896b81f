package edu.uw.easysva.analysis;

import java.util.Arrays;
import java.util.function.Function;
import java.util.stream.Collectors;

import edu.uw.easysva.lexicon.Lexicon;

/**
 * The available agreement engines, selectable by name.
 */
public enum EngineType {
	CSG("csg", CsgSvaEngine::new), RULE("rule", RuleSvaEngine::new);

	private final String name;
	private final Function<Lexicon, SvaEngine> factory;

	EngineType(final String name, final Function<Lexicon, SvaEngine> factory) {
		this.name = name;
		this.factory = factory;
	}

	public SvaEngine make(final Lexicon lexicon) {
		return factory.apply(lexicon);
	}

	public static EngineType fromName(final String name) {
		for (final EngineType type : values()) {
			if (type.name.equalsIgnoreCase(name == null ? "" : name.trim())) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown engine: " + name + ". Valid engines are: "
				+ Arrays.stream(values()).map(EngineType::toString).collect(Collectors.joining(", ")));
	}

	@Override
	public String toString() {
		return name;
	}
}
