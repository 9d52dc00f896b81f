package edu.uw.easysva.grammar;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A non-terminal with a list of features, rendered as e.g. NP[compound+and+plural].
 *
 * In a rule pattern, the feature "X" matches any single feature.
 */
public class TaggedSymbol {
	public static final String NP = "NP";
	public static final String VP = "VP";
	final static String WILDCARD_FEATURE = "X";

	private final String label;
	private final List<String> features;

	private TaggedSymbol(final String label, final List<String> features) {
		this.label = Preconditions.checkNotNull(label);
		this.features = ImmutableList.copyOf(features);
	}

	public static TaggedSymbol of(final String label, final String... features) {
		return new TaggedSymbol(label, Arrays.asList(features));
	}

	public static TaggedSymbol of(final String label, final List<String> features) {
		return new TaggedSymbol(label, features);
	}

	public String getLabel() {
		return label;
	}

	public List<String> getFeatures() {
		return features;
	}

	/**
	 * Treats this symbol as a pattern and tests another symbol against it.
	 */
	public boolean matches(final TaggedSymbol other) {
		if (!label.equals(other.label) || features.size() != other.features.size()) {
			return false;
		}
		for (int i = 0; i < features.size(); i++) {
			final String feature = features.get(i);
			if (!feature.equals(WILDCARD_FEATURE) && !feature.equals(other.features.get(i))) {
				return false;
			}
		}
		return true;
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof TaggedSymbol)) {
			return false;
		}
		final TaggedSymbol other = (TaggedSymbol) obj;
		return label.equals(other.label) && features.equals(other.features);
	}

	@Override
	public int hashCode() {
		return Objects.hash(label, features);
	}

	@Override
	public String toString() {
		return label + "[" + Joiner.on('+').join(features) + "]";
	}
}
