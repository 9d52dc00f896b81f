package edu.uw.easysva.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * The sentential form a derivation rewrites: a sequence of tagged symbols such as NP[plural] VP[singular].
 * Instances are immutable; rewriting returns a new string.
 */
public class TaggedString {
	private final List<TaggedSymbol> symbols;

	public TaggedString(final List<TaggedSymbol> symbols) {
		this.symbols = ImmutableList.copyOf(symbols);
	}

	public static TaggedString of(final TaggedSymbol... symbols) {
		return new TaggedString(Arrays.asList(symbols));
	}

	public int size() {
		return symbols.size();
	}

	public TaggedSymbol get(final int position) {
		return symbols.get(position);
	}

	/**
	 * Replaces the symbol at a position with a sequence of symbols.
	 */
	public TaggedString replace(final int position, final List<TaggedSymbol> replacement) {
		final List<TaggedSymbol> result = new ArrayList<>(symbols.size() + replacement.size());
		result.addAll(symbols.subList(0, position));
		result.addAll(replacement);
		result.addAll(symbols.subList(position + 1, symbols.size()));
		return new TaggedString(result);
	}

	public boolean contains(final TaggedSymbol symbol) {
		return symbols.contains(symbol);
	}

	@Override
	public boolean equals(final Object obj) {
		return obj instanceof TaggedString && symbols.equals(((TaggedString) obj).symbols);
	}

	@Override
	public int hashCode() {
		return symbols.hashCode();
	}

	@Override
	public String toString() {
		return Joiner.on(' ').join(symbols);
	}
}
