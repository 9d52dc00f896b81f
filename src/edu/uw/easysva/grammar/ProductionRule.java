package edu.uw.easysva.grammar;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A context-sensitive production αAβ → αγβ over tagged strings. The symbol A is rewritten to γ only where it is
 * preceded by α and followed by β. Contexts and A are patterns (see {@link TaggedSymbol#matches}); γ is concrete.
 */
public class ProductionRule {
	private final String id;
	private final List<TaggedSymbol> leftContext;
	private final TaggedSymbol symbol;
	private final List<TaggedSymbol> rightContext;
	private final List<TaggedSymbol> replacement;
	private final String description;
	private final int ruleNumber;

	ProductionRule(final String id, final List<TaggedSymbol> leftContext, final TaggedSymbol symbol,
			final List<TaggedSymbol> rightContext, final List<TaggedSymbol> replacement, final String description,
			final int ruleNumber) {
		Preconditions.checkArgument(!replacement.isEmpty(), "Rule %s must not erase its symbol", id);
		this.id = id;
		this.leftContext = ImmutableList.copyOf(leftContext);
		this.symbol = Preconditions.checkNotNull(symbol);
		this.rightContext = ImmutableList.copyOf(rightContext);
		this.replacement = ImmutableList.copyOf(replacement);
		this.description = description;
		this.ruleNumber = ruleNumber;
	}

	public String getId() {
		return id;
	}

	public List<TaggedSymbol> getLeftContext() {
		return leftContext;
	}

	public TaggedSymbol getSymbol() {
		return symbol;
	}

	public List<TaggedSymbol> getRightContext() {
		return rightContext;
	}

	public List<TaggedSymbol> getReplacement() {
		return replacement;
	}

	public String getDescription() {
		return description;
	}

	/**
	 * The number of the agreement rule this production encodes, e.g. 3 for "subjects joined by 'and' are plural".
	 */
	public int getRuleNumber() {
		return ruleNumber;
	}

	/**
	 * Can this rule rewrite the symbol at the given position?
	 */
	public boolean matches(final TaggedString string, final int position) {
		if (position < 0 || position >= string.size() || !symbol.matches(string.get(position))) {
			return false;
		}

		final int leftStart = position - leftContext.size();
		if (leftStart < 0) {
			return false;
		}
		for (int i = 0; i < leftContext.size(); i++) {
			if (!leftContext.get(i).matches(string.get(leftStart + i))) {
				return false;
			}
		}

		if (position + rightContext.size() >= string.size()) {
			return false;
		}
		for (int i = 0; i < rightContext.size(); i++) {
			if (!rightContext.get(i).matches(string.get(position + 1 + i))) {
				return false;
			}
		}

		return true;
	}

	public TaggedString apply(final TaggedString string, final int position) {
		Preconditions.checkArgument(matches(string, position), "Rule %s does not apply to %s at %s", id, string,
				position);
		return string.replace(position, replacement);
	}

	/**
	 * e.g. "NP[singular] VP[X] → NP[singular] VP[singular]"
	 */
	public String getProduction() {
		return render(ImmutableList.of(symbol)) + " → " + render(replacement);
	}

	private String render(final List<TaggedSymbol> middle) {
		return Joiner.on(' ').join(ImmutableList.<TaggedSymbol> builder().addAll(leftContext).addAll(middle)
				.addAll(rightContext).build());
	}

	@Override
	public String toString() {
		return id + ": " + getProduction();
	}
}
