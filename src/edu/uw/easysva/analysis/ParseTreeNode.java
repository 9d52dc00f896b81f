package edu.uw.easysva.analysis;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;

import edu.uw.easysva.lexicon.GrammaticalNumber;

/**
 * A node of the shallow S → NP VP tree shown for each clause. Leaves carry the word and its features.
 */
@JsonInclude(Include.NON_EMPTY)
@JsonPropertyOrder({ "label", "text", "features", "children" })
public class ParseTreeNode {
	public static final String SENTENCE = "S";
	public static final String COMPOUND_SENTENCE = "S (Compound)";

	private final String label;
	private final String text;
	private final Features features;
	private final List<ParseTreeNode> children;

	public ParseTreeNode(final String label, final String text, final Features features,
			final List<ParseTreeNode> children) {
		this.label = label;
		this.text = text;
		this.features = features;
		this.children = children == null ? Collections.emptyList() : ImmutableList.copyOf(children);
	}

	public static ParseTreeNode leaf(final String label, final String text, final GrammaticalNumber number) {
		return new ParseTreeNode(label, text, number == null ? null : new Features(number), null);
	}

	public static ParseTreeNode branch(final String label, final ParseTreeNode... children) {
		return new ParseTreeNode(label, null, null, Arrays.asList(children));
	}

	public static ParseTreeNode branch(final String label, final List<ParseTreeNode> children) {
		return new ParseTreeNode(label, null, null, children);
	}

	/**
	 * S → NP (number) VP (number), where the NP optionally starts with a determiner leaf.
	 */
	public static ParseTreeNode sentence(final String determiner, final String subject,
			final GrammaticalNumber subjectNumber, final String verb, final GrammaticalNumber verbNumber) {
		final ImmutableList.Builder<ParseTreeNode> np = ImmutableList.builder();
		if (determiner != null) {
			np.add(leaf("DET", determiner, null));
		}
		np.add(leaf("N", subject, subjectNumber));

		return branch(SENTENCE, branch("NP (" + subjectNumber + ")", np.build()),
				branch("VP (" + verbNumber + ")", leaf("V", verb, verbNumber)));
	}

	@JsonProperty("label")
	public String getLabel() {
		return label;
	}

	@JsonProperty("text")
	public String getText() {
		return text;
	}

	@JsonProperty("features")
	public Features getFeatures() {
		return features;
	}

	@JsonProperty("children")
	public List<ParseTreeNode> getChildren() {
		return children;
	}

	@Override
	public String toString() {
		final StringBuilder result = new StringBuilder();
		toString(result, 0);
		return result.toString();
	}

	private void toString(final StringBuilder result, final int depth) {
		for (int i = 0; i < depth; i++) {
			result.append("  ");
		}
		result.append(label);
		if (text != null) {
			result.append(" '").append(text).append("'");
		}
		result.append("\n");
		for (final ParseTreeNode child : children) {
			child.toString(result, depth + 1);
		}
	}
}
