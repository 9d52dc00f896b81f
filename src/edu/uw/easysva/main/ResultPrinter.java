package edu.uw.easysva.main;

import java.io.UncheckedIOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import edu.uw.easysva.analysis.AnalysisResult;
import edu.uw.easysva.analysis.ClauseResult;
import edu.uw.easysva.analysis.ProblemSpan;
import edu.uw.easysva.grammar.DerivationStep;

public abstract class ResultPrinter {
	public final static ResultPrinter JSON_PRINTER = new JsonPrinter();
	public final static ResultPrinter TEXT_PRINTER = new TextPrinter();

	/**
	 * @param id
	 *            1-based number of the sentence in the input, or -1 to omit the header
	 */
	public String print(final String sentence, final AnalysisResult result, final int id) {
		final StringBuilder output = new StringBuilder();
		if (id > -1) {
			printHeader(id, sentence, output);
		}
		printResult(result, output);
		return output.toString();
	}

	abstract void printHeader(int id, String sentence, StringBuilder output);

	abstract void printResult(AnalysisResult result, StringBuilder output);

	/**
	 * One JSON object per line.
	 */
	static class JsonPrinter extends ResultPrinter {
		private final ObjectMapper objectMapper = new ObjectMapper();

		@Override
		void printHeader(final int id, final String sentence, final StringBuilder output) {
		}

		@Override
		void printResult(final AnalysisResult result, final StringBuilder output) {
			output.append(toJson(result));
		}

		String toJson(final Object value) {
			try {
				return objectMapper.writeValueAsString(value);
			} catch (final JsonProcessingException e) {
				throw new UncheckedIOException(e);
			}
		}
	}

	static class TextPrinter extends ResultPrinter {

		@Override
		void printHeader(final int id, final String sentence, final StringBuilder output) {
			output.append("ID=").append(id).append(" ").append(sentence).append("\n");
		}

		@Override
		void printResult(final AnalysisResult result, final StringBuilder output) {
			output.append(result.getStatus()).append(": ").append(result.getMessage()).append("\n");
			for (final ProblemSpan span : result.getProblemSpans()) {
				output.append("  problem: '").append(span.getText()).append("' [").append(span.getStart())
						.append(",").append(span.getEnd()).append(")\n");
			}

			if (result.isCompound()) {
				for (final ClauseResult clause : result.getClauseAnalyses()) {
					output.append("  clause ").append(clause.getClauseNumber()).append(": ").append(clause.getText())
							.append(" -> ").append(clause.getAnalysis().getStatus()).append("\n");
				}
			}

			for (final DerivationStep step : result.getDerivation()) {
				output.append("  ").append(step).append("\n");
			}

			if (result.getSuggestedCorrection() != null) {
				output.append("Suggested correction: ").append(result.getSuggestedCorrection()).append("\n");
			}
		}
	}
}
