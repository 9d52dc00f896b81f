package edu.uw.easysva.analysis;

import com.google.common.collect.ImmutableList;

import edu.uw.easysva.lexicon.Lexicon;

/**
 * A lighter engine that treats the whole sentence as one clause and reports the agreement decision without a
 * derivation.
 */
public class RuleSvaEngine implements SvaEngine {
	private final ClauseAnalyzer clauseAnalyzer;

	public RuleSvaEngine(final Lexicon lexicon) {
		this(new ClauseAnalyzer(lexicon));
	}

	public RuleSvaEngine(final ClauseAnalyzer clauseAnalyzer) {
		this.clauseAnalyzer = clauseAnalyzer;
	}

	@Override
	public AnalysisResult analyze(final String sentence) {
		final ClauseAnalysis clause = clauseAnalyzer.analyze(sentence == null ? "" : sentence);
		if (clause == null) {
			return AnalysisResult.failure(AnalysisResult.UNPARSABLE_MESSAGE);
		}

		final ParseTreeNode parseTree = ParseTreeNode.sentence(clause.getLeadingDeterminer(), clause.getSubjectText(),
				clause.getSubjectNumber(), clause.getVerbText(), clause.getVerbNumber());

		final AnalysisResult.Builder result;
		if (clause.agrees()) {
			result = new AnalysisResult.Builder(Status.OK, Messages.agreement(clause));
		} else {
			result = new AnalysisResult.Builder(Status.ERROR,
					Messages.disagreement(clause, clause.getSubjectAndVerb().isAuxiliary()))
					.problemSpans(ImmutableList.of(Messages.problemSpan(clause)))
					.suggestedCorrection(clause.getSuggestedCorrection());
		}
		return result.parseTree(parseTree).agreement(clause).build();
	}

	@Override
	public EngineType getType() {
		return EngineType.RULE;
	}
}
