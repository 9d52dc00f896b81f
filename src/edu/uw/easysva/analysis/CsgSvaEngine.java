package edu.uw.easysva.analysis;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import edu.uw.easysva.grammar.CsgRuleEngine;
import edu.uw.easysva.grammar.Derivation;
import edu.uw.easysva.grammar.DerivationStep;
import edu.uw.easysva.grammar.TaggedString;
import edu.uw.easysva.lexicon.GrammaticalNumber;
import edu.uw.easysva.lexicon.Lexicon;
import edu.uw.easysva.syntax.Clause;
import edu.uw.easysva.syntax.ClauseSplitter;
import edu.uw.easysva.syntax.SplitSentence;

/**
 * The full engine. Compound sentences are split into independent clauses, each clause is checked on its own and
 * explained with a context-sensitive derivation, and the clause results are merged into one report.
 *
 * Agreement is decided by comparing the classified numbers of subject and verb; the derivation explains the decision.
 */
public class CsgSvaEngine implements SvaEngine {
	private static final Logger LOG = LoggerFactory.getLogger(CsgSvaEngine.class);

	private final ClauseAnalyzer clauseAnalyzer;
	private final ClauseSplitter clauseSplitter;
	private final CsgRuleEngine ruleEngine;

	public CsgSvaEngine(final Lexicon lexicon) {
		this(new ClauseAnalyzer(lexicon), new CsgRuleEngine());
	}

	public CsgSvaEngine(final ClauseAnalyzer clauseAnalyzer, final CsgRuleEngine ruleEngine) {
		this.clauseAnalyzer = clauseAnalyzer;
		this.clauseSplitter = new ClauseSplitter(clauseAnalyzer.getVerbHeuristics());
		this.ruleEngine = ruleEngine;
	}

	@Override
	public AnalysisResult analyze(final String sentence) {
		final String text = sentence == null ? "" : sentence;
		final SplitSentence split = clauseSplitter.split(text);
		if (!split.isCompound()) {
			return analyzeClause(text);
		}

		LOG.debug("Split [{}] into {} clauses", text, split.getClauses().size());
		return analyzeCompound(text, split);
	}

	AnalysisResult analyzeClause(final String text) {
		final ClauseAnalysis clause = clauseAnalyzer.analyze(text);
		if (clause == null) {
			return AnalysisResult.failure(AnalysisResult.UNPARSABLE_MESSAGE);
		}

		final GrammaticalNumber subjectNumber = clause.getSubjectNumber();
		final GrammaticalNumber verbNumber = clause.getVerbNumber();
		final TaggedString initial = CsgRuleEngine.buildInitialString(clause.getSubjectAndVerb().getSubject().getText(),
				clause.getSubjectClass(), verbNumber, clause.getSubjectAndVerb().getCompound());
		final Derivation derivation = ruleEngine.derive(initial);
		final boolean agrees = clause.agrees();
		final CsgAnalysis csgAnalysis = new CsgAnalysis(derivation,
				agrees ? null : "NP[" + subjectNumber + "] VP[" + subjectNumber + "]",
				derivation.derivesVerbNumber(subjectNumber.toString()));

		final ParseTreeNode parseTree = ParseTreeNode.sentence(null, clause.getSubjectText(), subjectNumber,
				clause.getVerbText(), verbNumber);

		final AnalysisResult.Builder result;
		if (agrees) {
			result = new AnalysisResult.Builder(Status.OK, Messages.agreement(clause));
		} else {
			result = new AnalysisResult.Builder(Status.ERROR, Messages.disagreement(clause, false))
					.problemSpans(ImmutableList.of(Messages.problemSpan(clause)))
					.suggestedCorrection(clause.getSuggestedCorrection());
		}

		return result.parseTree(parseTree).derivation(derivation.getSteps()).csgAnalysis(csgAnalysis)
				.agreement(clause).build();
	}

	private AnalysisResult analyzeCompound(final String sentence, final SplitSentence split) {
		final List<ClauseResult> clauseResults = new ArrayList<>();
		final List<ProblemSpan> problemSpans = new ArrayList<>();
		final List<ParseTreeNode> subtrees = new ArrayList<>();
		final List<DerivationStep> derivation = new ArrayList<>();
		final List<String> correctedClauses = new ArrayList<>();
		final List<Integer> disagreeing = new ArrayList<>();

		for (final Clause clause : split.getClauses()) {
			final int clauseNumber = clauseResults.size() + 1;
			final AnalysisResult analysis = analyzeClause(clause.getText());
			clauseResults.add(new ClauseResult(clauseNumber, clause.getText(), analysis));

			for (final ProblemSpan span : analysis.getProblemSpans()) {
				problemSpans.add(span.shift(clause.getStartOffset()));
			}
			if (analysis.getParseTree() != null) {
				subtrees.add(analysis.getParseTree());
			}
			for (final DerivationStep step : analysis.getDerivation()) {
				derivation.add(step.renumber(derivation.size(), "Clause " + clauseNumber + ": "));
			}

			if (analysis.isOk()) {
				correctedClauses.add(clause.getText());
			} else {
				disagreeing.add(clauseNumber);
				correctedClauses.add(analysis.getSuggestedCorrection() == null ? clause.getText()
						: analysis.getSuggestedCorrection());
			}
		}

		final AnalysisResult.Builder result;
		if (disagreeing.isEmpty()) {
			result = new AnalysisResult.Builder(Status.OK, Messages.compoundAgreement(clauseResults.size()));
		} else {
			result = new AnalysisResult.Builder(Status.ERROR,
					Messages.compoundDisagreement(clauseResults.size(), disagreeing))
					.suggestedCorrection(split.join(correctedClauses));
		}

		return result.problemSpans(problemSpans)
				.parseTree(ParseTreeNode.branch(ParseTreeNode.COMPOUND_SENTENCE, subtrees)).derivation(derivation)
				.compound(sentence, clauseResults).build();
	}

	@Override
	public EngineType getType() {
		return EngineType.CSG;
	}
}
