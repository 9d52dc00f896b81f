package edu.uw.easysva.analysis;

import java.util.List;
import java.util.stream.Collectors;

/**
 * User-facing explanations shared by the engines.
 */
class Messages {

	private Messages() {
	}

	static String agreement(final ClauseAnalysis clause) {
		return "Subject-verb agreement is correct. Subject '" + clause.getSubjectText() + "' ("
				+ clause.getSubjectNumber() + ") agrees with verb '" + clause.getVerbText() + "' ("
				+ clause.getVerbNumber() + ").";
	}

	/**
	 * @param auxiliary
	 *            mention that the disagreeing verb is an auxiliary or contraction
	 */
	static String disagreement(final ClauseAnalysis clause, final boolean auxiliary) {
		return "Subject-verb disagreement: '" + clause.getSubjectText() + "' (" + clause.getSubjectNumber()
				+ ") does not agree with '" + clause.getVerbText() + "' (" + clause.getVerbNumber() + ")"
				+ (auxiliary ? " (auxiliary)." : ".");
	}

	static String compoundAgreement(final int clauseCount) {
		return "Compound sentence with " + clauseCount
				+ " clauses: subject-verb agreement is correct in every clause.";
	}

	static String compoundDisagreement(final int clauseCount, final List<Integer> disagreeing) {
		return "Compound sentence with " + clauseCount + " clauses: subject-verb disagreement in clause"
				+ (disagreeing.size() == 1 ? " " : "s ")
				+ disagreeing.stream().map(String::valueOf).collect(Collectors.joining(", ")) + ".";
	}

	static ProblemSpan problemSpan(final ClauseAnalysis clause) {
		return new ProblemSpan(clause.getSubjectText(), clause.getSubjectStart(), clause.getSubjectEnd(),
				clause.getSubjectNumber(), clause.getVerbNumber());
	}
}
