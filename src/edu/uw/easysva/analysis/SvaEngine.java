package edu.uw.easysva.analysis;

/**
 * Checks subject-verb agreement of a sentence. Implementations never throw for any input text: failures are reported
 * as results with status {@link Status#ERROR}. They are stateless and can be shared between threads.
 */
public interface SvaEngine {

	AnalysisResult analyze(String sentence);

	EngineType getType();
}
