package edu.uw.easysva.analysis;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import edu.uw.easysva.correction.VerbCorrector;
import edu.uw.easysva.lexicon.GrammaticalNumber;
import edu.uw.easysva.lexicon.LexicalClassifier;
import edu.uw.easysva.lexicon.Lexicon;
import edu.uw.easysva.lexicon.NounClass;
import edu.uw.easysva.lexicon.NounClassification;
import edu.uw.easysva.lexicon.VerbHeuristics;
import edu.uw.easysva.syntax.CompoundInfo;
import edu.uw.easysva.syntax.CompoundSubjectDetector;
import edu.uw.easysva.syntax.SubjectAndVerb;
import edu.uw.easysva.syntax.SubjectVerbLocator;
import edu.uw.easysva.syntax.Token;
import edu.uw.easysva.syntax.Tokenizer;

/**
 * Runs one clause through location, classification and correction. Shared by both engines; holds no per-call state.
 */
public class ClauseAnalyzer {
	private static final Logger LOG = LoggerFactory.getLogger(ClauseAnalyzer.class);

	private final LexicalClassifier classifier;
	private final VerbHeuristics verbHeuristics;
	private final CompoundSubjectDetector compoundDetector;
	private final SubjectVerbLocator locator;
	private final VerbCorrector corrector;

	public ClauseAnalyzer(final Lexicon lexicon) {
		Preconditions.checkNotNull(lexicon);
		this.classifier = new LexicalClassifier(lexicon);
		this.verbHeuristics = new VerbHeuristics(lexicon);
		this.compoundDetector = new CompoundSubjectDetector(classifier, verbHeuristics);
		this.locator = new SubjectVerbLocator(lexicon);
		this.corrector = new VerbCorrector(classifier);
	}

	/**
	 * @return null if the text contains no words
	 */
	public ClauseAnalysis analyze(final String text) {
		final List<Token> words = Tokenizer.words(Tokenizer.tokenize(text));
		if (words.isEmpty()) {
			return null;
		}

		final CompoundInfo compound = compoundDetector.detect(words);
		final SubjectAndVerb subjectAndVerb = locator.locate(words, compound);
		if (subjectAndVerb == null) {
			return null;
		}

		final NounClassification subjectClass = compound == null
				? classifier.classifyNoun(subjectAndVerb.getSubject().getText())
				: new NounClassification(NounClass.COMPOUND, compound.getResultNumber());
		final GrammaticalNumber verbNumber = classifier.classifyVerb(subjectAndVerb.getVerb().getText());

		String correction = null;
		if (subjectClass.getNumber() != verbNumber) {
			correction = substitute(text, subjectAndVerb.getVerb(),
					corrector.correctVerb(subjectAndVerb.getVerb().getText(), subjectClass.getNumber()));
		}

		LOG.debug("[{}] subject={} ({}) verb={} ({})", text, subjectAndVerb.getSubjectText(), subjectClass,
				subjectAndVerb.getVerb().getText(), verbNumber);
		return new ClauseAnalysis(text, words, subjectAndVerb, subjectClass, verbNumber, correction);
	}

	/**
	 * Replaces the token's span, so an identical word earlier in the text is left alone.
	 */
	static String substitute(final String text, final Token token, final String replacement) {
		return text.substring(0, token.getStartOffset()) + replacement + text.substring(token.getEndOffset());
	}

	public LexicalClassifier getClassifier() {
		return classifier;
	}

	public VerbHeuristics getVerbHeuristics() {
		return verbHeuristics;
	}
}
