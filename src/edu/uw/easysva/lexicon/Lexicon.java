package edu.uw.easysva.lexicon;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import edu.uw.easysva.util.Util;

/**
 * The closed word lists the classifiers consult. All tables are read once and are immutable afterwards, so a single
 * instance can be shared by any number of concurrent analyses.
 *
 * Tables are tab-separated text files, one entry per line. Anything after "//" is a comment.
 */
public class Lexicon {
	private static final Logger LOG = LoggerFactory.getLogger(Lexicon.class);

	private static final String RESOURCE_FOLDER = "/edu/uw/easysva/lexicon/";

	static final String PRONOUNS = "pronouns.txt";
	static final String IRREGULAR_VERBS = "irregular_verbs.txt";
	static final String CONTRACTIONS = "contractions.txt";
	static final String AUXILIARIES = "auxiliaries.txt";
	static final String INDEFINITE_PRONOUNS = "indefinite_pronouns.txt";
	static final String COLLECTIVE_NOUNS = "collective_nouns.txt";
	static final String UNIT_WORDS = "unit_words.txt";
	static final String SINGULAR_PLURALS = "singular_plurals.txt";
	static final String IRREGULAR_PLURALS = "irregular_plurals.txt";
	static final String COMMON_VERBS = "common_verbs.txt";

	public static final Set<String> DETERMINERS = ImmutableSet.of("the", "a", "an");
	public static final Set<String> POSSESSIVES = ImmutableSet.of("my", "your", "his", "her", "its", "our", "their");
	public static final Set<String> SUBJECT_COORDINATORS = ImmutableSet.of("and", "or", "nor");
	public static final Set<String> CLAUSE_COORDINATORS = ImmutableSet.of("and", "or", "but", "yet", "so", "for",
			"nor");

	/**
	 * A verb form together with its number and the form of the opposite number, e.g. is/singular/are.
	 */
	public static class IrregularVerb {
		private final GrammaticalNumber number;
		private final String counterpart;

		IrregularVerb(final GrammaticalNumber number, final String counterpart) {
			this.number = number;
			this.counterpart = counterpart;
		}

		public GrammaticalNumber getNumber() {
			return number;
		}

		public String getCounterpart() {
			return counterpart;
		}
	}

	private final Map<String, GrammaticalNumber> pronouns;
	private final Map<String, IrregularVerb> irregularVerbs;
	private final Map<String, GrammaticalNumber> contractions;
	private final Set<String> auxiliaries;
	private final Set<String> indefinitePronouns;
	private final Set<String> collectiveNouns;
	private final Set<String> unitWords;
	private final Set<String> singularPlurals;
	private final Set<String> irregularPlurals;
	private final Set<String> commonVerbs;

	private Lexicon(final TableSource source) throws IOException {
		this.pronouns = loadNumberTable(source, PRONOUNS);
		this.irregularVerbs = loadIrregularVerbs(source);
		this.contractions = loadNumberTable(source, CONTRACTIONS);
		this.auxiliaries = loadWordList(source, AUXILIARIES);
		this.indefinitePronouns = loadWordList(source, INDEFINITE_PRONOUNS);
		this.collectiveNouns = loadWordList(source, COLLECTIVE_NOUNS);
		this.unitWords = loadWordList(source, UNIT_WORDS);
		this.singularPlurals = loadWordList(source, SINGULAR_PLURALS);
		this.irregularPlurals = loadWordList(source, IRREGULAR_PLURALS);
		this.commonVerbs = loadWordList(source, COMMON_VERBS);
	}

	/**
	 * Loads the tables bundled with the library.
	 */
	public static Lexicon loadDefault() {
		try {
			final Lexicon result = new Lexicon(new TableSource(null));
			LOG.info("Loaded default lexicon: {}", result.describe());
			return result;
		} catch (final IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	/**
	 * Loads tables from a folder. Any table the folder does not contain is taken from the bundled defaults.
	 */
	public static Lexicon load(final File folder) {
		Preconditions.checkNotNull(folder);
		Preconditions.checkArgument(folder.isDirectory(), "Not a lexicon folder: %s", folder);
		try {
			final Lexicon result = new Lexicon(new TableSource(folder));
			LOG.info("Loaded lexicon from {}: {}", folder, result.describe());
			return result;
		} catch (final IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	public GrammaticalNumber getPronounNumber(final String word) {
		return pronouns.get(normalize(word));
	}

	public boolean isPronoun(final String word) {
		return pronouns.containsKey(normalize(word));
	}

	public IrregularVerb getIrregularVerb(final String word) {
		return irregularVerbs.get(normalize(word));
	}

	public boolean isIrregularVerb(final String word) {
		return irregularVerbs.containsKey(normalize(word));
	}

	public GrammaticalNumber getContractionNumber(final String word) {
		return contractions.get(normalize(word));
	}

	public boolean isContraction(final String word) {
		return contractions.containsKey(normalize(word));
	}

	public boolean isAuxiliary(final String word) {
		return auxiliaries.contains(normalize(word));
	}

	public boolean isIndefinitePronoun(final String word) {
		return indefinitePronouns.contains(normalize(word));
	}

	public boolean isCollectiveNoun(final String word) {
		return collectiveNouns.contains(normalize(word));
	}

	public boolean isUnitWord(final String word) {
		return unitWords.contains(normalize(word));
	}

	public boolean isSingularPlural(final String word) {
		return singularPlurals.contains(normalize(word));
	}

	public boolean isIrregularPlural(final String word) {
		return irregularPlurals.contains(normalize(word));
	}

	public boolean isCommonVerb(final String word) {
		return commonVerbs.contains(normalize(word));
	}

	public static boolean isDeterminer(final String word) {
		return DETERMINERS.contains(normalize(word));
	}

	public static boolean isPossessive(final String word) {
		return POSSESSIVES.contains(normalize(word));
	}

	static String normalize(final String word) {
		return word == null ? "" : word.toLowerCase();
	}

	private String describe() {
		return pronouns.size() + " pronouns, " + irregularVerbs.size() + " irregular verbs, " + contractions.size()
				+ " contractions, " + auxiliaries.size() + " auxiliaries, " + indefinitePronouns.size()
				+ " indefinite pronouns, " + collectiveNouns.size() + " collective nouns, " + unitWords.size()
				+ " unit words, " + singularPlurals.size() + " singular plurals, " + irregularPlurals.size()
				+ " irregular plurals, " + commonVerbs.size() + " common verbs";
	}

	private static Set<String> loadWordList(final TableSource source, final String table) throws IOException {
		final ImmutableSet.Builder<String> result = ImmutableSet.builder();
		for (final String[] fields : source.read(table)) {
			result.add(fields[0].toLowerCase());
		}
		return result.build();
	}

	private static Map<String, GrammaticalNumber> loadNumberTable(final TableSource source, final String table)
			throws IOException {
		final Map<String, GrammaticalNumber> result = new LinkedHashMap<>();
		for (final String[] fields : source.read(table)) {
			if (fields.length < 2) {
				LOG.warn("Expected a word and a number in {}; ignoring [{}]", table, String.join("\t", fields));
				continue;
			}
			result.put(fields[0].toLowerCase(), GrammaticalNumber.fromString(fields[1]));
		}
		return ImmutableMap.copyOf(result);
	}

	private static Map<String, IrregularVerb> loadIrregularVerbs(final TableSource source) throws IOException {
		final Map<String, IrregularVerb> result = new LinkedHashMap<>();
		for (final String[] fields : source.read(IRREGULAR_VERBS)) {
			if (fields.length < 3) {
				LOG.warn("Expected a verb, its number and its counterpart in {}; ignoring [{}]", IRREGULAR_VERBS,
						String.join("\t", fields));
				continue;
			}
			result.put(fields[0].toLowerCase(),
					new IrregularVerb(GrammaticalNumber.fromString(fields[1]), fields[2].toLowerCase()));
		}
		return ImmutableMap.copyOf(result);
	}

	/**
	 * Reads a table either from a user folder or from the bundled resources.
	 */
	private static class TableSource {
		private final File folder;

		private TableSource(final File folder) {
			this.folder = folder;
		}

		private List<String[]> read(final String table) throws IOException {
			final Iterable<String> lines;
			final File file = folder == null ? null : new File(folder, table);
			if (file != null && file.exists()) {
				lines = Util.readFile(file);
			} else {
				lines = Util.readResource(RESOURCE_FOLDER + table);
				if (lines == null) {
					throw new IOException("Missing bundled lexicon table: " + table);
				}
			}

			final List<String[]> result = new ArrayList<>();
			for (final String line2 : lines) {
				final int commentIndex = line2.indexOf("//");
				final String line = (commentIndex > -1 ? line2.substring(0, commentIndex) : line2).trim();
				if (line.isEmpty()) {
					continue;
				}
				result.add(line.split("\t+"));
			}
			return result;
		}
	}
}
