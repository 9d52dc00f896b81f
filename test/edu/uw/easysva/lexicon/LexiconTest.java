package edu.uw.easysva.lexicon;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("unit")
class LexiconTest {

	@Test
	@DisplayName("Bundled tables are loaded")
	void loadDefault_shouldReadBundledTables() {
		final Lexicon lexicon = Lexicon.loadDefault();

		assertThat(lexicon.getPronounNumber("I")).isEqualTo(GrammaticalNumber.PLURAL);
		assertThat(lexicon.getIrregularVerb("is").getCounterpart()).isEqualTo("are");
		assertThat(lexicon.getContractionNumber("doesn't")).isEqualTo(GrammaticalNumber.SINGULAR);
		assertThat(lexicon.isAuxiliary("Should")).isTrue();
		assertThat(lexicon.isIndefinitePronoun("everybody")).isTrue();
		assertThat(lexicon.isCollectiveNoun("jury")).isTrue();
		assertThat(lexicon.isUnitWord("miles")).isTrue();
		assertThat(lexicon.isSingularPlural("news")).isTrue();
		assertThat(lexicon.isIrregularPlural("mice")).isTrue();
		assertThat(lexicon.isCommonVerb("bark")).isTrue();
		assertThat(lexicon.isCommonVerb("guitar")).isFalse();
	}

	@Test
	@DisplayName("A lexicon folder overrides only the tables it contains")
	void load_shouldOverrideTablesFromFolder(@TempDir final Path folder) throws IOException {
		Files.write(folder.resolve(Lexicon.COLLECTIVE_NOUNS),
				"// custom collectives\nflock\n\nherd   // trailing comment\n".getBytes(StandardCharsets.UTF_8));

		final Lexicon lexicon = Lexicon.load(folder.toFile());

		assertThat(lexicon.isCollectiveNoun("flock")).isTrue();
		assertThat(lexicon.isCollectiveNoun("herd")).isTrue();
		assertThat(lexicon.isCollectiveNoun("team")).isFalse();
		assertThat(lexicon.isPronoun("they")).isTrue();
	}

	@Test
	@DisplayName("Malformed table lines are skipped")
	void load_shouldSkipMalformedLines(@TempDir final Path folder) throws IOException {
		Files.write(folder.resolve(Lexicon.PRONOUNS),
				"he\tsingular\t3\nbroken\nwe\tplural\t1\n".getBytes(StandardCharsets.UTF_8));

		final Lexicon lexicon = Lexicon.load(folder.toFile());

		assertThat(lexicon.isPronoun("he")).isTrue();
		assertThat(lexicon.isPronoun("we")).isTrue();
		assertThat(lexicon.isPronoun("broken")).isFalse();
	}

	@Test
	@DisplayName("Loading from something that is not a folder fails fast")
	void load_shouldRejectMissingFolder() {
		assertThatThrownBy(() -> Lexicon.load(new File("no/such/lexicon/folder")))
				.isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Not a lexicon folder");
	}

	@Test
	@DisplayName("Determiners and possessives are fixed word classes")
	void staticWordClasses_shouldBeCaseInsensitive() {
		assertThat(Lexicon.isDeterminer("The")).isTrue();
		assertThat(Lexicon.isPossessive("their")).isTrue();
		assertThat(Lexicon.isDeterminer(null)).isFalse();
	}
}
