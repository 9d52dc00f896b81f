package edu.uw.easysva.main;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.text.DecimalFormat;
import java.util.Arrays;
import java.util.Iterator;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.flamingpenguin.jewel.cli.ArgumentValidationException;
import uk.co.flamingpenguin.jewel.cli.CliFactory;
import uk.co.flamingpenguin.jewel.cli.Option;

import com.google.common.base.Stopwatch;

import edu.uw.easysva.analysis.AnalysisResult;
import edu.uw.easysva.analysis.EngineType;
import edu.uw.easysva.analysis.SvaEngine;
import edu.uw.easysva.lexicon.Lexicon;
import edu.uw.easysva.util.Util;

public class EasySVA {
	private static final Logger LOG = LoggerFactory.getLogger(EasySVA.class);

	/**
	 * Command Line Interface
	 */
	public interface CommandLineArguments {
		@Option(shortName = "e", defaultValue = "csg", description = "(Optional) Agreement engine: one of \"csg\" or \"rule\". Defaults to csg.")
		String getEngine();

		@Option(shortName = "f", defaultValue = "", description = "(Optional) Path to the input text file, one sentence per line. Otherwise, sentences are read from stdin.")
		String getInputFile();

		@Option(shortName = "o", defaultValue = "json", description = "(Optional) Output Format: one of \"json\" or \"text\". Defaults to json.")
		String getOutputFormat();

		@Option(shortName = "l", defaultValue = "", description = "(Optional) Folder of lexicon tables overriding the bundled ones.")
		String getLexicon();

		@Option(helpRequest = true, description = "Display this message", shortName = "h")
		boolean getHelp();
	}

	// Set of supported OutputFormats
	public enum OutputFormat {
		JSON(ResultPrinter.JSON_PRINTER), TEXT(ResultPrinter.TEXT_PRINTER);

		public final ResultPrinter printer;

		OutputFormat(final ResultPrinter printer) {
			this.printer = printer;
		}

		public static OutputFormat fromName(final String name) {
			try {
				return valueOf(name.trim().toUpperCase());
			} catch (final IllegalArgumentException e) {
				throw new IllegalArgumentException("Unknown output format: " + name + ". Valid formats are: "
						+ Arrays.stream(values()).map(f -> f.name().toLowerCase()).collect(Collectors.joining(", ")),
						e);
			}
		}
	}

	public static void main(final String[] args) throws IOException {
		try {
			final CommandLineArguments commandLineOptions = CliFactory.parseArguments(CommandLineArguments.class, args);
			final SvaEngine engine = makeEngine(commandLineOptions);
			final ResultPrinter printer = OutputFormat.fromName(commandLineOptions.getOutputFormat()).printer;

			final boolean readingFromStdin;
			final Iterator<String> inputLines;
			if (commandLineOptions.getInputFile().isEmpty()) {
				inputLines = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)).lines()
						.iterator();
				readingFromStdin = true;
			} else {
				inputLines = Util.readFile(Util.getFile(commandLineOptions.getInputFile())).iterator();
				readingFromStdin = false;
			}

			final Stopwatch timer = Stopwatch.createStarted();
			final BufferedWriter sysout = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
			final int analysed = run(engine, printer, inputLines, sysout, readingFromStdin);
			sysout.close();

			final DecimalFormat twoDP = new DecimalFormat("#.##");
			LOG.info("Sentences analysed: {}", analysed);
			LOG.info("Speed: {} sentences per second",
					twoDP.format(1000.0 * analysed / Math.max(1, timer.elapsed(TimeUnit.MILLISECONDS))));

		} catch (final ArgumentValidationException e) {
			System.err.println(e.getMessage());
			System.err.println(CliFactory.createCli(CommandLineArguments.class).getHelpMessage());
		}
	}

	static SvaEngine makeEngine(final CommandLineArguments commandLineOptions) {
		final EngineType engineType = EngineType.fromName(commandLineOptions.getEngine());
		final Lexicon lexicon = commandLineOptions.getLexicon().isEmpty() ? Lexicon.loadDefault()
				: Lexicon.load(Util.getFile(commandLineOptions.getLexicon()));
		return engineType.make(lexicon);
	}

	/**
	 * Analyses each non-empty line that does not start with "#".
	 *
	 * @return the number of sentences analysed
	 */
	static int run(final SvaEngine engine, final ResultPrinter printer, final Iterator<String> inputLines,
			final BufferedWriter output, final boolean flushEachLine) throws IOException {
		int id = 0;
		while (inputLines.hasNext()) {
			final String line = inputLines.next().trim();
			if (line.isEmpty() || line.startsWith("#")) {
				continue;
			}
			id++;
			final AnalysisResult result = engine.analyze(line);
			output.write(printer.print(line, result, id));
			output.newLine();
			if (flushEachLine) {
				output.flush();
			}
		}
		output.flush();
		return id;
	}
}
