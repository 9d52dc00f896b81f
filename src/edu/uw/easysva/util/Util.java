package edu.uw.easysva.util;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.zip.GZIPInputStream;

public class Util {

	private Util() {
	}

	public static File getFile(final String path) {
		return new File(path.replace("~", System.getProperty("user.home")));
	}

	public static Iterable<String> readFile(final File filePath) throws IOException {
		if (!filePath.exists()) {
			throw new IOException("No such file: " + filePath);
		}
		return new Iterable<String>() {

			@Override
			public Iterator<String> iterator() {

				try {
					return readFileLineByLine(filePath);
				} catch (final IOException e) {
					throw new UncheckedIOException(e);
				}
			}
		};

	}

	public static Iterator<String> readFileLineByLine(final File filePath) throws IOException {
		InputStream fstream = new FileInputStream(filePath);
		if (filePath.getName().endsWith(".gz")) {
			// Automatically unzip zipped files.
			fstream = new GZIPInputStream(fstream);
		}

		return readLines(fstream);
	}

	/**
	 * Reads all lines of a classpath resource, or returns null if there is no such resource.
	 */
	public static List<String> readResource(final String resourcePath) throws IOException {
		final InputStream stream = Util.class.getResourceAsStream(resourcePath);
		if (stream == null) {
			return null;
		}

		final List<String> result = new ArrayList<>();
		final Iterator<String> lines = readLines(stream);
		while (lines.hasNext()) {
			result.add(lines.next());
		}
		return result;
	}

	private static Iterator<String> readLines(final InputStream stream) throws IOException {
		final BufferedReader br = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));

		return new Iterator<String>() {
			String next = br.readLine();

			@Override
			public boolean hasNext() {

				final boolean result = (next != null);
				if (!result) {
					try {
						br.close();
					} catch (final IOException e) {
						throw new UncheckedIOException(e);
					}
				}

				return result;
			}

			@Override
			public String next() {
				if (next == null) {
					throw new NoSuchElementException();
				}
				final String result = next;
				try {
					next = br.readLine();
				} catch (final IOException e) {
					throw new UncheckedIOException(e);
				}
				return result;
			}

			@Override
			public void remove() {
				throw new UnsupportedOperationException();
			}
		};
	}

	public static boolean isCapitalized(final String word) {
		if (word.isEmpty()) {
			return false;
		}
		return Character.isUpperCase(word.charAt(0));
	}

	/**
	 * Gives the replacement the same leading capitalization as the word it replaces, e.g. "Is" -> "Are".
	 */
	public static String matchCapitalization(final String original, final String replacement) {
		if (isCapitalized(original) && !replacement.isEmpty()) {
			return Character.toUpperCase(replacement.charAt(0)) + replacement.substring(1);
		}
		return replacement;
	}
}
