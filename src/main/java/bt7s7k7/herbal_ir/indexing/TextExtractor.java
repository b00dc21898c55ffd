package bt7s7k7.herbal_ir.indexing;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.apache.commons.lang3.StringUtils;

public final class TextExtractor {
	private TextExtractor() {}

	public static final int DEFAULT_MIN_TOKEN_LENGTH = 2;

	// Words broken over two lines by PDF text extraction, like "obat-\nobatan"
	private static final Pattern HYPHENATED_LINE_BREAK = Pattern.compile("(\\p{L})-[ \\t]*\\r?\\n[ \\t]*(\\p{L})");
	// Anything that is not a latin letter separates tokens, this also removes numbers
	private static final Pattern NON_LETTERS = Pattern.compile("[^a-z]+");

	public static String normalize(String text) {
		if (text == null || text.isEmpty()) return "";

		var joined = HYPHENATED_LINE_BREAK.matcher(text).replaceAll("$1$2");
		return NON_LETTERS.matcher(joined.toLowerCase(Locale.ROOT)).replaceAll(" ").strip();
	}

	public static Stream<String> extractTokens(String text) {
		return extractTokens(text, DEFAULT_MIN_TOKEN_LENGTH);
	}

	/** Splits text into lowercase alphabetic tokens, dropping tokens shorter than {@code minLength}. */
	public static Stream<String> extractTokens(String text, int minLength) {
		var normalized = normalize(text);
		if (normalized.isEmpty()) return Stream.empty();

		return Stream.of(StringUtils.split(normalized, ' '))
				// Single letters are mostly noise from PDF extraction
				.filter(token -> token.length() >= minLength);
	}

	/** Words followed by a period that do not end a sentence. */
	private static final Set<String> ABBREVIATIONS = Set.of(
			"dr", "drs", "dra", "ir", "prof", "sdr", "yth", "tsb", "dll", "dsb", "dst", "dkk", "no", "hlm", "hal", "jl",
			"kg", "mg", "ml", "gr", "cm", "mm", "kab", "kec", "kel", "ttg", "spp", "sp", "var", "vol", "ed", "et", "al", "cf");

	// Empty lines separate paragraphs, which are always separate sentences
	private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\r?\\n[ \\t]*\\r?\\n");
	private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+[\"')\\]]*\\s+");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");
	private static final Pattern LAST_WORD = Pattern.compile("(\\p{L}+)[.!?]+[\"')\\]]*$");
	private static final Pattern HAS_LETTER = Pattern.compile("\\p{L}");

	/**
	 * Splits raw text into sentences. Sentences end with '.', '!' or '?' followed by whitespace,
	 * except after abbreviations and initials. Sentences without any letters, such as page numbers,
	 * are skipped.
	 */
	public static List<String> splitSentences(String text) {
		var result = new ArrayList<String>();
		if (StringUtils.isBlank(text)) return result;

		var joined = HYPHENATED_LINE_BREAK.matcher(text).replaceAll("$1$2");

		for (var paragraph : PARAGRAPH_BREAK.split(joined)) {
			var current = new StringBuilder();
			var matcher = SENTENCE_END.matcher(paragraph);
			var prevIndex = 0;

			while (matcher.find()) {
				current.append(paragraph, prevIndex, matcher.end());
				prevIndex = matcher.end();

				var candidate = current.toString().strip();
				if (endsWithAbbreviation(candidate)) continue;

				addSentence(result, candidate);
				current.setLength(0);
			}

			// Add the rest of the paragraph as the last sentence
			current.append(paragraph, prevIndex, paragraph.length());
			addSentence(result, current.toString().strip());
		}

		return result;
	}

	private static boolean endsWithAbbreviation(String candidate) {
		// Only periods can follow an abbreviation
		if (!candidate.endsWith(".")) return false;

		var matcher = LAST_WORD.matcher(candidate);
		if (!matcher.find()) return false;

		var word = matcher.group(1);
		// A single letter is an initial, like in "A. Budi"
		if (word.length() == 1) return true;
		return ABBREVIATIONS.contains(word.toLowerCase(Locale.ROOT));
	}

	private static void addSentence(List<String> result, String sentence) {
		if (sentence.isEmpty()) return;
		if (!HAS_LETTER.matcher(sentence).find()) return;
		result.add(WHITESPACE.matcher(sentence).replaceAll(" "));
	}
}
