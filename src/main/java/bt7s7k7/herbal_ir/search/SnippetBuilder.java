package bt7s7k7.herbal_ir.search;

import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;

public final class SnippetBuilder {
	private SnippetBuilder() {}

	public static final int DEFAULT_WINDOW = 260;

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	/**
	 * Cuts a window of the text around the earliest occurrence of any of the words. The window starts
	 * a third of its length before the occurrence. Without any occurrence, the start of the text is
	 * returned.
	 */
	public static String build(String text, Collection<String> words, int window) {
		if (text == null || text.isBlank()) return "";

		var flat = WHITESPACE.matcher(text).replaceAll(" ").strip();
		var lower = flat.toLowerCase(Locale.ROOT);

		var first = -1;
		for (var word : words) {
			if (word.isEmpty()) continue;
			var position = lower.indexOf(word.toLowerCase(Locale.ROOT));
			if (position != -1 && (first == -1 || position < first)) first = position;
		}

		if (first == -1) {
			return flat.length() > window ? flat.substring(0, window) + "..." : flat;
		}

		var start = Math.max(0, first - window / 3);
		var end = Math.min(flat.length(), start + window);

		var snippet = flat.substring(start, end);
		if (start > 0) snippet = "..." + snippet;
		if (end < flat.length()) snippet = snippet + "...";
		return snippet;
	}

	public static String build(String text, Collection<String> words) {
		return build(text, words, DEFAULT_WINDOW);
	}
}
