package bt7s7k7.herbal_ir.indexing;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

import com.google.common.collect.ImmutableSet;

/**
 * Removes general Indonesian stopwords and stopwords specific to herbal documents. Matching is exact,
 * so it has to run before stemming, otherwise inflected forms of stopwords would be lost too.
 */
public class StopwordFilter {
	public static final String GENERAL_RESOURCE = "/stopwords/general.txt";
	public static final String DOMAIN_RESOURCE = "/stopwords/herbal.txt";

	public final ImmutableSet<String> general;
	public final ImmutableSet<String> domain;

	public StopwordFilter(Collection<String> general, Collection<String> domain) {
		this.general = normalize(general);
		this.domain = normalize(domain);
	}

	public static final StopwordFilter NONE = new StopwordFilter(List.of(), List.of());

	private static StopwordFilter defaultFilter = null;

	/** Stopwords from the bundled resources. Loaded once and shared. */
	public static synchronized StopwordFilter getDefault() {
		if (defaultFilter != null) return defaultFilter;

		try {
			defaultFilter = new StopwordFilter(loadResource(GENERAL_RESOURCE), loadResource(DOMAIN_RESOURCE));
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}

		return defaultFilter;
	}

	public boolean isStopword(String token) {
		var normalized = token.toLowerCase(Locale.ROOT);
		return this.general.contains(normalized) || this.domain.contains(normalized);
	}

	public List<String> filter(List<String> tokens) {
		return tokens.stream()
				.filter(token -> !this.isStopword(token))
				.toList();
	}

	private static ImmutableSet<String> normalize(Collection<String> words) {
		return words.stream()
				.map(String::trim)
				.filter(word -> !word.isEmpty())
				.map(word -> word.toLowerCase(Locale.ROOT))
				.collect(ImmutableSet.toImmutableSet());
	}

	public static List<String> loadResource(String name) throws IOException {
		var stream = StopwordFilter.class.getResourceAsStream(name);
		if (stream == null) throw new IOException("Missing stopword resource " + name);

		try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
			return reader.lines()
					// Ignore comments and empty lines
					.filter(line -> !line.isBlank() && !line.startsWith("#"))
					.toList();
		}
	}
}
