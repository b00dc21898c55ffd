package bt7s7k7.herbal_ir.stemming;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableSet;

/** Set of known root words, used by the stemmer to reject strips that do not produce a real root. */
public final class RootDictionary {
	public static final RootDictionary EMPTY = new RootDictionary(ImmutableSet.of());

	private final ImmutableSet<String> roots;

	private RootDictionary(ImmutableSet<String> roots) {
		this.roots = roots;
	}

	public boolean isEmpty() {
		return this.roots.isEmpty();
	}

	public int size() {
		return this.roots.size();
	}

	public boolean contains(String word) {
		return this.roots.contains(word);
	}

	public static RootDictionary of(Collection<String> roots) {
		var builder = ImmutableSet.<String>builder();
		for (var root : roots) {
			if (StringUtils.isBlank(root)) continue;
			builder.add(root.trim().toLowerCase(Locale.ROOT));
		}
		return new RootDictionary(builder.build());
	}

	/** Reads one root per line. Blank lines and lines starting with '#' are ignored. */
	public static RootDictionary load(InputStream stream) throws IOException {
		var builder = ImmutableSet.<String>builder();
		try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				line = line.trim();
				if (line.isEmpty() || line.startsWith("#")) continue;
				builder.add(line.toLowerCase(Locale.ROOT));
			}
		}
		return new RootDictionary(builder.build());
	}

	public static RootDictionary load(Path path) throws IOException {
		try (var stream = Files.newInputStream(path)) {
			return load(stream);
		}
	}
}
