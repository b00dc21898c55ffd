package bt7s7k7.herbal_ir.common;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

import bt7s7k7.herbal_ir.indexing.IndexingParameters;
import bt7s7k7.herbal_ir.ranking.WeightingScheme;
import bt7s7k7.herbal_ir.search.SummaryOptions;

/**
 * Settings of a project. Defaults are bundled as a classpath resource, a file with the same name
 * in the project directory overrides them.
 */
public class Settings {
	public static final String FILENAME = "herbal-ir.properties";

	protected final Properties properties;

	protected Settings(Properties properties) {
		this.properties = properties;
	}

	public static Settings loadDefaults() throws IOException {
		var properties = new Properties();
		try (var stream = Settings.class.getResourceAsStream("/" + FILENAME)) {
			if (stream == null) throw new IOException("Missing bundled " + FILENAME);
			properties.load(stream);
		}
		return new Settings(properties);
	}

	/** Loads the bundled defaults, overridden by the file at the path if it exists. */
	public static Settings load(Path overrides) throws IOException {
		var settings = loadDefaults();
		if (Files.exists(overrides)) {
			try (var reader = Files.newBufferedReader(overrides)) {
				settings.override(reader);
			}
			Logger.debug("Loaded settings from " + overrides);
		}
		return settings;
	}

	public Settings override(Reader reader) throws IOException {
		this.properties.load(reader);
		return this;
	}

	public Settings set(String key, String value) {
		this.properties.setProperty(key, value);
		return this;
	}

	public String getString(String key) {
		var value = this.properties.getProperty(key);
		if (value == null) throw new IllegalArgumentException("Missing setting " + key);
		return value.trim();
	}

	public int getInt(String key) {
		var value = this.getString(key);
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException error) {
			throw new IllegalArgumentException("Setting " + key + " must be an integer, got \"" + value + "\"", error);
		}
	}

	public double getDouble(String key) {
		var value = this.getString(key);
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException error) {
			throw new IllegalArgumentException("Setting " + key + " must be a number, got \"" + value + "\"", error);
		}
	}

	public boolean getBoolean(String key) {
		var value = this.getString(key);
		// Boolean.parseBoolean accepts anything as false
		return switch (value.toLowerCase(Locale.ROOT)) {
			case "true" -> true;
			case "false" -> false;
			default -> throw new IllegalArgumentException("Setting " + key + " must be true or false, got \"" + value + "\"");
		};
	}

	public IndexingParameters getIndexingParameters() {
		return new IndexingParameters(
				this.getInt("indexing.minDf"),
				this.getDouble("indexing.maxDfRatio"),
				this.getInt("indexing.topN"),
				this.getInt("indexing.minTokenLength"),
				WeightingScheme.parse(this.getString("ranking.tf"), this.getString("ranking.idf")),
				this.getBoolean("indexing.parallel"));
	}

	public SummaryOptions getSummaryOptions() {
		var scoring = this.getString("summary.scoring");
		try {
			return new SummaryOptions(
					this.getInt("summary.sentences"),
					SummaryOptions.Scoring.valueOf(scoring.toUpperCase(Locale.ROOT)),
					this.getInt("summary.maxChars"));
		} catch (IllegalArgumentException error) {
			throw new IllegalArgumentException("Invalid summary settings: " + error.getMessage(), error);
		}
	}

	public int getTopK() {
		return this.getInt("search.topK");
	}

	public boolean isVerbose() {
		return this.getBoolean("verbose");
	}

	/** Optional file of root words, relative to the project directory. Empty means no dictionary. */
	public String getDictionary() {
		return this.properties.getProperty("stemming.dictionary", "").trim();
	}
}
