package bt7s7k7.herbal_ir.indexing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

import org.apache.commons.lang3.StringUtils;

import bt7s7k7.herbal_ir.common.Logger;
import bt7s7k7.herbal_ir.common.Stopwatch;
import bt7s7k7.herbal_ir.common.Support;
import bt7s7k7.herbal_ir.ranking.TfIdfModel;
import bt7s7k7.herbal_ir.ranking.WeightingScheme;

/**
 * Saves and loads {@link IndexSnapshot} directories. Every part is a TSV file, the manifest
 * records the format version and the parameters of the build. Raw document text is not saved.
 */
public class SnapshotStore {
	public static final int FORMAT_VERSION = 1;

	public static final String MANIFEST = "manifest.tsv";
	public static final String DOCUMENTS = "documents.tsv";
	public static final String TOKENS = "tokens.tsv";
	public static final String VOCABULARY = "vocabulary.tsv";
	public static final String FEATURES = "features.tsv";
	public static final String INDEX = "index.tsv";
	public static final String IDF = "idf.tsv";
	public static final String VECTORS = "vectors.tsv";

	public final Path directory;

	public SnapshotStore(Path directory) {
		this.directory = directory;
	}

	public boolean exists() {
		return Files.exists(this.directory.resolve(MANIFEST));
	}

	public void save(IndexSnapshot snapshot) throws IOException {
		try (var __ = new Stopwatch("Saving snapshot to " + this.directory)) {
			Files.createDirectories(this.directory);

			snapshot.documents().save(this.directory.resolve(DOCUMENTS), this.directory.resolve(TOKENS));
			snapshot.vocabulary().save(this.directory.resolve(VOCABULARY));
			snapshot.features().save(this.directory.resolve(FEATURES));
			snapshot.index().save(this.directory.resolve(INDEX), snapshot.vocabulary());
			snapshot.model().save(this.directory.resolve(IDF), this.directory.resolve(VECTORS));

			// The manifest is written last, a directory without one is not a complete snapshot
			var manifest = new LinkedHashMap<String, String>();
			manifest.put("format", Integer.toString(FORMAT_VERSION));
			manifest.put("documents", Integer.toString(snapshot.getDocumentCount()));
			manifest.put("terms", Integer.toString(snapshot.vocabulary().size()));
			manifest.put("minTokenLength", Integer.toString(snapshot.pipeline().minTokenLength));
			manifest.put("tf", snapshot.model().scheme.tf().name());
			manifest.put("idf", snapshot.model().scheme.idf().name());
			manifest.put("stemmer", snapshot.pipeline().stemmer.getClass().getName());

			Files.write(this.directory.resolve(MANIFEST), (Iterable<String>) manifest.entrySet().stream()
					.map(kv -> kv.getKey() + "\t" + kv.getValue())::iterator);
		}
	}

	/**
	 * Loads a snapshot. The {@code pipeline} is used for queries, it should be configured the same
	 * way as the one that built the snapshot. Document text is requested from {@code textResolver}.
	 */
	public IndexSnapshot load(TextPipeline pipeline, Function<String, String> textResolver) throws IOException {
		try (var __ = new Stopwatch("Loading snapshot from " + this.directory)) {
			var manifest = this.readManifest();

			var format = Support.parseInt(require(manifest, "format"), MANIFEST, 0);
			if (format != FORMAT_VERSION) {
				throw new IOException("Unsupported snapshot format " + format + " in " + this.directory + ", expected " + FORMAT_VERSION);
			}

			var documentCount = Support.parseInt(require(manifest, "documents"), MANIFEST, 0);
			var termCount = Support.parseInt(require(manifest, "terms"), MANIFEST, 0);

			WeightingScheme scheme;
			try {
				scheme = WeightingScheme.parse(require(manifest, "tf"), require(manifest, "idf"));
			} catch (IllegalArgumentException error) {
				throw new IOException("Invalid weighting in " + MANIFEST, error);
			}

			var stemmer = manifest.getOrDefault("stemmer", "");
			if (!stemmer.equals(pipeline.stemmer.getClass().getName())) {
				Logger.warn("Snapshot was built with stemmer " + stemmer + ", but queries will use " + pipeline.stemmer.getClass().getName());
			}

			var minTokenLength = Support.parseInt(require(manifest, "minTokenLength"), MANIFEST, 0);
			if (minTokenLength != pipeline.minTokenLength) {
				Logger.warn("Snapshot was built with minimum token length " + minTokenLength + ", but queries will use " + pipeline.minTokenLength);
			}

			var documents = DocumentDatabase.load(this.directory.resolve(DOCUMENTS), this.directory.resolve(TOKENS), textResolver);
			if (documents.size() != documentCount) throw new IOException("Expected " + documentCount + " documents in " + DOCUMENTS + ", found " + documents.size());

			var vocabulary = Vocabulary.load(this.directory.resolve(VOCABULARY));
			if (vocabulary.size() != termCount) throw new IOException("Expected " + termCount + " terms in " + VOCABULARY + ", found " + vocabulary.size());

			var features = FeatureSelection.Report.load(this.directory.resolve(FEATURES));
			var index = Index.load(this.directory.resolve(INDEX), vocabulary, documentCount);
			var model = TfIdfModel.load(this.directory.resolve(IDF), this.directory.resolve(VECTORS), scheme, termCount, documentCount);

			Logger.success("Loaded " + documentCount + " documents with " + termCount + " terms");
			return new IndexSnapshot(documents, features, vocabulary, index, model, pipeline);
		}
	}

	protected Map<String, String> readManifest() throws IOException {
		var path = this.directory.resolve(MANIFEST);
		if (!Files.exists(path)) throw new IOException("No snapshot in " + this.directory);

		var manifest = new LinkedHashMap<String, String>();
		for (var line : Files.readAllLines(path)) {
			if (StringUtils.isBlank(line)) continue;
			var segments = line.split("\t", 2);
			if (segments.length != 2) throw new IOException("Invalid entry in " + MANIFEST + ": " + line);
			manifest.put(segments[0], segments[1]);
		}
		return manifest;
	}

	private static String require(Map<String, String> manifest, String key) throws IOException {
		var value = manifest.get(key);
		if (value == null) throw new IOException("Missing " + key + " in " + MANIFEST);
		return value;
	}
}
