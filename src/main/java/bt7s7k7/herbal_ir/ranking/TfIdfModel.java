package bt7s7k7.herbal_ir.ranking;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import bt7s7k7.herbal_ir.common.Support;
import bt7s7k7.herbal_ir.indexing.Index;
import bt7s7k7.herbal_ir.indexing.Vocabulary;

/**
 * Vector space model over an {@link Index}. Document vectors are computed once when the model is
 * built; query vectors are computed for every query with the same weighting scheme.
 */
public class TfIdfModel {
	public final WeightingScheme scheme;
	protected final double[] idf;
	protected final ImmutableList<SparseVector> documentVectors;

	protected TfIdfModel(WeightingScheme scheme, double[] idf, List<SparseVector> documentVectors) {
		this.scheme = scheme;
		this.idf = idf;
		this.documentVectors = ImmutableList.copyOf(documentVectors);
	}

	public static TfIdfModel build(Index index, WeightingScheme scheme) {
		var N = index.getDocumentCount();

		// IDF uses the document frequencies of the selected terms, which are the lengths of the postings
		var idf = IntStream.range(0, index.getTermCount())
				.mapToDouble(term -> scheme.idf().weight(N, index.getDF(term)))
				.toArray();

		var model = new TfIdfModel(scheme, idf, List.of());
		var vectors = IntStream.range(0, N)
				.mapToObj(document -> model.vectorize(index.getTermsInDocument(document)))
				.toList();

		return new TfIdfModel(scheme, idf, vectors);
	}

	public int getDocumentCount() {
		return this.documentVectors.size();
	}

	public int getTermCount() {
		return this.idf.length;
	}

	public double getIdf(int term) {
		return this.idf[term];
	}

	public SparseVector getDocumentVector(int document) {
		return this.documentVectors.get(document);
	}

	/** Weights term counts, keyed by term index, with the IDF of each term. */
	public SparseVector vectorize(Map<Integer, Integer> termCounts) {
		var weights = new HashMap<Integer, Double>();
		for (var kv : termCounts.entrySet()) {
			weights.put(kv.getKey(), this.scheme.weight(kv.getValue(), this.idf[kv.getKey()]));
		}
		return SparseVector.of(weights);
	}

	/** Vectorizes cleaned query tokens. Tokens that are not in the vocabulary are ignored. */
	public SparseVector vectorizeQuery(List<String> tokens, Vocabulary vocabulary) {
		var counts = tokens.stream()
				.mapToInt(vocabulary::indexOf)
				.filter(term -> term >= 0)
				.boxed()
				.collect(Collectors.toMap(term -> term, __ -> 1, Integer::sum));

		return this.vectorize(counts);
	}

	public static record ScoredDocument(int document, double score) {}

	/**
	 * Ranks documents by cosine similarity to the query. Only documents with a positive score are
	 * returned, best first, with ties ordered by document id. If {@code topK} is not positive, all of
	 * them are returned.
	 */
	public List<ScoredDocument> rank(SparseVector query, Index index, int topK) {
		if (query.isZero()) return List.of();

		// Only documents sharing a term with the query can have a non-zero score
		var candidates = new TreeSet<Integer>();
		query.forEach((term, weight) -> {
			for (var location : index.getLocations(term)) {
				candidates.add(location.document());
			}
		});

		var results = new ArrayList<ScoredDocument>();
		for (var document : candidates) {
			var score = query.cosine(this.documentVectors.get(document));
			if (score > 0) results.add(new ScoredDocument(document, score));
		}

		// Sort by score descending
		results.sort(Comparator.comparingDouble(ScoredDocument::score).reversed()
				.thenComparingInt(ScoredDocument::document));

		if (topK > 0 && results.size() > topK) {
			return List.copyOf(results.subList(0, topK));
		}

		return List.copyOf(results);
	}

	public void save(Path idfPath, Path vectorsPath) throws IOException {
		Files.write(idfPath, (Iterable<String>) IntStream.range(0, this.idf.length)
				.mapToObj(term -> term + "\t" + this.idf[term])::iterator);

		Files.write(vectorsPath, (Iterable<String>) IntStream.range(0, this.documentVectors.size())
				.mapToObj(document -> {
					var columns = Stream.<String>builder().add(Integer.toString(document));
					// For each weight, add a column for the term index and the weight
					this.documentVectors.get(document).forEach((term, weight) -> {
						columns.add(Integer.toString(term));
						columns.add(Double.toString(weight));
					});
					return columns.build().collect(Collectors.joining("\t"));
				})::iterator);
	}

	public static TfIdfModel load(Path idfPath, Path vectorsPath, WeightingScheme scheme, int termCount, int documentCount) throws IOException {
		var idf = new double[termCount];
		var idfFile = idfPath.getFileName().toString();
		var loadedTerms = 0;
		var lineNumber = 0;

		for (var line : Files.readAllLines(idfPath)) {
			lineNumber++;
			if (StringUtils.isBlank(line)) continue;

			var segments = line.split("\t");
			if (segments.length != 2) throw new IOException("Invalid entry in " + idfFile + " at line " + lineNumber);
			var term = Support.parseInt(segments[0], idfFile, lineNumber);
			if (term != loadedTerms || term >= termCount) throw new IOException("Unexpected term " + term + " in " + idfFile + " at line " + lineNumber);
			idf[term] = Support.parseDouble(segments[1], idfFile, lineNumber);
			loadedTerms++;
		}

		if (loadedTerms != termCount) throw new IOException("Expected " + termCount + " terms in " + idfFile + ", found " + loadedTerms);

		var vectors = new ArrayList<SparseVector>(documentCount);
		var vectorsFile = vectorsPath.getFileName().toString();
		lineNumber = 0;

		for (var line : Files.readAllLines(vectorsPath)) {
			lineNumber++;
			if (StringUtils.isBlank(line)) continue;

			var segments = line.split("\t");
			var document = Support.parseInt(segments[0], vectorsFile, lineNumber);
			if (document != vectors.size()) throw new IOException("Unexpected document " + document + " in " + vectorsFile + " at line " + lineNumber);
			if (segments.length % 2 != 1) throw new IOException("Unpaired weight in " + vectorsFile + " at line " + lineNumber);

			var weights = new HashMap<Integer, Double>();
			for (int i = 1; i < segments.length; i += 2) {
				var term = Support.parseInt(segments[i], vectorsFile, lineNumber);
				if (term < 0 || term >= termCount) throw new IOException("Term " + term + " out of range in " + vectorsFile + " at line " + lineNumber);
				weights.put(term, Support.parseDouble(segments[i + 1], vectorsFile, lineNumber));
			}

			vectors.add(SparseVector.of(weights));
		}

		if (vectors.size() != documentCount) throw new IOException("Expected " + documentCount + " vectors in " + vectorsFile + ", found " + vectors.size());

		return new TfIdfModel(scheme, idf, vectors);
	}
}
