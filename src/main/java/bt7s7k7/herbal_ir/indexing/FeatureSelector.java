package bt7s7k7.herbal_ir.indexing;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Chooses the vocabulary of the index without any labels: terms occurring in too few documents (or,
 * optionally, in too many) are discarded, the rest is ranked by document frequency and only the
 * first {@code topN} are kept.
 */
public class FeatureSelector {
	public final int minDf;
	public final double maxDfRatio;
	public final int topN;

	public FeatureSelector(int minDf, double maxDfRatio, int topN) {
		if (minDf < 1) throw new IllegalArgumentException("Minimum document frequency must be at least 1, got " + minDf);
		if (!(maxDfRatio > 0 && maxDfRatio <= 1)) throw new IllegalArgumentException("Maximum document frequency ratio must be in (0, 1], got " + maxDfRatio);
		if (topN < 1) throw new IllegalArgumentException("Vocabulary size must be at least 1, got " + topN);

		this.minDf = minDf;
		this.maxDfRatio = maxDfRatio;
		this.topN = topN;
	}

	public static Map<String, Integer> computeDocumentFrequencies(Collection<List<String>> documents) {
		var frequencies = new HashMap<String, Integer>();
		for (var tokens : documents) {
			// Count each term once per document
			for (var term : new HashSet<>(tokens)) {
				frequencies.merge(term, 1, Integer::sum);
			}
		}
		return frequencies;
	}

	/** The largest document frequency a term may have. */
	public int getMaxDf(int documentCount) {
		return Math.max(1, (int) Math.floor(this.maxDfRatio * documentCount));
	}

	public FeatureSelection select(Collection<List<String>> documents) {
		var documentCount = documents.size();
		var frequencies = computeDocumentFrequencies(documents);
		var maxDf = this.getMaxDf(documentCount);

		var selected = frequencies.entrySet().stream()
				.filter(kv -> kv.getValue() >= this.minDf && kv.getValue() <= maxDf)
				// Most frequent terms first, ties are ordered alphabetically so the result is reproducible
				.sorted(Comparator.<Map.Entry<String, Integer>>comparingInt(Map.Entry::getValue).reversed()
						.thenComparing(Map.Entry::getKey))
				.limit(this.topN)
				.map(Map.Entry::getKey)
				.toList();

		var report = new FeatureSelection.Report(documentCount, frequencies.size(), selected.size(), this.minDf, this.maxDfRatio, maxDf, this.topN);
		return new FeatureSelection(new Vocabulary(selected), report);
	}
}
