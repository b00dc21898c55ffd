package bt7s7k7.herbal_ir.indexing;

import bt7s7k7.herbal_ir.ranking.WeightingScheme;

/**
 * Tunables of a build. Invalid values are rejected here, before anything is indexed.
 *
 * @param minDf smallest number of documents a term must occur in to be selected
 * @param maxDfRatio largest fraction of documents a term may occur in, 1 disables the limit
 * @param topN largest vocabulary size
 * @param minTokenLength shorter tokens are dropped by the tokenizer
 * @param weighting TF-IDF weighting for document and query vectors
 * @param parallel preprocess documents on multiple threads
 */
public record IndexingParameters(int minDf, double maxDfRatio, int topN, int minTokenLength, WeightingScheme weighting, boolean parallel) {
	public static final IndexingParameters DEFAULT = new IndexingParameters(2, 1.0, 8000, TextExtractor.DEFAULT_MIN_TOKEN_LENGTH, WeightingScheme.DEFAULT, true);

	public IndexingParameters {
		if (minDf < 1) throw new IllegalArgumentException("minDf must be at least 1, got " + minDf);
		if (!(maxDfRatio > 0 && maxDfRatio <= 1)) throw new IllegalArgumentException("maxDfRatio must be in (0, 1], got " + maxDfRatio);
		if (topN < 1) throw new IllegalArgumentException("topN must be at least 1, got " + topN);
		if (minTokenLength < 1) throw new IllegalArgumentException("minTokenLength must be at least 1, got " + minTokenLength);
		if (weighting == null) throw new IllegalArgumentException("weighting must be specified");
	}

	public IndexingParameters(int minDf, int topN) {
		this(minDf, DEFAULT.maxDfRatio, topN, DEFAULT.minTokenLength, DEFAULT.weighting, DEFAULT.parallel);
	}

	public IndexingParameters withWeighting(WeightingScheme weighting) {
		return new IndexingParameters(this.minDf, this.maxDfRatio, this.topN, this.minTokenLength, weighting, this.parallel);
	}

	public IndexingParameters withMaxDfRatio(double maxDfRatio) {
		return new IndexingParameters(this.minDf, maxDfRatio, this.topN, this.minTokenLength, this.weighting, this.parallel);
	}

	public FeatureSelector createFeatureSelector() {
		return new FeatureSelector(this.minDf, this.maxDfRatio, this.topN);
	}
}
