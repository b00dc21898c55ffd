package bt7s7k7.herbal_ir.ranking;

import java.util.Locale;

/**
 * How term frequencies and document frequencies are turned into TF-IDF weights. The same scheme is
 * used for document and query vectors.
 */
public record WeightingScheme(TermFrequency tf, InverseDocumentFrequency idf) {
	public static final WeightingScheme DEFAULT = new WeightingScheme(TermFrequency.RAW, InverseDocumentFrequency.SMOOTH);

	public WeightingScheme {
		if (tf == null || idf == null) throw new IllegalArgumentException("Weighting scheme must specify both tf and idf");
	}

	public enum TermFrequency {
		/** The number of occurrences. */
		RAW,
		/** 1 + ln(tf), so repeated terms count less. */
		LOG;

		public double weight(int tf) {
			if (tf <= 0) return 0;
			return switch (this) {
				case RAW -> tf;
				case LOG -> 1 + Math.log(tf);
			};
		}
	}

	public enum InverseDocumentFrequency {
		/** ln(N / df). */
		PLAIN,
		/** ln((N + 1) / (df + 1)) + 1, which stays positive for terms occurring in every document. */
		SMOOTH;

		public double weight(int documentCount, int df) {
			// Terms that do not occur in any document cannot contribute
			if (df <= 0 || documentCount <= 0) return 0;
			return switch (this) {
				case PLAIN -> Math.log((double) documentCount / df);
				case SMOOTH -> Math.log((double) (documentCount + 1) / (df + 1)) + 1;
			};
		}
	}

	public double weight(int tf, double idf) {
		return this.tf.weight(tf) * idf;
	}

	public static WeightingScheme parse(String tf, String idf) {
		try {
			return new WeightingScheme(TermFrequency.valueOf(tf.trim().toUpperCase(Locale.ROOT)), InverseDocumentFrequency.valueOf(idf.trim().toUpperCase(Locale.ROOT)));
		} catch (IllegalArgumentException error) {
			throw new IllegalArgumentException("Invalid weighting scheme tf=" + tf + ", idf=" + idf, error);
		}
	}
}
