package bt7s7k7.herbal_ir.search;

/**
 * @param sentences number of sentences to extract
 * @param scoring how the weights of the terms in a sentence are combined
 * @param maxChars longest summary, longer ones are cut at a word boundary, 0 means no limit
 */
public record SummaryOptions(int sentences, Scoring scoring, int maxChars) {
	public enum Scoring {
		/** Sum of weights, favours long sentences. */
		SUM,
		/** Mean weight of the indexed terms in the sentence. */
		AVERAGE;
	}

	public static final SummaryOptions DEFAULT = new SummaryOptions(3, Scoring.SUM, 0);

	public SummaryOptions {
		if (sentences <= 0) throw new IllegalArgumentException("Summary must have at least one sentence, got " + sentences);
		if (scoring == null) throw new IllegalArgumentException("Summary scoring must be specified");
		if (maxChars < 0) throw new IllegalArgumentException("Summary length limit cannot be negative, got " + maxChars);
	}

	public SummaryOptions(int sentences) {
		this(sentences, DEFAULT.scoring, DEFAULT.maxChars);
	}
}
