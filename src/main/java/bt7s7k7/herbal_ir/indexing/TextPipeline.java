package bt7s7k7.herbal_ir.indexing;

import java.util.List;

import bt7s7k7.herbal_ir.stemming.IndonesianStemmer;
import bt7s7k7.herbal_ir.stemming.Stemmer;

/**
 * Turns raw text into the cleaned token stream that is indexed: tokenization, stopword removal and
 * stemming. Documents and queries must go through the same pipeline, so the pipeline is part of
 * every {@link IndexSnapshot}.
 */
public class TextPipeline {
	public final int minTokenLength;
	public final StopwordFilter stopwords;
	public final Stemmer stemmer;

	public TextPipeline(int minTokenLength, StopwordFilter stopwords, Stemmer stemmer) {
		if (minTokenLength < 1) throw new IllegalArgumentException("Minimum token length must be at least 1, got " + minTokenLength);
		this.minTokenLength = minTokenLength;
		this.stopwords = stopwords;
		this.stemmer = stemmer;
	}

	public static TextPipeline createDefault() {
		return new TextPipeline(TextExtractor.DEFAULT_MIN_TOKEN_LENGTH, StopwordFilter.getDefault(), new IndonesianStemmer());
	}

	public List<String> tokenize(String text) {
		return TextExtractor.extractTokens(text, this.minTokenLength).toList();
	}

	public List<String> process(String text) {
		var tokens = this.tokenize(text);
		var filtered = this.stopwords.filter(tokens);
		return this.stem(filtered);
	}

	/** Stems the tokens, failing if the stemmer breaks the alignment of its output with the input. */
	public List<String> stem(List<String> tokens) {
		var stemmed = this.stemmer.stemAll(tokens);
		if (stemmed == null || stemmed.size() != tokens.size()) {
			throw new IllegalStateException("Stemmer " + this.stemmer.getClass().getName() + " returned "
					+ (stemmed == null ? "null" : stemmed.size() + " roots") + " for " + tokens.size() + " words");
		}
		return List.copyOf(stemmed);
	}

	/** Intermediate results of each stage of the pipeline, for inspecting how text is indexed. */
	public static record Breakdown(String normalized, List<String> tokens, List<String> filtered, List<String> stemmed) {}

	public Breakdown breakdown(String text) {
		var normalized = TextExtractor.normalize(text);
		var tokens = this.tokenize(text);
		var filtered = this.stopwords.filter(tokens);
		var stemmed = this.stem(filtered);
		return new Breakdown(normalized, tokens, filtered, stemmed);
	}
}
