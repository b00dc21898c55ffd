package bt7s7k7.herbal_ir.search;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import bt7s7k7.herbal_ir.indexing.TextExtractor;
import bt7s7k7.herbal_ir.indexing.TextPipeline;
import bt7s7k7.herbal_ir.indexing.Vocabulary;
import bt7s7k7.herbal_ir.ranking.SparseVector;

/**
 * Extractive summaries. Sentences of the original text are scored by the weights their terms have
 * in the document vector, the best ones are returned in the order they appear in the document.
 */
public class Summarizer {
	protected final TextPipeline pipeline;
	protected final Vocabulary vocabulary;

	public Summarizer(TextPipeline pipeline, Vocabulary vocabulary) {
		this.pipeline = pipeline;
		this.vocabulary = vocabulary;
	}

	protected static record ScoredSentence(int position, double score) {}

	public double scoreSentence(String sentence, SparseVector documentVector, SummaryOptions.Scoring scoring) {
		var terms = this.pipeline.process(sentence).stream()
				.mapToInt(this.vocabulary::indexOf)
				.filter(term -> term >= 0)
				.toArray();

		if (terms.length == 0) return 0;

		var sum = 0.0;
		for (var term : terms) {
			sum += documentVector.get(term);
		}

		return switch (scoring) {
			case SUM -> sum;
			case AVERAGE -> sum / terms.length;
		};
	}

	public String summarize(String text, SparseVector documentVector, SummaryOptions options) {
		var sentences = TextExtractor.splitSentences(text);
		if (sentences.isEmpty()) return "";

		var selected = this.selectSentences(sentences, documentVector, options);
		var summary = selected.stream()
				.map(sentences::get)
				.collect(Collectors.joining(" "));

		return truncate(summary, options.maxChars());
	}

	/** Positions of the extracted sentences, in document order. */
	public List<Integer> selectSentences(List<String> sentences, SparseVector documentVector, SummaryOptions options) {
		var count = Math.min(options.sentences(), sentences.size());

		var scored = IntStream.range(0, sentences.size())
				.mapToObj(i -> new ScoredSentence(i, this.scoreSentence(sentences.get(i), documentVector, options.scoring())))
				.toList();

		// When nothing in the document is indexed, the leading sentences are used
		if (scored.stream().allMatch(sentence -> sentence.score() == 0)) {
			return IntStream.range(0, count).boxed().toList();
		}

		return scored.stream()
				// Best first, earlier sentences win ties
				.sorted(Comparator.comparingDouble(ScoredSentence::score).reversed()
						.thenComparingInt(ScoredSentence::position))
				.limit(count)
				.map(ScoredSentence::position)
				.sorted()
				.toList();
	}

	public static String truncate(String text, int maxChars) {
		if (maxChars <= 0 || text.length() <= maxChars) return text;

		var cut = text.lastIndexOf(' ', maxChars);
		// A single word longer than the limit is cut in the middle
		if (cut <= 0) cut = maxChars;
		return text.substring(0, cut).stripTrailing() + "...";
	}
}
