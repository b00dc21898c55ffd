package bt7s7k7.herbal_ir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import bt7s7k7.herbal_ir.indexing.TextPipeline;
import bt7s7k7.herbal_ir.indexing.Vocabulary;
import bt7s7k7.herbal_ir.ranking.SparseVector;
import bt7s7k7.herbal_ir.search.Summarizer;
import bt7s7k7.herbal_ir.search.SummaryOptions;
import bt7s7k7.herbal_ir.search.SummaryOptions.Scoring;

public class SummarizerTest {
	private static final String TEXT = "Cuaca hari ini cerah. Jahe tumbuh di kebun. Kunyit juga tumbuh. Jahe dan kunyit dijual di pasar.";

	// jahe is weighted 2, kunyit 1
	private final Summarizer summarizer = new Summarizer(TextPipeline.createDefault(), new Vocabulary(List.of("jahe", "kunyit")));
	private final SparseVector vector = SparseVector.of(Map.of(0, 2.0, 1, 1.0));

	@Test
	public void keepsDocumentOrder() {
		var summary = this.summarizer.summarize(TEXT, this.vector, new SummaryOptions(2));
		assertEquals("Jahe tumbuh di kebun. Jahe dan kunyit dijual di pasar.", summary);
	}

	@Test
	public void scoring() {
		assertEquals("Jahe dan kunyit dijual di pasar.", this.summarizer.summarize(TEXT, this.vector, new SummaryOptions(1, Scoring.SUM, 0)));
		assertEquals("Jahe tumbuh di kebun.", this.summarizer.summarize(TEXT, this.vector, new SummaryOptions(1, Scoring.AVERAGE, 0)));
	}

	@Test
	public void tiesPreferEarlierSentences() {
		assertEquals("Jahe satu.", this.summarizer.summarize("Jahe satu. Jahe dua.", this.vector, new SummaryOptions(1)));
	}

	@Test
	public void fewerSentences() {
		assertEquals("Jahe tumbuh di kebun.", this.summarizer.summarize("Jahe tumbuh di kebun.", this.vector, SummaryOptions.DEFAULT));
		assertEquals("", this.summarizer.summarize("", this.vector, SummaryOptions.DEFAULT));
	}

	@Test
	public void fallbackToLeadingSentences() {
		var summary = this.summarizer.summarize(TEXT, SparseVector.EMPTY, new SummaryOptions(2));
		assertEquals("Cuaca hari ini cerah. Jahe tumbuh di kebun.", summary);
	}

	@Test
	public void truncate() {
		assertEquals("satu dua...", Summarizer.truncate("satu dua tiga", 8));
		assertEquals("satu dua tiga", Summarizer.truncate("satu dua tiga", 0));
		assertEquals("satu...", Summarizer.truncate("satudua tiga", 4));
	}

	@Test
	public void invalidOptions() {
		assertThrows(IllegalArgumentException.class, () -> new SummaryOptions(0));
		assertThrows(IllegalArgumentException.class, () -> new SummaryOptions(1, Scoring.SUM, -1));
	}
}
