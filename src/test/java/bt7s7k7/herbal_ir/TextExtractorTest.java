package bt7s7k7.herbal_ir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertIterableEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import bt7s7k7.herbal_ir.indexing.StopwordFilter;
import bt7s7k7.herbal_ir.indexing.TextExtractor;
import bt7s7k7.herbal_ir.ranking.WeightingScheme;
import bt7s7k7.herbal_ir.ranking.WeightingScheme.InverseDocumentFrequency;

public class TextExtractorTest {
	@Test
	public void extractTokens() {
		var input = "Jahe-merah (Zingiber officinale) 100 gram, DAUN sirih!";
		var expected = "jahe,merah,zingiber,officinale,gram,daun,sirih";

		assertEquals(expected, TextExtractor.extractTokens(input).collect(Collectors.joining(",")));
	}

	@Test
	public void turkishDefaultLocale() {
		var original = Locale.getDefault();
		Locale.setDefault(new Locale("tr", "TR"));
		try {
			assertEquals("indonesia,obat,herbal", TextExtractor.extractTokens("INDONESIA OBAT HERBAL").collect(Collectors.joining(",")));
			assertTrue(StopwordFilter.getDefault().isStopword("YANG"));
			assertEquals(InverseDocumentFrequency.PLAIN, WeightingScheme.parse("raw", "plain").idf());
		} finally {
			Locale.setDefault(original);
		}
	}

	@Test
	public void minimumTokenLength() {
		assertEquals("cd,efg", TextExtractor.extractTokens("a b cd efg").collect(Collectors.joining(",")));
		assertEquals("efg", TextExtractor.extractTokens("a b cd efg", 3).collect(Collectors.joining(",")));
	}

	@Test
	public void hyphenatedLineBreak() {
		var input = "metode pengo-\nbatan tradisional";
		assertEquals("metode,pengobatan,tradisional", TextExtractor.extractTokens(input).collect(Collectors.joining(",")));
	}

	@Test
	public void emptyText() {
		assertEquals(0, TextExtractor.extractTokens("").count());
		assertEquals(0, TextExtractor.extractTokens(null).count());
		assertEquals(0, TextExtractor.extractTokens("123 !!! 4.5").count());
	}

	@Test
	public void splitSentences() {
		var input = "Jahe baik. Dr. Budi meneliti kunyit! Apakah aman?\n\nParagraf baru tanpa titik";
		var expected = List.of("Jahe baik.", "Dr. Budi meneliti kunyit!", "Apakah aman?", "Paragraf baru tanpa titik");

		assertIterableEquals(expected, TextExtractor.splitSentences(input));
	}

	@Test
	public void splitSentencesSkipsNumbers() {
		assertIterableEquals(List.of("Kunyit.", "Jahe."), TextExtractor.splitSentences("Kunyit. 12\n\nJahe."));
	}

	@Test
	public void splitSentencesCollapsesWhitespace() {
		assertIterableEquals(List.of("Daun sirih dapat direbus."), TextExtractor.splitSentences("Daun sirih\ndapat   direbus."));
		assertTrue(TextExtractor.splitSentences("  ").isEmpty());
	}
}
