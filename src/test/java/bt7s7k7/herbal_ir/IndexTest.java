package bt7s7k7.herbal_ir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertIterableEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import bt7s7k7.herbal_ir.indexing.Index;
import bt7s7k7.herbal_ir.indexing.Index.Location;
import bt7s7k7.herbal_ir.indexing.Vocabulary;

public class IndexTest {
	private static final Vocabulary VOCABULARY = new Vocabulary(List.of("jahe", "obat", "kunyit"));

	private static Index build() {
		return new Index.Builder(3, VOCABULARY.size())
				// Documents are added out of order, postings must still be ordered
				.addDocument(2, List.of("jahe", "kunyit", "lain"), VOCABULARY)
				.addDocument(0, List.of("jahe", "obat", "jahe"), VOCABULARY)
				.addDocument(1, List.of("tidak", "ada"), VOCABULARY)
				.build();
	}

	@Test
	public void locations() {
		var list = new ArrayList<Location>();
		Location.put(list, 5, 1);
		Location.put(list, 1, 2);
		Location.put(list, 3, 3);
		Location.put(list, 5, 4);

		assertIterableEquals(List.of(new Location(1, 2), new Location(3, 3), new Location(5, 4)), list);
		assertEquals(3, Location.get(list, 3));
		assertEquals(0, Location.get(list, 4));
	}

	@Test
	public void postings() {
		var index = build();
		var jahe = VOCABULARY.indexOf("jahe");

		assertIterableEquals(List.of(new Location(0, 2), new Location(2, 1)), index.getLocations(jahe));
		assertEquals(2, index.getDF(jahe));
		assertEquals(2, index.getTF(jahe, 0));
		assertEquals(0, index.getTF(jahe, 1));
	}

	@Test
	public void termsInDocument() {
		var index = build();

		assertEquals(Map.of(VOCABULARY.indexOf("jahe"), 2, VOCABULARY.indexOf("obat"), 1), index.getTermsInDocument(0));
		assertTrue(index.getTermsInDocument(1).isEmpty());
	}

	@Test
	public void consistency() {
		var index = build();
		var postings = 0;

		for (var term = 0; term < index.getTermCount(); term++) {
			var previous = -1;
			for (var location : index.getLocations(term)) {
				assertTrue(location.document() > previous);
				assertTrue(location.document() < index.getDocumentCount());
				assertTrue(location.frequency() > 0);
				assertEquals(location.frequency(), index.getTermsInDocument(location.document()).get(term));
				previous = location.document();
				postings++;
			}
		}

		assertEquals(postings, index.getPostingCount());
		assertEquals(VOCABULARY.size(), index.getTermCount());
	}

	@Test
	public void invalidPostings() {
		var builder = new Index.Builder(2, 1);
		assertThrows(IllegalArgumentException.class, () -> builder.setFrequency(0, 2, 1));
		assertThrows(IllegalArgumentException.class, () -> builder.setFrequency(0, 0, 0));
	}
}
