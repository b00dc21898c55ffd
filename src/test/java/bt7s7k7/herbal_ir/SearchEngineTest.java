package bt7s7k7.herbal_ir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertIterableEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import bt7s7k7.herbal_ir.indexing.Indexer;
import bt7s7k7.herbal_ir.indexing.IndexingParameters;
import bt7s7k7.herbal_ir.indexing.SourceDocument;
import bt7s7k7.herbal_ir.search.SearchEngine;
import bt7s7k7.herbal_ir.search.SearchEngine.Suggestion;
import bt7s7k7.herbal_ir.search.SummaryOptions;

public class SearchEngineTest {
	private static final List<SourceDocument> CORPUS = List.of(
			new SourceDocument("doc1", "daun jahe merah sangat bermanfaat untuk kesehatan"),
			new SourceDocument("doc2", "kunyit dan jahe digunakan sebagai obat tradisional"));

	private static SearchEngine createEngine(List<SourceDocument> documents) {
		var snapshot = new Indexer(new IndexingParameters(1, 20)).index(documents);
		return new SearchEngine(snapshot);
	}

	@Test
	public void ranking() {
		var engine = createEngine(CORPUS);
		var results = engine.search("jahe obat tradisional", 10);

		assertIterableEquals(List.of("doc2", "doc1"), results.stream().map(Suggestion::name).toList());
		assertTrue(results.get(0).score() > results.get(1).score());
		assertTrue(results.get(1).score() > 0);
	}

	@Test
	public void deterministic() {
		var first = createEngine(CORPUS).search("jahe obat tradisional", 10);
		var second = createEngine(CORPUS).search("jahe obat tradisional", 10);
		// Input order does not affect document ids
		var reversed = createEngine(List.of(CORPUS.get(1), CORPUS.get(0))).search("jahe obat tradisional", 10);

		assertEquals(first, second);
		assertEquals(first, reversed);
	}

	@Test
	public void topK() {
		var engine = createEngine(CORPUS);

		assertEquals(1, engine.search("jahe", 1).size());
		assertEquals(2, engine.search("jahe", 0).size());
	}

	@Test
	public void selfSimilarity() {
		var engine = createEngine(CORPUS);
		var results = engine.search(CORPUS.get(0).text(), 10);

		assertEquals("doc1", results.get(0).name());
		assertEquals(1.0, results.get(0).score(), 1e-9);
	}

	@Test
	public void outOfVocabularyQuery() {
		var engine = createEngine(CORPUS);

		assertTrue(engine.search("temulawak sirih", 10).isEmpty());
		assertTrue(engine.search("yang dan untuk", 10).isEmpty());
		assertTrue(engine.search("", 10).isEmpty());
	}

	@Test
	public void emptyCorpus() {
		var engine = createEngine(List.of());

		assertEquals(0, engine.getSnapshot().getDocumentCount());
		assertTrue(engine.getSnapshot().vocabulary().isEmpty());
		assertTrue(engine.search("jahe", 10).isEmpty());
	}

	@Test
	public void invalidDocuments() {
		var documents = List.of(
				new SourceDocument("doc1", "jahe merah"),
				new SourceDocument("doc1", "kunyit kuning"),
				new SourceDocument("empty", "   "));
		var snapshot = new Indexer(new IndexingParameters(1, 20)).index(documents);

		assertEquals(2, snapshot.getDocumentCount());
		assertEquals("jahe merah", snapshot.documents().getDocument(0).text());
		assertTrue(snapshot.documents().getDocument(1).tokens().isEmpty());
		assertTrue(snapshot.model().getDocumentVector(1).isZero());
	}

	@Test
	public void publish() {
		var engine = createEngine(List.of(CORPUS.get(0)));
		var old = engine.getSnapshot();
		assertTrue(engine.search("kunyit", 10).isEmpty());

		var rebuilt = new Indexer(new IndexingParameters(1, 20)).index(CORPUS);
		assertSame(old, engine.publish(rebuilt));
		assertSame(rebuilt, engine.getSnapshot());
		assertEquals("doc2", engine.search("kunyit", 10).get(0).name());
	}

	@Test
	public void searchWithSummary() {
		var engine = createEngine(CORPUS);
		var results = engine.search("obat", 10, new SummaryOptions(1));

		assertEquals(1, results.size());
		assertEquals("doc2", results.get(0).name());
		assertEquals(CORPUS.get(1).text(), results.get(0).summary());
		assertEquals(CORPUS.get(1).text(), results.get(0).snippet());
	}

	@Test
	public void searchWithoutSummary() {
		var engine = createEngine(CORPUS);
		var results = engine.search("obat", 10, null);

		assertEquals(1, results.size());
		assertEquals("", results.get(0).summary());
		assertEquals(CORPUS.get(1).text(), results.get(0).snippet());
	}

	@Test
	public void equalScores() {
		var engine = createEngine(List.of(
				new SourceDocument("b.txt", "jahe merah untuk kesehatan"),
				new SourceDocument("a.txt", "jahe merah untuk kesehatan")));
		var results = engine.search("jahe", 10);

		assertIterableEquals(List.of(0, 1), results.stream().map(Suggestion::document).toList());
		assertIterableEquals(List.of("a.txt", "b.txt"), results.stream().map(Suggestion::name).toList());
		assertEquals(results.get(0).score(), results.get(1).score());
		assertTrue(results.get(0).score() > 0);
	}

	@Test
	public void explain() {
		var engine = createEngine(CORPUS);
		var reports = engine.explain("jahe jahe obat temulawak", List.of(0, 1));

		assertIterableEquals(List.of("jahe", "obat"), reports.stream().map(report -> report.term()).toList());

		var jahe = reports.get(0);
		assertEquals(2, jahe.df());
		assertEquals(2, jahe.queryTf());
		assertEquals(1.0, jahe.idf(), 1e-12);
		assertEquals(1, jahe.documents().get(0).tf());

		var obat = reports.get(1);
		assertEquals(0, obat.documents().get(0).tf());
		assertEquals(0.0, obat.documents().get(0).weight());
		assertTrue(obat.documents().get(1).weight() > 0);
	}

	@Test
	public void parseCommands() {
		var query = SearchEngine.parseCommands("jahe -summary obat-obatan -explain");

		assertEquals("jahe  obat-obatan", query.text());
		assertEquals(Set.of("summary", "explain"), query.commands());
	}
}
