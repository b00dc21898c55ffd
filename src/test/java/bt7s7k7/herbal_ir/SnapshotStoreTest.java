package bt7s7k7.herbal_ir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertIterableEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import bt7s7k7.herbal_ir.indexing.Indexer;
import bt7s7k7.herbal_ir.indexing.IndexingParameters;
import bt7s7k7.herbal_ir.indexing.SnapshotStore;
import bt7s7k7.herbal_ir.indexing.SourceDocument;
import bt7s7k7.herbal_ir.indexing.TextPipeline;
import bt7s7k7.herbal_ir.search.SearchEngine;

public class SnapshotStoreTest {
	private static final List<SourceDocument> CORPUS = List.of(
			new SourceDocument("doc1.txt", "Daun jahe merah sangat bermanfaat untuk kesehatan. Jahe menghangatkan badan."),
			new SourceDocument("doc2.txt", "Kunyit dan jahe digunakan sebagai obat tradisional."),
			new SourceDocument("doc3.pdf", "Daun sirih untuk pengobatan luka. Sirih juga obat kumur."));

	@TempDir
	Path directory;

	@Test
	public void roundTrip() throws IOException {
		var snapshot = new Indexer(new IndexingParameters(1, 100)).index(CORPUS);
		var store = new SnapshotStore(this.directory.resolve("snapshot"));

		assertFalse(store.exists());
		store.save(snapshot);
		assertTrue(store.exists());

		var texts = CORPUS.stream().collect(Collectors.toMap(SourceDocument::name, SourceDocument::text));
		var loaded = store.load(TextPipeline.createDefault(), texts::get);

		assertIterableEquals(snapshot.vocabulary().getTerms(), loaded.vocabulary().getTerms());
		assertEquals(snapshot.features(), loaded.features());
		assertIterableEquals(snapshot.documents().getDocuments(), loaded.documents().getDocuments());
		assertEquals(1, loaded.documents().findIndexByName("doc2.txt"));
		assertEquals(-1, loaded.documents().findIndexByName("doc4.txt"));
		assertEquals(snapshot.index().getPostingCount(), loaded.index().getPostingCount());

		for (var document = 0; document < snapshot.getDocumentCount(); document++) {
			assertEquals(snapshot.model().getDocumentVector(document), loaded.model().getDocumentVector(document));
		}

		for (var term = 0; term < snapshot.vocabulary().size(); term++) {
			assertIterableEquals(snapshot.index().getLocations(term), loaded.index().getLocations(term));
			assertEquals(snapshot.model().getIdf(term), loaded.model().getIdf(term));
		}

		for (var query : List.of("jahe obat tradisional", "daun sirih", "kesehatan")) {
			assertEquals(new SearchEngine(snapshot).search(query, 10), new SearchEngine(loaded).search(query, 10));
		}
	}

	@Test
	public void emptySnapshot() throws IOException {
		var snapshot = new Indexer(IndexingParameters.DEFAULT).index(List.of());
		var store = new SnapshotStore(this.directory);
		store.save(snapshot);

		var loaded = store.load(TextPipeline.createDefault(), __ -> null);
		assertEquals(0, loaded.getDocumentCount());
		assertTrue(new SearchEngine(loaded).search("jahe", 10).isEmpty());
	}

	@Test
	public void unsupportedFormat() throws IOException {
		var store = new SnapshotStore(this.directory);
		store.save(new Indexer(IndexingParameters.DEFAULT).index(CORPUS));

		var manifest = this.directory.resolve(SnapshotStore.MANIFEST);
		Files.writeString(manifest, Files.readString(manifest).replace("format\t1", "format\t2"));

		assertThrows(IOException.class, () -> store.load(TextPipeline.createDefault(), __ -> null));
	}

	@Test
	public void malformedIndex() throws IOException {
		var store = new SnapshotStore(this.directory);
		store.save(new Indexer(IndexingParameters.DEFAULT).index(CORPUS));

		Files.writeString(this.directory.resolve(SnapshotStore.INDEX), "jahe\t0\n");

		var error = assertThrows(IOException.class, () -> store.load(TextPipeline.createDefault(), __ -> null));
		assertTrue(error.getMessage().contains(SnapshotStore.INDEX));
	}

	@Test
	public void missingSnapshot() {
		var store = new SnapshotStore(this.directory.resolve("missing"));
		assertThrows(IOException.class, () -> store.load(TextPipeline.createDefault(), __ -> null));
	}
}
