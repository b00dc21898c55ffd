package bt7s7k7.herbal_ir.indexing;

/** A document as handed to the indexer: a stable name, usually the file name, and its extracted text. */
public record SourceDocument(String name, String text) {
	public SourceDocument {
		if (name == null || name.isBlank()) throw new IllegalArgumentException("Document name must not be blank");
	}
}
