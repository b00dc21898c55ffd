package bt7s7k7.herbal_ir.indexing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.function.Function;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableList;

import bt7s7k7.herbal_ir.common.Support;

/** Documents of a snapshot, addressed by their id, which is also their position. */
public class DocumentDatabase {
	public static final DocumentDatabase EMPTY = new DocumentDatabase(List.of());

	protected final ImmutableList<Document> documents;
	protected final ImmutableBiMap<Integer, String> documentNameMapping;

	public DocumentDatabase(List<Document> documents) {
		var mapping = ImmutableBiMap.<Integer, String>builder();
		for (var i = 0; i < documents.size(); i++) {
			var document = documents.get(i);
			if (document.id() != i) throw new IllegalArgumentException("Document " + document.name() + " has id " + document.id() + " at position " + i);
			mapping.put(i, document.name());
		}

		this.documents = ImmutableList.copyOf(documents);
		// Also rejects duplicate names
		this.documentNameMapping = mapping.build();
	}

	public int size() {
		return this.documents.size();
	}

	public boolean isEmpty() {
		return this.documents.isEmpty();
	}

	public Document getDocument(int id) {
		return this.documents.get(id);
	}

	public String findDocumentByIndex(int index) {
		return this.documentNameMapping.get(index);
	}

	/** Returns the id of the document with the name, or -1 if there is none. */
	public int findIndexByName(String name) {
		var id = this.documentNameMapping.inverse().get(name);
		return id == null ? -1 : id;
	}

	public List<Document> getDocuments() {
		return this.documents;
	}

	public void save(Path documentsPath, Path tokensPath) throws IOException {
		// Document names are saved in a TSV format, mapping id to name
		Files.write(documentsPath, (Iterable<String>) this.documents.stream()
				.map(document -> document.id() + "\t" + document.name())::iterator);

		// Tokens are saved in the same order, space separated after the id
		Files.write(tokensPath, (Iterable<String>) this.documents.stream()
				.map(document -> document.id() + "\t" + String.join(" ", document.tokens()))::iterator);
	}

	/**
	 * Loads documents saved by {@link #save}. Their text is not part of the snapshot, so it is
	 * requested from {@code textResolver} by document name.
	 */
	public static DocumentDatabase load(Path documentsPath, Path tokensPath, Function<String, String> textResolver) throws IOException {
		var names = new ArrayList<String>();
		var lineNumber = 0;
		for (var line : Files.readAllLines(documentsPath)) {
			lineNumber++;
			// Ignore empty lines
			if (StringUtils.isBlank(line)) continue;

			var segments = line.split("\t", 2);
			if (segments.length != 2) throw new IOException("Invalid document entry in " + documentsPath.getFileName() + " at line " + lineNumber);
			var id = Support.parseInt(segments[0], documentsPath.getFileName().toString(), lineNumber);
			if (id != names.size()) throw new IOException("Document ids in " + documentsPath.getFileName() + " are not consecutive at line " + lineNumber);
			names.add(segments[1]);
		}

		var tokens = new HashMap<Integer, List<String>>();
		lineNumber = 0;
		for (var line : Files.readAllLines(tokensPath)) {
			lineNumber++;
			if (line.isEmpty()) continue;

			var segments = line.split("\t", 2);
			var id = Support.parseInt(segments[0], tokensPath.getFileName().toString(), lineNumber);
			var documentTokens = segments.length < 2 || segments[1].isEmpty() ? List.<String>of() : Arrays.asList(StringUtils.split(segments[1], ' '));
			tokens.put(id, documentTokens);
		}

		var documents = new ArrayList<Document>(names.size());
		for (var id = 0; id < names.size(); id++) {
			var name = names.get(id);
			documents.add(new Document(id, name, textResolver.apply(name), tokens.getOrDefault(id, List.of())));
		}

		return new DocumentDatabase(documents);
	}
}
