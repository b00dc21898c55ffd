package bt7s7k7.herbal_ir.input;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;

import bt7s7k7.herbal_ir.common.Logger;
import bt7s7k7.herbal_ir.common.Stopwatch;
import bt7s7k7.herbal_ir.indexing.SourceDocument;

public class InputFileManager {
	public final Path path;
	protected TreeMap<String, InputFile> cachedFiles = new TreeMap<>();

	public InputFileManager(Path path) {
		this.path = path;
	}

	public InputFile findFile(String name) {
		return this.cachedFiles.get(name);
	}

	public int size() {
		return this.cachedFiles.size();
	}

	public String getContent(InputFile file) throws IOException {
		if (file.content != null) return file.content;
		file.load(this.path);
		return file.content;
	}

	/** Text of the document with the name, or null if there is no such document or it cannot be read. */
	public String findContent(String name) {
		var file = this.findFile(name);
		if (file == null) {
			Logger.warn("Input file " + name + " no longer exists");
			return null;
		}

		try {
			return this.getContent(file);
		} catch (IOException error) {
			Logger.warn("Failed to read input file " + name + ": " + error.getMessage());
			return null;
		}
	}

	public void refreshCache() throws IOException {
		this.cachedFiles.clear();
		try (var reader = Files.newDirectoryStream(this.path)) {
			for (var path : reader) {
				if (!Files.isRegularFile(path)) continue;

				var inputFile = InputFile.fromPath(path);
				if (inputFile == null) {
					Logger.debug("Skipping unsupported input file " + path.getFileName());
					continue;
				}

				this.cachedFiles.put(inputFile.name, inputFile);
			}
		}
	}

	/**
	 * Reads all input files. A file that cannot be read is still returned, with empty text, so it is
	 * reported by the indexer instead of silently missing.
	 */
	public List<SourceDocument> loadDocuments() {
		var documents = new ArrayList<SourceDocument>(this.cachedFiles.size());

		try (var __ = new Stopwatch("Reading " + this.cachedFiles.size() + " input files")) {
			for (var file : this.cachedFiles.values()) {
				String text;
				try {
					text = this.getContent(file);
				} catch (IOException error) {
					Logger.error("Failed to read " + file.name + ": " + error.getMessage());
					text = "";
				}
				documents.add(new SourceDocument(file.name, text));
			}
		}

		documents.sort(Comparator.comparing(SourceDocument::name));
		return documents;
	}
}
