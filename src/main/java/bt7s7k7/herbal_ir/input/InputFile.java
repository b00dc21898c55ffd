package bt7s7k7.herbal_ir.input;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.text.PDFTextStripper;

/** A document in the input directory. The name is the filename, the content is read on demand. */
public class InputFile {
	public enum Type {
		TEXT(".txt"),
		PDF(".pdf");

		public final String extension;

		private Type(String extension) {
			this.extension = extension;
		}

		/** Returns the type of the file, or null if it is not a supported document. */
		public static Type fromFilename(String filename) {
			var lower = filename.toLowerCase(Locale.ROOT);
			for (var type : values()) {
				if (lower.endsWith(type.extension)) return type;
			}
			return null;
		}
	}

	public final String name;
	public final Type type;

	protected String content;

	protected InputFile(String name, Type type, String content) {
		this.name = name;
		this.type = type;
		this.content = content;
	}

	public void load(Path directory) throws IOException {
		var path = directory.resolve(this.name);
		this.content = switch (this.type) {
			// Bytes that are not valid UTF-8 become replacement characters instead of failing the whole file
			case TEXT -> new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
			case PDF -> extractPdfText(path);
		};
	}

	public static String extractPdfText(Path path) throws IOException {
		try (var document = Loader.loadPDF(path.toFile())) {
			var stripper = new PDFTextStripper();
			// Keep the reading order of multi column layouts
			stripper.setSortByPosition(true);
			return stripper.getText(document);
		}
	}

	/** Returns an unloaded file for a path in the input directory, or null if the file is not a supported document. */
	public static InputFile fromPath(Path path) {
		var filename = path.getFileName().toString();
		var type = Type.fromFilename(filename);
		if (type == null) return null;
		return new InputFile(filename, type, null);
	}
}
