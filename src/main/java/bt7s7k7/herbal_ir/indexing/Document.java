package bt7s7k7.herbal_ir.indexing;

import java.util.List;

/**
 * An indexed document. The id is the position of the document in the {@link DocumentDatabase}, the
 * tokens are the output of the {@link TextPipeline} for the text.
 */
public record Document(int id, String name, String text, List<String> tokens) {
	public Document {
		text = text == null ? "" : text;
		tokens = List.copyOf(tokens);
	}
}
