package bt7s7k7.herbal_ir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import bt7s7k7.herbal_ir.search.SnippetBuilder;

public class SnippetBuilderTest {
	@Test
	public void shortText() {
		assertEquals("Kunyit kuning.", SnippetBuilder.build("Kunyit kuning.", List.of("jahe")));
		assertEquals("Jahe merah", SnippetBuilder.build("Jahe\n\n   merah", List.of("merah")));
		assertEquals("", SnippetBuilder.build(null, List.of("jahe")));
	}

	@Test
	public void windowAroundMatch() {
		var text = "x ".repeat(200) + "Jahe merah " + "y ".repeat(200);
		var snippet = SnippetBuilder.build(text, List.of("merah", "jahe"));

		assertTrue(snippet.startsWith("..."));
		assertTrue(snippet.endsWith("..."));
		assertTrue(snippet.contains("Jahe merah"));
		assertEquals(SnippetBuilder.DEFAULT_WINDOW + 6, snippet.length());
	}

	@Test
	public void headWithoutMatch() {
		var text = "z".repeat(500);
		var snippet = SnippetBuilder.build(text, List.of("jahe"));

		assertEquals("z".repeat(SnippetBuilder.DEFAULT_WINDOW) + "...", snippet);
	}
}
