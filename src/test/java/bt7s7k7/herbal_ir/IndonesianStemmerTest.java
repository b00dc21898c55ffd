package bt7s7k7.herbal_ir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertIterableEquals;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import bt7s7k7.herbal_ir.stemming.IndonesianStemmer;
import bt7s7k7.herbal_ir.stemming.RootDictionary;

public class IndonesianStemmerTest {
	private final IndonesianStemmer stemmer = new IndonesianStemmer();

	private void assertStem(String expected, String word) {
		assertEquals(expected, this.stemmer.stem(word), word);
	}

	@Test
	public void prefixesAndSuffixes() {
		assertStem("guna", "digunakan");
		assertStem("sehat", "kesehatan");
		assertStem("manfaat", "bermanfaat");
		assertStem("obat", "pengobatan");
		assertStem("obat", "mengobati");
		assertStem("guna", "penggunaan");
	}

	@Test
	public void particlesAndPronouns() {
		assertStem("makan", "makanlah");
		assertStem("buku", "bukunya");
	}

	@Test
	public void recodedNasals() {
		assertStem("sapu", "menyapu");
		assertStem("tanam", "menanam");
	}

	@Test
	public void irregularPrefixes() {
		assertStem("ajar", "belajar");
		assertStem("ajar", "pelajaran");
		assertStem("kerja", "bekerja");
	}

	@Test
	public void unchanged() {
		assertStem("organisasi", "organisasi");
		assertStem("di", "di");
		assertStem("", "");
		assertEquals(null, this.stemmer.stem(null));
	}

	@Test
	public void rootsAreStable() {
		for (var root : List.of("jahe", "obat", "kunyit", "daun", "merah", "sehat", "manfaat", "tradisional", "sirih")) {
			assertStem(root, root);
			assertStem(root, this.stemmer.stem(root));
		}
	}

	@Test
	public void stemAll() {
		var words = List.of("digunakan", "jahe", "kesehatan", "jahe");
		assertIterableEquals(List.of("guna", "jahe", "sehat", "jahe"), this.stemmer.stemAll(words));
		assertIterableEquals(List.of(), this.stemmer.stemAll(List.of()));
	}

	@Test
	public void dictionaryKeepsNasal() {
		var stemmer = new IndonesianStemmer(RootDictionary.of(List.of("nikah", "pakai")));

		assertEquals("nikah", stemmer.stem("menikah"));
		assertEquals("pakai", stemmer.stem("memakai"));
	}

	@Test
	public void dictionaryRollback() {
		var stemmer = new IndonesianStemmer(RootDictionary.of(List.of("obat")));

		// No intermediate form is a known root, so the word is kept as it is
		assertEquals("kesehatan", stemmer.stem("kesehatan"));
		assertEquals("obat", stemmer.stem("pengobatan"));
	}

	@Test
	public void loadDictionary() throws Exception {
		var input = "# roots\nObat\n\n jahe \n";
		var dictionary = RootDictionary.load(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)));

		assertEquals(2, dictionary.size());
		assertEquals(true, dictionary.contains("obat"));
		assertEquals(true, dictionary.contains("jahe"));
	}
}
