package bt7s7k7.herbal_ir.indexing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import bt7s7k7.herbal_ir.common.Support;

/**
 * Selected terms of a snapshot. Vectors and postings refer to terms by their index in the
 * vocabulary, so the index of a term never changes until the next rebuild.
 */
public class Vocabulary {
	public static final Vocabulary EMPTY = new Vocabulary(List.of());

	protected final ImmutableList<String> terms;
	protected final ImmutableMap<String, Integer> indices;

	public Vocabulary(List<String> terms) {
		this.terms = ImmutableList.copyOf(terms);

		var indices = ImmutableMap.<String, Integer>builder();
		for (var i = 0; i < this.terms.size(); i++) {
			indices.put(this.terms.get(i), i);
		}
		// Fails on duplicate terms
		this.indices = indices.buildOrThrow();
	}

	public int size() {
		return this.terms.size();
	}

	public boolean isEmpty() {
		return this.terms.isEmpty();
	}

	/** Returns the index of the term, or -1 if the term was not selected. */
	public int indexOf(String term) {
		var index = this.indices.get(term);
		return index == null ? -1 : index;
	}

	public String getTerm(int index) {
		return this.terms.get(index);
	}

	public List<String> getTerms() {
		return this.terms;
	}

	public IntStream indexStream() {
		return IntStream.range(0, this.terms.size());
	}

	public void save(Path path) throws IOException {
		Files.write(path, (Iterable<String>) this.indexStream()
				.mapToObj(index -> index + "\t" + this.terms.get(index))::iterator);
	}

	public static Vocabulary load(Path path) throws IOException {
		var terms = new ArrayList<String>();
		var lineNumber = 0;
		for (var line : Files.readAllLines(path)) {
			lineNumber++;
			// Ignore empty lines
			if (StringUtils.isBlank(line)) continue;

			var segments = line.split("\t");
			if (segments.length != 2) throw new IOException("Invalid vocabulary entry in " + path.getFileName() + " at line " + lineNumber);

			var index = Support.parseInt(segments[0], path.getFileName().toString(), lineNumber);
			if (index != terms.size()) throw new IOException("Term indices in " + path.getFileName() + " are not consecutive at line " + lineNumber);
			terms.add(segments[1]);
		}

		return new Vocabulary(terms);
	}
}
