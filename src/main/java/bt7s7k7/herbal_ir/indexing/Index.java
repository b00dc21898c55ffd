package bt7s7k7.herbal_ir.indexing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Lists;
import com.google.common.collect.Table;

import bt7s7k7.herbal_ir.common.Support;

/**
 * Inverted index over the terms of a {@link Vocabulary}. For each term, the postings list the
 * documents containing the term together with the number of occurrences, ordered by document id.
 * Documents not in a postings list contain the term zero times.
 */
public class Index {
	public static record Location(int document, int frequency) {
		public static void put(List<Location> list, int document, int frequency) {
			var index = Collections.binarySearch(Lists.transform(list, Location::document), document);
			// Test if not found
			if (index >= 0) {
				list.set(index, new Location(document, frequency));
			} else {
				list.add(-index - 1, new Location(document, frequency));
			}
		}

		public static int get(List<Location> list, int document) {
			var index = Collections.binarySearch(Lists.transform(list, Location::document), document);
			// Test if not found
			if (index < 0) return 0;
			return list.get(index).frequency;
		}
	}

	protected final int documentCount;
	protected final ImmutableList<ImmutableList<Location>> documentsByTerms;
	protected final ImmutableTable<Integer, Integer, Integer> termsInDocuments;

	protected Index(int documentCount, List<? extends List<Location>> documentsByTerms, Table<Integer, Integer, Integer> termsInDocuments) {
		this.documentCount = documentCount;
		this.documentsByTerms = documentsByTerms.stream()
				.map(ImmutableList::copyOf)
				.collect(ImmutableList.toImmutableList());
		this.termsInDocuments = ImmutableTable.copyOf(termsInDocuments);
	}

	public static Index empty(int documentCount, int termCount) {
		return new Builder(documentCount, termCount).build();
	}

	public int getDocumentCount() {
		return this.documentCount;
	}

	public int getTermCount() {
		return this.documentsByTerms.size();
	}

	public List<Location> getLocations(int term) {
		return this.documentsByTerms.get(term);
	}

	public int getDF(int term) {
		return this.documentsByTerms.get(term).size();
	}

	public int getTF(int term, int document) {
		return Location.get(this.documentsByTerms.get(term), document);
	}

	/** Counts of every vocabulary term in the document, keyed by term index. */
	public Map<Integer, Integer> getTermsInDocument(int document) {
		return this.termsInDocuments.row(document);
	}

	public int getPostingCount() {
		return this.termsInDocuments.size();
	}

	public static class Builder {
		protected final int documentCount;
		protected final List<List<Location>> documentsByTerms;
		protected final Table<Integer, Integer, Integer> termsInDocuments = HashBasedTable.create();

		public Builder(int documentCount, int termCount) {
			this.documentCount = documentCount;
			this.documentsByTerms = new ArrayList<>(termCount);
			for (var i = 0; i < termCount; i++) {
				this.documentsByTerms.add(new ArrayList<>());
			}
		}

		public Builder setFrequency(int term, int document, int frequency) {
			if (document < 0 || document >= this.documentCount) throw new IllegalArgumentException("Document " + document + " is out of range");
			if (frequency <= 0) throw new IllegalArgumentException("Frequency of term " + term + " in document " + document + " must be positive");

			Location.put(this.documentsByTerms.get(term), document, frequency);
			this.termsInDocuments.put(document, term, frequency);
			return this;
		}

		/** Counts the tokens of the document that are in the vocabulary and adds them to the index. */
		public Builder addDocument(int document, List<String> tokens, Vocabulary vocabulary) {
			var frequencies = tokens.stream()
					.mapToInt(vocabulary::indexOf)
					.filter(term -> term >= 0)
					.boxed()
					.collect(Collectors.groupingBy(term -> term, Collectors.counting()));

			for (var kv : frequencies.entrySet()) {
				this.setFrequency(kv.getKey(), document, kv.getValue().intValue());
			}

			return this;
		}

		public Index build() {
			return new Index(this.documentCount, this.documentsByTerms, this.termsInDocuments);
		}
	}

	public void save(Path path, Vocabulary vocabulary) throws IOException {
		Files.write(path, (Iterable<String>) vocabulary.indexStream()
				// Save postings in a TSV format
				.mapToObj(term -> Stream.concat(
						// First column is the term
						Stream.of(vocabulary.getTerm(term)),
						// For each location, add column for document ID and frequency
						this.getLocations(term).stream().flatMap(location -> Stream.of(
								Integer.toString(location.document()),
								Integer.toString(location.frequency()))))
						.collect(Collectors.joining("\t")))::iterator);
	}

	public static Index load(Path path, Vocabulary vocabulary, int documentCount) throws IOException {
		var builder = new Builder(documentCount, vocabulary.size());
		var file = path.getFileName().toString();
		var lineNumber = 0;

		for (var line : Files.readAllLines(path)) {
			lineNumber++;
			// Ignore empty lines
			if (StringUtils.isBlank(line)) continue;

			var segments = line.split("\t");
			// First column is the term
			var term = vocabulary.indexOf(segments[0]);
			if (term < 0) throw new IOException("Term " + segments[0] + " in " + file + " at line " + lineNumber + " is not in the vocabulary");
			if (segments.length % 2 != 1) throw new IOException("Unpaired posting in " + file + " at line " + lineNumber);

			// All documents that contain this term are specified by a pair of columns, the document ID and frequency
			for (int i = 1; i < segments.length; i += 2) {
				var document = Support.parseInt(segments[i], file, lineNumber);
				var frequency = Support.parseInt(segments[i + 1], file, lineNumber);
				if (document < 0 || document >= documentCount || frequency <= 0) {
					throw new IOException("Invalid posting " + document + ":" + frequency + " in " + file + " at line " + lineNumber);
				}

				builder.setFrequency(term, document, frequency);
			}
		}

		return builder.build();
	}
}
