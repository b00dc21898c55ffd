package bt7s7k7.herbal_ir.search;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

import bt7s7k7.herbal_ir.common.Logger;
import bt7s7k7.herbal_ir.indexing.IndexSnapshot;
import bt7s7k7.herbal_ir.indexing.TextExtractor;

/**
 * Answers queries against the current {@link IndexSnapshot}. A rebuilt snapshot is installed with
 * {@link #publish}, every query reads the current snapshot once, so it never sees a mix of two
 * builds.
 */
public class SearchEngine {
	protected final AtomicReference<IndexSnapshot> snapshot;

	public SearchEngine(IndexSnapshot snapshot) {
		this.snapshot = new AtomicReference<>(snapshot);
	}

	public IndexSnapshot getSnapshot() {
		return this.snapshot.get();
	}

	/** Replaces the snapshot used by queries and returns the previous one. */
	public IndexSnapshot publish(IndexSnapshot snapshot) {
		var previous = this.snapshot.getAndSet(snapshot);
		Logger.debug("Published snapshot with " + snapshot.getDocumentCount() + " documents");
		return previous;
	}

	private static final Pattern COMMAND_PATTERN = Pattern.compile("(?<=^|\\s)-([a-z-]+)");

	/** Query text with the "-command" flags typed into the search prompt removed. */
	public static record ParsedQuery(String text, Set<String> commands) {}

	public static ParsedQuery parseCommands(String queryString) {
		// Extract commands from input
		var commands = new HashSet<String>();
		var text = COMMAND_PATTERN.matcher(queryString).replaceAll(match -> {
			commands.add(match.group(1));
			return "";
		});

		return new ParsedQuery(text.strip(), Set.copyOf(commands));
	}

	public static record Suggestion(int document, String name, double score) {}

	public List<Suggestion> search(String query, int topK) {
		var snapshot = this.snapshot.get();
		return this.rank(snapshot, query, topK);
	}

	protected List<Suggestion> rank(IndexSnapshot snapshot, String query, int topK) {
		var tokens = snapshot.pipeline().process(query);
		var queryVector = snapshot.model().vectorizeQuery(tokens, snapshot.vocabulary());

		// No query term is in the vocabulary
		if (queryVector.isZero()) {
			Logger.debug("Query \"" + query + "\" has no indexed terms");
			return List.of();
		}

		return snapshot.model().rank(queryVector, snapshot.index(), topK).stream()
				.map(scored -> new Suggestion(scored.document(), snapshot.documents().findDocumentByIndex(scored.document()), scored.score()))
				.toList();
	}

	/**
	 * Ranks documents and adds a snippet to each of them. Summaries are only extracted when
	 * {@code options} are given, otherwise they are empty.
	 */
	public List<SearchResult> search(String query, int topK, SummaryOptions options) {
		var snapshot = this.snapshot.get();
		var suggestions = this.rank(snapshot, query, topK);
		var summarizer = new Summarizer(snapshot.pipeline(), snapshot.vocabulary());
		var words = List.of(TextExtractor.normalize(query).split(" "));

		var results = new ArrayList<SearchResult>(suggestions.size());
		for (var suggestion : suggestions) {
			var document = snapshot.documents().getDocument(suggestion.document());
			var summary = options == null ? "" : summarizer.summarize(document.text(), snapshot.model().getDocumentVector(document.id()), options);
			var snippet = SnippetBuilder.build(document.text(), words);
			results.add(new SearchResult(suggestion.document(), suggestion.name(), suggestion.score(), summary, snippet));
		}

		return results;
	}

	public static record DocumentWeight(int document, int tf, double weight) {}

	/** How a query term is weighted, in the query and in each of the requested documents. */
	public static record TermReport(String term, int df, double idf, int queryTf, double queryWeight, List<DocumentWeight> documents) {}

	/** Weights of the query terms that are in the vocabulary, in the order they first appear in the query. */
	public List<TermReport> explain(String query, List<Integer> documents) {
		var snapshot = this.snapshot.get();
		var model = snapshot.model();
		var tokens = snapshot.pipeline().process(query);

		var reports = new ArrayList<TermReport>();
		for (var token : tokens.stream().distinct().toList()) {
			var term = snapshot.vocabulary().indexOf(token);
			if (term < 0) continue;

			var queryTf = (int) tokens.stream().filter(token::equals).count();
			var idf = model.getIdf(term);

			var weights = new ArrayList<DocumentWeight>(documents.size());
			for (var document : documents) {
				var tf = snapshot.index().getTF(term, document);
				weights.add(new DocumentWeight(document, tf, model.getDocumentVector(document).get(term)));
			}

			reports.add(new TermReport(token, snapshot.index().getDF(term), idf, queryTf, model.scheme.weight(queryTf, idf), List.copyOf(weights)));
		}

		return reports;
	}
}
