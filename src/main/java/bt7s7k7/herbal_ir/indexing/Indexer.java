package bt7s7k7.herbal_ir.indexing;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import bt7s7k7.herbal_ir.common.Logger;
import bt7s7k7.herbal_ir.common.Stopwatch;
import bt7s7k7.herbal_ir.ranking.TfIdfModel;
import bt7s7k7.herbal_ir.stemming.IndonesianStemmer;
import bt7s7k7.herbal_ir.stemming.Stemmer;

/**
 * Builds an {@link IndexSnapshot} from a set of documents. Documents are preprocessed
 * independently, possibly in parallel; the vocabulary, index and vectors are then built from all
 * of them at once.
 */
public class Indexer {
	public final IndexingParameters parameters;
	public final TextPipeline pipeline;

	public Indexer(IndexingParameters parameters, TextPipeline pipeline) {
		if (pipeline.minTokenLength != parameters.minTokenLength()) {
			throw new IllegalArgumentException("Pipeline drops tokens shorter than " + pipeline.minTokenLength + ", but parameters require " + parameters.minTokenLength());
		}

		this.parameters = parameters;
		this.pipeline = pipeline;
	}

	public Indexer(IndexingParameters parameters, Stemmer stemmer) {
		this(parameters, new TextPipeline(parameters.minTokenLength(), StopwordFilter.getDefault(), stemmer));
	}

	public Indexer(IndexingParameters parameters) {
		this(parameters, new IndonesianStemmer());
	}

	public IndexSnapshot index(List<SourceDocument> sources) {
		var sorted = this.deduplicate(sources);

		// Tokenize all documents, the order of the result is the order of the documents, even in parallel
		List<List<String>> tokens;
		try (var __ = new Stopwatch("Preprocessing " + sorted.size() + " documents")) {
			var stream = this.parameters.parallel() ? sorted.parallelStream() : sorted.stream();
			tokens = stream.map(this::preprocess).toList();
		}

		var documents = new ArrayList<Document>(sorted.size());
		for (var id = 0; id < sorted.size(); id++) {
			var source = sorted.get(id);
			documents.add(new Document(id, source.name(), source.text(), tokens.get(id)));
		}
		var database = new DocumentDatabase(documents);

		FeatureSelection selection;
		try (var __ = new Stopwatch("Selecting features")) {
			selection = this.parameters.createFeatureSelector().select(tokens);
		}

		var report = selection.report();
		Logger.text("Selected " + report.selected() + " of " + report.distinctTerms() + " terms (minDf=" + report.minDf() + ", maxDf=" + report.maxDf() + ", topN=" + report.topN() + ")");
		if (selection.vocabulary().isEmpty()) {
			Logger.warn("No terms were selected, all queries will return no results");
		}

		Index index;
		try (var __ = new Stopwatch("Building inverted index")) {
			var builder = new Index.Builder(database.size(), selection.vocabulary().size());
			for (var document : documents) {
				builder.addDocument(document.id(), document.tokens(), selection.vocabulary());
			}
			index = builder.build();
		}

		TfIdfModel model;
		try (var __ = new Stopwatch("Computing document vectors")) {
			model = TfIdfModel.build(index, this.parameters.weighting());
		}

		Logger.success("Indexed " + database.size() + " documents with " + index.getPostingCount() + " postings");
		return new IndexSnapshot(database, report, selection.vocabulary(), index, model, this.pipeline);
	}

	protected List<String> preprocess(SourceDocument source) {
		// An empty or unreadable document is kept, but contributes nothing to the index
		if (StringUtils.isBlank(source.text())) {
			Logger.warn("Document " + source.name() + " has no text");
			return List.of();
		}

		var tokens = this.pipeline.process(source.text());
		Logger.debug("Document " + source.name() + ": " + tokens.size() + " tokens");
		return tokens;
	}

	/** Orders documents by name, so ids are stable between builds, and drops repeated names. */
	protected List<SourceDocument> deduplicate(List<SourceDocument> sources) {
		var byName = new LinkedHashMap<String, SourceDocument>();
		for (var source : sources) {
			if (byName.putIfAbsent(source.name(), source) != null) {
				Logger.warn("Document " + source.name() + " was given more than once, ignoring the duplicate");
			}
		}

		return byName.values().stream()
				.sorted(Comparator.comparing(SourceDocument::name))
				.toList();
	}
}
