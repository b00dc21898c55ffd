package bt7s7k7.herbal_ir.cli;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.TerminalBuilder;

import bt7s7k7.herbal_ir.common.Logger;
import bt7s7k7.herbal_ir.common.Project;
import bt7s7k7.herbal_ir.common.Support;
import bt7s7k7.herbal_ir.indexing.Indexer;
import bt7s7k7.herbal_ir.indexing.TextExtractor;
import bt7s7k7.herbal_ir.search.SearchEngine;

public class App {
	public static void main(String[] args) {
		try {
			var rootPath = Paths.get("").toAbsolutePath().resolve("project");
			var project = Project.fromPath(rootPath);
			var rest = String.join(" ", Arrays.asList(args).subList(Math.min(1, args.length), args.length));

			switch (args.length == 0 ? "" : args[0]) {
				case "index" -> {
					var inputFiles = project.getInputFileManager();
					if (inputFiles.size() == 0) {
						Logger.warn("No .txt or .pdf files in " + inputFiles.path);
					}

					var indexer = new Indexer(project.settings.getIndexingParameters(), project.createPipeline());
					var snapshot = indexer.index(inputFiles.loadDocuments());
					project.getSnapshotStore().save(snapshot);
				}
				case "search" -> {
					var loadSearchEngine = Support.makeSafe((Project target) -> {
						var inputFiles = target.getInputFileManager();
						var snapshot = target.getSnapshotStore().load(target.createPipeline(), inputFiles::findContent);
						return new SearchEngine(snapshot);
					});
					var searchEngineFuture = CompletableFuture.supplyAsync(() -> loadSearchEngine.apply(project));

					// A query on the command line is answered once, without the prompt
					if (!rest.isBlank()) {
						runQuery(project, searchEngineFuture.get(), rest);
						break;
					}

					var terminal = TerminalBuilder.builder()
							.system(true)
							.build();

					var history = new DefaultHistory();

					var reader = LineReaderBuilder.builder()
							.terminal(terminal)
							.history(history)
							.build();

					while (true) {
						try {
							var line = reader.readLine("> ").trim();
							if (line.isEmpty()) continue;

							runQuery(project, searchEngineFuture.get(), line);
						} catch (UserInterruptException __) {
							continue;
						} catch (EndOfFileException __) {
							break;
						}
					}

					terminal.close();
				}
				case "features" -> {
					var limit = 50;
					if (!rest.isBlank()) {
						try {
							limit = Integer.parseInt(rest.trim());
						} catch (NumberFormatException error) {
							limit = -1;
						}
					}

					if (limit < 0) {
						Logger.error("Invalid arguments, expected: features [count]");
						System.exit(1);
						return;
					}

					var snapshot = project.getSnapshotStore().load(project.createPipeline(), __ -> null);
					for (var kv : snapshot.features().toMap().entrySet()) {
						Logger.info(kv.getKey() + ": " + kv.getValue());
					}

					var index = snapshot.index();
					snapshot.vocabulary().indexStream()
							.boxed()
							.sorted(Comparator.<Integer>comparingInt(index::getDF).reversed())
							.limit(limit)
							.forEach(term -> Logger.text(snapshot.vocabulary().getTerm(term) + "\t\u001b[2mDF: " + index.getDF(term)
									+ "; IDF: " + snapshot.model().getIdf(term) + "\u001b[0m"));
				}
				case "inspect" -> {
					var breakdown = project.createPipeline().breakdown(rest);
					Logger.info("Normalized: " + breakdown.normalized());
					Logger.info("Tokens: " + breakdown.tokens());
					Logger.info("Without stopwords: " + breakdown.filtered());
					Logger.info("Stemmed: " + breakdown.stemmed());
				}
				default -> {
					Logger.error("Invalid arguments, expected one of: index, search [query], features [count], inspect <text>");
					System.exit(1);
				}
			}
		} catch (IOException | InterruptedException | ExecutionException e) {
			throw new RuntimeException(e);
		}
	}

	/**
	 * Runs a query typed into the search prompt. The query may contain commands: "-summary" prints
	 * a summary of each result, "-explain" prints how the query was processed and weighted.
	 */
	protected static void runQuery(Project project, SearchEngine searchEngine, String line) {
		var query = SearchEngine.parseCommands(line);
		var explain = query.commands().contains("explain");

		if (explain) {
			var breakdown = searchEngine.getSnapshot().pipeline().breakdown(query.text());
			Logger.text("\u001b[2mTokens: " + breakdown.tokens() + "; stemmed: " + breakdown.stemmed() + "\u001b[0m");
		}

		var summarize = query.commands().contains("summary");
		var results = searchEngine.search(query.text(), project.settings.getTopK(), summarize ? project.settings.getSummaryOptions() : null);
		if (results.isEmpty()) {
			Logger.error("No documents found");
			return;
		}

		var words = List.of(StringUtils.split(TextExtractor.normalize(query.text()), ' '));
		for (var result : results) {
			Logger.info("Found: " + result.name() + " \u001b[2m(Score: " + result.score() + ")\u001b[0m");
			Logger.text("    " + highlight(result.snippet(), words));
			if (summarize) {
				Logger.text("    \u001b[2mSummary:\u001b[0m " + highlight(result.summary(), words));
			}
		}

		if (explain) {
			var documents = results.stream().map(result -> result.document()).toList();
			for (var term : searchEngine.explain(query.text(), documents)) {
				var weights = term.documents().stream()
						.map(weight -> searchEngine.getSnapshot().documents().findDocumentByIndex(weight.document()) + "=" + weight.tf() + "/" + String.format("%.4f", weight.weight()))
						.collect(Collectors.joining(", "));
				Logger.text("\u001b[2m" + term.term() + ": DF " + term.df() + ", IDF " + String.format("%.4f", term.idf())
						+ ", query TF " + term.queryTf() + "; " + weights + "\u001b[0m");
			}
		}

		Logger.success("Found " + results.size() + " results");
	}

	/** Marks occurrences of query words in the text. Words shorter than 3 letters are not marked. */
	protected static String highlight(String text, List<String> words) {
		var result = text;
		for (var word : words.stream().distinct().sorted(Comparator.comparingInt(String::length).reversed()).toList()) {
			if (word.length() < 3) continue;
			result = Pattern.compile(Pattern.quote(word), Pattern.CASE_INSENSITIVE).matcher(result)
					.replaceAll(match -> "\u001b[1;93m" + match.group() + "\u001b[0m");
		}
		return result;
	}
}
