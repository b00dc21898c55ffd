package bt7s7k7.herbal_ir.indexing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import bt7s7k7.herbal_ir.common.Support;

/** Vocabulary chosen by the {@link FeatureSelector}, with a report of how it was chosen. */
public record FeatureSelection(Vocabulary vocabulary, Report report) {
	public static record Report(int documentCount, int distinctTerms, int selected, int minDf, double maxDfRatio, int maxDf, int topN) {
		public static final Report EMPTY = new Report(0, 0, 0, 0, 0, 0, 0);

		public Map<String, String> toMap() {
			var map = new LinkedHashMap<String, String>();
			map.put("documentCount", Integer.toString(this.documentCount));
			map.put("distinctTerms", Integer.toString(this.distinctTerms));
			map.put("selected", Integer.toString(this.selected));
			map.put("minDf", Integer.toString(this.minDf));
			map.put("maxDfRatio", Double.toString(this.maxDfRatio));
			map.put("maxDf", Integer.toString(this.maxDf));
			map.put("topN", Integer.toString(this.topN));
			return map;
		}

		public void save(Path path) throws IOException {
			Files.write(path, (Iterable<String>) this.toMap().entrySet().stream()
					.map(kv -> kv.getKey() + "\t" + kv.getValue())::iterator);
		}

		public static Report load(Path path) throws IOException {
			var values = new LinkedHashMap<String, String>();
			for (var line : Files.readAllLines(path)) {
				if (StringUtils.isBlank(line)) continue;
				var segments = line.split("\t", 2);
				if (segments.length == 2) values.put(segments[0], segments[1]);
			}

			var file = path.getFileName().toString();
			return new Report(
					Support.parseInt(values.getOrDefault("documentCount", "0"), file, 0),
					Support.parseInt(values.getOrDefault("distinctTerms", "0"), file, 0),
					Support.parseInt(values.getOrDefault("selected", "0"), file, 0),
					Support.parseInt(values.getOrDefault("minDf", "0"), file, 0),
					Support.parseDouble(values.getOrDefault("maxDfRatio", "0"), file, 0),
					Support.parseInt(values.getOrDefault("maxDf", "0"), file, 0),
					Support.parseInt(values.getOrDefault("topN", "0"), file, 0));
		}
	}
}
