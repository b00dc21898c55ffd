package bt7s7k7.herbal_ir.indexing;

import bt7s7k7.herbal_ir.ranking.TfIdfModel;
import bt7s7k7.herbal_ir.ranking.WeightingScheme;

/**
 * Everything produced by one build. A snapshot is never modified, a rebuild creates a new one, so
 * any number of queries can read it at the same time.
 */
public record IndexSnapshot(
		DocumentDatabase documents,
		FeatureSelection.Report features,
		Vocabulary vocabulary,
		Index index,
		TfIdfModel model,
		TextPipeline pipeline) {

	public static IndexSnapshot empty(TextPipeline pipeline, WeightingScheme weighting) {
		var index = Index.empty(0, 0);
		return new IndexSnapshot(DocumentDatabase.EMPTY, FeatureSelection.Report.EMPTY, Vocabulary.EMPTY, index, TfIdfModel.build(index, weighting), pipeline);
	}

	public int getDocumentCount() {
		return this.documents.size();
	}
}
