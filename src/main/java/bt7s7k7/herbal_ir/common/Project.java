package bt7s7k7.herbal_ir.common;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import bt7s7k7.herbal_ir.indexing.SnapshotStore;
import bt7s7k7.herbal_ir.indexing.StopwordFilter;
import bt7s7k7.herbal_ir.indexing.TextPipeline;
import bt7s7k7.herbal_ir.input.InputFileManager;
import bt7s7k7.herbal_ir.stemming.IndonesianStemmer;
import bt7s7k7.herbal_ir.stemming.RootDictionary;

public class Project {
	public final Path rootPath;
	public final Settings settings;

	protected Project(Path rootPath, Settings settings) {
		this.rootPath = rootPath;
		this.settings = settings;
	}

	public InputFileManager getInputFileManager() throws IOException {
		var inputFilesPath = this.rootPath.resolve("input");
		// In a fresh project the input directory may not exist, so create it
		Files.createDirectories(inputFilesPath);

		var manager = new InputFileManager(inputFilesPath);
		manager.refreshCache();

		return manager;
	}

	public SnapshotStore getSnapshotStore() {
		return new SnapshotStore(this.rootPath.resolve("snapshot"));
	}

	public RootDictionary getRootDictionary() throws IOException {
		var dictionary = this.settings.getDictionary();
		if (dictionary.isEmpty()) return RootDictionary.EMPTY;

		var result = RootDictionary.load(this.rootPath.resolve(dictionary));
		Logger.debug("Loaded " + result.size() + " root words from " + dictionary);
		return result;
	}

	/** Text pipeline configured by the settings, used both for indexing and for queries. */
	public TextPipeline createPipeline() throws IOException {
		var parameters = this.settings.getIndexingParameters();
		return new TextPipeline(parameters.minTokenLength(), StopwordFilter.getDefault(), new IndonesianStemmer(this.getRootDictionary()));
	}

	/** Creates a project at a path. If the project folder does not exist it is created. */
	public static Project fromPath(Path rootPath) throws IOException {
		Files.createDirectories(rootPath);
		var settings = Settings.load(rootPath.resolve(Settings.FILENAME));
		Logger.setVerbose(settings.isVerbose());
		return new Project(rootPath, settings);
	}
}
