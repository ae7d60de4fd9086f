package pl.marcinmilkowski.keyboard_lexicon.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads build settings from JSON.
 *
 * Expected JSON structure (relative paths resolve against the config file's directory):
 * {
 *   "legitimate_words": "corpus/legitimate_words.txt",
 *   "hidden_words": "corpus/hidden_words.txt",
 *   "frequency_source": "corpus/word_frequencies.txt",
 *   "source_format": "ordinal",
 *   "auxiliary_corpus": "corpus/big.txt",
 *   "output": "build/words.idx",
 *   "filtered_word_list": "corpus/words.txt",
 *   "prefix_cap": 20,
 *   "delete_budget": 2,
 *   "fuzzy_strategy": "symspell",
 *   "threads": 4
 * }
 */
public class BuildConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(BuildConfigLoader.class);

    private final Path configPath;
    private final Path baseDir;
    private final JSONObject root;

    /**
     * Parse the configuration file.
     *
     * @param configPath Path to the build JSON
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is not a JSON object
     */
    public BuildConfigLoader(Path configPath) throws IOException {
        this.configPath = configPath;
        if (!Files.exists(configPath)) {
            throw new IOException("Build config file not found: " + configPath);
        }
        Path parent = configPath.toAbsolutePath().getParent();
        this.baseDir = parent != null ? parent : Path.of("").toAbsolutePath();

        String content = Files.readString(configPath);
        try {
            this.root = JSON.parseObject(content);
        } catch (RuntimeException e) {
            // fastjson2 reports some truncated documents with index errors rather than JSONException
            throw new IllegalArgumentException("Invalid build config JSON in " + configPath + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty build config: " + configPath);
        }
    }

    /**
     * Returns a builder pre-filled from the file so that command-line flags can still override values.
     */
    public BuildConfig.Builder toBuilder() {
        BuildConfig.Builder builder = BuildConfig.builder()
            .legitimateWordsPath(resolve(root.getString("legitimate_words")))
            .hiddenWordsPath(resolve(root.getString("hidden_words")))
            .frequencySourcePath(resolve(root.getString("frequency_source")))
            .sourceFormat(SourceFormat.parse(root.getString("source_format")))
            .auxiliaryCorpusPath(resolve(root.getString("auxiliary_corpus")))
            .outputPath(resolve(root.getString("output")))
            .filteredWordListPath(resolve(root.getString("filtered_word_list")))
            .prefixCap(root.getIntValue("prefix_cap", BuildConfig.DEFAULT_PREFIX_CAP))
            .deleteBudget(root.getIntValue("delete_budget", BuildConfig.DEFAULT_DELETE_BUDGET))
            .fuzzyStrategy(FuzzyStrategy.parse(root.getString("fuzzy_strategy")));
        if (root.containsKey("threads")) {
            builder.threads(root.getIntValue("threads"));
        }
        return builder;
    }

    /**
     * Parse and validate in one step.
     */
    public BuildConfig load() {
        BuildConfig config = toBuilder().build();
        logger.info("Loaded build config from {}: {}", configPath, config);
        return config;
    }

    private Path resolve(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Path path = Path.of(value);
        return path.isAbsolute() ? path : baseDir.resolve(path).normalize();
    }
}
