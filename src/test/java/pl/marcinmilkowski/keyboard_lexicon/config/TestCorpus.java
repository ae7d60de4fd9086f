package pl.marcinmilkowski.keyboard_lexicon.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Test helper pointing at the fixture corpus under src/test/resources/corpus.
 */
public class TestCorpus {

    public static final Path DIR = Paths.get("src/test/resources/corpus");
    public static final Path LEGITIMATE = DIR.resolve("legitimate_words.txt");
    public static final Path HIDDEN = DIR.resolve("hidden_words.txt");
    public static final Path ORDINAL_SOURCE = DIR.resolve("word_frequencies.txt");
    public static final Path FREQUENCY_SOURCE = DIR.resolve("word_frequencies.tsv");
    public static final Path BIG_TXT = DIR.resolve("big.txt");

    /** Distinct retained words in the ordinal fixture. */
    public static final int ORDINAL_WORD_COUNT = 35;

    /**
     * Config over the ordinal fixture writing to {@code output}.
     */
    public static BuildConfig.Builder ordinalConfig(Path output) {
        return BuildConfig.builder()
            .legitimateWordsPath(LEGITIMATE)
            .hiddenWordsPath(HIDDEN)
            .frequencySourcePath(ORDINAL_SOURCE)
            .sourceFormat(SourceFormat.ORDINAL)
            .auxiliaryCorpusPath(BIG_TXT)
            .outputPath(output)
            .threads(2);
    }
}
