package pl.marcinmilkowski.keyboard_lexicon.indexer;

import pl.marcinmilkowski.keyboard_lexicon.config.FuzzyStrategy;

import java.nio.file.Path;
import java.util.Map;

/**
 * Summary of a finished build: where the artifact went and how many rows each table got.
 */
public record BuildReport(
    Path artifactPath,
    FuzzyStrategy fuzzyStrategy,
    int wordCount,
    int hiddenCount,
    int malformedLines,
    Map<String, Long> tableRows,
    LetterDistribution distribution,
    long elapsedMillis
) {

    public long rows(String table) {
        return tableRows.getOrDefault(table, 0L);
    }

    @Override
    public String toString() {
        return String.format("BuildReport[%s, %s, words=%d (hidden %d), malformed=%d, tables=%s, %d ms]",
            artifactPath, fuzzyStrategy, wordCount, hiddenCount, malformedLines, tableRows, elapsedMillis);
    }
}
