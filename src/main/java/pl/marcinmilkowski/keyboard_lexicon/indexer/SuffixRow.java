package pl.marcinmilkowski.keyboard_lexicon.indexer;

/**
 * Row of the {@code words_by_suffix} table, keyed by {@code (word_lower_reversed, frequency_rank)}.
 * Suffix lookups become prefix scans over the reversed key.
 */
public record SuffixRow(
    String wordLowerReversed,
    int frequencyRank,
    String word,
    String wordLower,
    boolean hidden
) {
}
