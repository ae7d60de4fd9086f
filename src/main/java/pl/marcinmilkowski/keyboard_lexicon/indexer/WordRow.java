package pl.marcinmilkowski.keyboard_lexicon.indexer;

/**
 * Row of the {@code words} table, keyed by {@code (word_lower, frequency_rank)}.
 */
public record WordRow(
    String wordLower,
    String wordLowerReversed,
    int frequencyRank,
    String word,
    boolean hidden
) {
}
