package pl.marcinmilkowski.keyboard_lexicon.indexer;

/**
 * Row of the {@code prefixes} table, keyed by {@code (prefix_lower, frequency_rank)}.
 */
public record PrefixRow(
    String prefixLower,
    String word,
    int frequencyRank,
    boolean hidden
) {
}
