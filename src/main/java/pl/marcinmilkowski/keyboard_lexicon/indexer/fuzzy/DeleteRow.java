package pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy;

/**
 * Row of the {@code symspell_deletes} table, keyed by {@code (delete_hash, word_lower)}.
 */
public record DeleteRow(
    long deleteHash,
    String wordLower,
    int frequencyRank,
    String word
) {
}
