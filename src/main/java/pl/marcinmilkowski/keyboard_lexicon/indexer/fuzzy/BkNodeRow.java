package pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy;

/**
 * Row of {@code bk_nodes}. Node 1 is the root; ids carry no ranking meaning.
 */
public record BkNodeRow(
    int nodeId,
    String word,
    int frequencyRank,
    boolean hidden
) {
}
