package pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy;

/**
 * Row of {@code bk_edges}; {@code distance} is the edit distance between parent and child words.
 */
public record BkEdgeRow(
    int parentId,
    int childId,
    int distance
) {
}
