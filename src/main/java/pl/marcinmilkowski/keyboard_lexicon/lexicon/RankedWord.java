package pl.marcinmilkowski.keyboard_lexicon.lexicon;

/**
 * A word that survived filtering, with its dense final rank (1 = most important).
 */
public record RankedWord(
    String word,
    String wordLower,
    int rank,
    boolean hidden
) {

    public RankedWord {
        if (wordLower == null || wordLower.isEmpty()) {
            throw new IllegalArgumentException("Ranked word must not be empty");
        }
        if (rank < 1) {
            throw new IllegalArgumentException("Rank must be >= 1, got " + rank + " for " + wordLower);
        }
    }

    @Override
    public String toString() {
        return String.format("%s #%d%s", word, rank, hidden ? " (hidden)" : "");
    }
}
