package pl.marcinmilkowski.keyboard_lexicon.lexicon;

/**
 * A candidate word as read from the frequency source, before filtering.
 */
public record SourceWord(
    String word,           // First-seen display casing
    String wordLower,      // Lookup key
    long weight,           // Line ordinal (ORDINAL) or explicit count (FREQUENCY)
    int inputOrder         // 0-based position among accepted source words, used for stable ties
) {
}
