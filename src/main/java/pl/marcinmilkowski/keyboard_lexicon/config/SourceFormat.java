package pl.marcinmilkowski.keyboard_lexicon.config;

import java.util.Locale;

/**
 * Layout of the ranked word source, which also selects the ranking mode.
 */
public enum SourceFormat {
    /** One word per line, already sorted by descending importance. Rank follows the line number. */
    ORDINAL,
    /** {@code word<TAB>frequency} per line. Rank follows descending frequency. */
    FREQUENCY,
    /** Decide from the first non-blank line: a tab means {@link #FREQUENCY}. */
    AUTO;

    public static SourceFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown source format: " + value
                + " (expected ordinal, frequency or auto)");
        }
    }
}
