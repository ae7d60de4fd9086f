package pl.marcinmilkowski.keyboard_lexicon.config;

import java.util.Locale;

/**
 * Typo-tolerant index layout. Exactly one is built per artifact.
 */
public enum FuzzyStrategy {
    DELETE_DICTIONARY("symspell"),
    BK_TREE("bktree");

    private final String alias;

    FuzzyStrategy(String alias) {
        this.alias = alias;
    }

    public String alias() {
        return alias;
    }

    public static FuzzyStrategy parse(String value) {
        if (value == null || value.isBlank()) {
            return DELETE_DICTIONARY;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (FuzzyStrategy strategy : values()) {
            if (strategy.alias.equals(normalized) || strategy.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown fuzzy strategy: " + value
            + " (expected symspell or bktree)");
    }
}
