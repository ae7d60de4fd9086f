package pl.marcinmilkowski.keyboard_lexicon.indexer;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * First-letter and any-letter counts for {@code a}..{@code z}, in alphabetical order.
 */
public final class LetterDistribution {

    public static final int LETTERS = 26;
    public static final String INITIAL_KEY = "initial_distribution";
    public static final String GENERAL_KEY = "general_distribution";

    private final long[] initial;
    private final long[] general;

    public LetterDistribution(long[] initial, long[] general) {
        if (initial.length != LETTERS || general.length != LETTERS) {
            throw new IllegalArgumentException("Distributions must have " + LETTERS + " buckets");
        }
        this.initial = initial.clone();
        this.general = general.clone();
    }

    public static LetterDistribution empty() {
        return new LetterDistribution(new long[LETTERS], new long[LETTERS]);
    }

    /**
     * Parses the comma-joined form written to the {@code kv} table.
     */
    public static long[] parseCsv(String csv) {
        String[] parts = csv.split(",");
        if (parts.length != LETTERS) {
            throw new IllegalArgumentException("Expected " + LETTERS + " values, got " + parts.length + ": " + csv);
        }
        long[] values = new long[LETTERS];
        for (int i = 0; i < LETTERS; i++) {
            values[i] = Long.parseLong(parts[i].trim());
        }
        return values;
    }

    public long initial(char letter) {
        return initial[letter - 'a'];
    }

    public long general(char letter) {
        return general[letter - 'a'];
    }

    public long[] getInitial() {
        return initial.clone();
    }

    public long[] getGeneral() {
        return general.clone();
    }

    public long initialTotal() {
        return Arrays.stream(initial).sum();
    }

    public long generalTotal() {
        return Arrays.stream(general).sum();
    }

    public String initialCsv() {
        return toCsv(initial);
    }

    public String generalCsv() {
        return toCsv(general);
    }

    private static String toCsv(long[] values) {
        return Arrays.stream(values).mapToObj(Long::toString).collect(Collectors.joining(","));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LetterDistribution)) return false;
        LetterDistribution other = (LetterDistribution) o;
        return Arrays.equals(initial, other.initial) && Arrays.equals(general, other.general);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(initial) + Arrays.hashCode(general);
    }

    @Override
    public String toString() {
        return "LetterDistribution[initial=" + initialCsv() + ", general=" + generalCsv() + "]";
    }
}
