package pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy;

/**
 * Levenshtein distance over Unicode code points (unit cost insert, delete, substitute; no transpositions).
 */
public final class EditDistance {

    private EditDistance() {
    }

    public static int between(String a, String b) {
        if (a.equals(b)) {
            return 0;
        }
        int[] s = a.codePoints().toArray();
        int[] t = b.codePoints().toArray();
        if (s.length == 0) {
            return t.length;
        }
        if (t.length == 0) {
            return s.length;
        }

        // Two rolling rows of the DP table
        int[] previous = new int[t.length + 1];
        int[] current = new int[t.length + 1];
        for (int j = 0; j <= t.length; j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= s.length; i++) {
            current[0] = i;
            for (int j = 1; j <= t.length; j++) {
                int cost = s[i - 1] == t[j - 1] ? 0 : 1;
                current[j] = Math.min(
                    Math.min(previous[j] + 1, current[j - 1] + 1),
                    previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[t.length];
    }
}
