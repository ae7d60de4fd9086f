package pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy;

/**
 * Platform-independent 63-bit polynomial hash used as the on-disk delete key.
 *
 * {@code h = (h * 31 + codePoint) & 0x7FFFFFFFFFFFFFFF}, one code point at a time.
 * Consumers on other platforms compute the same value, so the formula must not change.
 * Collisions are possible; the stored word disambiguates.
 */
public final class DeleteHash {

    private static final long MASK = 0x7FFFFFFFFFFFFFFFL;

    private DeleteHash() {
    }

    public static long hash(String s) {
        long h = 0;
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            h = (h * 31 + cp) & MASK;
            i += Character.charCount(cp);
        }
        return h;
    }
}
