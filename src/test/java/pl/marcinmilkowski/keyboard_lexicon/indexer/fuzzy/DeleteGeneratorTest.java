package pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DeleteGeneratorTest {

    @Test
    @DisplayName("Budget 2 yields the word, its single and its double deletes")
    void generatesUpToBudget() {
        Set<String> deletes = new DeleteGenerator(2).deletes("abc");
        assertEquals(Set.of("abc", "bc", "ac", "ab", "a", "b", "c"), deletes);
        assertEquals("abc", deletes.iterator().next());
    }

    @Test
    @DisplayName("Repeated letters collapse to distinct strings")
    void deduplicatesPaths() {
        Set<String> deletes = new DeleteGenerator(2).deletes("aab");
        assertEquals(Set.of("aab", "ab", "aa", "a", "b"), deletes);
    }

    @Test
    @DisplayName("The empty string is never generated")
    void neverEmpty() {
        assertEquals(Set.of("a"), new DeleteGenerator(2).deletes("a"));
        assertEquals(Set.of("ab", "a", "b"), new DeleteGenerator(3).deletes("ab"));
        assertTrue(new DeleteGenerator(2).deletes("").isEmpty());
    }

    @Test
    @DisplayName("Budget 0 yields only the word")
    void zeroBudget() {
        assertEquals(Set.of("hello"), new DeleteGenerator(0).deletes("hello"));
    }

    @Test
    @DisplayName("Matches every subsequence within the budget")
    void matchesBruteForce() {
        String word = "helmet";
        Set<String> expected = new HashSet<>();
        int n = word.length();
        for (int mask = 0; mask < (1 << n); mask++) {
            if (Integer.bitCount(mask) > 2 || Integer.bitCount(mask) == n) {
                continue;
            }
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < n; i++) {
                if ((mask & (1 << i)) == 0) {
                    sb.append(word.charAt(i));
                }
            }
            expected.add(sb.toString());
        }
        assertEquals(expected, new DeleteGenerator(2).deletes(word));
    }

    @Test
    @DisplayName("Deletes whole code points")
    void codePoints() {
        assertEquals(Set.of("😀b", "😀", "b"), new DeleteGenerator(1).deletes("😀b"));
    }
}
