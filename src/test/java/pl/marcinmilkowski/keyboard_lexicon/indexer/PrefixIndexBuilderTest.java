package pl.marcinmilkowski.keyboard_lexicon.indexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.keyboard_lexicon.lexicon.RankedWord;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class PrefixIndexBuilderTest {

    @Test
    @DisplayName("Only the 20 best visible words are kept per prefix")
    void capsVisibleEntries() {
        List<RankedWord> ranked = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            String word = "pre" + (char) ('a' + i / 26) + (char) ('a' + i % 26);
            ranked.add(new RankedWord(word, word, i + 1, false));
        }

        List<PrefixRow> rows = new PrefixIndexBuilder(20).build(ranked);

        List<Integer> preRanks = rows.stream()
            .filter(r -> r.prefixLower().equals("pre"))
            .map(PrefixRow::frequencyRank)
            .toList();
        assertEquals(IntStream.rangeClosed(1, 20).boxed().toList(), preRanks);
        assertEquals(20, rows.stream().filter(r -> r.prefixLower().equals("p")).count());

        // Full-length prefixes are unique words, so each one is present
        assertEquals(30, rows.stream().filter(r -> r.prefixLower().length() == 5).count());
    }

    @Test
    @DisplayName("Hidden words are never capped and never count toward the cap")
    void hiddenUncapped() {
        List<RankedWord> ranked = List.of(
            new RankedWord("hello", "hello", 1, false),
            new RankedWord("hell", "hell", 2, true),
            new RankedWord("help", "help", 3, false),
            new RankedWord("helmet", "helmet", 4, false),
            new RankedWord("hellish", "hellish", 5, true));

        List<PrefixRow> rows = new PrefixIndexBuilder(2).build(ranked);

        List<PrefixRow> hel = rows.stream().filter(r -> r.prefixLower().equals("hel")).toList();
        assertEquals(List.of(
            new PrefixRow("hel", "hello", 1, false),
            new PrefixRow("hel", "hell", 2, true),
            new PrefixRow("hel", "help", 3, false),
            new PrefixRow("hel", "hellish", 5, true)), hel);
        assertEquals(2, hel.stream().filter(r -> !r.hidden()).count());
    }

    @Test
    @DisplayName("Single-character words produce exactly one row")
    void singleCharacterWord() {
        List<PrefixRow> rows = new PrefixIndexBuilder(20).build(List.of(new RankedWord("I", "i", 1, false)));
        assertEquals(List.of(new PrefixRow("i", "I", 1, false)), rows);
    }

    @Test
    @DisplayName("Prefixes are cut on code point boundaries")
    void codePointPrefixes() {
        String word = "😀x";
        List<PrefixRow> rows = new PrefixIndexBuilder(20).build(List.of(new RankedWord(word, word, 1, false)));
        assertEquals(2, rows.size());
        assertEquals("😀", rows.get(0).prefixLower());
    }

    @Test
    @DisplayName("Out-of-order ranks are rejected")
    void requiresRankOrder() {
        List<RankedWord> ranked = List.of(
            new RankedWord("b", "b", 2, false),
            new RankedWord("a", "a", 1, false));
        assertThrows(IllegalArgumentException.class, () -> new PrefixIndexBuilder(20).build(ranked));
        assertThrows(IllegalArgumentException.class, () -> new PrefixIndexBuilder(0));
    }
}
