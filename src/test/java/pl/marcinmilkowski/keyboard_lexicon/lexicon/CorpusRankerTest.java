package pl.marcinmilkowski.keyboard_lexicon.lexicon;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.keyboard_lexicon.config.SourceFormat;
import pl.marcinmilkowski.keyboard_lexicon.config.TestCorpus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class CorpusRankerTest {

    @TempDir
    Path tempDir;

    private final CorpusRanker ranker = new CorpusRanker();

    @Test
    @DisplayName("Ranks are dense 1..N over the retained words")
    void ranksAreDense() throws IOException {
        List<RankedWord> ranked = rankFixture();

        assertEquals(TestCorpus.ORDINAL_WORD_COUNT, ranked.size());
        List<Integer> ranks = ranked.stream().map(RankedWord::rank).sorted().toList();
        assertEquals(IntStream.rangeClosed(1, ranked.size()).boxed().toList(), ranks);
    }

    @Test
    @DisplayName("A word survives iff it is legitimate or hidden")
    void legitimacyOrHiddenGate() throws IOException {
        Map<String, RankedWord> byLower = rankFixture().stream()
            .collect(Collectors.toMap(RankedWord::wordLower, w -> w));

        assertFalse(byLower.containsKey("zzzxq"));
        assertFalse(byLower.containsKey("qwrtz"));

        RankedWord damn = byLower.get("damn");
        assertNotNull(damn);
        assertTrue(damn.hidden());
        assertTrue(byLower.get("hell").hidden());
        assertFalse(byLower.get("hello").hidden());
    }

    @Test
    @DisplayName("Ordinal mode keeps source order and display casing")
    void ordinalOrder() throws IOException {
        List<RankedWord> ranked = rankFixture();

        assertEquals(new RankedWord("The", "the", 1, false), ranked.get(0));
        RankedWord i = ranked.stream().filter(w -> w.wordLower().equals("i")).findFirst().orElseThrow();
        assertEquals("I", i.word());
        assertEquals(20, i.rank());
        assertEquals(26, ranked.stream().filter(w -> w.wordLower().equals("hello")).findFirst().orElseThrow().rank());
        assertEquals("talk", ranked.get(ranked.size() - 1).wordLower());
    }

    @Test
    @DisplayName("Frequency mode sorts by descending count with stable ties")
    void frequencyOrder() throws IOException {
        LexiconInputs inputs = new LexiconLoader().load(TestCorpus.ordinalConfig(tempDir.resolve("out"))
            .frequencySourcePath(TestCorpus.FREQUENCY_SOURCE)
            .sourceFormat(SourceFormat.FREQUENCY)
            .build());

        List<RankedWord> ranked = ranker.rank(inputs);

        assertEquals(List.of("the", "world", "Hello", "help", "talk", "damn"),
            ranked.stream().map(RankedWord::word).toList());
        assertEquals(List.of(1, 2, 3, 4, 5, 6), ranked.stream().map(RankedWord::rank).toList());
    }

    @Test
    @DisplayName("Nothing legitimate or hidden fails with EmptyCorpusException")
    void emptyCorpus() {
        LexiconInputs inputs = new LexiconInputs(Set.of("alpha"), Set.of(),
            List.of(new SourceWord("beta", "beta", 1, 0)), SourceFormat.ORDINAL, 0);

        assertThrows(EmptyCorpusException.class, () -> ranker.rank(inputs));
    }

    @Test
    @DisplayName("AUTO must be resolved before ranking")
    void unresolvedFormat() {
        LexiconInputs inputs = new LexiconInputs(Set.of("beta"), Set.of(),
            List.of(new SourceWord("beta", "beta", 1, 0)), SourceFormat.AUTO, 0);

        assertThrows(IllegalArgumentException.class, () -> ranker.rank(inputs));
    }

    @Test
    @DisplayName("Filtered word list is written in rank order")
    void writesWordList() throws IOException {
        List<RankedWord> ranked = rankFixture();
        Path out = tempDir.resolve("corpus/words.txt");

        ranker.writeWordList(ranked, out);

        List<String> lines = Files.readAllLines(out);
        assertEquals(ranked.size(), lines.size());
        assertEquals("The", lines.get(0));
        assertEquals("I", lines.get(19));
    }

    private List<RankedWord> rankFixture() throws IOException {
        return ranker.rank(new LexiconLoader().load(TestCorpus.ordinalConfig(tempDir.resolve("out")).build()));
    }
}
