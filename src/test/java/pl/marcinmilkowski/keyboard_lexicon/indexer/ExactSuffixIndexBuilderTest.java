package pl.marcinmilkowski.keyboard_lexicon.indexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.keyboard_lexicon.lexicon.RankedWord;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExactSuffixIndexBuilderTest {

    private final ExactSuffixIndexBuilder builder = new ExactSuffixIndexBuilder();

    @Test
    @DisplayName("Every word gets a matching reversed suffix row")
    void suffixSymmetry() {
        List<RankedWord> ranked = List.of(
            new RankedWord("The", "the", 1, false),
            new RankedWord("walking", "walking", 2, false),
            new RankedWord("damn", "damn", 3, true));

        ExactSuffixIndexBuilder.Result result = builder.build(ranked);

        assertEquals(3, result.words().size());
        assertEquals(3, result.suffixes().size());
        for (int i = 0; i < ranked.size(); i++) {
            WordRow word = result.words().get(i);
            SuffixRow suffix = result.suffixes().get(i);
            assertEquals(new StringBuilder(word.wordLower()).reverse().toString(), suffix.wordLowerReversed());
            assertEquals(word.wordLowerReversed(), suffix.wordLowerReversed());
            assertEquals(word.frequencyRank(), suffix.frequencyRank());
            assertEquals(word.word(), suffix.word());
            assertEquals(word.wordLower(), suffix.wordLower());
            assertEquals(word.hidden(), suffix.hidden());
        }
        assertEquals(new WordRow("the", "eht", 1, "The", false), result.words().get(0));
    }

    @Test
    @DisplayName("Hidden flag is carried through verbatim")
    void hiddenPreserved() {
        ExactSuffixIndexBuilder.Result result = builder.build(List.of(new RankedWord("damn", "damn", 1, true)));
        assertTrue(result.words().get(0).hidden());
        assertTrue(result.suffixes().get(0).hidden());
    }

    @Test
    @DisplayName("Reversal keeps supplementary characters intact")
    void reverseByCodePoint() {
        String word = "a😀b";
        assertEquals("b😀a", ExactSuffixIndexBuilder.reverse(word));
        assertEquals("ło", ExactSuffixIndexBuilder.reverse("oł"));
    }
}
