package pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EditDistanceTest {

    @Test
    @DisplayName("Classic Levenshtein examples")
    void classicExamples() {
        assertEquals(0, EditDistance.between("hello", "hello"));
        assertEquals(3, EditDistance.between("kitten", "sitting"));
        assertEquals(1, EditDistance.between("help", "hell"));
        assertEquals(4, EditDistance.between("", "word"));
        assertEquals(4, EditDistance.between("word", ""));
    }

    @Test
    @DisplayName("Transpositions cost two edits")
    void noTranspositions() {
        assertEquals(2, EditDistance.between("teh", "the"));
    }

    @Test
    @DisplayName("Distance is symmetric")
    void symmetric() {
        assertEquals(EditDistance.between("walk", "talking"), EditDistance.between("talking", "walk"));
    }

    @Test
    @DisplayName("A supplementary character counts as one edit")
    void codePoints() {
        assertEquals(1, EditDistance.between("a😀b", "ab"));
        assertEquals(1, EditDistance.between("a😀b", "a😃b"));
    }
}
