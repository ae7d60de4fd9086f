package pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.keyboard_lexicon.lexicon.RankedWord;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BkTreeTest {

    private static final List<String> WORDS = List.of(
        "the", "hello", "help", "hell", "helmet", "world", "word", "work", "walk", "talk",
        "tall", "ball", "wall", "halo", "hollow", "yellow", "fellow", "mellow", "i", "a");

    @Test
    @DisplayName("Root is node 1 and ids follow insertion order")
    void rootAndIds() {
        BkTree tree = buildTree();
        assertEquals("the", tree.nodeAt(1).word());
        assertEquals(WORDS.size(), tree.size());
        for (int i = 0; i < WORDS.size(); i++) {
            assertEquals(i + 1, tree.getNodes().get(i).nodeId());
            assertEquals(WORDS.get(i), tree.getNodes().get(i).word());
        }
        assertEquals(WORDS.size() - 1, tree.getEdges().size());
    }

    @Test
    @DisplayName("Each edge distance equals the fresh edit distance of its endpoints")
    void edgeDistancesAreExact() {
        BkTree tree = buildTree();
        for (BkEdgeRow edge : tree.getEdges()) {
            int expected = EditDistance.between(tree.nodeAt(edge.parentId()).word(), tree.nodeAt(edge.childId()).word());
            assertEquals(expected, edge.distance());
        }
    }

    @Test
    @DisplayName("Children of one parent have distinct edge distances")
    void distinctChildDistances() {
        BkTree tree = buildTree();
        Set<String> seen = new HashSet<>();
        for (BkEdgeRow edge : tree.getEdges()) {
            assertTrue(seen.add(edge.parentId() + ":" + edge.distance()));
        }
    }

    @Test
    @DisplayName("Radius search finds exactly what a full scan finds")
    void searchMatchesBruteForce() {
        BkTree tree = buildTree();
        for (String query : List.of("helo", "wrok", "xyz", "tal", "hollow")) {
            for (int radius = 0; radius <= 2; radius++) {
                final int r = radius;
                Set<String> expected = WORDS.stream()
                    .filter(w -> EditDistance.between(query, w) <= r)
                    .collect(Collectors.toSet());
                Set<String> found = tree.search(query, radius).stream()
                    .map(BkTree.Match::word)
                    .collect(Collectors.toSet());
                assertEquals(expected, found, "query=" + query + " radius=" + radius);
            }
        }
    }

    @Test
    @DisplayName("Builder skips repeated words and keeps hidden ones flagged")
    void builderDeduplicates() {
        List<RankedWord> ranked = List.of(
            new RankedWord("hello", "hello", 1, false),
            new RankedWord("damn", "damn", 2, true),
            new RankedWord("Hello", "hello", 3, false));

        BkTree tree = new BkTreeBuilder().build(ranked);

        assertEquals(2, tree.size());
        assertTrue(tree.nodeAt(2).hidden());
        assertEquals(2, tree.nodeAt(2).frequencyRank());
    }

    @Test
    @DisplayName("Inserting the same word twice creates a distance-0 edge")
    void duplicateInsertion() {
        BkTree tree = new BkTree();
        tree.insert("word", 1, false);
        tree.insert("word", 2, false);
        assertEquals(new BkEdgeRow(1, 2, 0), tree.getEdges().get(0));
    }

    @Test
    @DisplayName("Empty tree finds nothing")
    void emptyTree() {
        assertTrue(new BkTree().search("word", 2).isEmpty());
    }

    private static BkTree buildTree() {
        List<RankedWord> ranked = new ArrayList<>();
        for (int i = 0; i < WORDS.size(); i++) {
            ranked.add(new RankedWord(WORDS.get(i), WORDS.get(i), i + 1, false));
        }
        return new BkTreeBuilder().build(ranked);
    }
}
