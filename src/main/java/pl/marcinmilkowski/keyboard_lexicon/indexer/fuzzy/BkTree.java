package pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * BK-tree stored as an arena: nodes are addressed by 1-based int handles and edges
 * map {@code (parent, distance)} to a child handle.
 *
 * Not thread-safe. Built once, then exported as rows or searched in memory.
 */
public class BkTree {

    private final List<BkNodeRow> nodes = new ArrayList<>();
    private final List<BkEdgeRow> edges = new ArrayList<>();
    private final Map<Long, Integer> children = new HashMap<>();
    private int maxEdgeDistance = 0;

    /**
     * Inserts a word and returns its node id. The first word becomes the root.
     * Inserting a word already present adds a distance-0 child; callers should dedupe first.
     */
    public int insert(String word, int frequencyRank, boolean hidden) {
        int id = nodes.size() + 1;
        BkNodeRow node = new BkNodeRow(id, word, frequencyRank, hidden);
        if (nodes.isEmpty()) {
            nodes.add(node);
            return id;
        }

        int current = 1;
        while (true) {
            int distance = EditDistance.between(word, nodeAt(current).word());
            Integer child = children.get(edgeKey(current, distance));
            if (child == null) {
                nodes.add(node);
                edges.add(new BkEdgeRow(current, id, distance));
                children.put(edgeKey(current, distance), id);
                maxEdgeDistance = Math.max(maxEdgeDistance, distance);
                return id;
            }
            current = child;
        }
    }

    /**
     * Finds every word within {@code radius} of {@code query}, hidden ones included.
     * Only children whose edge distance d satisfies |d - dist(query, node)| <= radius are visited.
     */
    public List<Match> search(String query, int radius) {
        List<Match> matches = new ArrayList<>();
        if (nodes.isEmpty()) {
            return matches;
        }
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(1);
        while (!queue.isEmpty()) {
            BkNodeRow node = nodeAt(queue.poll());
            int distance = EditDistance.between(query, node.word());
            if (distance <= radius) {
                matches.add(new Match(node.word(), distance, node.frequencyRank(), node.hidden()));
            }
            int low = Math.max(0, distance - radius);
            int high = Math.min(maxEdgeDistance, distance + radius);
            for (int d = low; d <= high; d++) {
                Integer child = children.get(edgeKey(node.nodeId(), d));
                if (child != null) {
                    queue.add(child);
                }
            }
        }
        return matches;
    }

    public BkNodeRow nodeAt(int id) {
        return nodes.get(id - 1);
    }

    public int size() {
        return nodes.size();
    }

    public List<BkNodeRow> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<BkEdgeRow> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    private static long edgeKey(int parent, int distance) {
        return ((long) parent << 32) | (distance & 0xFFFFFFFFL);
    }

    /**
     * A search hit; callers drop hidden matches before suggesting.
     */
    public record Match(String word, int distance, int frequencyRank, boolean hidden) {
    }
}
