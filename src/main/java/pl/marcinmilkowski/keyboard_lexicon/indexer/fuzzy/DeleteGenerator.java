package pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Generates every string reachable from a word by deleting up to {@code budget} code points.
 *
 * Worklist with a seen-set: a string reached by two deletion paths is expanded once.
 * The word itself is always included, and a single code point is never deleted, so
 * the empty string never appears. The same generator serves index build and query.
 */
public final class DeleteGenerator {

    private final int budget;

    public DeleteGenerator(int budget) {
        if (budget < 0) {
            throw new IllegalArgumentException("Delete budget must be >= 0, got " + budget);
        }
        this.budget = budget;
    }

    /**
     * @return deletes in generation order, starting with {@code word} itself
     */
    public Set<String> deletes(String word) {
        Set<String> seen = new LinkedHashSet<>();
        if (word.isEmpty()) {
            return seen;
        }
        Deque<Pending> work = new ArrayDeque<>();
        seen.add(word);
        work.add(new Pending(word, 0));

        while (!work.isEmpty()) {
            Pending current = work.poll();
            if (current.depth >= budget) {
                continue;
            }
            String s = current.text;
            if (s.codePointCount(0, s.length()) <= 1) {
                continue;
            }
            for (int i = 0; i < s.length(); ) {
                int next = s.offsetByCodePoints(i, 1);
                String delete = s.substring(0, i) + s.substring(next);
                if (seen.add(delete)) {
                    work.add(new Pending(delete, current.depth + 1));
                }
                i = next;
            }
        }
        return Collections.unmodifiableSet(seen);
    }

    public int getBudget() {
        return budget;
    }

    private record Pending(String text, int depth) {
    }
}
