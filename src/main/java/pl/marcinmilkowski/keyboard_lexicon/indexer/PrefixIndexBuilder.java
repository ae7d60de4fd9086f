package pl.marcinmilkowski.keyboard_lexicon.indexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.keyboard_lexicon.lexicon.RankedWord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Emits one row per (prefix, word) pair, keeping at most {@code visibleCap} visible
 * words per prefix. Hidden words are always emitted and never count toward the cap.
 *
 * Words must arrive in ascending rank order so the kept visible rows are the best ones.
 */
public class PrefixIndexBuilder {

    private static final Logger logger = LoggerFactory.getLogger(PrefixIndexBuilder.class);

    private final int visibleCap;

    public PrefixIndexBuilder(int visibleCap) {
        if (visibleCap < 1) {
            throw new IllegalArgumentException("visibleCap must be >= 1, got " + visibleCap);
        }
        this.visibleCap = visibleCap;
    }

    public List<PrefixRow> build(List<RankedWord> ranked) {
        List<PrefixRow> rows = new ArrayList<>();
        Map<String, Integer> visibleCounts = new HashMap<>();
        int previousRank = 0;

        for (RankedWord w : ranked) {
            if (w.rank() <= previousRank) {
                throw new IllegalArgumentException("Ranked words out of order at " + w);
            }
            previousRank = w.rank();

            String lower = w.wordLower();
            int length = lower.codePointCount(0, lower.length());
            for (int i = 1; i <= length; i++) {
                String prefix = lower.substring(0, lower.offsetByCodePoints(0, i));
                if (w.hidden()) {
                    rows.add(new PrefixRow(prefix, w.word(), w.rank(), true));
                    continue;
                }
                int seen = visibleCounts.getOrDefault(prefix, 0);
                if (seen < visibleCap) {
                    rows.add(new PrefixRow(prefix, w.word(), w.rank(), false));
                    visibleCounts.put(prefix, seen + 1);
                }
            }
        }

        logger.info("Built {} prefix rows over {} distinct prefixes (capped at {} visible per prefix)",
            rows.size(), visibleCounts.size(), visibleCap);
        return Collections.unmodifiableList(rows);
    }
}
