package pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.keyboard_lexicon.lexicon.RankedWord;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Inserts the ranked vocabulary into a {@link BkTree} in rank order, so the best word is the root.
 *
 * Hidden words are inserted and flagged; the consumer filters them. Repeated lowercase
 * forms are skipped.
 */
public class BkTreeBuilder {

    private static final Logger logger = LoggerFactory.getLogger(BkTreeBuilder.class);

    private static final int PROGRESS_EVERY = 10_000;

    public BkTree build(List<RankedWord> ranked) {
        logger.info("Building BK-tree...");
        BkTree tree = new BkTree();
        Set<String> inserted = new HashSet<>();

        for (int i = 0; i < ranked.size(); i++) {
            RankedWord w = ranked.get(i);
            if (!inserted.add(w.wordLower())) {
                logger.debug("Skipping duplicate BK-tree word '{}'", w.wordLower());
                continue;
            }
            tree.insert(w.wordLower(), w.rank(), w.hidden());

            if (i % PROGRESS_EVERY == 0) {
                logger.info("Inserted {}/{} words into BK-tree...", i, ranked.size());
            }
        }

        logger.info("BK-tree built with {} nodes and {} edges", tree.size(), tree.getEdges().size());
        return tree;
    }
}
