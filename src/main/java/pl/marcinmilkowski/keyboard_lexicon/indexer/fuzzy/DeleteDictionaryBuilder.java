package pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.keyboard_lexicon.lexicon.RankedWord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the symmetric-delete dictionary: every delete of every visible word maps back to the word.
 *
 * Hidden words are skipped so they are never offered as corrections. Rows are unique
 * per {@code (delete_hash, word_lower)}; when two deletes of one word share a hash the
 * first generated wins.
 */
public class DeleteDictionaryBuilder {

    private static final Logger logger = LoggerFactory.getLogger(DeleteDictionaryBuilder.class);

    private static final int PROGRESS_EVERY = 10_000;

    private final DeleteGenerator generator;

    public DeleteDictionaryBuilder(int deleteBudget) {
        this.generator = new DeleteGenerator(deleteBudget);
    }

    public List<DeleteRow> build(List<RankedWord> ranked) {
        logger.info("Building SymSpell dictionary (delete budget {})...", generator.getBudget());
        List<DeleteRow> rows = new ArrayList<>();
        int skippedHidden = 0;
        int collisions = 0;

        for (int i = 0; i < ranked.size(); i++) {
            RankedWord w = ranked.get(i);
            if (w.hidden()) {
                skippedHidden++;
                continue;
            }

            Set<Long> hashes = new HashSet<>();
            for (String delete : generator.deletes(w.wordLower())) {
                long hash = DeleteHash.hash(delete);
                if (hashes.add(hash)) {
                    rows.add(new DeleteRow(hash, w.wordLower(), w.rank(), w.word()));
                } else {
                    collisions++;
                }
            }

            if (i % PROGRESS_EVERY == 0) {
                logger.info("Processed {}/{} words for SymSpell...", i, ranked.size());
            }
        }

        if (collisions > 0) {
            logger.debug("{} delete hashes collided within a single word", collisions);
        }
        logger.info("SymSpell dictionary built with {} deletes ({} hidden words skipped)",
            rows.size(), skippedHidden);
        return Collections.unmodifiableList(rows);
    }
}
