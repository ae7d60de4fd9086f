package pl.marcinmilkowski.keyboard_lexicon.lexicon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.keyboard_lexicon.config.SourceFormat;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Filters source words against the legitimacy and hidden sets and assigns dense ranks.
 *
 * A word survives iff it is legitimate or hidden. Survivors are sorted by descending
 * frequency ({@link SourceFormat#FREQUENCY}) or ascending line ordinal
 * ({@link SourceFormat#ORDINAL}); ties keep source order. Ranks run 1..N.
 */
public class CorpusRanker {

    private static final Logger logger = LoggerFactory.getLogger(CorpusRanker.class);

    /**
     * @throws EmptyCorpusException if nothing survives the filter
     */
    public List<RankedWord> rank(LexiconInputs inputs) throws EmptyCorpusException {
        List<SourceWord> retained = new ArrayList<>();
        for (SourceWord candidate : inputs.sourceWords()) {
            String lower = candidate.wordLower();
            if (inputs.legitimateWords().contains(lower) || inputs.hiddenWords().contains(lower)) {
                retained.add(candidate);
            }
        }

        if (retained.isEmpty()) {
            throw new EmptyCorpusException(inputs.sourceWords().size(),
                inputs.legitimateWords().size(), inputs.hiddenWords().size());
        }

        // List.sort is stable, so equal weights keep their source order
        retained.sort(comparatorFor(inputs.format()));

        List<RankedWord> ranked = new ArrayList<>(retained.size());
        int hiddenCount = 0;
        for (int i = 0; i < retained.size(); i++) {
            SourceWord w = retained.get(i);
            boolean hidden = inputs.hiddenWords().contains(w.wordLower());
            if (hidden) {
                hiddenCount++;
            }
            ranked.add(new RankedWord(w.word(), w.wordLower(), i + 1, hidden));
        }

        logger.info("Found {} words that are both frequent and legitimate or hidden ({} hidden)",
            ranked.size(), hiddenCount);
        return Collections.unmodifiableList(ranked);
    }

    static Comparator<SourceWord> comparatorFor(SourceFormat format) {
        switch (format) {
            case FREQUENCY:
                return Comparator.comparingLong(SourceWord::weight).reversed();
            case ORDINAL:
                return Comparator.comparingLong(SourceWord::weight);
            default:
                throw new IllegalArgumentException("Ranking mode must be resolved before ranking: " + format);
        }
    }

    /**
     * Writes the display forms, one per line in rank order.
     */
    public void writeWordList(List<RankedWord> ranked, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            for (RankedWord w : ranked) {
                writer.write(w.word());
                writer.write('\n');
            }
        }
        logger.info("Wrote {} words to {}", ranked.size(), path);
    }
}
