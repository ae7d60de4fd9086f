package pl.marcinmilkowski.keyboard_lexicon.indexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.keyboard_lexicon.lexicon.RankedWord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Projects the ranked list onto the {@code words} table and its reversed twin.
 */
public class ExactSuffixIndexBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ExactSuffixIndexBuilder.class);

    public Result build(List<RankedWord> ranked) {
        List<WordRow> words = new ArrayList<>(ranked.size());
        List<SuffixRow> suffixes = new ArrayList<>(ranked.size());

        for (RankedWord w : ranked) {
            String reversed = reverse(w.wordLower());
            words.add(new WordRow(w.wordLower(), reversed, w.rank(), w.word(), w.hidden()));
            suffixes.add(new SuffixRow(reversed, w.rank(), w.word(), w.wordLower(), w.hidden()));
        }

        logger.info("Built {} word rows and {} suffix rows", words.size(), suffixes.size());
        return new Result(Collections.unmodifiableList(words), Collections.unmodifiableList(suffixes));
    }

    /**
     * Reverses by code point; surrogate pairs stay intact.
     */
    public static String reverse(String s) {
        return new StringBuilder(s).reverse().toString();
    }

    public record Result(List<WordRow> words, List<SuffixRow> suffixes) {
    }
}
