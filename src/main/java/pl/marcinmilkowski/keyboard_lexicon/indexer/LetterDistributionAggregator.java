package pl.marcinmilkowski.keyboard_lexicon.indexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.keyboard_lexicon.lexicon.MissingInputFileException;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Counts first letters and all letters of whitespace-delimited tokens in a free-text corpus.
 *
 * Each token is lowercased and stripped of everything outside {@code a-z}; empty results
 * are ignored. The corpus is streamed line by line; bytes that are not valid UTF-8 decode
 * to replacement characters, which never count as letters.
 */
public class LetterDistributionAggregator {

    private static final Logger logger = LoggerFactory.getLogger(LetterDistributionAggregator.class);

    private static final Pattern TOKEN = Pattern.compile("\\S+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * @param corpus may be null, which yields all-zero distributions
     */
    public LetterDistribution aggregate(Path corpus) throws IOException {
        if (corpus == null) {
            logger.warn("No auxiliary corpus configured; letter distributions will be all zero");
            return LetterDistribution.empty();
        }
        logger.info("Processing {} for letter distributions...", corpus);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(corpus), decoder))) {
            return aggregate(reader);
        } catch (NoSuchFileException e) {
            throw new MissingInputFileException("auxiliary corpus", corpus);
        } catch (IOException e) {
            throw new MissingInputFileException("auxiliary corpus", corpus, e);
        }
    }

    public LetterDistribution aggregate(Reader source) throws IOException {
        long[] initial = new long[LetterDistribution.LETTERS];
        long[] general = new long[LetterDistribution.LETTERS];
        long tokens = 0;

        BufferedReader reader = source instanceof BufferedReader
            ? (BufferedReader) source
            : new BufferedReader(source);
        StringBuilder normalized = new StringBuilder();
        String line;
        while ((line = reader.readLine()) != null) {
            Matcher m = TOKEN.matcher(line);
            while (m.find()) {
                normalized.setLength(0);
                String lower = m.group().toLowerCase(Locale.ROOT);
                for (int i = 0; i < lower.length(); i++) {
                    char c = lower.charAt(i);
                    if (c >= 'a' && c <= 'z') {
                        normalized.append(c);
                    }
                }
                if (normalized.length() == 0) {
                    continue;
                }
                tokens++;
                initial[normalized.charAt(0) - 'a']++;
                for (int i = 0; i < normalized.length(); i++) {
                    general[normalized.charAt(i) - 'a']++;
                }
            }
        }

        LetterDistribution distribution = new LetterDistribution(initial, general);
        logger.info("Counted {} letter tokens; initial distribution: {}", tokens, distribution.initialCsv());
        logger.info("General letter distribution: {}", distribution.generalCsv());
        return distribution;
    }
}
