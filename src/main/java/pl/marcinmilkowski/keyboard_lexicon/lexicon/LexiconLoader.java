package pl.marcinmilkowski.keyboard_lexicon.lexicon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.keyboard_lexicon.config.BuildConfig;
import pl.marcinmilkowski.keyboard_lexicon.config.SourceFormat;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the legitimacy list, the hidden-word list and the ranked word source.
 *
 * All lookups are keyed by the {@link Locale#ROOT} lowercase form. The source keeps the
 * first-seen casing of each word; later casing variants are dropped.
 */
public class LexiconLoader {

    private static final Logger logger = LoggerFactory.getLogger(LexiconLoader.class);

    private static final int MALFORMED_LINES_LOGGED = 10;

    /**
     * Loads all word inputs named by the config.
     *
     * @throws MissingInputFileException if a required or configured input cannot be read
     */
    public LexiconInputs load(BuildConfig config) throws IOException {
        logger.info("Loading legitimate words from {}", config.getLegitimateWordsPath());
        Set<String> legitimate = loadWordSet(config.getLegitimateWordsPath(), "legitimate words");
        logger.info("Loaded {} legitimate words", legitimate.size());

        Set<String> hidden;
        if (config.getHiddenWordsPath() != null) {
            logger.info("Loading hidden words from {}", config.getHiddenWordsPath());
            hidden = loadWordSet(config.getHiddenWordsPath(), "hidden words");
            logger.info("Loaded {} hidden words", hidden.size());
        } else {
            hidden = Collections.emptySet();
            logger.info("No hidden word list configured");
        }

        SourceFormat format = resolveFormat(config.getFrequencySourcePath(), config.getSourceFormat());
        logger.info("Loading word source from {} ({})", config.getFrequencySourcePath(), format);
        SourceLoad source = loadSource(config.getFrequencySourcePath(), format);
        logger.info("Loaded {} distinct source words ({} duplicates, {} malformed lines skipped)",
            source.words.size(), source.duplicates, source.malformed);

        return new LexiconInputs(legitimate, hidden, source.words, format, source.malformed);
    }

    /**
     * Reads a one-word-per-line list into a lowercase set. Blank lines are ignored.
     */
    public Set<String> loadWordSet(Path path, String role) throws IOException {
        Set<String> words = new HashSet<>();
        try (BufferedReader reader = open(path, role)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String word = line.strip().toLowerCase(Locale.ROOT);
                if (!word.isEmpty()) {
                    words.add(word);
                }
            }
        } catch (LexiconBuildException e) {
            throw e;
        } catch (IOException e) {
            throw new MissingInputFileException(role, path, e);
        }
        return Collections.unmodifiableSet(words);
    }

    /**
     * Resolves {@link SourceFormat#AUTO} by peeking at the first non-blank line.
     */
    public SourceFormat resolveFormat(Path path, SourceFormat requested) throws IOException {
        if (requested != SourceFormat.AUTO) {
            return requested;
        }
        try (BufferedReader reader = open(path, "word source")) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    return line.indexOf('\t') >= 0 ? SourceFormat.FREQUENCY : SourceFormat.ORDINAL;
                }
            }
        } catch (LexiconBuildException e) {
            throw e;
        } catch (IOException e) {
            throw new MissingInputFileException("word source", path, e);
        }
        return SourceFormat.ORDINAL;
    }

    /**
     * Parses one {@code word<TAB>frequency} line.
     *
     * @return the display word and its count
     * @throws MalformedInputLineException if the line does not have that shape
     */
    static Map.Entry<String, Long> parseFrequencyLine(long lineNumber, String line) throws MalformedInputLineException {
        int tab = line.indexOf('\t');
        if (tab < 0) {
            throw new MalformedInputLineException(lineNumber, line, "no tab");
        }
        String word = line.substring(0, tab).strip();
        if (word.isEmpty()) {
            throw new MalformedInputLineException(lineNumber, line, "empty word");
        }
        String count = line.substring(tab + 1).strip();
        try {
            return Map.entry(word, Long.parseLong(count));
        } catch (NumberFormatException e) {
            throw new MalformedInputLineException(lineNumber, line, "frequency is not an integer");
        }
    }

    private SourceLoad loadSource(Path path, SourceFormat format) throws IOException {
        Map<String, SourceWord> byLower = new LinkedHashMap<>();
        int duplicates = 0;
        int malformed = 0;
        long lineNumber = 0;

        try (BufferedReader reader = open(path, "word source")) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }

                String word;
                long weight;
                if (format == SourceFormat.FREQUENCY) {
                    try {
                        Map.Entry<String, Long> parsed = parseFrequencyLine(lineNumber, line);
                        word = parsed.getKey();
                        weight = parsed.getValue();
                    } catch (MalformedInputLineException e) {
                        malformed++;
                        if (malformed <= MALFORMED_LINES_LOGGED) {
                            logger.warn("Skipping {}", e.getMessage());
                        }
                        continue;
                    }
                } else {
                    word = line.strip();
                    weight = lineNumber;
                }

                String lower = word.toLowerCase(Locale.ROOT);
                if (byLower.containsKey(lower)) {
                    duplicates++;
                    logger.debug("Dropping duplicate source word '{}' at line {}", word, lineNumber);
                    continue;
                }
                byLower.put(lower, new SourceWord(word, lower, weight, byLower.size()));
            }
        } catch (LexiconBuildException e) {
            throw e;
        } catch (IOException e) {
            throw new MissingInputFileException("word source", path, e);
        }

        if (malformed > MALFORMED_LINES_LOGGED) {
            logger.warn("Skipped {} malformed lines in {} ({} not shown)",
                malformed, path, malformed - MALFORMED_LINES_LOGGED);
        }
        return new SourceLoad(Collections.unmodifiableList(new ArrayList<>(byLower.values())), duplicates, malformed);
    }

    private static BufferedReader open(Path path, String role) throws IOException {
        if (path == null) {
            throw new MissingInputFileException(role, null);
        }
        try {
            return Files.newBufferedReader(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new MissingInputFileException(role, path);
        } catch (IOException e) {
            throw new MissingInputFileException(role, path, e);
        }
    }

    private record SourceLoad(List<SourceWord> words, int duplicates, int malformed) {
    }
}
