package pl.marcinmilkowski.keyboard_lexicon.lexicon;

import pl.marcinmilkowski.keyboard_lexicon.config.SourceFormat;

import java.util.List;
import java.util.Set;

/**
 * Everything the ranker needs, already normalized.
 *
 * @param format the resolved ranking mode, never {@link SourceFormat#AUTO}
 */
public record LexiconInputs(
    Set<String> legitimateWords,
    Set<String> hiddenWords,
    List<SourceWord> sourceWords,
    SourceFormat format,
    int malformedLines
) {
}
