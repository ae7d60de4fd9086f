package pl.marcinmilkowski.keyboard_lexicon.lexicon;

/**
 * No source word survived the legitimacy filter.
 */
public class EmptyCorpusException extends LexiconBuildException {

    public EmptyCorpusException(int sourceWords, int legitimateWords, int hiddenWords) {
        super(String.format("No words left after filtering (%d source words, %d legitimate, %d hidden)",
            sourceWords, legitimateWords, hiddenWords));
    }
}
