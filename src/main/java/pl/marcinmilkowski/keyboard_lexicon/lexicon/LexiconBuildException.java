package pl.marcinmilkowski.keyboard_lexicon.lexicon;

import java.io.IOException;

/**
 * Base type for every failure the index build reports.
 */
public abstract class LexiconBuildException extends IOException {

    protected LexiconBuildException(String message) {
        super(message);
    }

    protected LexiconBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
