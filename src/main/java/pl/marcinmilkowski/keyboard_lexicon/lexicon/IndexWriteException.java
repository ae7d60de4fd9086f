package pl.marcinmilkowski.keyboard_lexicon.lexicon;

import java.io.IOException;

/**
 * The underlying store rejected a write. The previous artifact, if any, is left in place.
 */
public class IndexWriteException extends LexiconBuildException {

    public IndexWriteException(String message, IOException cause) {
        super(message + ": " + cause.getMessage(), cause);
    }
}
