package pl.marcinmilkowski.keyboard_lexicon.lexicon;

import java.nio.file.Path;

/**
 * A required input is absent or unreadable. Raised before anything is written.
 */
public class MissingInputFileException extends LexiconBuildException {

    private final Path path;

    public MissingInputFileException(String role, Path path) {
        super("Could not find required " + role + " file: " + path);
        this.path = path;
    }

    public MissingInputFileException(String role, Path path, Throwable cause) {
        super("Could not read required " + role + " file: " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
