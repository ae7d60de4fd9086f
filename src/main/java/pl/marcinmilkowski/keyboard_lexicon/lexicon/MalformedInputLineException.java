package pl.marcinmilkowski.keyboard_lexicon.lexicon;

/**
 * A frequency source line is not {@code word<TAB>integer}. Callers skip the line and continue.
 */
public class MalformedInputLineException extends LexiconBuildException {

    private final long lineNumber;
    private final String line;

    public MalformedInputLineException(long lineNumber, String line, String reason) {
        super("Malformed line " + lineNumber + " (" + reason + "): " + line);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
