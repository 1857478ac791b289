package ai.mapper.syntax;

/**
 * Source text that the parser adapter could not turn into a syntax tree.
 */
public class ParseException extends Exception {

    private final int line;

    public ParseException(int line, String message) {
        super("line " + line + ": " + message);
        this.line = line;
    }

    public int line() {
        return line;
    }
}
