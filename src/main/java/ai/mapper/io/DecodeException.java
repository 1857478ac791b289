package ai.mapper.io;

/**
 * A compact payload that cannot be expanded: malformed structure, unknown code or an id that
 * is missing from the index.
 */
public class DecodeException extends Exception {

    public DecodeException(String message) {
        super(message);
    }
}
