package ai.mapper.model;

/**
 * Raised when an empty or malformed FQN is offered for registration.
 */
public class InvalidIdentifierException extends IllegalArgumentException {

    private final String identifier;

    public InvalidIdentifierException(String identifier, String reason) {
        super("invalid identifier '" + identifier + "': " + reason);
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
