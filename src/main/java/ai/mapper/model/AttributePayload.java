package ai.mapper.model;

public record AttributePayload(
        String attribute,   // accessed name
        String expression,  // full access as written, e.g. self.x
        String owner,       // resolved owner name, null when dynamic
        int hop
) implements EdgePayload {
}
