package ai.mapper.model;

import java.util.List;

public record InheritPayload(
        String base,                   // base expression as written
        List<String> overriddenMethods // sorted
) implements EdgePayload {
    public InheritPayload {
        overriddenMethods = List.copyOf(overriddenMethods);
    }
}
