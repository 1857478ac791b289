package ai.mapper.model;

import java.util.Objects;

/**
 * Directed, typed relationship between two components.
 * <p>
 * {@code targetId} is a registered component id when {@code resolution} is
 * {@link Resolution#RESOLVED}, and the unresolved sentinel otherwise. {@code targetName} keeps
 * the name the target resolved to after alias substitution (null only for dynamic targets).
 */
public record IntegrationEdge(
        int sourceId,
        int targetId,
        EdgeKind kind,
        int line,
        String targetName,
        Resolution resolution,
        EdgePayload payload
) {
    public static final int UNRESOLVED = 0;

    public IntegrationEdge {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(resolution, "resolution");
        Objects.requireNonNull(payload, "payload");
        if (!EdgePayload.expectedFor(kind).isInstance(payload)) {
            throw new IllegalArgumentException(kind.label() + " edge cannot carry "
                    + payload.getClass().getSimpleName());
        }
        if ((resolution == Resolution.RESOLVED) == (targetId == UNRESOLVED)) {
            throw new IllegalArgumentException("target " + targetId + " does not match resolution "
                    + resolution.label());
        }
    }

    public boolean isResolved() {
        return resolution == Resolution.RESOLVED;
    }
}
