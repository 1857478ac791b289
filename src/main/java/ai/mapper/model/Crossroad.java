package ai.mapper.model;

import java.util.List;

/**
 * Junction between two module-level components, derived from the edge set on every run.
 */
public record Crossroad(
        int id,
        List<Integer> componentIds,   // sorted by fqn
        int edgeCount,
        Criticality criticality,
        List<EdgeKind> interactionKinds
) {
    public Crossroad {
        if (componentIds.size() < 2) {
            throw new IllegalArgumentException("crossroad needs two components: " + componentIds);
        }
        componentIds = List.copyOf(componentIds);
        interactionKinds = List.copyOf(interactionKinds);
    }
}
