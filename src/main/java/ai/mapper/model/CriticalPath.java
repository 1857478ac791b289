package ai.mapper.model;

/**
 * High fan-in call target, ranked by distinct callers.
 */
public record CriticalPath(
        int id,
        int entryComponentId,
        int callerCount,
        int callCount,
        Criticality complexity
) {
}
