package ai.mapper.graph;

import ai.mapper.model.EdgeKind;
import ai.mapper.model.IntegrationEdge;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Call-only view of the edge set: resolved call edges, indexed both ways.
 */
public final class CallGraph {

    private final Map<Integer, Set<Integer>> callersByCallee = new TreeMap<>();
    private final Map<Integer, Set<Integer>> calleesByCaller = new TreeMap<>();
    private final Map<Integer, Integer> callCounts = new TreeMap<>();

    public static CallGraph of(List<IntegrationEdge> edges) {
        final CallGraph g = new CallGraph();
        for (IntegrationEdge e : edges) {
            if (e.kind() != EdgeKind.CALL || !e.isResolved()) {
                continue;
            }
            g.callersByCallee.computeIfAbsent(e.targetId(), k -> new TreeSet<>()).add(e.sourceId());
            g.calleesByCaller.computeIfAbsent(e.sourceId(), k -> new TreeSet<>()).add(e.targetId());
            g.callCounts.merge(e.targetId(), 1, Integer::sum);
        }
        return g;
    }

    /** Every component that is called at least once, ascending by id. */
    public Set<Integer> callees() {
        return Collections.unmodifiableSet(callersByCallee.keySet());
    }

    public Set<Integer> callersOf(int callee) {
        return Collections.unmodifiableSet(callersByCallee.getOrDefault(callee, Set.of()));
    }

    public Set<Integer> calleesOf(int caller) {
        return Collections.unmodifiableSet(calleesByCaller.getOrDefault(caller, Set.of()));
    }

    /** Distinct callers. */
    public int inDegree(int callee) {
        return callersOf(callee).size();
    }

    /** Call edges, repeated calls from the same caller included. */
    public int callCount(int callee) {
        return callCounts.getOrDefault(callee, 0);
    }
}
