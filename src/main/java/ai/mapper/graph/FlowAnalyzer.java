package ai.mapper.graph;

import ai.mapper.model.Component;
import ai.mapper.model.ComponentKind;
import ai.mapper.model.Criticality;
import ai.mapper.model.CriticalPath;
import ai.mapper.model.Crossroad;
import ai.mapper.model.EdgeKind;
import ai.mapper.model.Fqns;
import ai.mapper.model.IntegrationEdge;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Whole-program synthesis over the collected edges:
 * - crossroads: edge counts between module boundaries
 * - critical paths: callees ranked by distinct callers
 * Output depends only on the edge set, never on iteration order of a hash container.
 */
public final class FlowAnalyzer {

    private static final Comparator<EdgeKind> BY_LABEL = Comparator.comparing(EdgeKind::label);

    private final SymbolRegistry registry;
    private final AnalysisSettings settings;

    public FlowAnalyzer(SymbolRegistry registry, AnalysisSettings settings) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * First {@code boundaryDepth} segments of the module or package that owns {@code fqn}, so a
     * boundary is never finer than a module. Null when no registered component owns the name.
     */
    String boundary(String fqn) {
        String owner = fqn;
        while (owner != null && !registry.contains(owner)) {
            owner = Fqns.parent(owner);
        }
        if (owner == null) {
            return null;
        }
        Component c = registry.component(owner);
        while (c.kind() != ComponentKind.MODULE && c.kind() != ComponentKind.PACKAGE && c.parentId() != null) {
            c = registry.component(c.parentId());
        }
        return Fqns.boundary(c.fqn(), settings.boundaryDepth());
    }

    public List<Crossroad> crossroads(List<IntegrationEdge> edges) {
        final Map<String, Junction> byPair = new TreeMap<>();
        for (IntegrationEdge e : edges) {
            final String targetFqn = e.isResolved() ? registry.fqnOf(e.targetId()) : e.targetName();
            if (targetFqn == null) {
                continue;
            }
            final String from = boundary(registry.fqnOf(e.sourceId()));
            final String to = boundary(targetFqn);
            if (from == null || to == null || from.equals(to) || !registry.contains(to)) {
                continue;
            }
            final String low = from.compareTo(to) < 0 ? from : to;
            final String high = low.equals(from) ? to : from;
            byPair.computeIfAbsent(low + "\n" + high, k -> new Junction(low, high)).add(e.kind());
        }

        final List<Junction> junctions = new ArrayList<>(byPair.values());
        junctions.sort(Comparator.comparingInt((Junction j) -> -j.count)
                .thenComparing(j -> j.low)
                .thenComparing(j -> j.high));

        int max = 0;
        for (Junction j : junctions) {
            max = Math.max(max, j.count);
        }

        final List<Crossroad> out = new ArrayList<>(junctions.size());
        int id = 1;
        for (Junction j : junctions) {
            out.add(new Crossroad(id++, List.of(registry.idOf(j.low), registry.idOf(j.high)), j.count,
                    criticality(j.count, max), new ArrayList<>(j.kinds)));
        }
        return out;
    }

    static Criticality criticality(int count, int max) {
        if (3 * count > 2 * max) {
            return Criticality.HIGH;
        }
        if (3 * count > max) {
            return Criticality.MEDIUM;
        }
        return Criticality.LOW;
    }

    public List<CriticalPath> criticalPaths(CallGraph calls) {
        final List<Integer> ranked = new ArrayList<>(calls.callees());
        ranked.sort(Comparator.comparingInt((Integer id) -> -calls.inDegree(id))
                .thenComparingInt(id -> -calls.callCount(id))
                .thenComparing(registry::fqnOf));

        final List<Integer> chosen;
        if (settings.percentile() != null) {
            final int threshold = percentileOf(ranked, calls, settings.percentile());
            chosen = new ArrayList<>();
            for (Integer id : ranked) {
                if (calls.inDegree(id) >= threshold) {
                    chosen.add(id);
                }
            }
        } else {
            chosen = ranked.subList(0, Math.min(settings.topK(), ranked.size()));
        }

        final List<CriticalPath> out = new ArrayList<>(chosen.size());
        int id = 1;
        for (Integer callee : chosen) {
            final int degree = calls.inDegree(callee);
            out.add(new CriticalPath(id++, callee, degree, calls.callCount(callee), complexity(degree)));
        }
        return out;
    }

    /** Nearest-rank percentile of the in-degrees; 0 keeps everything. */
    private static int percentileOf(List<Integer> callees, CallGraph calls, double percentile) {
        if (callees.isEmpty() || percentile <= 0) {
            return 0;
        }
        final List<Integer> degrees = new ArrayList<>(callees.size());
        for (Integer id : callees) {
            degrees.add(calls.inDegree(id));
        }
        degrees.sort(Comparator.naturalOrder());
        final int rank = (int) Math.ceil(percentile / 100.0 * degrees.size());
        return degrees.get(Math.max(rank, 1) - 1);
    }

    static Criticality complexity(int inDegree) {
        if (inDegree >= 6) {
            return Criticality.HIGH;
        }
        if (inDegree >= 3) {
            return Criticality.MEDIUM;
        }
        return Criticality.LOW;
    }

    private static final class Junction {
        final String low;
        final String high;
        final Set<EdgeKind> kinds = new TreeSet<>(BY_LABEL);
        int count;

        Junction(String low, String high) {
            this.low = low;
            this.high = high;
        }

        void add(EdgeKind kind) {
            count++;
            kinds.add(kind);
        }
    }
}
