package ai.mapper.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.mapper.model.AttributePayload;
import ai.mapper.model.CallPayload;
import ai.mapper.model.ComponentKind;
import ai.mapper.model.CriticalPath;
import ai.mapper.model.Criticality;
import ai.mapper.model.Crossroad;
import ai.mapper.model.EdgeKind;
import ai.mapper.model.ImportPayload;
import ai.mapper.model.IntegrationEdge;
import ai.mapper.model.Resolution;
import ai.mapper.model.SourceSpan;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class FlowAnalyzerTest {

    private SymbolRegistry registry;
    private List<IntegrationEdge> edges;

    @BeforeEach
    void setUp() {
        registry = new SymbolRegistry();
        registry.ensurePackage("app", "app");
        registry.ensurePackage("lib", "lib");
        module("app.a");
        module("app.b");
        module("lib.core");
        function("app.a.f1");
        function("app.a.f2");
        function("app.b.g");
        function("lib.core.h");
        registry.freeze();

        edges = List.of(
                call("app.a.f1", "app.b.g", 3),
                call("app.a.f2", "app.b.g", 7),
                call("app.a.f1", "lib.core.h", 4),
                call("app.a.f1", "app.a.f2", 5),
                new IntegrationEdge(id("app.b"), id("app.a"), EdgeKind.IMPORT, 1, "app.a", Resolution.RESOLVED,
                        new ImportPayload("app.a", List.of(), false, null, null, 0, null, null)),
                new IntegrationEdge(id("app.b.g"), id("lib.core.h"), EdgeKind.ATTR_READ, 9, "lib.core.h",
                        Resolution.RESOLVED, new AttributePayload("h", "core.h", "lib.core", 1)),
                new IntegrationEdge(id("app.b.g"), IntegrationEdge.UNRESOLVED, EdgeKind.CALL, 10, "zzz.nothing",
                        Resolution.UNKNOWN, new CallPayload("nothing", List.of(), false, null, null, 0)));
    }

    private void module(String fqn) {
        registry.define(new Declaration(fqn, fqn.substring(fqn.indexOf('.') + 1), ComponentKind.MODULE,
                fqn.substring(0, fqn.indexOf('.')), fqn.replace('.', '/') + ".py", SourceSpan.synthetic(),
                List.of(), List.of(), null));
    }

    private void function(String fqn) {
        final int dot = fqn.lastIndexOf('.');
        registry.define(new Declaration(fqn, fqn.substring(dot + 1), ComponentKind.FUNCTION, fqn.substring(0, dot),
                "x.py", SourceSpan.line(1), List.of(), List.of(), null));
    }

    private int id(String fqn) {
        return registry.idOf(fqn);
    }

    private IntegrationEdge call(String from, String to, int line) {
        return new IntegrationEdge(id(from), id(to), EdgeKind.CALL, line, to, Resolution.RESOLVED,
                new CallPayload(to, List.of(), false, null, null, 0));
    }

    private static AnalysisSettings settings(int topK, Double percentile) {
        return new AnalysisSettings(2, topK, percentile, 1);
    }

    @Test
    void aggregatesBoundaryCrossingsIntoCrossroads() {
        final List<Crossroad> crossroads = new FlowAnalyzer(registry, settings(5, null)).crossroads(edges);

        assertEquals(3, crossroads.size());
        final Crossroad busiest = crossroads.get(0);
        assertEquals(1, busiest.id());
        assertEquals(List.of(id("app.a"), id("app.b")), busiest.componentIds());
        assertEquals(3, busiest.edgeCount());
        assertEquals(Criticality.HIGH, busiest.criticality());
        assertEquals(List.of(EdgeKind.CALL, EdgeKind.IMPORT), busiest.interactionKinds());

        assertEquals(List.of(id("app.a"), id("lib.core")), crossroads.get(1).componentIds());
        assertEquals(List.of(id("app.b"), id("lib.core")), crossroads.get(2).componentIds());
        assertEquals(Criticality.LOW, crossroads.get(2).criticality());
        assertEquals(List.of(EdgeKind.ATTR_READ), crossroads.get(2).interactionKinds());
    }

    @Test
    void crossroadsDoNotDependOnEdgeOrder() {
        final FlowAnalyzer analyzer = new FlowAnalyzer(registry, settings(5, null));
        final List<IntegrationEdge> shuffled = new ArrayList<>(edges);
        Collections.reverse(shuffled);
        assertEquals(analyzer.crossroads(edges), analyzer.crossroads(shuffled));
    }

    @Test
    void coarserBoundaryMergesModules() {
        final List<Crossroad> crossroads = new FlowAnalyzer(registry, new AnalysisSettings(1, 5, null, 1))
                .crossroads(edges);
        assertEquals(1, crossroads.size());
        assertEquals(List.of(id("app"), id("lib")), crossroads.get(0).componentIds());
        assertEquals(2, crossroads.get(0).edgeCount());
    }

    @Test
    void ranksCriticalPathsByDistinctCallers() {
        final List<CriticalPath> paths = new FlowAnalyzer(registry, settings(2, null))
                .criticalPaths(CallGraph.of(edges));

        assertEquals(2, paths.size());
        assertEquals(id("app.b.g"), paths.get(0).entryComponentId());
        assertEquals(2, paths.get(0).callerCount());
        assertEquals(2, paths.get(0).callCount());
        assertEquals(Criticality.LOW, paths.get(0).complexity());
        // tie on callers and calls: ordered by name
        assertEquals(id("app.a.f2"), paths.get(1).entryComponentId());
        assertEquals(2, paths.get(1).id());
    }

    @Test
    void percentileReplacesTopK() {
        final CallGraph calls = CallGraph.of(edges);
        assertEquals(3, new FlowAnalyzer(registry, settings(1, 50.0)).criticalPaths(calls).size());
        final List<CriticalPath> top = new FlowAnalyzer(registry, settings(1, 100.0)).criticalPaths(calls);
        assertEquals(1, top.size());
        assertEquals(id("app.b.g"), top.get(0).entryComponentId());
    }

    @Test
    void callGraphIgnoresUnresolvedAndNonCallEdges() {
        final CallGraph calls = CallGraph.of(edges);
        assertEquals(3, calls.callees().size());
        assertTrue(calls.calleesOf(id("app.b.g")).isEmpty());
        assertEquals(3, calls.calleesOf(id("app.a.f1")).size());
        assertEquals(0, calls.inDegree(id("app.a")));
    }

    @Test
    void emptyEdgeSetGivesEmptyResults() {
        final FlowAnalyzer analyzer = new FlowAnalyzer(registry, settings(5, 90.0));
        assertTrue(analyzer.crossroads(List.of()).isEmpty());
        assertTrue(analyzer.criticalPaths(CallGraph.of(List.of())).isEmpty());
    }

    @Test
    void thresholdsAreRelativeToTheBusiestCrossroad() {
        assertEquals(Criticality.HIGH, FlowAnalyzer.criticality(10, 10));
        assertEquals(Criticality.MEDIUM, FlowAnalyzer.criticality(5, 10));
        assertEquals(Criticality.LOW, FlowAnalyzer.criticality(3, 10));
        assertEquals(Criticality.HIGH, FlowAnalyzer.complexity(6));
        assertEquals(Criticality.MEDIUM, FlowAnalyzer.complexity(3));
        assertEquals(Criticality.LOW, FlowAnalyzer.complexity(2));
    }

    @Test
    void callsInsideOneRootModuleAreNotCrossroads() {
        final SymbolRegistry single = new SymbolRegistry();
        single.define(new Declaration("main", "main", ComponentKind.MODULE, null, "main.py", SourceSpan.synthetic(),
                List.of(), List.of(), null));
        single.define(new Declaration("main.helper", "helper", ComponentKind.FUNCTION, "main", "main.py",
                SourceSpan.line(1), List.of(), List.of(), null));
        single.define(new Declaration("main.run", "run", ComponentKind.FUNCTION, "main", "main.py",
                SourceSpan.line(4), List.of(), List.of(), null));
        single.freeze();
        final IntegrationEdge call = new IntegrationEdge(single.idOf("main.run"), single.idOf("main.helper"),
                EdgeKind.CALL, 5, "main.helper", Resolution.RESOLVED,
                new CallPayload("helper", List.of(), false, null, null, 0));

        assertTrue(new FlowAnalyzer(single, settings(5, null)).crossroads(List.of(call)).isEmpty());
    }

    @Test
    void deepBoundariesStopAtTheModule() {
        final FlowAnalyzer analyzer = new FlowAnalyzer(registry, new AnalysisSettings(4, 5, null, 1));
        assertEquals("app.a", analyzer.boundary("app.a.f1"));
        assertEquals("app", analyzer.boundary("app"));
        assertEquals("lib.core", analyzer.boundary("lib.core.h.missing"));

        assertEquals(new FlowAnalyzer(registry, settings(5, null)).crossroads(edges), analyzer.crossroads(edges));
    }

    @Test
    void settingsAreValidated() {
        assertThrows(IllegalArgumentException.class, () -> new AnalysisSettings(0, 5, null, 1));
        assertThrows(IllegalArgumentException.class, () -> new AnalysisSettings(2, -1, null, 1));
        assertThrows(IllegalArgumentException.class, () -> new AnalysisSettings(2, 5, 101.0, 1));
        assertThrows(IllegalArgumentException.class, () -> new AnalysisSettings(2, 5, null, 0));
    }
}
