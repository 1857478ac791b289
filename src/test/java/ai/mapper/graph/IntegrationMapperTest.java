package ai.mapper.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.mapper.model.CallPayload;
import ai.mapper.model.ComponentKind;
import ai.mapper.model.Crossroad;
import ai.mapper.model.EdgeKind;
import ai.mapper.model.FileError;
import ai.mapper.model.ImportPayload;
import ai.mapper.model.IntegrationEdge;
import ai.mapper.scan.SourceFile;
import ai.mapper.syntax.PythonParser;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

final class IntegrationMapperTest {

    private static final List<SourceFile> SCENARIO = List.of(
            new SourceFile("pkg/b.py", "from pkg.a import foo\nx = foo()\n"),
            new SourceFile("pkg/a.py", "def foo():\n    return 1\n"));

    private static AnalysisResult analyze(List<SourceFile> files, int threads) throws InterruptedException {
        return new IntegrationMapper(new PythonParser(), new AnalysisSettings(2, 5, null, threads)).analyze(files);
    }

    private static List<IntegrationEdge> ofKind(AnalysisResult result, EdgeKind kind) {
        final List<IntegrationEdge> out = new ArrayList<>();
        for (IntegrationEdge e : result.edges()) {
            if (e.kind() == kind) {
                out.add(e);
            }
        }
        return out;
    }

    @Test
    void mapsImportAndCallAcrossModules() throws InterruptedException {
        final AnalysisResult result = analyze(SCENARIO, 2);
        final SymbolRegistry registry = result.registry();

        assertEquals(ComponentKind.MODULE, registry.component("pkg.a").kind());
        assertEquals(ComponentKind.FUNCTION, registry.component("pkg.a.foo").kind());
        assertEquals(ComponentKind.MODULE, registry.component("pkg.b").kind());
        assertEquals(2, result.filesTotal());
        assertEquals(2, result.filesAnalyzed());
        assertTrue(result.errors().isEmpty());

        final List<IntegrationEdge> imports = ofKind(result, EdgeKind.IMPORT);
        assertEquals(1, imports.size());
        assertEquals("pkg.b", registry.fqnOf(imports.get(0).sourceId()));
        assertEquals("pkg.a.foo", registry.fqnOf(imports.get(0).targetId()));
        assertEquals(List.of("foo"), ((ImportPayload) imports.get(0).payload()).items());

        final List<IntegrationEdge> calls = ofKind(result, EdgeKind.CALL);
        assertEquals(1, calls.size());
        assertEquals("pkg.b", registry.fqnOf(calls.get(0).sourceId()));
        assertEquals("pkg.a.foo", registry.fqnOf(calls.get(0).targetId()));
        final CallPayload call = (CallPayload) calls.get(0).payload();
        assertTrue(call.returnCaptured());
        assertEquals("x", call.returnVar());

        assertEquals(1, result.crossroads().size());
        final Crossroad crossroad = result.crossroads().get(0);
        assertEquals(List.of(registry.idOf("pkg.a"), registry.idOf("pkg.b")), crossroad.componentIds());
        assertEquals(2, crossroad.edgeCount());

        assertEquals(1, result.criticalPaths().size());
        assertEquals(registry.idOf("pkg.a.foo"), result.criticalPaths().get(0).entryComponentId());
    }

    @Test
    void singleRootModuleHasNoCrossroads() throws InterruptedException {
        final AnalysisResult result = analyze(List.of(new SourceFile("main.py",
                "def helper():\n    return 1\n\n\ndef run():\n    return helper()\n")), 1);

        assertEquals(1, ofKind(result, EdgeKind.CALL).size());
        assertTrue(result.crossroads().isEmpty());
        assertEquals("main.helper", result.registry().fqnOf(result.criticalPaths().get(0).entryComponentId()));
    }

    @Test
    void parseErrorLeavesOtherFilesAnalysed() throws InterruptedException {
        final List<SourceFile> files = new ArrayList<>(SCENARIO);
        files.add(new SourceFile("pkg/broken.py", "def broken(:\n    pass\n"));

        final AnalysisResult result = analyze(files, 2);

        assertEquals(3, result.filesTotal());
        assertEquals(2, result.filesAnalyzed());
        assertEquals(1, result.filesFailed());
        assertEquals(1, result.errors().size());
        final FileError error = result.errors().get(0);
        assertEquals("pkg/broken.py", error.path());
        assertEquals(1, error.line());
        assertFalse(result.registry().contains("pkg.broken"));
        assertEquals(1, result.crossroads().size());
    }

    @Test
    void invalidModuleNameIsReportedNotFatal() throws InterruptedException {
        final List<SourceFile> files = new ArrayList<>(SCENARIO);
        files.add(new SourceFile("pkg/bad-name.py", "y = 1\n"));

        final AnalysisResult result = analyze(files, 1);

        assertEquals(1, result.errors().size());
        assertEquals("pkg/bad-name.py", result.errors().get(0).path());
        assertEquals(0, result.errors().get(0).line());
        assertNotNull(result.registry().component("pkg.a.foo"));
    }

    @Test
    void readErrorsCountTowardsTheTotal() throws InterruptedException {
        final AnalysisResult result = new IntegrationMapper(new PythonParser(), new AnalysisSettings(2, 5, null, 1))
                .analyze(SCENARIO, List.of(new FileError("pkg/locked.py", 0, "unreadable: denied")));

        assertEquals(3, result.filesTotal());
        assertEquals(2, result.filesAnalyzed());
        assertEquals("pkg/locked.py", result.errors().get(0).path());
    }

    @Test
    void emptyInputGivesEmptyResult() throws InterruptedException {
        final AnalysisResult result = analyze(List.of(), 1);
        assertEquals(0, result.registry().size());
        assertTrue(result.edges().isEmpty());
        assertTrue(result.crossroads().isEmpty());
        assertTrue(result.criticalPaths().isEmpty());
    }

    @Test
    void resultDoesNotDependOnThreadCount() throws InterruptedException {
        final List<SourceFile> files = new ArrayList<>(SCENARIO);
        files.add(new SourceFile("lib/__init__.py", ""));
        files.add(new SourceFile("lib/core.py", String.join("\n",
                "from pkg.a import foo",
                "from pkg import b",
                "",
                "class Engine:",
                "    def start(self):",
                "        self.state = foo()",
                "        return b.x",
                "")));
        files.add(new SourceFile("app.py", String.join("\n",
                "from lib.core import Engine",
                "import pkg.a",
                "",
                "def main():",
                "    Engine().start()",
                "    pkg.a.foo()",
                "")));

        final AnalysisResult single = analyze(files, 1);
        final AnalysisResult parallel = analyze(files, 4);

        assertTrue(single.errors().isEmpty());
        assertEquals(single.registry().size(), parallel.registry().size());
        assertEquals(single.edges(), parallel.edges());
        assertEquals(single.crossroads(), parallel.crossroads());
        assertEquals(single.criticalPaths(), parallel.criticalPaths());
    }
}
