package ai.mapper.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.mapper.model.Component;
import ai.mapper.model.ComponentKind;
import ai.mapper.model.InvalidIdentifierException;
import ai.mapper.model.SourceSpan;
import ai.mapper.syntax.ParseException;
import ai.mapper.syntax.PythonParser;
import java.util.List;
import org.junit.jupiter.api.Test;

final class HierarchyBuilderTest {

    private final PythonParser parser = new PythonParser();
    private final HierarchyBuilder builder = new HierarchyBuilder();

    private FileHierarchy build(String path, String... lines) throws ParseException {
        return builder.build(path, parser.parse(String.join("\n", lines) + "\n"));
    }

    private static SymbolRegistry registryOf(FileHierarchy... files) {
        final SymbolRegistry registry = new SymbolRegistry();
        for (FileHierarchy f : files) {
            HierarchyBuilder.register(f, registry);
        }
        registry.freeze();
        return registry;
    }

    @Test
    void assignsLexicalNamesToNestedDefinitions() throws ParseException {
        final SymbolRegistry registry = registryOf(build("app/service.py",
                "\"\"\"Service module.\"\"\"",
                "LIMIT = 10",
                "",
                "class Service(Base):",
                "    retries = 3",
                "",
                "    def __init__(self, client):",
                "        self.client = client",
                "        self.client = None",
                "",
                "    def run(self):",
                "        def step():",
                "            local = 1",
                "        return step",
                "",
                "def helper(x, *rest):",
                "    return x"));

        assertEquals(ComponentKind.PACKAGE, registry.component("app").kind());
        final Component module = registry.component("app.service");
        assertEquals(ComponentKind.MODULE, module.kind());
        assertEquals("Service module.", module.docstring());
        assertEquals(SourceSpan.synthetic(), module.span());

        assertEquals(ComponentKind.ATTRIBUTE, registry.component("app.service.LIMIT").kind());
        final Component service = registry.component("app.service.Service");
        assertEquals(ComponentKind.CLASS, service.kind());
        assertEquals(List.of("Base"), service.declaredBases());
        assertEquals(new SourceSpan(4, 14), service.span());

        assertEquals(ComponentKind.ATTRIBUTE, registry.component("app.service.Service.retries").kind());
        assertEquals(ComponentKind.METHOD, registry.component("app.service.Service.__init__").kind());
        assertEquals(List.of("self", "client"), registry.component("app.service.Service.__init__").parameters());

        final Component client = registry.component("app.service.Service.client");
        assertEquals(ComponentKind.ATTRIBUTE, client.kind());
        assertEquals(SourceSpan.line(8), client.span());

        assertEquals(ComponentKind.FUNCTION, registry.component("app.service.Service.run.step").kind());
        assertNull(registry.component("app.service.Service.run.step.local"));
        assertEquals(List.of("x", "*rest"), registry.component("app.service.helper").parameters());
        assertEquals(ComponentKind.FUNCTION, registry.component("app.service.helper").kind());
    }

    @Test
    void packageInitTakesThePackageName() throws ParseException {
        final SymbolRegistry registry = registryOf(build("app/sub/__init__.py",
                "\"\"\"The sub package.\"\"\"",
                "def api():",
                "    pass"));

        final Component sub = registry.component("app.sub");
        assertEquals(ComponentKind.PACKAGE, sub.kind());
        assertEquals("app/sub/__init__.py", sub.path());
        assertEquals("The sub package.", sub.docstring());
        assertTrue(sub.history().isEmpty());
        assertEquals(registry.idOf("app.sub"), registry.component("app.sub.api").parentId());
    }

    @Test
    void redefinitionKeepsTheLatestSpan() throws ParseException {
        final SymbolRegistry registry = registryOf(build("mod.py",
                "def handler():",
                "    return 1",
                "",
                "def handler(event):",
                "    return event"));

        final Component handler = registry.component("mod.handler");
        assertEquals(new SourceSpan(4, 5), handler.span());
        assertEquals(List.of("event"), handler.parameters());
        assertEquals(List.of("redefined at line 4 (previous lines 1-2)"), handler.history());
    }

    @Test
    void staticMethodsHaveNoReceiver() throws ParseException {
        final SymbolRegistry registry = registryOf(build("mod.py",
                "class Box:",
                "    @staticmethod",
                "    def make(value):",
                "        value.size = 1",
                "",
                "    def fill(this):",
                "        this.content = []"));

        assertNull(registry.component("mod.Box.size"));
        assertEquals(ComponentKind.ATTRIBUTE, registry.component("mod.Box.content").kind());
    }

    @Test
    void definitionsInsideBlocksBelongToTheEnclosingScope() throws ParseException {
        final SymbolRegistry registry = registryOf(build("mod.py",
                "try:",
                "    import fast as impl",
                "except ImportError:",
                "    def impl():",
                "        pass",
                "if DEBUG:",
                "    level = 10"));

        assertEquals(ComponentKind.FUNCTION, registry.component("mod.impl").kind());
        assertEquals(ComponentKind.ATTRIBUTE, registry.component("mod.level").kind());
    }

    @Test
    void rejectsFilesWithoutAValidModuleName() throws ParseException {
        final var syntax = parser.parse("x = 1\n");
        assertThrows(InvalidIdentifierException.class, () -> builder.build("bad-name.py", syntax));
    }
}
