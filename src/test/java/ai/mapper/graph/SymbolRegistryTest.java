package ai.mapper.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.mapper.model.Component;
import ai.mapper.model.ComponentKind;
import ai.mapper.model.IntegrationEdge;
import ai.mapper.model.InvalidIdentifierException;
import ai.mapper.model.SourceSpan;
import java.util.List;
import org.junit.jupiter.api.Test;

final class SymbolRegistryTest {

    private static Declaration module(String fqn, String path) {
        return new Declaration(fqn, fqn.substring(fqn.lastIndexOf('.') + 1), ComponentKind.MODULE,
                fqn.contains(".") ? fqn.substring(0, fqn.lastIndexOf('.')) : null, path,
                SourceSpan.synthetic(), List.of(), List.of(), null);
    }

    private static Declaration function(String parent, String name, int from, int to, String path) {
        return new Declaration(parent + "." + name, name, ComponentKind.FUNCTION, parent, path,
                new SourceSpan(from, to), List.of(), List.of(), null);
    }

    @Test
    void idsStartAtOneAndAreIdempotent() {
        final SymbolRegistry registry = new SymbolRegistry();
        final int first = registry.internId("app");
        final int second = registry.internId("app.mod");

        assertEquals(1, first);
        assertEquals(2, second);
        assertEquals(first, registry.internId("app"));
        assertEquals("app.mod", registry.fqnOf(second));
        assertEquals(second, registry.idOf("app.mod"));
        assertEquals(SymbolRegistry.UNRESOLVED_FQN, registry.fqnOf(IntegrationEdge.UNRESOLVED));
        assertEquals(IntegrationEdge.UNRESOLVED, registry.idOf("never.seen"));
    }

    @Test
    void rejectsMalformedNames() {
        final SymbolRegistry registry = new SymbolRegistry();
        assertThrows(InvalidIdentifierException.class, () -> registry.internId("app..mod"));
        assertThrows(InvalidIdentifierException.class, () -> registry.internId(""));
        assertThrows(InvalidIdentifierException.class, () -> registry.internId("app."));
        assertThrows(IllegalArgumentException.class, () -> registry.fqnOf(99));
    }

    @Test
    void refusesWritesOnceFrozen() {
        final SymbolRegistry registry = new SymbolRegistry();
        registry.define(module("tool", "tool.py"));
        registry.freeze();

        assertTrue(registry.isFrozen());
        assertThrows(IllegalStateException.class, () -> registry.internId("other"));
        assertThrows(IllegalStateException.class, () -> registry.define(module("other", "other.py")));
    }

    @Test
    void childrenAreOnlyQueryableAfterFreeze() {
        final SymbolRegistry registry = new SymbolRegistry();
        registry.define(module("tool", "tool.py"));
        assertThrows(IllegalStateException.class, () -> registry.childrenOf(1));
    }

    @Test
    void definesContainmentAndOrdersChildrenByName() {
        final SymbolRegistry registry = new SymbolRegistry();
        registry.ensurePackage("app", "app");
        registry.define(module("app.mod", "app/mod.py"));
        registry.define(function("app.mod", "zeta", 5, 6, "app/mod.py"));
        registry.define(function("app.mod", "alpha", 1, 2, "app/mod.py"));
        registry.freeze();

        final Component mod = registry.component("app.mod");
        assertEquals(registry.idOf("app"), mod.parentId());
        assertEquals(List.of(registry.idOf("app.mod.alpha"), registry.idOf("app.mod.zeta")),
                registry.childrenOf(mod.id()));
        assertEquals(1, registry.roots().size());
        assertEquals(ComponentKind.PACKAGE, registry.roots().get(0).kind());
        assertEquals(4, registry.size());
    }

    @Test
    void requiresTheParentToBeRegisteredFirst() {
        final SymbolRegistry registry = new SymbolRegistry();
        assertThrows(IllegalStateException.class,
                () -> registry.define(function("ghost", "fn", 1, 1, "ghost.py")));
        assertThrows(IllegalArgumentException.class, () -> registry.define(new Declaration("a.b", "b",
                ComponentKind.FUNCTION, "x", "a.py", SourceSpan.synthetic(), List.of(), List.of(), null)));
    }

    @Test
    void redefinitionKeepsIdAndLatestSpanWithHistory() {
        final SymbolRegistry registry = new SymbolRegistry();
        registry.define(module("mod", "mod.py"));
        final Component first = registry.define(function("mod", "handler", 3, 4, "mod.py"));
        final Component second = registry.define(function("mod", "handler", 10, 12, "mod.py"));

        assertEquals(first.id(), second.id());
        assertEquals(new SourceSpan(10, 12), registry.component("mod.handler").span());
        assertEquals(List.of("redefined at line 10 (previous lines 3-4)"), second.history());
    }

    @Test
    void ensurePackageCreatesEveryLevelOnce() {
        final SymbolRegistry registry = new SymbolRegistry();
        registry.ensurePackage("app.sub.inner", "app/sub/inner");
        registry.ensurePackage("app.sub", "app/sub");

        assertEquals(3, registry.size());
        assertEquals(ComponentKind.PACKAGE, registry.component("app.sub").kind());
        assertTrue(registry.component("app.sub.inner").history().isEmpty());
        assertTrue(registry.contains("app"));
        assertFalse(registry.contains("app.other"));
        assertNull(registry.component("app.other"));
    }
}
