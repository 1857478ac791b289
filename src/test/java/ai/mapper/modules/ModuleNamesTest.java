package ai.mapper.modules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.mapper.model.InvalidIdentifierException;
import ai.mapper.modules.ModuleNames.ModuleName;
import java.util.List;
import org.junit.jupiter.api.Test;

final class ModuleNamesTest {

    @Test
    void plainModuleTakesItsDottedPath() {
        final ModuleName m = ModuleNames.of("app/sub/mod.py");
        assertEquals("app.sub.mod", m.fqn());
        assertFalse(m.packageInit());
        assertEquals(List.of("app", "app.sub"), m.packages());
    }

    @Test
    void packageInitTakesThePackageName() {
        final ModuleName m = ModuleNames.of("app/sub/__init__.py");
        assertEquals("app.sub", m.fqn());
        assertTrue(m.packageInit());
        assertEquals(List.of("app", "app.sub"), m.packages());
    }

    @Test
    void topLevelModuleHasNoPackages() {
        final ModuleName m = ModuleNames.of("script.py");
        assertEquals("script", m.fqn());
        assertTrue(m.packages().isEmpty());
    }

    @Test
    void rejectsPathsThatAreNotModules() {
        assertThrows(InvalidIdentifierException.class, () -> ModuleNames.of("README.md"));
        assertThrows(InvalidIdentifierException.class, () -> ModuleNames.of("__init__.py"));
        assertThrows(InvalidIdentifierException.class, () -> ModuleNames.of("my-app/mod.py"));
        assertThrows(InvalidIdentifierException.class, () -> ModuleNames.of("app/2fast.py"));
    }

    @Test
    void resolvesRelativeImportsFromModules() {
        final ModuleName m = ModuleNames.of("app/sub/mod.py");
        assertEquals("app.sub", ModuleNames.resolveRelative(m, 1, null));
        assertEquals("app.sub.sibling", ModuleNames.resolveRelative(m, 1, "sibling"));
        assertEquals("app.utils", ModuleNames.resolveRelative(m, 2, "utils"));
        assertNull(ModuleNames.resolveRelative(m, 3, "utils"));
    }

    @Test
    void resolvesRelativeImportsFromPackageInit() {
        final ModuleName init = ModuleNames.of("app/sub/__init__.py");
        assertEquals("app.sub.mod", ModuleNames.resolveRelative(init, 1, "mod"));
        assertEquals("app.utils", ModuleNames.resolveRelative(init, 2, "utils"));
    }
}
