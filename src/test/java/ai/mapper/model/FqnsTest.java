package ai.mapper.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class FqnsTest {

    @Test
    void splitsDottedNames() {
        assertEquals("c", Fqns.simpleName("a.b.c"));
        assertEquals("a.b", Fqns.parent("a.b.c"));
        assertNull(Fqns.parent("a"));
        assertEquals("a.b", Fqns.child("a", "b"));
        assertEquals("b", Fqns.child(null, "b"));
    }

    @Test
    void boundaryKeepsLeadingSegments() {
        assertEquals("app.utils", Fqns.boundary("app.utils.helper", 2));
        assertEquals("app", Fqns.boundary("app.utils.helper", 1));
        assertEquals("app", Fqns.boundary("app", 3));
        assertThrows(IllegalArgumentException.class, () -> Fqns.boundary("app", 0));
    }

    @Test
    void reportsMalformedNames() {
        assertNull(Fqns.problem("app.mod.Cls"));
        assertNotNull(Fqns.problem(""));
        assertNotNull(Fqns.problem(".app"));
        assertNotNull(Fqns.problem("app."));
        assertNotNull(Fqns.problem("app..mod"));
        assertNotNull(Fqns.problem("app.my mod"));
        assertNotNull(Fqns.problem(null));
    }

    @Test
    void recognisesIdentifiers() {
        assertTrue(Fqns.isIdentifier("_private"));
        assertTrue(Fqns.isIdentifier("mod2"));
        assertFalse(Fqns.isIdentifier("2mod"));
        assertFalse(Fqns.isIdentifier("my-mod"));
        assertFalse(Fqns.isIdentifier(""));
    }
}
