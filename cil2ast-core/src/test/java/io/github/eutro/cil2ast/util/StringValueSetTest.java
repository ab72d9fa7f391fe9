package io.github.eutro.cil2ast.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StringValueSetTest {
    @Test
    void finiteUnionKeepsOrder() {
        StringValueSet set = StringValueSet.of("b").union(StringValueSet.of("a")).union(StringValueSet.NULL);
        assertEquals(Arrays.asList("b", "a"), new ArrayList<>(set.strings()));
        assertTrue(set.containsNull());
        assertEquals("{null, \"b\", \"a\"}", set.toString());
    }

    @Test
    void complementOfFiniteSet() {
        StringValueSet rest = StringValueSet.of("a").invert();
        assertTrue(rest.isCofinite());
        assertFalse(rest.contains("a"));
        assertTrue(rest.contains("z"));
        assertTrue(rest.containsNull());
        assertThrows(IllegalStateException.class, rest::strings);
        assertEquals("~{\"a\"}", rest.toString());
    }

    @Test
    void exceptRemovesCases() {
        StringValueSet remaining = StringValueSet.UNIVERSE
                .except(StringValueSet.of("x"))
                .except(StringValueSet.NULL);
        assertFalse(remaining.containsNull());
        assertEquals(StringValueSet.of("x").union(StringValueSet.NULL).invert(), remaining);
        assertTrue(StringValueSet.of("x").intersect(remaining).isEmpty());
        assertEquals(StringValueSet.of("y"), StringValueSet.of("y").intersect(remaining));
    }
}
