package io.github.eutro.cil2ast.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LongSetTest {
    @Test
    void unionMergesAdjacentIntervals() {
        LongSet set = LongSet.of(1).union(LongSet.range(3, 4)).union(LongSet.of(5));
        assertEquals("{1, [3..5]}", set.toString());
        assertEquals(2, set.intervalCount());
        assertEquals(4, set.count());
        assertEquals(Arrays.asList(1L, 3L, 4L, 5L), set.values());
        assertEquals(LongSet.range(1, 5), set.union(LongSet.of(2)));
    }

    @Test
    void invertTwiceIsIdentity() {
        LongSet set = LongSet.of(0).union(LongSet.range(10, 20));
        LongSet inverted = set.invert();
        assertFalse(inverted.contains(0));
        assertTrue(inverted.contains(5));
        assertTrue(inverted.contains(Long.MIN_VALUE));
        assertTrue(inverted.contains(Long.MAX_VALUE));
        assertEquals(set, inverted.invert());
        assertTrue(LongSet.EMPTY.invert().isUniverse());
        assertTrue(LongSet.UNIVERSE.invert().isEmpty());
    }

    @Test
    void exceptAndIntersect() {
        LongSet set = LongSet.range(0, 9).except(LongSet.range(3, 5));
        assertEquals("{[0..2], [6..9]}", set.toString());
        assertEquals(LongSet.range(6, 7), set.intersect(LongSet.range(5, 7)));
        assertTrue(set.intersect(LongSet.range(3, 5)).isEmpty());
    }

    @Test
    void countSaturates() {
        assertEquals(Long.MAX_VALUE, LongSet.UNIVERSE.count());
        assertEquals(Long.MAX_VALUE, LongSet.atLeast(0).count());
        assertThrows(IllegalStateException.class, () -> LongSet.atLeast(0).values());
    }

    @Test
    void shiftDropsOverflow() {
        assertEquals(LongSet.range(5, 7), LongSet.range(0, 2).shift(5));
        assertEquals(LongSet.of(Long.MAX_VALUE), LongSet.range(Long.MAX_VALUE - 1, Long.MAX_VALUE).shift(1));
        assertTrue(LongSet.of(Long.MIN_VALUE).shift(-1).isEmpty());
    }
}
