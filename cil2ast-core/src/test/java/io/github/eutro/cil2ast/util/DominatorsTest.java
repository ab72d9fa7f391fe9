package io.github.eutro.cil2ast.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;

public class DominatorsTest {
    @Test
    void diamond() {
        // 0 -> 1, 2; 1 -> 3; 2 -> 3
        int[][] succ = {{1, 2}, {3}, {3}, {}};
        assertArrayEquals(new int[]{-1, 0, 0, 0}, Dominators.compute(succ, 0));
    }

    @Test
    void loopWithExit() {
        // 0 -> 1; 1 -> 2, 4; 2 -> 3; 3 -> 1; 4
        int[][] succ = {{1}, {2, 4}, {3}, {1}, {}};
        assertArrayEquals(new int[]{-1, 0, 1, 2, 1}, Dominators.compute(succ, 0));
    }

    @Test
    void unreachableNodes() {
        int[][] succ = {{1}, {}, {1}};
        assertArrayEquals(new int[]{-1, 0, -1}, Dominators.compute(succ, 0));
    }

    @Test
    void reversedGraphGivesPostDominators() {
        // the diamond reversed, rooted at its exit
        int[][] pred = {{}, {0}, {0}, {1, 2}};
        assertArrayEquals(new int[]{3, 3, 3, -1}, Dominators.compute(pred, 3));
    }
}
