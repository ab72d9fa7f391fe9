package io.github.eutro.cil2ast.ext;

import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import io.github.eutro.cil2ast.passes.InPlaceIRPass;
import io.github.eutro.cil2ast.passes.meta.ComputeDoms;
import io.github.eutro.cil2ast.passes.meta.ComputeLoops;
import io.github.eutro.cil2ast.passes.meta.ComputePostDoms;
import io.github.eutro.cil2ast.passes.meta.ComputePreds;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Tracks which derived facts about a {@link ControlFlowGraph} still match its current shape.
 * <p>
 * Predecessor lists, dominators and loops are stored as exts on the blocks. Each kind names the
 * kinds it is derived from, so computing a kind brings its inputs up to date first and invalidating
 * a kind also invalidates everything derived from it.
 */
public class MetadataState {
    /**
     * A derived fact about a graph, with the pass that recomputes it.
     */
    public static final class Kind {
        private static int nextBit = 0;

        private final int bit;
        private final String name;
        private final InPlaceIRPass<ControlFlowGraph> computer;
        private final List<Kind> inputs;

        private Kind(String name, InPlaceIRPass<ControlFlowGraph> computer, Kind... inputs) {
            this.bit = 1 << nextBit++;
            this.name = name;
            this.computer = computer;
            this.inputs = Collections.unmodifiableList(Arrays.asList(inputs));
        }

        public List<Kind> getInputs() {
            return inputs;
        }

        private boolean dependsOn(Kind other) {
            for (Kind input : inputs) {
                if (input == other || input.dependsOn(other)) return true;
            }
            return false;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final Kind PREDS = new Kind("PREDS", ComputePreds.INSTANCE);
    public static final Kind DOMS = new Kind("DOMS", ComputeDoms.INSTANCE, PREDS);
    public static final Kind POST_DOMS = new Kind("POST_DOMS", ComputePostDoms.INSTANCE, PREDS);
    public static final Kind LOOPS = new Kind("LOOPS", ComputeLoops.INSTANCE, PREDS, DOMS);

    private static final List<Kind> ALL = Collections.unmodifiableList(Arrays.asList(PREDS, DOMS, POST_DOMS, LOOPS));

    private int valid = 0;

    public boolean isValid(Kind kind) {
        return (valid & kind.bit) != 0;
    }

    /**
     * Recompute whichever of the given kinds are stale, along with any stale inputs they need.
     *
     * @param graph The graph this state belongs to.
     * @param kinds The kinds the caller is about to read.
     */
    public void ensureValid(ControlFlowGraph graph, Kind... kinds) {
        for (Kind kind : kinds) {
            if (isValid(kind)) continue;
            ensureValid(graph, kind.inputs.toArray(new Kind[0]));
            kind.computer.runInPlace(graph);
            validate(kind);
        }
    }

    /**
     * Mark kinds as up to date. Called by the passes that compute them.
     *
     * @param kinds The kinds.
     */
    public void validate(Kind... kinds) {
        for (Kind kind : kinds) {
            valid |= kind.bit;
        }
    }

    /**
     * Mark kinds, and every kind derived from them, as stale.
     *
     * @param kinds The kinds.
     */
    public void invalidate(Kind... kinds) {
        for (Kind kind : kinds) {
            valid &= ~kind.bit;
            for (Kind other : ALL) {
                if (other.dependsOn(kind)) valid &= ~other.bit;
            }
        }
    }

    /**
     * Called after blocks or edges are added, removed or retargeted.
     */
    public void graphChanged() {
        invalidate(PREDS);
    }
}
