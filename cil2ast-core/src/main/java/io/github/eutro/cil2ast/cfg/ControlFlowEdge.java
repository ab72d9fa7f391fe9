package io.github.eutro.cil2ast.cfg;

/**
 * An edge between two blocks. Edges are derived from {@link Control controls} and
 * {@link ProtectedRegion protected regions}, and are not stored.
 */
public final class ControlFlowEdge {
    /**
     * How control reaches the target.
     */
    public enum Kind {
        /**
         * The taken edge of a conditional, or an entry of a jump table.
         */
        BRANCH,
        /**
         * The not-taken edge of a conditional, the default of a jump table,
         * or straight-line flow into the next block.
         */
        FALLTHROUGH,
        /**
         * An unconditional {@code br} or {@code leave}.
         */
        JUMP,
        /**
         * From the entry of a protected region to its handler. Never an ordinary branch.
         */
        EXCEPTION_HANDLER,
    }

    private final BasicBlock source;
    private final BasicBlock target;
    private final Kind kind;

    public ControlFlowEdge(BasicBlock source, BasicBlock target, Kind kind) {
        this.source = source;
        this.target = target;
        this.kind = kind;
    }

    public BasicBlock getSource() {
        return source;
    }

    public BasicBlock getTarget() {
        return target;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return source.getLabel() + " -" + kind + "-> " + target.getLabel();
    }
}
