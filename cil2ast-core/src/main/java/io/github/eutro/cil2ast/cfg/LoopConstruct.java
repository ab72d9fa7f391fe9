package io.github.eutro.cil2ast.cfg;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A natural loop, found from a back-edge to its header.
 */
public final class LoopConstruct {
    /**
     * The shape a loop is emitted as.
     */
    public enum Kind {
        WHILE,
        DO_WHILE,
        FOR,
        /**
         * Enumerator loops. Not produced by this core.
         */
        FOREACH,
    }

    private final BasicBlock header;
    private final Set<BasicBlock> body;
    private final List<BasicBlock> latches;
    @Nullable
    private final BasicBlock breakTarget;
    @Nullable
    private Kind kind;
    @Nullable
    private BasicBlock continueTarget;

    /**
     * Construct a loop.
     *
     * @param header      The header, which dominates the body.
     * @param body        The body, including the header.
     * @param latches     The sources of back-edges, in block order.
     * @param breakTarget The single block control goes to after the loop, or null if the loop never exits normally.
     */
    public LoopConstruct(BasicBlock header, Set<BasicBlock> body, List<BasicBlock> latches, @Nullable BasicBlock breakTarget) {
        this.header = header;
        this.body = Collections.unmodifiableSet(body);
        this.latches = Collections.unmodifiableList(new ArrayList<>(latches));
        this.breakTarget = breakTarget;
    }

    public BasicBlock getHeader() {
        return header;
    }

    public Set<BasicBlock> getBody() {
        return body;
    }

    public List<BasicBlock> getLatches() {
        return latches;
    }

    public @Nullable BasicBlock getBreakTarget() {
        return breakTarget;
    }

    /**
     * Get the shape, once it has been decided.
     *
     * @return The shape, or null.
     */
    public @Nullable Kind getKind() {
        return kind;
    }

    /**
     * Get the block {@code continue} transfers to, once the shape has been decided.
     *
     * @return The continue target, or null.
     */
    public @Nullable BasicBlock getContinueTarget() {
        return continueTarget;
    }

    public void setShape(Kind kind, BasicBlock continueTarget) {
        this.kind = kind;
        this.continueTarget = continueTarget;
    }

    public boolean contains(BasicBlock block) {
        return body.contains(block);
    }

    @Override
    public String toString() {
        return "loop " + header.getLabel() + " (" + body.size() + " blocks)"
                + (breakTarget == null ? "" : " -> " + breakTarget.getLabel());
    }
}
