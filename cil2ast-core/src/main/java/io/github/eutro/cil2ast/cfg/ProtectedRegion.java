package io.github.eutro.cil2ast.cfg;

import io.github.eutro.cil2ast.api.ExceptionRegion;
import io.github.eutro.cil2ast.api.TypeRef;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An exception region, mapped onto the blocks of a graph.
 */
public final class ProtectedRegion {
    private final ExceptionRegion region;
    private final BasicBlock tryEntry;
    private final Set<BasicBlock> tryBlocks = new LinkedHashSet<>();
    private final BasicBlock handlerEntry;
    private final Set<BasicBlock> handlerBlocks = new LinkedHashSet<>();
    @Nullable
    private final String exceptionVariable;

    public ProtectedRegion(ExceptionRegion region,
                           BasicBlock tryEntry,
                           BasicBlock handlerEntry,
                           @Nullable String exceptionVariable) {
        this.region = region;
        this.tryEntry = tryEntry;
        this.handlerEntry = handlerEntry;
        this.exceptionVariable = exceptionVariable;
    }

    public ExceptionRegion getRegion() {
        return region;
    }

    public ExceptionRegion.Kind getKind() {
        return region.getKind();
    }

    public @Nullable TypeRef getCatchType() {
        return region.getCatchType();
    }

    public BasicBlock getTryEntry() {
        return tryEntry;
    }

    /**
     * Get the blocks of the protected range, including the entry. Mutable while the graph is built.
     *
     * @return The blocks.
     */
    public Set<BasicBlock> getTryBlocks() {
        return tryBlocks;
    }

    public BasicBlock getHandlerEntry() {
        return handlerEntry;
    }

    public Set<BasicBlock> getHandlerBlocks() {
        return handlerBlocks;
    }

    /**
     * Get the name of the variable the caught exception is stored in, for catch handlers.
     *
     * @return The name, or null.
     */
    public @Nullable String getExceptionVariable() {
        return exceptionVariable;
    }

    /**
     * Whether this region lies within another, so must be structured inside it.
     *
     * @param other The other region.
     * @return Whether this is nested in {@code other}.
     */
    public boolean isNestedIn(ProtectedRegion other) {
        ExceptionRegion o = other.region;
        int start = region.getTryStart();
        int end = Math.max(region.getTryEnd(), region.getHandlerEnd());
        int oStart = o.getTryStart();
        int oEnd = Math.max(o.getTryEnd(), o.getHandlerEnd());
        return this != other && oStart <= start && end <= oEnd;
    }

    @Override
    public String toString() {
        return region + " try " + tryEntry.getLabel() + " handler " + handlerEntry.getLabel();
    }
}
