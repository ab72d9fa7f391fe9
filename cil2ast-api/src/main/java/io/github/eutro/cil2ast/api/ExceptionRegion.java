package io.github.eutro.cil2ast.api;

import org.jetbrains.annotations.Nullable;

/**
 * An exception handling clause of a method body. All ranges are half-open IL offset ranges.
 */
public final class ExceptionRegion {
    /**
     * The kind of handler.
     */
    public enum Kind {
        CATCH,
        FINALLY,
        FAULT,
        FILTER,
    }

    private final Kind kind;
    private final int tryStart;
    private final int tryEnd;
    private final int handlerStart;
    private final int handlerEnd;
    @Nullable
    private final TypeRef catchType;

    public ExceptionRegion(Kind kind,
                           int tryStart, int tryEnd,
                           int handlerStart, int handlerEnd,
                           @Nullable TypeRef catchType) {
        this.kind = kind;
        this.tryStart = tryStart;
        this.tryEnd = tryEnd;
        this.handlerStart = handlerStart;
        this.handlerEnd = handlerEnd;
        this.catchType = catchType;
    }

    public Kind getKind() {
        return kind;
    }

    public int getTryStart() {
        return tryStart;
    }

    public int getTryEnd() {
        return tryEnd;
    }

    public int getHandlerStart() {
        return handlerStart;
    }

    public int getHandlerEnd() {
        return handlerEnd;
    }

    public @Nullable TypeRef getCatchType() {
        return catchType;
    }

    public boolean tryContains(int offset) {
        return tryStart <= offset && offset < tryEnd;
    }

    public boolean handlerContains(int offset) {
        return handlerStart <= offset && offset < handlerEnd;
    }

    @Override
    public String toString() {
        return String.format("%s [%s, %s) -> [%s, %s)%s",
                kind,
                Instruction.formatOffset(tryStart),
                Instruction.formatOffset(tryEnd),
                Instruction.formatOffset(handlerStart),
                Instruction.formatOffset(handlerEnd),
                catchType == null ? "" : " " + catchType);
    }
}
