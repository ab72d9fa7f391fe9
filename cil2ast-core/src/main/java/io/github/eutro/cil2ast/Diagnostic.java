package io.github.eutro.cil2ast;

import io.github.eutro.cil2ast.api.ErrorKind;
import io.github.eutro.cil2ast.api.Instruction;

/**
 * A problem that was recovered from while decompiling a method.
 */
public final class Diagnostic {
    /**
     * The offset of diagnostics that are not tied to an instruction.
     */
    public static final int NO_OFFSET = -1;

    private final ErrorKind kind;
    private final int offset;
    private final String message;

    public Diagnostic(ErrorKind kind, int offset, String message) {
        this.kind = kind;
        this.offset = offset;
        this.message = message;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Get the IL offset the problem was found at.
     *
     * @return The offset, or {@link #NO_OFFSET}.
     */
    public int getOffset() {
        return offset;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return offset == NO_OFFSET
                ? kind + ": " + message
                : kind + " at " + Instruction.formatOffset(offset) + ": " + message;
    }
}
