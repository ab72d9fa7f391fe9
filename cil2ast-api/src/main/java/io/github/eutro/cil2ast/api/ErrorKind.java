package io.github.eutro.cil2ast.api;

/**
 * The kinds of problem that reconstruction can run into.
 */
public enum ErrorKind {
    /**
     * Malformed branch or offset data. Fatal for the method.
     */
    INVALID_CONTROL_FLOW(true),
    /**
     * A block that no structured construct reaches. Recovered by emitting a comment stub.
     */
    UNREACHABLE_BLOCK(false),
    /**
     * A comparison chain that can't confidently be called a switch. Recovered by keeping nested ifs.
     */
    AMBIGUOUS_SWITCH_SHAPE(false),
    /**
     * A {@code goto case} whose target isn't among the sibling cases. Fatal for the surrounding switch,
     * which falls back to a raw block-based form.
     */
    UNRESOLVED_GOTO(false),
    /**
     * Decompilation was cancelled before the method was reconstructed.
     */
    CANCELLED(true),
    ;

    private final boolean fatalForMethod;

    ErrorKind(boolean fatalForMethod) {
        this.fatalForMethod = fatalForMethod;
    }

    /**
     * Whether this kind of error aborts the reconstruction of the whole method.
     *
     * @return Whether it is fatal for the method.
     */
    public boolean isFatalForMethod() {
        return fatalForMethod;
    }
}
