package io.github.eutro.cil2ast.api;

/**
 * A cooperative cancellation signal. Checked between methods, never inside one.
 */
public final class CancellationToken {
    /**
     * A token that is never cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken();

    private volatile boolean cancelled;

    /**
     * Request cancellation.
     */
    public void cancel() {
        if (this == NONE) throw new UnsupportedOperationException("NONE cannot be cancelled");
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Throw if cancellation was requested.
     *
     * @throws DecompilationException with {@link ErrorKind#CANCELLED} if cancelled.
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new DecompilationException(ErrorKind.CANCELLED, "decompilation cancelled");
        }
    }
}
