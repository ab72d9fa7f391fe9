package io.github.eutro.cil2ast.api;

/**
 * Thrown when reconstruction of a method, or a region of it, cannot continue.
 */
public class DecompilationException extends RuntimeException {
    private final ErrorKind kind;

    public DecompilationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DecompilationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    @Override
    public String getMessage() {
        return kind + ": " + super.getMessage();
    }
}
