package io.github.eutro.cil2ast;

import io.github.eutro.cil2ast.api.DecompilationException;
import io.github.eutro.cil2ast.api.MethodId;
import io.github.eutro.cil2ast.ast.BlockStatement;
import io.github.eutro.cil2ast.ast.CommentStatement;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * The outcome of decompiling one method.
 * <p>
 * A failed method still has a body: a single comment saying why it could not be decompiled.
 */
public final class MethodResult {
    private final MethodId methodId;
    private final BlockStatement body;
    private final List<Diagnostic> diagnostics;
    private final @Nullable DecompilationException failure;

    private MethodResult(MethodId methodId,
                         BlockStatement body,
                         List<Diagnostic> diagnostics,
                         @Nullable DecompilationException failure) {
        this.methodId = methodId;
        this.body = body;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
        this.failure = failure;
    }

    public static MethodResult success(MethodId methodId, BlockStatement body, List<Diagnostic> diagnostics) {
        return new MethodResult(methodId, body, diagnostics, null);
    }

    public static MethodResult failure(MethodId methodId, DecompilationException failure) {
        BlockStatement placeholder = BlockStatement.of(
                new CommentStatement("decompilation failed: " + failure.getMessage()));
        return new MethodResult(methodId, placeholder, Collections.emptyList(), failure);
    }

    public MethodId getMethodId() {
        return methodId;
    }

    public BlockStatement getBody() {
        return body;
    }

    /**
     * Get the problems that were recovered from. Empty for failed methods.
     *
     * @return The diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public @Nullable DecompilationException getFailure() {
        return failure;
    }

    public boolean isSuccess() {
        return failure == null;
    }

    @Override
    public String toString() {
        return methodId + (failure == null ? " (ok, " + diagnostics.size() + " diagnostics)" : " (" + failure.getKind() + ")");
    }
}
