package io.github.eutro.cil2ast;

import io.github.eutro.cil2ast.api.MethodId;
import io.github.eutro.cil2ast.ast.Annotations;
import io.github.eutro.cil2ast.ast.BlockStatement;

import java.util.List;

/**
 * The statement tree of one method, as it is passed between the tree passes.
 */
public final class MethodTree {
    private final MethodId methodId;
    private final DecompilerContext context;
    private final Annotations annotations;
    private final List<Diagnostic> diagnostics;
    private BlockStatement body;

    public MethodTree(MethodId methodId,
                      DecompilerContext context,
                      Annotations annotations,
                      List<Diagnostic> diagnostics,
                      BlockStatement body) {
        this.methodId = methodId;
        this.context = context;
        this.annotations = annotations;
        this.diagnostics = diagnostics;
        this.body = body;
    }

    public MethodId getMethodId() {
        return methodId;
    }

    public DecompilerContext getContext() {
        return context;
    }

    public Annotations getAnnotations() {
        return annotations;
    }

    /**
     * Get the recovered problems of this method, which passes may add to.
     *
     * @return The diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public BlockStatement getBody() {
        return body;
    }

    public void setBody(BlockStatement body) {
        this.body = body;
    }

    @Override
    public String toString() {
        return body.toString();
    }
}
