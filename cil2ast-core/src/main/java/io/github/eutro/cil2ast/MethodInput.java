package io.github.eutro.cil2ast;

import io.github.eutro.cil2ast.api.MethodId;

/**
 * A method to decompile, and the context to decompile it in.
 */
public final class MethodInput {
    private final DecompilerContext context;
    private final MethodId methodId;

    public MethodInput(DecompilerContext context, MethodId methodId) {
        this.context = context;
        this.methodId = methodId;
    }

    public DecompilerContext getContext() {
        return context;
    }

    public MethodId getMethodId() {
        return methodId;
    }

    @Override
    public String toString() {
        return methodId.toString();
    }
}
