package io.github.eutro.cil2ast.ast;

public final class ContinueStatement extends Statement {
    public static final ContinueStatement INSTANCE = new ContinueStatement();

    private ContinueStatement() {
    }

    @Override
    public Kind getKind() {
        return Kind.CONTINUE;
    }
}
