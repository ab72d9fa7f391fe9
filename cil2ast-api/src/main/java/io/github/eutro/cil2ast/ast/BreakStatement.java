package io.github.eutro.cil2ast.ast;

public final class BreakStatement extends Statement {
    public static final BreakStatement INSTANCE = new BreakStatement();

    private BreakStatement() {
    }

    @Override
    public Kind getKind() {
        return Kind.BREAK;
    }
}
