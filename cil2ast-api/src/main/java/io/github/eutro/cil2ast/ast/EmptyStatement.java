package io.github.eutro.cil2ast.ast;

public final class EmptyStatement extends Statement {
    public static final EmptyStatement INSTANCE = new EmptyStatement();

    private EmptyStatement() {
    }

    @Override
    public Kind getKind() {
        return Kind.EMPTY;
    }
}
