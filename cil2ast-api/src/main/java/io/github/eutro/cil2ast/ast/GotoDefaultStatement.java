package io.github.eutro.cil2ast.ast;

public final class GotoDefaultStatement extends Statement {
    public static final GotoDefaultStatement INSTANCE = new GotoDefaultStatement();

    private GotoDefaultStatement() {
    }

    @Override
    public Kind getKind() {
        return Kind.GOTO_DEFAULT;
    }
}
