package io.github.eutro.cil2ast.ast;

public final class GotoStatement extends Statement {
    private final String label;

    public GotoStatement(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public Kind getKind() {
        return Kind.GOTO;
    }
}
