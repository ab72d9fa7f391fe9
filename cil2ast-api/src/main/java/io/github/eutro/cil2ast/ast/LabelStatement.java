package io.github.eutro.cil2ast.ast;

public final class LabelStatement extends Statement {
    private final String label;

    public LabelStatement(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public Kind getKind() {
        return Kind.LABEL;
    }
}
