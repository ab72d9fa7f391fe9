package io.github.eutro.cil2ast.ast;

/**
 * {@code goto case label;}. Use {@link GotoDefaultStatement} for {@code goto default;}.
 */
public final class GotoCaseStatement extends Statement {
    private final CaseLabel label;

    public GotoCaseStatement(CaseLabel label) {
        if (label.isDefault()) throw new IllegalArgumentException("use GotoDefaultStatement");
        this.label = label;
    }

    public CaseLabel getLabel() {
        return label;
    }

    @Override
    public Kind getKind() {
        return Kind.GOTO_CASE;
    }
}
