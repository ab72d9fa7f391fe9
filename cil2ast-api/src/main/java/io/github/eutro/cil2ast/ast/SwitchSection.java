package io.github.eutro.cil2ast.ast;

import java.util.List;

/**
 * A section of a {@link SwitchStatement}: one or more stacked labels followed by statements.
 * The statements of a well-formed section never complete normally.
 */
public final class SwitchSection {
    private final List<CaseLabel> labels;
    private final List<Statement> statements;

    public SwitchSection(List<CaseLabel> labels, List<Statement> statements) {
        if (labels.isEmpty()) throw new IllegalArgumentException("switch section without labels");
        this.labels = Nodes.copy(labels);
        this.statements = Nodes.copy(statements);
    }

    public List<CaseLabel> getLabels() {
        return labels;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public boolean hasDefault() {
        for (CaseLabel label : labels) {
            if (label.isDefault()) return true;
        }
        return false;
    }

    /**
     * Whether this section consists of nothing but {@code break;}.
     *
     * @return Whether the section is break-only.
     */
    public boolean isBreakOnly() {
        return statements.size() == 1 && statements.get(0).getKind() == Statement.Kind.BREAK;
    }

    public SwitchSection withStatements(List<Statement> statements) {
        return Nodes.sameElements(statements, this.statements) ? this : new SwitchSection(labels, statements);
    }

    public SwitchSection withLabels(List<CaseLabel> labels) {
        return Nodes.sameElements(labels, this.labels) ? this : new SwitchSection(labels, statements);
    }
}
