package io.github.eutro.cil2ast.ast;

import java.util.List;

/**
 * An arm of a {@link SwitchExpression}: {@code label or label => body}.
 */
public final class SwitchExpressionSection {
    private final List<CaseLabel> labels;
    private final Expression body;

    public SwitchExpressionSection(List<CaseLabel> labels, Expression body) {
        if (labels.isEmpty()) throw new IllegalArgumentException("switch expression arm without labels");
        this.labels = Nodes.copy(labels);
        this.body = body;
    }

    public List<CaseLabel> getLabels() {
        return labels;
    }

    public Expression getBody() {
        return body;
    }

    public SwitchExpressionSection withBody(Expression body) {
        return body == this.body ? this : new SwitchExpressionSection(labels, body);
    }
}
