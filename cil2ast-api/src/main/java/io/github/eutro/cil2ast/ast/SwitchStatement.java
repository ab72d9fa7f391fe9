package io.github.eutro.cil2ast.ast;

import java.util.List;

public final class SwitchStatement extends Statement {
    private final Expression expression;
    private final List<SwitchSection> sections;

    public SwitchStatement(Expression expression, List<SwitchSection> sections) {
        this.expression = expression;
        this.sections = Nodes.copy(sections);
    }

    public Expression getExpression() {
        return expression;
    }

    public List<SwitchSection> getSections() {
        return sections;
    }

    public SwitchStatement with(Expression expression, List<SwitchSection> sections) {
        if (expression == this.expression && Nodes.sameElements(sections, this.sections)) return this;
        return new SwitchStatement(expression, sections);
    }

    @Override
    public Kind getKind() {
        return Kind.SWITCH;
    }
}
