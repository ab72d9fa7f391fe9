package io.github.eutro.cil2ast.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code governing switch { ... }}, the value form of a switch.
 */
public final class SwitchExpression extends Expression {
    private final Expression governing;
    private final List<SwitchExpressionSection> sections;

    public SwitchExpression(Expression governing, List<SwitchExpressionSection> sections) {
        this.governing = governing;
        this.sections = Nodes.copy(sections);
    }

    public Expression getGoverning() {
        return governing;
    }

    public List<SwitchExpressionSection> getSections() {
        return sections;
    }

    public SwitchExpression with(Expression governing, List<SwitchExpressionSection> sections) {
        if (governing == this.governing && Nodes.sameElements(sections, this.sections)) return this;
        return new SwitchExpression(governing, new ArrayList<>(sections));
    }

    @Override
    public Kind getKind() {
        return Kind.SWITCH;
    }
}
