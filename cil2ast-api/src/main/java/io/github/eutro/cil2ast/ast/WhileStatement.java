package io.github.eutro.cil2ast.ast;

public final class WhileStatement extends Statement {
    private final Expression condition;
    private final Statement body;

    public WhileStatement(Expression condition, Statement body) {
        this.condition = condition;
        this.body = body;
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getBody() {
        return body;
    }

    public WhileStatement with(Expression condition, Statement body) {
        return condition == this.condition && body == this.body ? this : new WhileStatement(condition, body);
    }

    @Override
    public Kind getKind() {
        return Kind.WHILE;
    }
}
