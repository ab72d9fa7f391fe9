package io.github.eutro.cil2ast.ast;

public final class DoWhileStatement extends Statement {
    private final Statement body;
    private final Expression condition;

    public DoWhileStatement(Statement body, Expression condition) {
        this.body = body;
        this.condition = condition;
    }

    public Statement getBody() {
        return body;
    }

    public Expression getCondition() {
        return condition;
    }

    public DoWhileStatement with(Statement body, Expression condition) {
        return condition == this.condition && body == this.body ? this : new DoWhileStatement(body, condition);
    }

    @Override
    public Kind getKind() {
        return Kind.DO_WHILE;
    }
}
