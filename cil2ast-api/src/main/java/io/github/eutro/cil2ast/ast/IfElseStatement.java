package io.github.eutro.cil2ast.ast;

import org.jetbrains.annotations.Nullable;

public final class IfElseStatement extends Statement {
    private final Expression condition;
    private final Statement trueStatement;
    @Nullable
    private final Statement falseStatement;

    public IfElseStatement(Expression condition, Statement trueStatement, @Nullable Statement falseStatement) {
        this.condition = condition;
        this.trueStatement = trueStatement;
        this.falseStatement = falseStatement;
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getTrueStatement() {
        return trueStatement;
    }

    public @Nullable Statement getFalseStatement() {
        return falseStatement;
    }

    public IfElseStatement with(Expression condition, Statement trueStatement, @Nullable Statement falseStatement) {
        if (condition == this.condition && trueStatement == this.trueStatement && falseStatement == this.falseStatement) {
            return this;
        }
        return new IfElseStatement(condition, trueStatement, falseStatement);
    }

    @Override
    public Kind getKind() {
        return Kind.IF_ELSE;
    }
}
