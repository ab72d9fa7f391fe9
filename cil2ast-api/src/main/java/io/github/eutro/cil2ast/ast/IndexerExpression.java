package io.github.eutro.cil2ast.ast;

/**
 * An element access {@code target[index]}.
 */
public final class IndexerExpression extends Expression {
    private final Expression target;
    private final Expression index;

    public IndexerExpression(Expression target, Expression index) {
        this.target = target;
        this.index = index;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIndex() {
        return index;
    }

    public IndexerExpression with(Expression target, Expression index) {
        return target == this.target && index == this.index ? this : new IndexerExpression(target, index);
    }

    @Override
    public Kind getKind() {
        return Kind.INDEXER;
    }
}
