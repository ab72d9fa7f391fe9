package io.github.eutro.cil2ast.ast;

/**
 * An expression node. The hierarchy is closed: every subclass is in this package,
 * and {@link #getKind()} identifies it.
 * <p>
 * Expressions are immutable.
 */
public abstract class Expression {
    /**
     * The kind of an expression, one per subclass.
     */
    public enum Kind {
        IDENTIFIER,
        THIS_REFERENCE,
        BASE_REFERENCE,
        PRIMITIVE,
        TYPE_REFERENCE,
        MEMBER_REFERENCE,
        INDEXER,
        INVOCATION,
        OBJECT_CREATE,
        BINARY_OPERATOR,
        UNARY_OPERATOR,
        ASSIGNMENT,
        CAST,
        OUT_VAR_DECLARATION,
        SWITCH,
    }

    Expression() {
    }

    /**
     * Get the kind of this expression.
     *
     * @return The kind.
     */
    public abstract Kind getKind();

    /**
     * Cast this expression to a subclass, after checking its kind.
     *
     * @param kind The expected kind.
     * @param type The subclass.
     * @param <T>  The subclass.
     * @return This expression.
     * @throws IllegalStateException If the kind does not match.
     */
    public <T extends Expression> T as(Kind kind, Class<T> type) {
        if (getKind() != kind) {
            throw new IllegalStateException("expected " + kind + ", got " + getKind() + ": " + this);
        }
        return type.cast(this);
    }

    @Override
    public String toString() {
        return AstPrinter.print(this);
    }
}
