package io.github.eutro.cil2ast.ast;

/**
 * A statement node. The hierarchy is closed: every subclass is in this package,
 * and {@link #getKind()} identifies it.
 * <p>
 * Statements are immutable; transforms build new trees, keeping unchanged subtrees.
 */
public abstract class Statement {
    /**
     * The kind of a statement, one per subclass.
     */
    public enum Kind {
        BLOCK,
        EXPRESSION,
        EMPTY,
        COMMENT,
        VARIABLE_DECLARATION,
        LOCAL_FUNCTION_DECLARATION,
        IF_ELSE,
        WHILE,
        DO_WHILE,
        FOR,
        SWITCH,
        BREAK,
        CONTINUE,
        RETURN,
        THROW,
        GOTO,
        GOTO_CASE,
        GOTO_DEFAULT,
        LABEL,
        TRY_CATCH,
    }

    Statement() {
    }

    /**
     * Get the kind of this statement.
     *
     * @return The kind.
     */
    public abstract Kind getKind();

    /**
     * Cast this statement to a subclass, after checking its kind.
     *
     * @param kind The expected kind.
     * @param type The subclass.
     * @param <T>  The subclass.
     * @return This statement.
     * @throws IllegalStateException If the kind does not match.
     */
    public <T extends Statement> T as(Kind kind, Class<T> type) {
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
