package io.github.eutro.cil2ast.ast;

/**
 * A reference to a local, parameter or synthetic variable by name.
 */
public final class IdentifierExpression extends Expression {
    private final String name;

    public IdentifierExpression(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Whether this is an identifier with the given name.
     *
     * @param expr The expression.
     * @param name The name.
     * @return Whether {@code expr} refers to {@code name}.
     */
    public static boolean isNamed(Expression expr, String name) {
        return expr.getKind() == Kind.IDENTIFIER && ((IdentifierExpression) expr).name.equals(name);
    }

    @Override
    public Kind getKind() {
        return Kind.IDENTIFIER;
    }
}
