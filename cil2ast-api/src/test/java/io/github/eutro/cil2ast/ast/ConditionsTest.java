package io.github.eutro.cil2ast.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

public class ConditionsTest {
    private static final IdentifierExpression X = new IdentifierExpression("x");

    @Test
    void flipsComparisons() {
        Expression lt = new BinaryOperatorExpression(X, BinaryOperatorType.LESS_THAN, PrimitiveExpression.of(3));
        assertEquals("x >= 3", Conditions.not(lt).toString());
        Expression eq = new BinaryOperatorExpression(X, BinaryOperatorType.EQUALITY, PrimitiveExpression.NULL);
        assertEquals("x != null", Conditions.not(eq).toString());
    }

    @Test
    void removesDoubleNegation() {
        Expression notX = new UnaryOperatorExpression(UnaryOperatorType.NOT, X);
        assertSame(X, Conditions.not(notX));
        assertEquals("!x", Conditions.not(X).toString());
    }

    @Test
    void flipsBooleanLiterals() {
        assertSame(PrimitiveExpression.FALSE, Conditions.not(PrimitiveExpression.TRUE));
        assertSame(PrimitiveExpression.TRUE, Conditions.not(PrimitiveExpression.FALSE));
    }

    @Test
    void wrapsEverythingElse() {
        Expression and = new BinaryOperatorExpression(X, BinaryOperatorType.CONDITIONAL_AND, new IdentifierExpression("y"));
        assertEquals("!(x && y)", Conditions.not(and).toString());
    }
}
