package io.github.eutro.cil2ast.ast;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class AstPrinterTest {
    private static final IdentifierExpression X = new IdentifierExpression("x");

    private static Statement assign(String name, int value) {
        return new ExpressionStatement(new AssignmentExpression(new IdentifierExpression(name), PrimitiveExpression.of(value)));
    }

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }

    @Test
    void printsSwitchSections() {
        Statement sw = new SwitchStatement(X, Arrays.asList(
                new SwitchSection(Arrays.asList(CaseLabel.of(1), CaseLabel.of(2)),
                        Arrays.asList(assign("y", 1), BreakStatement.INSTANCE)),
                new SwitchSection(Collections.singletonList(CaseLabel.DEFAULT),
                        Collections.singletonList(ReturnStatement.VOID))));
        assertEquals(lines(
                "switch (x) {",
                "    case 1:",
                "    case 2:",
                "        y = 1;",
                "        break;",
                "    default:",
                "        return;",
                "}"), sw.toString());
    }

    @Test
    void printsElseIfChains() {
        Statement stmt = new IfElseStatement(X,
                BlockStatement.of(assign("a", 1)),
                new IfElseStatement(new IdentifierExpression("y"),
                        BlockStatement.of(assign("a", 2)),
                        BlockStatement.of(ReturnStatement.VOID)));
        assertEquals(lines(
                "if (x) {",
                "    a = 1;",
                "} else if (y) {",
                "    a = 2;",
                "} else {",
                "    return;",
                "}"), stmt.toString());
    }

    @Test
    void printsUnbracedStatementsIndented() {
        Statement stmt = new IfElseStatement(X, ReturnStatement.VOID, null);
        assertEquals(lines(
                "if (x)",
                "    return;"), stmt.toString());
    }

    @Test
    void parenthesizesByPrecedence() {
        Expression sum = new BinaryOperatorExpression(X, BinaryOperatorType.ADD, PrimitiveExpression.of(1));
        Expression product = new BinaryOperatorExpression(sum, BinaryOperatorType.MULTIPLY, PrimitiveExpression.of(2));
        assertEquals("(x + 1) * 2", product.toString());
        Expression difference = new BinaryOperatorExpression(X, BinaryOperatorType.SUBTRACT,
                new BinaryOperatorExpression(new IdentifierExpression("y"), BinaryOperatorType.SUBTRACT, PrimitiveExpression.of(1)));
        assertEquals("x - (y - 1)", difference.toString());
    }

    @Test
    void printsSwitchExpressions() {
        Expression sw = new SwitchExpression(X, Arrays.asList(
                new SwitchExpressionSection(Arrays.asList(CaseLabel.of(1), CaseLabel.of(2)), new PrimitiveExpression("a")),
                new SwitchExpressionSection(Collections.singletonList(CaseLabel.DEFAULT), new PrimitiveExpression("b"))));
        assertEquals(lines(
                "x switch {",
                "    1 or 2 => \"a\",",
                "    _ => \"b\"",
                "}"), sw.toString());
    }

    @Test
    void quotesStrings() {
        assertEquals("\"a\\\"b\\n\"", AstPrinter.quote("a\"b\n"));
    }
}
