package io.github.eutro.cil2ast.ast;

import io.github.eutro.cil2ast.api.TypeRef;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AstQueriesTest {
    private static final IdentifierExpression C = new IdentifierExpression("c");

    private static Statement call(String name) {
        return new ExpressionStatement(new AssignmentExpression(new IdentifierExpression(name), PrimitiveExpression.of(1)));
    }

    @Test
    void ifWithoutElseCompletes() {
        Statement stmt = new IfElseStatement(C, BlockStatement.of(new ReturnStatement(null)), null);
        assertTrue(AstQueries.canCompleteNormally(stmt));
    }

    @Test
    void ifWhereBothBranchesJumpDoesNotComplete() {
        Statement stmt = new IfElseStatement(C,
                BlockStatement.of(new ReturnStatement(null)),
                BlockStatement.of(new ThrowStatement(null)));
        assertFalse(AstQueries.canCompleteNormally(stmt));
    }

    @Test
    void infiniteLoopCompletesOnlyWithBreak() {
        Statement forever = new WhileStatement(PrimitiveExpression.TRUE, BlockStatement.of(call("a")));
        assertFalse(AstQueries.canCompleteNormally(forever));
        Statement broken = new WhileStatement(PrimitiveExpression.TRUE, BlockStatement.of(
                new IfElseStatement(C, BlockStatement.of(BreakStatement.INSTANCE), null)));
        assertTrue(AstQueries.canCompleteNormally(broken));
    }

    @Test
    void nestedLoopBreakDoesNotCount() {
        Statement inner = new WhileStatement(C, BlockStatement.of(BreakStatement.INSTANCE));
        Statement outer = new WhileStatement(PrimitiveExpression.TRUE, BlockStatement.of(inner));
        assertFalse(AstQueries.canCompleteNormally(outer));
    }

    @Test
    void labelMakesCodeReachableAgain() {
        assertTrue(AstQueries.canCompleteNormally(Arrays.asList(
                new GotoStatement("L"),
                new LabelStatement("L"),
                call("a"))));
        assertFalse(AstQueries.canCompleteNormally(Arrays.asList(
                call("a"),
                new ReturnStatement(null))));
    }

    @Test
    void declarationsAreVisibleToSiblings() {
        assertTrue(AstQueries.declaresInScope(Collections.singletonList(
                new VariableDeclarationStatement(TypeRef.INT32, "i", null))));
        assertTrue(AstQueries.declaresInScope(Collections.singletonList(
                new LocalFunctionDeclarationStatement(TypeRef.VOID, "f", BlockStatement.EMPTY))));
        assertFalse(AstQueries.declaresInScope(Collections.singletonList(
                BlockStatement.of(new VariableDeclarationStatement(TypeRef.INT32, "i", null)))));
        assertFalse(AstQueries.declaresInScope(Collections.singletonList(call("a"))));
    }

    @Test
    void outVarInConditionLeaks() {
        Expression out = new OutVarDeclarationExpression(TypeRef.INT32, "v");
        Statement stmt = new IfElseStatement(
                new BinaryOperatorExpression(out, BinaryOperatorType.EQUALITY, PrimitiveExpression.NULL),
                BlockStatement.EMPTY, null);
        assertTrue(AstQueries.declaresInScope(Collections.singletonList(stmt)));
    }
}
