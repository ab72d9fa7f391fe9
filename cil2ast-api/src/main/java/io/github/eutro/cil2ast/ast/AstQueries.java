package io.github.eutro.cil2ast.ast;

import java.util.List;
import java.util.function.Predicate;

/**
 * Read-only questions about trees.
 */
public final class AstQueries {
    private AstQueries() {
    }

    /**
     * Whether control can reach the end of a statement.
     * <p>
     * This is conservative in the same direction as the C# reachability rules: statements
     * are only said to not complete if they obviously cannot.
     *
     * @param stmt The statement.
     * @return Whether the statement can complete normally.
     */
    public static boolean canCompleteNormally(Statement stmt) {
        switch (stmt.getKind()) {
            case BLOCK:
                return canCompleteNormally(((BlockStatement) stmt).getStatements());
            case IF_ELSE: {
                IfElseStatement ifElse = (IfElseStatement) stmt;
                Statement falseStatement = ifElse.getFalseStatement();
                return falseStatement == null
                        || canCompleteNormally(ifElse.getTrueStatement())
                        || canCompleteNormally(falseStatement);
            }
            case WHILE: {
                WhileStatement loop = (WhileStatement) stmt;
                return !isTrue(loop.getCondition()) || containsBreak(loop.getBody());
            }
            case DO_WHILE: {
                DoWhileStatement loop = (DoWhileStatement) stmt;
                return !isTrue(loop.getCondition()) || containsBreak(loop.getBody());
            }
            case FOR: {
                ForStatement loop = (ForStatement) stmt;
                return (loop.getCondition() != null && !isTrue(loop.getCondition())) || containsBreak(loop.getBody());
            }
            case SWITCH: {
                SwitchStatement sw = (SwitchStatement) stmt;
                boolean hasDefault = false;
                for (SwitchSection section : sw.getSections()) {
                    if (section.hasDefault()) hasDefault = true;
                    if (canCompleteNormally(section.getStatements())) return true;
                    for (Statement statement : section.getStatements()) {
                        if (containsBreak(statement)) return true;
                    }
                }
                return !hasDefault;
            }
            case TRY_CATCH: {
                TryCatchStatement tc = (TryCatchStatement) stmt;
                if (tc.getFinallyBlock() != null && !canCompleteNormally(tc.getFinallyBlock())) return false;
                if (canCompleteNormally(tc.getTryBlock())) return true;
                for (CatchClause clause : tc.getCatchClauses()) {
                    if (canCompleteNormally(clause.getBody())) return true;
                }
                return false;
            }
            case BREAK:
            case CONTINUE:
            case RETURN:
            case THROW:
            case GOTO:
            case GOTO_CASE:
            case GOTO_DEFAULT:
                return false;
            default:
                return true;
        }
    }

    /**
     * Whether control can reach the end of a statement list. A label makes the code after it reachable again.
     *
     * @param statements The statements.
     * @return Whether the list can complete normally.
     */
    public static boolean canCompleteNormally(List<Statement> statements) {
        boolean reachable = true;
        for (Statement statement : statements) {
            if (statement.getKind() == Statement.Kind.LABEL) {
                reachable = true;
            } else if (reachable && !canCompleteNormally(statement)) {
                reachable = false;
            }
        }
        return reachable;
    }

    private static boolean isTrue(Expression expr) {
        return expr.getKind() == Expression.Kind.PRIMITIVE
                && Boolean.TRUE.equals(((PrimitiveExpression) expr).getValue());
    }

    /**
     * Whether a statement contains a {@code break} that would leave a loop or switch directly
     * enclosing it, i.e. one not nested in another loop or switch.
     *
     * @param stmt The statement.
     * @return Whether it contains such a break.
     */
    public static boolean containsBreak(Statement stmt) {
        switch (stmt.getKind()) {
            case BREAK:
                return true;
            case BLOCK:
                for (Statement statement : ((BlockStatement) stmt).getStatements()) {
                    if (containsBreak(statement)) return true;
                }
                return false;
            case IF_ELSE: {
                IfElseStatement ifElse = (IfElseStatement) stmt;
                return containsBreak(ifElse.getTrueStatement())
                        || (ifElse.getFalseStatement() != null && containsBreak(ifElse.getFalseStatement()));
            }
            case TRY_CATCH: {
                TryCatchStatement tc = (TryCatchStatement) stmt;
                if (containsBreak(tc.getTryBlock())) return true;
                for (CatchClause clause : tc.getCatchClauses()) {
                    if (containsBreak(clause.getBody())) return true;
                }
                return tc.getFinallyBlock() != null && containsBreak(tc.getFinallyBlock());
            }
            default:
                return false;
        }
    }

    /**
     * Whether a statement list declares something in its own scope: a local variable,
     * a local function or an {@code out} variable. Nested blocks open their own scope
     * and are not looked into.
     *
     * @param statements The statements.
     * @return Whether any declaration would leak if the list were spliced into its parent.
     */
    public static boolean declaresInScope(List<Statement> statements) {
        for (Statement statement : statements) {
            if (declaresInScope(statement)) return true;
        }
        return false;
    }

    private static boolean declaresInScope(Statement stmt) {
        switch (stmt.getKind()) {
            case VARIABLE_DECLARATION:
            case LOCAL_FUNCTION_DECLARATION:
                return true;
            case BLOCK:
                return false;
            case EXPRESSION:
                return anySubExpression(((ExpressionStatement) stmt).getExpression(), AstQueries::isOutVar);
            case RETURN:
            case THROW: {
                Expression value = stmt.getKind() == Statement.Kind.RETURN
                        ? ((ReturnStatement) stmt).getExpression()
                        : ((ThrowStatement) stmt).getExpression();
                return value != null && anySubExpression(value, AstQueries::isOutVar);
            }
            case IF_ELSE:
                // out vars in an if condition leak into the enclosing scope
                return anySubExpression(((IfElseStatement) stmt).getCondition(), AstQueries::isOutVar);
            case SWITCH:
                return anySubExpression(((SwitchStatement) stmt).getExpression(), AstQueries::isOutVar);
            default:
                return false;
        }
    }

    private static boolean isOutVar(Expression expr) {
        return expr.getKind() == Expression.Kind.OUT_VAR_DECLARATION;
    }

    /**
     * Whether an expression or any of its subexpressions satisfies a predicate.
     *
     * @param expr      The expression.
     * @param predicate The predicate.
     * @return Whether any matched.
     */
    public static boolean anySubExpression(Expression expr, Predicate<Expression> predicate) {
        if (predicate.test(expr)) return true;
        switch (expr.getKind()) {
            case MEMBER_REFERENCE:
                return anySubExpression(((MemberReferenceExpression) expr).getTarget(), predicate);
            case INDEXER: {
                IndexerExpression indexer = (IndexerExpression) expr;
                return anySubExpression(indexer.getTarget(), predicate)
                        || anySubExpression(indexer.getIndex(), predicate);
            }
            case INVOCATION: {
                InvocationExpression invocation = (InvocationExpression) expr;
                return anySubExpression(invocation.getTarget(), predicate)
                        || anySubExpression(invocation.getArguments(), predicate);
            }
            case OBJECT_CREATE:
                return anySubExpression(((ObjectCreateExpression) expr).getArguments(), predicate);
            case BINARY_OPERATOR: {
                BinaryOperatorExpression binary = (BinaryOperatorExpression) expr;
                return anySubExpression(binary.getLeft(), predicate)
                        || anySubExpression(binary.getRight(), predicate);
            }
            case UNARY_OPERATOR:
                return anySubExpression(((UnaryOperatorExpression) expr).getOperand(), predicate);
            case ASSIGNMENT: {
                AssignmentExpression assignment = (AssignmentExpression) expr;
                return anySubExpression(assignment.getLeft(), predicate)
                        || anySubExpression(assignment.getRight(), predicate);
            }
            case CAST:
                return anySubExpression(((CastExpression) expr).getExpression(), predicate);
            case SWITCH: {
                SwitchExpression sw = (SwitchExpression) expr;
                if (anySubExpression(sw.getGoverning(), predicate)) return true;
                for (SwitchExpressionSection section : sw.getSections()) {
                    if (anySubExpression(section.getBody(), predicate)) return true;
                }
                return false;
            }
            default:
                return false;
        }
    }

    private static boolean anySubExpression(List<Expression> exprs, Predicate<Expression> predicate) {
        for (Expression expr : exprs) {
            if (anySubExpression(expr, predicate)) return true;
        }
        return false;
    }

    /**
     * Whether any statement in a tree satisfies a predicate, looking into every nested statement.
     *
     * @param stmt      The root.
     * @param predicate The predicate.
     * @return Whether any matched.
     */
    public static boolean anyStatement(Statement stmt, Predicate<Statement> predicate) {
        if (predicate.test(stmt)) return true;
        switch (stmt.getKind()) {
            case BLOCK:
                return anyStatement(((BlockStatement) stmt).getStatements(), predicate);
            case LOCAL_FUNCTION_DECLARATION:
                return anyStatement(((LocalFunctionDeclarationStatement) stmt).getBody(), predicate);
            case IF_ELSE: {
                IfElseStatement ifElse = (IfElseStatement) stmt;
                return anyStatement(ifElse.getTrueStatement(), predicate)
                        || (ifElse.getFalseStatement() != null && anyStatement(ifElse.getFalseStatement(), predicate));
            }
            case WHILE:
                return anyStatement(((WhileStatement) stmt).getBody(), predicate);
            case DO_WHILE:
                return anyStatement(((DoWhileStatement) stmt).getBody(), predicate);
            case FOR: {
                ForStatement loop = (ForStatement) stmt;
                return anyStatement(loop.getInitializers(), predicate) || anyStatement(loop.getBody(), predicate);
            }
            case SWITCH:
                for (SwitchSection section : ((SwitchStatement) stmt).getSections()) {
                    if (anyStatement(section.getStatements(), predicate)) return true;
                }
                return false;
            case TRY_CATCH: {
                TryCatchStatement tc = (TryCatchStatement) stmt;
                if (anyStatement(tc.getTryBlock(), predicate)) return true;
                for (CatchClause clause : tc.getCatchClauses()) {
                    if (anyStatement(clause.getBody(), predicate)) return true;
                }
                return tc.getFinallyBlock() != null && anyStatement(tc.getFinallyBlock(), predicate);
            }
            default:
                return false;
        }
    }

    public static boolean anyStatement(List<Statement> statements, Predicate<Statement> predicate) {
        for (Statement statement : statements) {
            if (anyStatement(statement, predicate)) return true;
        }
        return false;
    }
}
