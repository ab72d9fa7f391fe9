package io.github.eutro.cil2ast.passes.normalize;

import io.github.eutro.cil2ast.MethodTree;
import io.github.eutro.cil2ast.ast.Annotations;
import io.github.eutro.cil2ast.ast.AssignmentExpression;
import io.github.eutro.cil2ast.ast.AssignmentOperatorType;
import io.github.eutro.cil2ast.ast.AstQueries;
import io.github.eutro.cil2ast.ast.AstRewriter;
import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ast.ExpressionStatement;
import io.github.eutro.cil2ast.ast.ForStatement;
import io.github.eutro.cil2ast.ast.IdentifierExpression;
import io.github.eutro.cil2ast.ast.Statement;
import io.github.eutro.cil2ast.passes.InPlaceIRPass;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Moves an assignment to a loop variable that immediately precedes a {@code for} loop
 * into the loop's initializer.
 */
public class IntroduceForInitializers implements InPlaceIRPass<MethodTree> {
    /**
     * A singleton instance of this pass.
     */
    public static final IntroduceForInitializers INSTANCE = new IntroduceForInitializers();

    @Override
    public void runInPlace(MethodTree tree) {
        tree.setBody(new Introducer(tree.getAnnotations()).rewriteBlock(tree.getBody()));
    }

    private static final class Introducer extends AstRewriter {
        Introducer(Annotations annotations) {
            super(annotations);
        }

        @Override
        public Expression rewrite(Expression expr) {
            return expr;
        }

        @Override
        protected List<Statement> rewriteStatements(List<Statement> statements) {
            List<Statement> result = new ArrayList<>(statements.size());
            for (int i = 0; i < statements.size(); i++) {
                Statement stmt = rewrite(statements.get(i));
                if (i + 1 < statements.size() && statements.get(i + 1).getKind() == Statement.Kind.FOR) {
                    String variable = assignedVariable(stmt);
                    ForStatement loop = (ForStatement) rewrite(statements.get(i + 1));
                    if (variable != null && loop.getInitializers().isEmpty() && usesVariable(loop, variable)) {
                        ForStatement merged = loop.with(
                                Collections.singletonList(stmt),
                                loop.getCondition(),
                                loop.getIterators(),
                                loop.getBody());
                        annotations.copy(loop, merged);
                        result.add(merged);
                    } else {
                        result.add(stmt);
                        result.add(loop);
                    }
                    i++;
                    continue;
                }
                result.add(stmt);
            }
            return result;
        }

        private static @Nullable String assignedVariable(Statement stmt) {
            if (stmt.getKind() != Statement.Kind.EXPRESSION) return null;
            Expression expr = ((ExpressionStatement) stmt).getExpression();
            if (expr.getKind() != Expression.Kind.ASSIGNMENT) return null;
            AssignmentExpression assignment = (AssignmentExpression) expr;
            if (assignment.getOperator() != AssignmentOperatorType.ASSIGN
                    || assignment.getLeft().getKind() != Expression.Kind.IDENTIFIER) {
                return null;
            }
            return ((IdentifierExpression) assignment.getLeft()).getName();
        }

        private static boolean usesVariable(ForStatement loop, String variable) {
            Expression condition = loop.getCondition();
            if (condition != null && mentions(condition, variable)) return true;
            for (Expression iterator : loop.getIterators()) {
                if (mentions(iterator, variable)) return true;
            }
            return false;
        }

        private static boolean mentions(Expression expr, String variable) {
            return AstQueries.anySubExpression(expr, e -> IdentifierExpression.isNamed(e, variable));
        }
    }
}
