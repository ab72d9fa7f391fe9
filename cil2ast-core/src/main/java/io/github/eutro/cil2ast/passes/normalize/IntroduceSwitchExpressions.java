package io.github.eutro.cil2ast.passes.normalize;

import io.github.eutro.cil2ast.MethodTree;
import io.github.eutro.cil2ast.ast.Annotations;
import io.github.eutro.cil2ast.ast.AssignmentExpression;
import io.github.eutro.cil2ast.ast.AssignmentOperatorType;
import io.github.eutro.cil2ast.ast.AstQueries;
import io.github.eutro.cil2ast.ast.AstRewriter;
import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ast.ExpressionStatement;
import io.github.eutro.cil2ast.ast.IdentifierExpression;
import io.github.eutro.cil2ast.ast.Statement;
import io.github.eutro.cil2ast.ast.SwitchExpression;
import io.github.eutro.cil2ast.ast.SwitchExpressionSection;
import io.github.eutro.cil2ast.ast.SwitchSection;
import io.github.eutro.cil2ast.ast.SwitchStatement;
import io.github.eutro.cil2ast.passes.InPlaceIRPass;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a switch statement whose every section assigns one variable and breaks into
 * an assignment of a switch expression. Does nothing unless enabled in the settings.
 */
public class IntroduceSwitchExpressions implements InPlaceIRPass<MethodTree> {
    /**
     * A singleton instance of this pass.
     */
    public static final IntroduceSwitchExpressions INSTANCE = new IntroduceSwitchExpressions();

    @Override
    public void runInPlace(MethodTree tree) {
        if (!tree.getContext().getSettings().isSwitchExpressions()) return;
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
        public Statement rewrite(Statement stmt) {
            Statement rewritten = rewriteChildren(stmt);
            if (rewritten.getKind() != Statement.Kind.SWITCH) return rewritten;
            SwitchStatement sw = (SwitchStatement) rewritten;
            String variable = null;
            boolean hasDefault = false;
            boolean hasCase = false;
            List<SwitchExpressionSection> sections = new ArrayList<>();
            for (SwitchSection section : sw.getSections()) {
                AssignmentExpression assignment = assignThenBreak(section.getStatements());
                if (assignment == null) return rewritten;
                String target = ((IdentifierExpression) assignment.getLeft()).getName();
                if (variable == null) {
                    variable = target;
                } else if (!variable.equals(target)) {
                    return rewritten;
                }
                String assigned = variable;
                if (AstQueries.anySubExpression(assignment.getRight(), e -> IdentifierExpression.isNamed(e, assigned))) {
                    return rewritten;
                }
                if (section.hasDefault()) {
                    hasDefault = true;
                } else {
                    hasCase = true;
                }
                sections.add(new SwitchExpressionSection(section.getLabels(), assignment.getRight()));
            }
            // a switch expression must be exhaustive
            if (variable == null || !hasDefault || !hasCase) return rewritten;
            SwitchExpression expression = new SwitchExpression(sw.getExpression(), sections);
            Statement replacement = new ExpressionStatement(
                    new AssignmentExpression(new IdentifierExpression(variable), expression));
            annotations.copy(stmt, replacement);
            return replacement;
        }

        private static @Nullable AssignmentExpression assignThenBreak(List<Statement> statements) {
            if (statements.size() != 2
                    || statements.get(0).getKind() != Statement.Kind.EXPRESSION
                    || statements.get(1).getKind() != Statement.Kind.BREAK) {
                return null;
            }
            Expression expr = ((ExpressionStatement) statements.get(0)).getExpression();
            if (expr.getKind() != Expression.Kind.ASSIGNMENT) return null;
            AssignmentExpression assignment = (AssignmentExpression) expr;
            if (assignment.getOperator() != AssignmentOperatorType.ASSIGN
                    || assignment.getLeft().getKind() != Expression.Kind.IDENTIFIER) {
                return null;
            }
            return assignment;
        }
    }
}
