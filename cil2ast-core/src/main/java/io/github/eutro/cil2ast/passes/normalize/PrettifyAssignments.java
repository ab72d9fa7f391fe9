package io.github.eutro.cil2ast.passes.normalize;

import io.github.eutro.cil2ast.MethodTree;
import io.github.eutro.cil2ast.ast.Annotations;
import io.github.eutro.cil2ast.ast.AssignmentExpression;
import io.github.eutro.cil2ast.ast.AssignmentOperatorType;
import io.github.eutro.cil2ast.ast.AstRewriter;
import io.github.eutro.cil2ast.ast.BinaryOperatorExpression;
import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ast.ExpressionStatement;
import io.github.eutro.cil2ast.ast.ForStatement;
import io.github.eutro.cil2ast.ast.IdentifierExpression;
import io.github.eutro.cil2ast.ast.IndexerExpression;
import io.github.eutro.cil2ast.ast.MemberReferenceExpression;
import io.github.eutro.cil2ast.ast.PrimitiveExpression;
import io.github.eutro.cil2ast.ast.Statement;
import io.github.eutro.cil2ast.ast.TypeReferenceExpression;
import io.github.eutro.cil2ast.ast.UnaryOperatorExpression;
import io.github.eutro.cil2ast.ast.UnaryOperatorType;
import io.github.eutro.cil2ast.passes.InPlaceIRPass;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns {@code x = x op y} into {@code x op= y}, and, if enabled, {@code x += 1} into {@code x++}
 * where the value of the assignment is unused.
 * <p>
 * Only targets that can be evaluated twice without side effects are combined,
 * and never through a user-defined operator.
 */
public class PrettifyAssignments implements InPlaceIRPass<MethodTree> {
    /**
     * A singleton instance of this pass.
     */
    public static final PrettifyAssignments INSTANCE = new PrettifyAssignments();

    @Override
    public void runInPlace(MethodTree tree) {
        Prettifier prettifier = new Prettifier(tree.getAnnotations(),
                tree.getContext().getSettings().isIntroduceIncrementAndDecrement());
        tree.setBody(prettifier.rewriteBlock(tree.getBody()));
    }

    /**
     * Whether an expression denotes a storage location that can be read and written without side effects.
     *
     * @param expr The expression.
     * @return Whether evaluating it twice is the same as evaluating it once.
     */
    static boolean isSideEffectFree(Expression expr) {
        switch (expr.getKind()) {
            case IDENTIFIER:
            case THIS_REFERENCE:
            case BASE_REFERENCE:
            case TYPE_REFERENCE:
            case PRIMITIVE:
                return true;
            case MEMBER_REFERENCE:
                return isSideEffectFree(((MemberReferenceExpression) expr).getTarget());
            case INDEXER: {
                IndexerExpression indexer = (IndexerExpression) expr;
                return isSideEffectFree(indexer.getTarget()) && isSideEffectFree(indexer.getIndex());
            }
            default:
                return false;
        }
    }

    /**
     * Whether two side-effect-free expressions denote the same location.
     *
     * @param a The first expression.
     * @param b The second expression.
     * @return Whether they are structurally equal.
     */
    static boolean sameLocation(Expression a, Expression b) {
        if (a.getKind() != b.getKind()) return false;
        switch (a.getKind()) {
            case IDENTIFIER:
                return IdentifierExpression.isNamed(b, ((IdentifierExpression) a).getName());
            case THIS_REFERENCE:
            case BASE_REFERENCE:
                return true;
            case TYPE_REFERENCE:
                return ((TypeReferenceExpression) a).getType().equals(((TypeReferenceExpression) b).getType());
            case PRIMITIVE:
                return a.equals(b);
            case MEMBER_REFERENCE: {
                MemberReferenceExpression ma = (MemberReferenceExpression) a;
                MemberReferenceExpression mb = (MemberReferenceExpression) b;
                return Objects.equals(ma.getMember(), mb.getMember()) && sameLocation(ma.getTarget(), mb.getTarget());
            }
            case INDEXER: {
                IndexerExpression ia = (IndexerExpression) a;
                IndexerExpression ib = (IndexerExpression) b;
                return sameLocation(ia.getTarget(), ib.getTarget()) && sameLocation(ia.getIndex(), ib.getIndex());
            }
            default:
                return false;
        }
    }

    private static final class Prettifier extends AstRewriter {
        private final boolean incrementDecrement;

        Prettifier(Annotations annotations, boolean incrementDecrement) {
            super(annotations);
            this.incrementDecrement = incrementDecrement;
        }

        @Override
        public Expression rewrite(Expression expr) {
            Expression rewritten = rewriteChildren(expr);
            if (rewritten.getKind() != Expression.Kind.ASSIGNMENT) return rewritten;
            AssignmentExpression assignment = (AssignmentExpression) rewritten;
            if (assignment.getOperator() != AssignmentOperatorType.ASSIGN
                    || assignment.getRight().getKind() != Expression.Kind.BINARY_OPERATOR
                    || !isSideEffectFree(assignment.getLeft())) {
                return rewritten;
            }
            BinaryOperatorExpression binary = (BinaryOperatorExpression) assignment.getRight();
            AssignmentOperatorType compound = AssignmentOperatorType.compoundOf(binary.getOperator());
            if (compound == null
                    || annotations.isUserDefinedOperator(binary)
                    || !sameLocation(assignment.getLeft(), binary.getLeft())) {
                return rewritten;
            }
            AssignmentExpression combined = new AssignmentExpression(assignment.getLeft(), compound, binary.getRight());
            annotations.copy(expr, combined);
            return combined;
        }

        @Override
        public Statement rewrite(Statement stmt) {
            Statement rewritten = rewriteChildren(stmt);
            if (!incrementDecrement) return rewritten;
            switch (rewritten.getKind()) {
                case EXPRESSION: {
                    ExpressionStatement es = (ExpressionStatement) rewritten;
                    Expression step = toStep(es.getExpression());
                    return step == es.getExpression() ? rewritten : keep(stmt, es.withExpression(step));
                }
                case FOR: {
                    ForStatement loop = (ForStatement) rewritten;
                    List<Expression> iterators = new ArrayList<>(loop.getIterators().size());
                    boolean changed = false;
                    for (Expression iterator : loop.getIterators()) {
                        Expression step = toStep(iterator);
                        changed |= step != iterator;
                        iterators.add(step);
                    }
                    if (!changed) return rewritten;
                    return keep(stmt, loop.with(loop.getInitializers(), loop.getCondition(), iterators, loop.getBody()));
                }
                default:
                    return rewritten;
            }
        }

        private Statement keep(Statement old, Statement replacement) {
            annotations.copy(old, replacement);
            return replacement;
        }

        // only valid where the value is discarded
        private Expression toStep(Expression expr) {
            if (expr.getKind() != Expression.Kind.ASSIGNMENT) return expr;
            AssignmentExpression assignment = (AssignmentExpression) expr;
            if (!PrimitiveExpression.isInteger(assignment.getRight(), 1)) return expr;
            UnaryOperatorType op;
            switch (assignment.getOperator()) {
                case ADD:
                    op = UnaryOperatorType.POST_INCREMENT;
                    break;
                case SUBTRACT:
                    op = UnaryOperatorType.POST_DECREMENT;
                    break;
                default:
                    return expr;
            }
            Expression step = new UnaryOperatorExpression(op, assignment.getLeft());
            annotations.copy(expr, step);
            return step;
        }
    }
}
