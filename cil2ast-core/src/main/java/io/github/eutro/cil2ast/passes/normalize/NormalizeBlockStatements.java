package io.github.eutro.cil2ast.passes.normalize;

import io.github.eutro.cil2ast.MethodTree;
import io.github.eutro.cil2ast.ast.Annotations;
import io.github.eutro.cil2ast.ast.AstRewriter;
import io.github.eutro.cil2ast.ast.BlockStatement;
import io.github.eutro.cil2ast.ast.DoWhileStatement;
import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ast.ForStatement;
import io.github.eutro.cil2ast.ast.IfElseStatement;
import io.github.eutro.cil2ast.ast.Statement;
import io.github.eutro.cil2ast.ast.WhileStatement;
import io.github.eutro.cil2ast.passes.InPlaceIRPass;
import org.jetbrains.annotations.Nullable;

/**
 * Decides where embedded statements get braces.
 * <p>
 * An {@code else} holding only another {@code if} always becomes {@code else if}. Loop bodies
 * and both branches of an {@code if} with an {@code else} are always braced. The branch of a lone
 * {@code if} loses its braces if it holds a single simple statement, unless braces are always wanted.
 */
public class NormalizeBlockStatements implements InPlaceIRPass<MethodTree> {
    /**
     * A singleton instance of this pass.
     */
    public static final NormalizeBlockStatements INSTANCE = new NormalizeBlockStatements();

    @Override
    public void runInPlace(MethodTree tree) {
        Normalizer normalizer = new Normalizer(tree.getAnnotations(),
                tree.getContext().getSettings().isAlwaysUseBraces());
        tree.setBody(normalizer.rewriteBlock(tree.getBody()));
    }

    private static final class Normalizer extends AstRewriter {
        private final boolean alwaysUseBraces;

        Normalizer(Annotations annotations, boolean alwaysUseBraces) {
            super(annotations);
            this.alwaysUseBraces = alwaysUseBraces;
        }

        @Override
        public Expression rewrite(Expression expr) {
            return expr;
        }

        @Override
        public Statement rewrite(Statement stmt) {
            Statement rewritten = rewriteChildren(stmt);
            Statement result;
            switch (rewritten.getKind()) {
                case IF_ELSE:
                    result = normalizeIf((IfElseStatement) rewritten);
                    break;
                case WHILE: {
                    WhileStatement loop = (WhileStatement) rewritten;
                    result = loop.with(loop.getCondition(), BlockStatement.wrap(loop.getBody()));
                    break;
                }
                case DO_WHILE: {
                    DoWhileStatement loop = (DoWhileStatement) rewritten;
                    result = loop.with(BlockStatement.wrap(loop.getBody()), loop.getCondition());
                    break;
                }
                case FOR: {
                    ForStatement loop = (ForStatement) rewritten;
                    result = loop.with(loop.getInitializers(), loop.getCondition(), loop.getIterators(),
                            BlockStatement.wrap(loop.getBody()));
                    break;
                }
                default:
                    return rewritten;
            }
            if (result != stmt) annotations.copy(stmt, result);
            return result;
        }

        private Statement normalizeIf(IfElseStatement ifElse) {
            Statement falseStatement = ifElse.getFalseStatement();
            if (falseStatement != null) {
                IfElseStatement elseIf = soleIf(falseStatement);
                Statement normalizedElse = elseIf != null ? elseIf : BlockStatement.wrap(falseStatement);
                return ifElse.with(ifElse.getCondition(), BlockStatement.wrap(ifElse.getTrueStatement()), normalizedElse);
            }
            Statement trueStatement = ifElse.getTrueStatement();
            if (alwaysUseBraces) {
                return ifElse.with(ifElse.getCondition(), BlockStatement.wrap(trueStatement), null);
            }
            if (trueStatement.getKind() == Statement.Kind.BLOCK) {
                BlockStatement block = (BlockStatement) trueStatement;
                if (block.getStatements().size() == 1 && isEmbeddable(block.getStatements().get(0))) {
                    return ifElse.with(ifElse.getCondition(), block.getStatements().get(0), null);
                }
                return ifElse;
            }
            return isEmbeddable(trueStatement)
                    ? ifElse
                    : ifElse.with(ifElse.getCondition(), BlockStatement.wrap(trueStatement), null);
        }

        private static @Nullable IfElseStatement soleIf(Statement stmt) {
            if (stmt.getKind() == Statement.Kind.IF_ELSE) return (IfElseStatement) stmt;
            if (stmt.getKind() != Statement.Kind.BLOCK) return null;
            BlockStatement block = (BlockStatement) stmt;
            if (block.getStatements().size() != 1) return null;
            Statement inner = block.getStatements().get(0);
            return inner.getKind() == Statement.Kind.IF_ELSE ? (IfElseStatement) inner : null;
        }

        // an if directly inside an unbraced if would capture a later else
        private static boolean isEmbeddable(Statement stmt) {
            switch (stmt.getKind()) {
                case VARIABLE_DECLARATION:
                case LOCAL_FUNCTION_DECLARATION:
                case LABEL:
                case BLOCK:
                case IF_ELSE:
                case EMPTY:
                    return false;
                default:
                    return true;
            }
        }
    }
}
