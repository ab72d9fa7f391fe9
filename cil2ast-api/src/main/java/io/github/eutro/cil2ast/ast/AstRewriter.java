package io.github.eutro.cil2ast.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A bottom-up tree transformer.
 * <p>
 * By default, every method rebuilds its node from rewritten children, returning the original node
 * if no child changed. Subclasses override {@link #rewrite(Statement)}, {@link #rewrite(Expression)}
 * or {@link #rewriteStatements(List)} and call {@link #rewriteChildren(Statement)} or
 * {@link #rewriteChildren(Expression)} to recurse. Rebuilt nodes inherit the annotations of the nodes they replace.
 */
public class AstRewriter {
    protected final Annotations annotations;

    public AstRewriter(Annotations annotations) {
        this.annotations = annotations;
    }

    public Statement rewrite(Statement stmt) {
        return rewriteChildren(stmt);
    }

    public Expression rewrite(Expression expr) {
        return rewriteChildren(expr);
    }

    /**
     * Rewrite a block-typed child, wrapping the result in a block if it is no longer one.
     *
     * @param block The block.
     * @return The rewritten block.
     */
    public BlockStatement rewriteBlock(BlockStatement block) {
        return BlockStatement.wrap(rewrite(block));
    }

    /**
     * Rewrite a statement list, such as the contents of a block or a switch section.
     * Overriding this allows one statement to be replaced by several, or merged with its neighbours.
     *
     * @param statements The statements.
     * @return The rewritten statements.
     */
    protected List<Statement> rewriteStatements(List<Statement> statements) {
        List<Statement> result = new ArrayList<>(statements.size());
        for (Statement statement : statements) {
            result.add(rewrite(statement));
        }
        return result;
    }

    protected SwitchSection rewriteSection(SwitchSection section) {
        return section.withStatements(rewriteStatements(section.getStatements()));
    }

    private List<Expression> rewriteExpressions(List<Expression> expressions) {
        List<Expression> result = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            result.add(rewrite(expression));
        }
        return result;
    }

    private <T> T keep(Object old, T rebuilt) {
        annotations.copy(old, rebuilt);
        return rebuilt;
    }

    protected final Statement rewriteChildren(Statement stmt) {
        switch (stmt.getKind()) {
            case BLOCK: {
                BlockStatement block = (BlockStatement) stmt;
                return keep(stmt, block.withStatements(rewriteStatements(block.getStatements())));
            }
            case EXPRESSION: {
                ExpressionStatement es = (ExpressionStatement) stmt;
                return keep(stmt, es.withExpression(rewrite(es.getExpression())));
            }
            case VARIABLE_DECLARATION: {
                VariableDeclarationStatement decl = (VariableDeclarationStatement) stmt;
                Expression init = decl.getInitializer();
                return keep(stmt, decl.withInitializer(init == null ? null : rewrite(init)));
            }
            case LOCAL_FUNCTION_DECLARATION: {
                LocalFunctionDeclarationStatement fn = (LocalFunctionDeclarationStatement) stmt;
                return keep(stmt, fn.withBody(rewriteBlock(fn.getBody())));
            }
            case IF_ELSE: {
                IfElseStatement ifElse = (IfElseStatement) stmt;
                Statement falseStatement = ifElse.getFalseStatement();
                return keep(stmt, ifElse.with(
                        rewrite(ifElse.getCondition()),
                        rewrite(ifElse.getTrueStatement()),
                        falseStatement == null ? null : rewrite(falseStatement)));
            }
            case WHILE: {
                WhileStatement loop = (WhileStatement) stmt;
                return keep(stmt, loop.with(rewrite(loop.getCondition()), rewrite(loop.getBody())));
            }
            case DO_WHILE: {
                DoWhileStatement loop = (DoWhileStatement) stmt;
                return keep(stmt, loop.with(rewrite(loop.getBody()), rewrite(loop.getCondition())));
            }
            case FOR: {
                ForStatement loop = (ForStatement) stmt;
                List<Statement> initializers = new ArrayList<>();
                for (Statement initializer : loop.getInitializers()) {
                    initializers.add(rewrite(initializer));
                }
                Expression condition = loop.getCondition();
                return keep(stmt, loop.with(
                        initializers,
                        condition == null ? null : rewrite(condition),
                        rewriteExpressions(loop.getIterators()),
                        rewrite(loop.getBody())));
            }
            case SWITCH: {
                SwitchStatement sw = (SwitchStatement) stmt;
                List<SwitchSection> sections = new ArrayList<>();
                for (SwitchSection section : sw.getSections()) {
                    sections.add(rewriteSection(section));
                }
                return keep(stmt, sw.with(rewrite(sw.getExpression()), sections));
            }
            case RETURN: {
                ReturnStatement ret = (ReturnStatement) stmt;
                Expression value = ret.getExpression();
                return keep(stmt, ret.withExpression(value == null ? null : rewrite(value)));
            }
            case THROW: {
                ThrowStatement thr = (ThrowStatement) stmt;
                Expression value = thr.getExpression();
                return keep(stmt, thr.withExpression(value == null ? null : rewrite(value)));
            }
            case TRY_CATCH: {
                TryCatchStatement tc = (TryCatchStatement) stmt;
                List<CatchClause> clauses = new ArrayList<>();
                for (CatchClause clause : tc.getCatchClauses()) {
                    clauses.add(clause.withBody(rewriteBlock(clause.getBody())));
                }
                BlockStatement finallyBlock = tc.getFinallyBlock();
                return keep(stmt, tc.with(
                        rewriteBlock(tc.getTryBlock()),
                        clauses,
                        finallyBlock == null ? null : rewriteBlock(finallyBlock)));
            }
            case EMPTY:
            case COMMENT:
            case BREAK:
            case CONTINUE:
            case GOTO:
            case GOTO_CASE:
            case GOTO_DEFAULT:
            case LABEL:
                return stmt;
            default:
                throw new IllegalStateException("unknown statement kind " + stmt.getKind());
        }
    }

    protected final Expression rewriteChildren(Expression expr) {
        switch (expr.getKind()) {
            case MEMBER_REFERENCE: {
                MemberReferenceExpression member = (MemberReferenceExpression) expr;
                return keep(expr, member.withTarget(rewrite(member.getTarget())));
            }
            case INDEXER: {
                IndexerExpression indexer = (IndexerExpression) expr;
                return keep(expr, indexer.with(rewrite(indexer.getTarget()), rewrite(indexer.getIndex())));
            }
            case INVOCATION: {
                InvocationExpression invocation = (InvocationExpression) expr;
                return keep(expr, invocation.with(
                        rewrite(invocation.getTarget()),
                        rewriteExpressions(invocation.getArguments())));
            }
            case OBJECT_CREATE: {
                ObjectCreateExpression create = (ObjectCreateExpression) expr;
                return keep(expr, create.withArguments(rewriteExpressions(create.getArguments())));
            }
            case BINARY_OPERATOR: {
                BinaryOperatorExpression binary = (BinaryOperatorExpression) expr;
                return keep(expr, binary.with(rewrite(binary.getLeft()), rewrite(binary.getRight())));
            }
            case UNARY_OPERATOR: {
                UnaryOperatorExpression unary = (UnaryOperatorExpression) expr;
                return keep(expr, unary.withOperand(rewrite(unary.getOperand())));
            }
            case ASSIGNMENT: {
                AssignmentExpression assignment = (AssignmentExpression) expr;
                return keep(expr, assignment.with(rewrite(assignment.getLeft()), rewrite(assignment.getRight())));
            }
            case CAST: {
                CastExpression cast = (CastExpression) expr;
                return keep(expr, cast.withExpression(rewrite(cast.getExpression())));
            }
            case SWITCH: {
                SwitchExpression sw = (SwitchExpression) expr;
                List<SwitchExpressionSection> sections = new ArrayList<>();
                for (SwitchExpressionSection section : sw.getSections()) {
                    sections.add(section.withBody(rewrite(section.getBody())));
                }
                return keep(expr, sw.with(rewrite(sw.getGoverning()), sections));
            }
            case IDENTIFIER:
            case THIS_REFERENCE:
            case BASE_REFERENCE:
            case PRIMITIVE:
            case TYPE_REFERENCE:
            case OUT_VAR_DECLARATION:
                return expr;
            default:
                throw new IllegalStateException("unknown expression kind " + expr.getKind());
        }
    }
}
