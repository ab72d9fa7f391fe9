package io.github.eutro.cil2ast.ast;

import io.github.eutro.cil2ast.api.Symbol;
import io.github.eutro.cil2ast.api.TypeRef;

import java.util.List;

/**
 * Renders trees as C#-like text, one statement per line with four-space indentation.
 * <p>
 * This is a debug rendering, used by {@code toString()} and by tests; it makes no attempt
 * at being compilable.
 */
public final class AstPrinter {
    private static final String INDENT = "    ";
    private static final int PREC_ASSIGNMENT = 1;
    private static final int PREC_SWITCH = 14;
    private static final int PREC_UNARY = 15;
    private static final int PREC_PRIMARY = 16;

    private final StringBuilder sb = new StringBuilder();
    private int indent = 0;

    private AstPrinter() {
    }

    /**
     * Render a statement. A block renders as its statements, without surrounding braces.
     *
     * @param stmt The statement.
     * @return The rendering, without a trailing newline.
     */
    public static String print(Statement stmt) {
        AstPrinter printer = new AstPrinter();
        if (stmt.getKind() == Statement.Kind.BLOCK) {
            printer.statements(((BlockStatement) stmt).getStatements());
        } else {
            printer.statement(stmt);
        }
        return printer.finish();
    }

    public static String print(Expression expr) {
        AstPrinter printer = new AstPrinter();
        printer.expression(expr, 0);
        return printer.sb.toString();
    }

    /**
     * Quote a string as a C# literal.
     *
     * @param s The string.
     * @return The literal.
     */
    public static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case '\0':
                    sb.append("\\0");
                    break;
                default:
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append('"').toString();
    }

    private String finish() {
        int len = sb.length();
        if (len > 0 && sb.charAt(len - 1) == '\n') sb.setLength(len - 1);
        return sb.toString();
    }

    private void line(String text) {
        startLine();
        sb.append(text).append('\n');
    }

    private void startLine() {
        for (int i = 0; i < indent; i++) sb.append(INDENT);
    }

    private void statements(List<Statement> statements) {
        for (Statement statement : statements) {
            statement(statement);
        }
    }

    private void braced(List<Statement> statements) {
        sb.append("{\n");
        indent++;
        statements(statements);
        indent--;
        startLine();
        sb.append('}');
    }

    /**
     * Print an embedded statement after a header such as {@code if (c)}; the header is already on the line.
     * Returns whether the statement ended with a closing brace on the current line.
     */
    private boolean embedded(Statement body) {
        if (body.getKind() == Statement.Kind.BLOCK) {
            sb.append(' ');
            braced(((BlockStatement) body).getStatements());
            return true;
        }
        sb.append('\n');
        indent++;
        statement(body);
        indent--;
        return false;
    }

    private void statement(Statement stmt) {
        switch (stmt.getKind()) {
            case BLOCK:
                startLine();
                braced(((BlockStatement) stmt).getStatements());
                sb.append('\n');
                break;
            case EXPRESSION:
                startLine();
                expression(((ExpressionStatement) stmt).getExpression(), 0);
                sb.append(";\n");
                break;
            case EMPTY:
                line(";");
                break;
            case COMMENT:
                line("// " + ((CommentStatement) stmt).getText());
                break;
            case VARIABLE_DECLARATION: {
                VariableDeclarationStatement decl = (VariableDeclarationStatement) stmt;
                startLine();
                variableDeclaration(decl);
                sb.append(";\n");
                break;
            }
            case LOCAL_FUNCTION_DECLARATION: {
                LocalFunctionDeclarationStatement fn = (LocalFunctionDeclarationStatement) stmt;
                startLine();
                sb.append(fn.getReturnType()).append(' ').append(fn.getName()).append("() ");
                braced(fn.getBody().getStatements());
                sb.append('\n');
                break;
            }
            case IF_ELSE:
                startLine();
                ifElse((IfElseStatement) stmt);
                break;
            case WHILE: {
                WhileStatement loop = (WhileStatement) stmt;
                startLine();
                sb.append("while (");
                expression(loop.getCondition(), 0);
                sb.append(')');
                if (embedded(loop.getBody())) sb.append('\n');
                break;
            }
            case DO_WHILE: {
                DoWhileStatement loop = (DoWhileStatement) stmt;
                startLine();
                sb.append("do");
                if (embedded(loop.getBody())) {
                    sb.append(' ');
                } else {
                    startLine();
                }
                sb.append("while (");
                expression(loop.getCondition(), 0);
                sb.append(");\n");
                break;
            }
            case FOR: {
                ForStatement loop = (ForStatement) stmt;
                startLine();
                sb.append("for (");
                List<Statement> initializers = loop.getInitializers();
                for (int i = 0; i < initializers.size(); i++) {
                    if (i != 0) sb.append(", ");
                    forInitializer(initializers.get(i));
                }
                sb.append(';');
                if (loop.getCondition() != null) {
                    sb.append(' ');
                    expression(loop.getCondition(), 0);
                }
                sb.append(';');
                List<Expression> iterators = loop.getIterators();
                for (int i = 0; i < iterators.size(); i++) {
                    sb.append(i == 0 ? " " : ", ");
                    expression(iterators.get(i), 0);
                }
                sb.append(')');
                if (embedded(loop.getBody())) sb.append('\n');
                break;
            }
            case SWITCH: {
                SwitchStatement sw = (SwitchStatement) stmt;
                startLine();
                sb.append("switch (");
                expression(sw.getExpression(), 0);
                sb.append(") {\n");
                indent++;
                for (SwitchSection section : sw.getSections()) {
                    for (CaseLabel label : section.getLabels()) {
                        line(label.toString());
                    }
                    indent++;
                    statements(section.getStatements());
                    indent--;
                }
                indent--;
                line("}");
                break;
            }
            case BREAK:
                line("break;");
                break;
            case CONTINUE:
                line("continue;");
                break;
            case RETURN: {
                Expression value = ((ReturnStatement) stmt).getExpression();
                startLine();
                sb.append("return");
                if (value != null) {
                    sb.append(' ');
                    expression(value, 0);
                }
                sb.append(";\n");
                break;
            }
            case THROW: {
                Expression value = ((ThrowStatement) stmt).getExpression();
                startLine();
                sb.append("throw");
                if (value != null) {
                    sb.append(' ');
                    expression(value, 0);
                }
                sb.append(";\n");
                break;
            }
            case GOTO:
                line("goto " + ((GotoStatement) stmt).getLabel() + ";");
                break;
            case GOTO_CASE:
                line("goto case " + ((GotoCaseStatement) stmt).getLabel().valueString() + ";");
                break;
            case GOTO_DEFAULT:
                line("goto default;");
                break;
            case LABEL:
                line(((LabelStatement) stmt).getLabel() + ":");
                break;
            case TRY_CATCH: {
                TryCatchStatement tc = (TryCatchStatement) stmt;
                startLine();
                sb.append("try ");
                braced(tc.getTryBlock().getStatements());
                for (CatchClause clause : tc.getCatchClauses()) {
                    sb.append(" catch ");
                    if (clause.getType() != null) {
                        sb.append('(').append(clause.getType());
                        if (clause.getVariableName() != null) {
                            sb.append(' ').append(clause.getVariableName());
                        }
                        sb.append(") ");
                    }
                    braced(clause.getBody().getStatements());
                }
                if (tc.getFinallyBlock() != null) {
                    sb.append(" finally ");
                    braced(tc.getFinallyBlock().getStatements());
                }
                sb.append('\n');
                break;
            }
            default:
                throw new IllegalStateException("unknown statement kind " + stmt.getKind());
        }
    }

    private void ifElse(IfElseStatement stmt) {
        sb.append("if (");
        expression(stmt.getCondition(), 0);
        sb.append(')');
        boolean braced = embedded(stmt.getTrueStatement());
        Statement falseStatement = stmt.getFalseStatement();
        if (falseStatement == null) {
            if (braced) sb.append('\n');
            return;
        }
        if (braced) {
            sb.append(" else");
        } else {
            startLine();
            sb.append("else");
        }
        if (falseStatement.getKind() == Statement.Kind.IF_ELSE) {
            sb.append(' ');
            ifElse((IfElseStatement) falseStatement);
        } else if (embedded(falseStatement)) {
            sb.append('\n');
        }
    }

    private void variableDeclaration(VariableDeclarationStatement decl) {
        sb.append(decl.getType()).append(' ').append(decl.getName());
        if (decl.getInitializer() != null) {
            sb.append(" = ");
            expression(decl.getInitializer(), PREC_ASSIGNMENT);
        }
    }

    private void forInitializer(Statement init) {
        switch (init.getKind()) {
            case VARIABLE_DECLARATION:
                variableDeclaration((VariableDeclarationStatement) init);
                break;
            case EXPRESSION:
                expression(((ExpressionStatement) init).getExpression(), 0);
                break;
            default:
                throw new IllegalStateException("not a for initializer: " + init.getKind());
        }
    }

    private static int precedence(Expression expr) {
        switch (expr.getKind()) {
            case BINARY_OPERATOR:
                return ((BinaryOperatorExpression) expr).getOperator().getPrecedence();
            case UNARY_OPERATOR:
                return ((UnaryOperatorExpression) expr).getOperator().isPostfix() ? PREC_PRIMARY : PREC_UNARY;
            case CAST:
                return PREC_UNARY;
            case ASSIGNMENT:
                return PREC_ASSIGNMENT;
            case SWITCH:
                return PREC_SWITCH;
            default:
                return PREC_PRIMARY;
        }
    }

    private void expression(Expression expr, int minPrecedence) {
        boolean parens = precedence(expr) < minPrecedence;
        if (parens) sb.append('(');
        expression0(expr);
        if (parens) sb.append(')');
    }

    private void arguments(List<Expression> args) {
        sb.append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i != 0) sb.append(", ");
            expression(args.get(i), PREC_ASSIGNMENT);
        }
        sb.append(')');
    }

    private void memberTarget(Expression target, Symbol member) {
        if (target.getKind() == Expression.Kind.TYPE_REFERENCE) {
            sb.append(((TypeReferenceExpression) target).getType());
        } else {
            expression(target, PREC_PRIMARY);
        }
        sb.append('.').append(member.getName());
    }

    private void literal(Object value) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof String) {
            sb.append(quote((String) value));
        } else if (value instanceof Double) {
            double d = (Double) value;
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                sb.append((long) d).append(".0");
            } else {
                sb.append(d);
            }
        } else if (value instanceof Long) {
            sb.append(value).append('L');
        } else {
            sb.append(value);
        }
    }

    private void expression0(Expression expr) {
        switch (expr.getKind()) {
            case IDENTIFIER:
                sb.append(((IdentifierExpression) expr).getName());
                break;
            case THIS_REFERENCE:
                sb.append("this");
                break;
            case BASE_REFERENCE:
                sb.append("base");
                break;
            case PRIMITIVE:
                literal(((PrimitiveExpression) expr).getValue());
                break;
            case TYPE_REFERENCE:
                sb.append(((TypeReferenceExpression) expr).getType());
                break;
            case MEMBER_REFERENCE: {
                MemberReferenceExpression member = (MemberReferenceExpression) expr;
                memberTarget(member.getTarget(), member.getMember());
                break;
            }
            case INDEXER: {
                IndexerExpression indexer = (IndexerExpression) expr;
                expression(indexer.getTarget(), PREC_PRIMARY);
                sb.append('[');
                expression(indexer.getIndex(), 0);
                sb.append(']');
                break;
            }
            case INVOCATION: {
                InvocationExpression invocation = (InvocationExpression) expr;
                memberTarget(invocation.getTarget(), invocation.getMethod());
                arguments(invocation.getArguments());
                break;
            }
            case OBJECT_CREATE: {
                ObjectCreateExpression create = (ObjectCreateExpression) expr;
                TypeRef type = create.getConstructor().getDeclaringType();
                sb.append("new ").append(type == null ? "?" : type.toString());
                arguments(create.getArguments());
                break;
            }
            case BINARY_OPERATOR: {
                BinaryOperatorExpression binary = (BinaryOperatorExpression) expr;
                int prec = binary.getOperator().getPrecedence();
                expression(binary.getLeft(), prec);
                sb.append(' ').append(binary.getOperator().getToken()).append(' ');
                expression(binary.getRight(), prec + 1);
                break;
            }
            case UNARY_OPERATOR: {
                UnaryOperatorExpression unary = (UnaryOperatorExpression) expr;
                if (unary.getOperator().isPostfix()) {
                    expression(unary.getOperand(), PREC_PRIMARY);
                    sb.append(unary.getOperator().getToken());
                } else {
                    sb.append(unary.getOperator().getToken());
                    expression(unary.getOperand(), PREC_UNARY);
                }
                break;
            }
            case ASSIGNMENT: {
                AssignmentExpression assignment = (AssignmentExpression) expr;
                expression(assignment.getLeft(), PREC_UNARY);
                sb.append(' ').append(assignment.getOperator().getToken()).append(' ');
                expression(assignment.getRight(), PREC_ASSIGNMENT);
                break;
            }
            case CAST: {
                CastExpression cast = (CastExpression) expr;
                sb.append('(').append(cast.getType()).append(')');
                expression(cast.getExpression(), PREC_UNARY);
                break;
            }
            case OUT_VAR_DECLARATION: {
                OutVarDeclarationExpression out = (OutVarDeclarationExpression) expr;
                sb.append("out ").append(out.getType()).append(' ').append(out.getName());
                break;
            }
            case SWITCH: {
                SwitchExpression sw = (SwitchExpression) expr;
                expression(sw.getGoverning(), PREC_PRIMARY);
                sb.append(" switch {\n");
                indent++;
                List<SwitchExpressionSection> sections = sw.getSections();
                for (int i = 0; i < sections.size(); i++) {
                    SwitchExpressionSection section = sections.get(i);
                    startLine();
                    List<CaseLabel> labels = section.getLabels();
                    for (int j = 0; j < labels.size(); j++) {
                        if (j != 0) sb.append(" or ");
                        CaseLabel label = labels.get(j);
                        sb.append(label.isDefault() ? "_" : label.valueString());
                    }
                    sb.append(" => ");
                    expression(section.getBody(), PREC_ASSIGNMENT);
                    sb.append(i == sections.size() - 1 ? "\n" : ",\n");
                }
                indent--;
                startLine();
                sb.append('}');
                break;
            }
            default:
                throw new IllegalStateException("unknown expression kind " + expr.getKind());
        }
    }
}
