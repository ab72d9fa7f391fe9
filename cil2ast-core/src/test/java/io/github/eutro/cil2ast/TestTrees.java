package io.github.eutro.cil2ast;

import io.github.eutro.cil2ast.api.DecompilerSettings;
import io.github.eutro.cil2ast.api.MethodId;
import io.github.eutro.cil2ast.api.Symbol;
import io.github.eutro.cil2ast.api.TypeRef;
import io.github.eutro.cil2ast.ast.Annotations;
import io.github.eutro.cil2ast.ast.AssignmentExpression;
import io.github.eutro.cil2ast.ast.AstQueries;
import io.github.eutro.cil2ast.ast.BlockStatement;
import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ast.ExpressionStatement;
import io.github.eutro.cil2ast.ast.IdentifierExpression;
import io.github.eutro.cil2ast.ast.InvocationExpression;
import io.github.eutro.cil2ast.ast.PrimitiveExpression;
import io.github.eutro.cil2ast.ast.Statement;
import io.github.eutro.cil2ast.ast.TypeReferenceExpression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Helpers for building and searching statement trees in tests.
 */
public final class TestTrees {
    private TestTrees() {
    }

    public static MethodTree tree(DecompilerSettings settings, Statement... body) {
        DecompilerContext context = new TestMetadata().context(settings);
        return new MethodTree(new MethodId(0x06000001, "Test"),
                context,
                new Annotations(),
                new ArrayList<>(),
                new BlockStatement(Arrays.asList(body)));
    }

    public static <T extends Statement> List<T> collect(Statement root, Statement.Kind kind, Class<T> type) {
        List<T> found = new ArrayList<>();
        AstQueries.anyStatement(root, stmt -> {
            if (stmt.getKind() == kind) found.add(type.cast(stmt));
            return false;
        });
        return found;
    }

    public static IdentifierExpression id(String name) {
        return new IdentifierExpression(name);
    }

    public static Statement assign(String name, int value) {
        return assign(name, PrimitiveExpression.of(value));
    }

    public static Statement assign(String name, Expression value) {
        return new ExpressionStatement(new AssignmentExpression(id(name), value));
    }

    /**
     * A call to a static void method of no arguments, e.g. {@code Program.F();}.
     */
    public static Statement call(String name) {
        Symbol method = Symbol.method(0x0A000001, TestMetadata.PROGRAM, name,
                TypeRef.VOID, Collections.emptyList(), Collections.emptyList(), true);
        return new ExpressionStatement(new InvocationExpression(
                new TypeReferenceExpression(TestMetadata.PROGRAM), method, Collections.emptyList()));
    }

    public static String lines(String... lines) {
        return String.join("\n", lines);
    }
}
