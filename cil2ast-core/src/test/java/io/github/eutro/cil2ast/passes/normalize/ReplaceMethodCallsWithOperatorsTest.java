package io.github.eutro.cil2ast.passes.normalize;

import io.github.eutro.cil2ast.DecompilerContext;
import io.github.eutro.cil2ast.MethodTree;
import io.github.eutro.cil2ast.TestMetadata;
import io.github.eutro.cil2ast.api.ConversionOperator;
import io.github.eutro.cil2ast.api.DecompilerSettings;
import io.github.eutro.cil2ast.api.MethodId;
import io.github.eutro.cil2ast.api.NameBasedTypeResolver;
import io.github.eutro.cil2ast.api.Symbol;
import io.github.eutro.cil2ast.api.TypeRef;
import io.github.eutro.cil2ast.ast.Annotations;
import io.github.eutro.cil2ast.ast.AstPrinter;
import io.github.eutro.cil2ast.ast.BlockStatement;
import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ast.InvocationExpression;
import io.github.eutro.cil2ast.ast.PrimitiveExpression;
import io.github.eutro.cil2ast.ast.ReturnStatement;
import io.github.eutro.cil2ast.ast.TypeReferenceExpression;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.cil2ast.TestTrees.id;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

public class ReplaceMethodCallsWithOperatorsTest {
    private static final TypeRef VECTOR = TypeRef.of("Tests.Vector");

    private static Symbol operator(String name, TypeRef ret, TypeRef... params) {
        return TestMetadata.staticMethod(0x0A000020, VECTOR, name, ret, params);
    }

    private static Expression invoke(Symbol method, Expression... args) {
        return new InvocationExpression(new TypeReferenceExpression(method.getDeclaringType()),
                method, Arrays.asList(args));
    }

    private static MethodTree replace(DecompilerSettings settings, NameBasedTypeResolver resolver, Expression expr) {
        DecompilerContext context = new DecompilerContext(new TestMetadata(), resolver, settings);
        MethodTree tree = new MethodTree(new MethodId(0x06000001, "Test"), context, new Annotations(),
                new ArrayList<>(), new BlockStatement(Collections.singletonList(new ReturnStatement(expr))));
        return ReplaceMethodCallsWithOperators.INSTANCE.run(tree);
    }

    private static String replace(Expression expr) {
        return AstPrinter.print(replace(DecompilerSettings.DEFAULT, NameBasedTypeResolver.empty(), expr).getBody());
    }

    @Test
    void binaryOperatorMethod() {
        MethodTree tree = replace(DecompilerSettings.DEFAULT, NameBasedTypeResolver.empty(),
                invoke(operator("op_Addition", VECTOR, VECTOR, VECTOR), id("a"), id("b")));
        assertEquals("return a + b;", AstPrinter.print(tree.getBody()));
        Expression sum = ((ReturnStatement) tree.getBody().getStatements().get(0)).getExpression();
        assertNotNull(sum);
        assertNotNull(tree.getAnnotations().get(sum, Annotations.USER_DEFINED_OPERATOR));
    }

    @Test
    void unaryOperatorMethod() {
        assertEquals("return -a;", replace(invoke(operator("op_UnaryNegation", VECTOR, VECTOR), id("a"))));
    }

    @Test
    void incrementMethodStaysACall() {
        assertEquals("return Vector.op_Increment(a);",
                replace(invoke(operator("op_Increment", VECTOR, VECTOR), id("a"))));
    }

    @Test
    void conversionOperatorBecomesCast() {
        Symbol explicit = operator("op_Explicit", TypeRef.INT32, VECTOR);
        NameBasedTypeResolver resolver = NameBasedTypeResolver.withConversions(Collections.singletonList(
                new ConversionOperator(ConversionOperator.Kind.EXPLICIT, explicit)));
        MethodTree tree = replace(DecompilerSettings.DEFAULT, resolver, invoke(explicit, id("v")));
        assertEquals("return (int)v;", AstPrinter.print(tree.getBody()));

        // unknown to the resolver
        assertEquals("return Vector.op_Explicit(v);", replace(invoke(explicit, id("v"))));
    }

    @Test
    void stringConcat() {
        Symbol concat = TestMetadata.staticMethod(0x0A000021, TypeRef.STRING, "Concat",
                TypeRef.STRING, TypeRef.STRING, TypeRef.STRING, TypeRef.STRING);
        Expression call = invoke(concat, id("a"), new PrimitiveExpression("-"), id("b"));
        assertEquals("return a + \"-\" + b;", replace(call));

        DecompilerSettings noConcat = DecompilerSettings.builder().setStringConcat(false).build();
        assertEquals("return string.Concat(a, \"-\", b);",
                AstPrinter.print(replace(noConcat, NameBasedTypeResolver.empty(), call).getBody()));
    }

    @Test
    void objectConcatNeedsAStringOperand() {
        Symbol concat = TestMetadata.staticMethod(0x0A000022, TypeRef.STRING, "Concat",
                TypeRef.STRING, TypeRef.OBJECT, TypeRef.OBJECT);
        assertEquals("return string.Concat(a, b);", replace(invoke(concat, id("a"), id("b"))));
        assertEquals("return \"n=\" + b;", replace(invoke(concat, new PrimitiveExpression("n="), id("b"))));
    }

    @Test
    void nestedCallsAreReplaced() {
        Symbol add = operator("op_Addition", VECTOR, VECTOR, VECTOR);
        Symbol mul = operator("op_Multiply", VECTOR, VECTOR, VECTOR);
        assertEquals("return (a + b) * c;", replace(invoke(mul, invoke(add, id("a"), id("b")), id("c"))));
    }
}
