package io.github.eutro.cil2ast.passes.structure;

import io.github.eutro.cil2ast.IlBuilder;
import io.github.eutro.cil2ast.MethodResult;
import io.github.eutro.cil2ast.TestMetadata;
import io.github.eutro.cil2ast.TestTrees;
import io.github.eutro.cil2ast.api.ErrorKind;
import io.github.eutro.cil2ast.api.ExceptionRegion;
import io.github.eutro.cil2ast.api.MethodId;
import io.github.eutro.cil2ast.api.OpCode;
import io.github.eutro.cil2ast.api.TypeRef;
import io.github.eutro.cil2ast.ast.AstPrinter;
import io.github.eutro.cil2ast.ast.BreakStatement;
import io.github.eutro.cil2ast.ast.ContinueStatement;
import io.github.eutro.cil2ast.ast.ReturnStatement;
import io.github.eutro.cil2ast.ast.Statement;
import io.github.eutro.cil2ast.ast.SwitchStatement;
import io.github.eutro.cil2ast.ast.TryCatchStatement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StructureControlFlowTest {
    private static final int PRINT = 0x0A000001;
    private static final int F = 0x0A000002;
    private static final int G = 0x0A000003;
    private static final int H = 0x0A000004;

    private TestMetadata metadata;

    @BeforeEach
    void setUp() {
        metadata = new TestMetadata()
                .symbol(TestMetadata.staticMethod(PRINT, TestMetadata.PROGRAM, "Print", TypeRef.VOID, TypeRef.INT32))
                .symbol(TestMetadata.staticMethod(F, TestMetadata.PROGRAM, "F", TypeRef.VOID))
                .symbol(TestMetadata.staticMethod(G, TestMetadata.PROGRAM, "G", TypeRef.VOID))
                .symbol(TestMetadata.staticMethod(H, TestMetadata.PROGRAM, "H", TypeRef.BOOLEAN));
    }

    private String decompile(MethodId method) {
        MethodResult result = metadata.decompile(method);
        assertTrue(result.isSuccess(), () -> String.valueOf(result.getFailure()));
        return AstPrinter.print(result.getBody());
    }

    @Test
    void earlyReturnBecomesGuard() {
        MethodId abs = metadata.define("Abs", TypeRef.INT32, new IlBuilder()
                .ldarg(0)
                .ldc(0)
                .branch(OpCode.BGE, "positive")
                .ldarg(0)
                .op(OpCode.NEG)
                .ret()
                .label("positive")
                .ldarg(0)
                .ret(), "x", TypeRef.INT32);
        assertEquals(TestTrees.lines(
                "if (x < 0)",
                "    return -x;",
                "return x;"), decompile(abs));
    }

    @Test
    void whileLoop() {
        MethodId sum = metadata.define("Sum", TypeRef.INT32, new IlBuilder()
                .local("i", TypeRef.INT32)
                .local("s", TypeRef.INT32)
                .ldc(0).stloc(0)
                .ldc(0).stloc(1)
                .branch(OpCode.BR, "cond")
                .label("body")
                .ldloc(1).ldloc(0).op(OpCode.ADD).stloc(1)
                .ldloc(0).ldc(1).op(OpCode.ADD).stloc(0)
                .label("cond")
                .ldloc(0).ldarg(0)
                .branch(OpCode.BLT, "body")
                .ldloc(1)
                .ret(), "n", TypeRef.INT32);
        String text = decompile(sum);
        assertTrue(text.startsWith(TestTrees.lines("int i;", "int s;")), text);
        assertTrue(text.contains(TestTrees.lines(
                "while (i < n) {",
                "    s += i;",
                "    i++;",
                "}")), text);
        assertTrue(text.endsWith("return s;"), text);
        assertFalse(text.contains("goto"), text);
    }

    @Test
    void loopWithSharedLatchBecomesFor() {
        MethodId printAll = metadata.define("PrintAll", TypeRef.VOID, new IlBuilder()
                .local("i", TypeRef.INT32)
                .ldc(0).stloc(0)
                .branch(OpCode.BR, "cond")
                .label("body")
                .ldarg(0).ldloc(0)
                .branch(OpCode.BEQ, "latch")
                .ldloc(0).call(PRINT)
                .label("latch")
                .ldloc(0).ldc(1).op(OpCode.ADD).stloc(0)
                .label("cond")
                .ldloc(0).ldarg(0)
                .branch(OpCode.BLT, "body")
                .ret(), "n", TypeRef.INT32);
        String text = decompile(printAll);
        assertTrue(text.contains("for (i = 0; i < n; i++) {"), text);
        assertTrue(text.contains("if (n != i)"), text);
        assertTrue(text.contains("Program.Print(i);"), text);
        assertFalse(text.contains("goto"), text);
    }

    @Test
    void selfLoopBecomesDoWhile() {
        MethodId count = metadata.define("Count", TypeRef.VOID, new IlBuilder()
                .local("i", TypeRef.INT32)
                .ldc(0).stloc(0)
                .label("top")
                .ldloc(0).call(PRINT)
                .ldloc(0).ldc(1).op(OpCode.ADD).stloc(0)
                .ldloc(0).ldarg(0)
                .branch(OpCode.BLT, "top")
                .ret(), "n", TypeRef.INT32);
        String text = decompile(count);
        assertTrue(text.contains(TestTrees.lines(
                "do {",
                "    Program.Print(i);",
                "    i++;",
                "} while (i < n);")), text);
    }

    @Test
    void continueInsideSwitchBindsToLoop() {
        MethodId method = metadata.define("Dispatch", TypeRef.VOID, new IlBuilder()
                .local("i", TypeRef.INT32)
                .ldc(0).stloc(0)
                .branch(OpCode.BR, "cond")
                .label("body")
                .ldarg(1)
                .switchTo("zero", "one")
                .branch(OpCode.BR, "after")
                .label("zero").call(F).branch(OpCode.BR, "after")
                .label("one").branch(OpCode.BR, "latch")
                .label("after").call(G)
                .label("latch")
                .ldloc(0).ldc(1).op(OpCode.ADD).stloc(0)
                .label("cond")
                .ldloc(0).ldarg(0)
                .branch(OpCode.BLT, "body")
                .ret(), "n", TypeRef.INT32, "x", TypeRef.INT32);
        MethodResult result = metadata.decompile(method);
        assertTrue(result.isSuccess());
        String text = AstPrinter.print(result.getBody());
        assertFalse(text.contains("goto"), text);
        assertTrue(text.contains("for (i = 0; i < n; i++) {"), text);

        List<SwitchStatement> switches = TestTrees.collect(result.getBody(), Statement.Kind.SWITCH, SwitchStatement.class);
        assertEquals(1, switches.size());
        SwitchStatement sw = switches.get(0);
        assertEquals(1, TestTrees.collect(sw, Statement.Kind.CONTINUE, ContinueStatement.class).size());
        String switchText = AstPrinter.print(sw);
        assertTrue(switchText.contains("Program.F();"), switchText);
        assertFalse(switchText.contains("Program.G();"), switchText);
        assertTrue(text.contains("Program.G();"), text);
    }

    @Test
    void switchInsideForLoopBreaksToCodeAfterIt() {
        MethodId method = metadata.define("DispatchOrReturn", TypeRef.VOID, new IlBuilder()
                .local("i", TypeRef.INT32)
                .ldc(0).stloc(0)
                .branch(OpCode.BR, "cond")
                .label("body")
                .ldarg(1)
                .switchTo("zero", "one", "two")
                .branch(OpCode.BR, "after")
                .label("zero").call(F).branch(OpCode.BR, "after")
                .label("one").branch(OpCode.BR, "latch")
                .label("two").ret()
                .label("after").call(G)
                .label("latch")
                .ldloc(0).ldc(1).op(OpCode.ADD).stloc(0)
                .label("cond")
                .ldloc(0).ldarg(0)
                .branch(OpCode.BLT, "body")
                .ret(), "n", TypeRef.INT32, "x", TypeRef.INT32);
        MethodResult result = metadata.decompile(method);
        assertTrue(result.isSuccess());
        String text = AstPrinter.print(result.getBody());
        assertFalse(text.contains("goto"), text);
        assertTrue(text.contains("for (i = 0; i < n; i++) {"), text);
        assertTrue(text.contains("Program.G();"), text);

        List<SwitchStatement> switches = TestTrees.collect(result.getBody(), Statement.Kind.SWITCH, SwitchStatement.class);
        assertEquals(1, switches.size());
        SwitchStatement sw = switches.get(0);
        String switchText = AstPrinter.print(sw);
        assertEquals(1, TestTrees.collect(sw, Statement.Kind.CONTINUE, ContinueStatement.class).size(), switchText);
        assertEquals(1, TestTrees.collect(sw, Statement.Kind.RETURN, ReturnStatement.class).size(), switchText);
        assertFalse(TestTrees.collect(sw, Statement.Kind.BREAK, BreakStatement.class).isEmpty(), switchText);
        assertTrue(switchText.contains("Program.F();"), switchText);
        assertFalse(switchText.contains("Program.G();"), switchText);
        assertFalse(switchText.contains("default:"), switchText);
    }

    @Test
    void bottomTestedLoopLeavingToReturnBecomesDoWhile() {
        MethodId method = metadata.define("Poll", TypeRef.VOID, new IlBuilder()
                .call(G)
                .label("top")
                .call(H).branch(OpCode.BRTRUE, "cond")
                .call(F)
                .label("cond")
                .call(H).branch(OpCode.BRTRUE, "top")
                .ret());
        String text = decompile(method);
        assertFalse(text.contains("goto"), text);
        assertFalse(text.contains("while (true)"), text);
        assertTrue(text.contains("do {"), text);
        assertTrue(text.contains("if (!Program.H())"), text);
        assertTrue(text.contains("} while (Program.H());"), text);
    }

    @Test
    void tryCatch() {
        MethodId method = metadata.define("Guarded", TypeRef.VOID, new IlBuilder()
                .label("try")
                .call(F)
                .branch(OpCode.LEAVE, "end")
                .label("handler")
                .op(OpCode.POP)
                .call(G)
                .branch(OpCode.LEAVE, "end")
                .label("end")
                .ret()
                .region(ExceptionRegion.Kind.CATCH, "try", "handler", "handler", "end", TypeRef.of("System.Exception")));
        MethodResult result = metadata.decompile(method);
        assertTrue(result.isSuccess());
        List<TryCatchStatement> tries = TestTrees.collect(result.getBody(), Statement.Kind.TRY_CATCH, TryCatchStatement.class);
        assertEquals(1, tries.size());
        TryCatchStatement tc = tries.get(0);
        assertNull(tc.getFinallyBlock());
        assertEquals(1, tc.getCatchClauses().size());
        assertEquals("Exception", String.valueOf(tc.getCatchClauses().get(0).getType()));
        assertEquals("Program.F();", AstPrinter.print(tc.getTryBlock()));
        assertEquals("Program.G();", AstPrinter.print(tc.getCatchClauses().get(0).getBody()));
    }

    @Test
    void tryFinally() {
        MethodId method = metadata.define("Cleanup", TypeRef.VOID, new IlBuilder()
                .label("try")
                .call(F)
                .branch(OpCode.LEAVE, "end")
                .label("handler")
                .call(G)
                .op(OpCode.ENDFINALLY)
                .label("end")
                .ret()
                .region(ExceptionRegion.Kind.FINALLY, "try", "handler", "handler", "end", null));
        MethodResult result = metadata.decompile(method);
        assertTrue(result.isSuccess());
        List<TryCatchStatement> tries = TestTrees.collect(result.getBody(), Statement.Kind.TRY_CATCH, TryCatchStatement.class);
        assertEquals(1, tries.size());
        TryCatchStatement tc = tries.get(0);
        assertTrue(tc.getCatchClauses().isEmpty());
        assertNotNull(tc.getFinallyBlock());
        assertEquals("Program.G();", AstPrinter.print(tc.getFinallyBlock()));
    }

    @Test
    void unreachableCodeBecomesComment() {
        MethodId method = metadata.define("Dead", TypeRef.VOID, new IlBuilder()
                .ret()
                .call(F)
                .ret());
        MethodResult result = metadata.decompile(method);
        assertTrue(result.isSuccess());
        assertEquals("// unreachable code at IL_0001", AstPrinter.print(result.getBody()));
        assertTrue(result.getDiagnostics().stream().anyMatch(it -> it.getKind() == ErrorKind.UNREACHABLE_BLOCK));
    }
}
