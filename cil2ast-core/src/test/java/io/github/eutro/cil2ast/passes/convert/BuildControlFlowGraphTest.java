package io.github.eutro.cil2ast.passes.convert;

import io.github.eutro.cil2ast.IlBuilder;
import io.github.eutro.cil2ast.MethodInput;
import io.github.eutro.cil2ast.TestMetadata;
import io.github.eutro.cil2ast.api.DecompilationException;
import io.github.eutro.cil2ast.api.DecompilerSettings;
import io.github.eutro.cil2ast.api.ErrorKind;
import io.github.eutro.cil2ast.api.MethodId;
import io.github.eutro.cil2ast.api.OpCode;
import io.github.eutro.cil2ast.api.Symbol;
import io.github.eutro.cil2ast.api.TypeRef;
import io.github.eutro.cil2ast.ast.AstPrinter;
import io.github.eutro.cil2ast.ast.VariableDeclarationStatement;
import io.github.eutro.cil2ast.cfg.BasicBlock;
import io.github.eutro.cil2ast.cfg.Control;
import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class BuildControlFlowGraphTest {
    private final TestMetadata metadata = new TestMetadata();

    private ControlFlowGraph build(MethodId method) {
        return BuildControlFlowGraph.INSTANCE.run(new MethodInput(metadata.context(DecompilerSettings.DEFAULT), method));
    }

    private static BasicBlock at(ControlFlowGraph graph, int offset) {
        for (BasicBlock block : graph.blocks) {
            if (block.getOffset() == offset) return block;
        }
        throw new AssertionError("no block at " + offset);
    }

    @Test
    void blocksStartAtBranchTargets() {
        ControlFlowGraph graph = build(metadata.define("Max", TypeRef.INT32, new IlBuilder()
                .ldarg(0).ldarg(1).branch(OpCode.BGT, "first")
                .ldarg(1).ret()
                .label("first").ldarg(0).ret(), "a", TypeRef.INT32, "b", TypeRef.INT32));
        assertEquals(3, graph.blocks.size());
        Control control = graph.getEntry().getControl();
        assertEquals(Control.Kind.CONDITIONAL, control.getKind());
        assertNotNull(control.getValue());
        assertEquals("a > b", AstPrinter.print(control.getValue()));
        assertEquals(Arrays.asList(at(graph, 5), at(graph, 3)), control.targets);
        assertEquals("IL_0005", at(graph, 5).getLabel());
    }

    @Test
    void valuesLiveAcrossBlocksAreSpilled() {
        // return c ? 2 : 1;
        ControlFlowGraph graph = build(metadata.define("Pick", TypeRef.INT32, new IlBuilder()
                .ldarg(0).branch(OpCode.BRTRUE, "two")
                .ldc(1).branch(OpCode.BR, "end")
                .label("two").ldc(2)
                .label("end").ret(), "c", TypeRef.BOOLEAN));
        List<String> declared = new ArrayList<>();
        for (VariableDeclarationStatement decl : graph.getDeclarations()) declared.add(decl.getName());
        assertEquals(Arrays.asList("stack_0"), declared);
        assertEquals("stack_0 = 1;", AstPrinter.print(at(graph, 2).getStatements().get(0)));
        assertEquals("stack_0 = 2;", AstPrinter.print(at(graph, 4).getStatements().get(0)));
        Control ret = at(graph, 5).getControl();
        assertEquals(Control.Kind.RETURN, ret.getKind());
        assertNotNull(ret.getValue());
        assertEquals("stack_0", AstPrinter.print(ret.getValue()));
    }

    @Test
    void mismatchedStackHeightsAreInvalid() {
        MethodId method = metadata.define("Uneven", TypeRef.VOID, new IlBuilder()
                .ldarg(0).branch(OpCode.BRTRUE, "end")
                .ldc(1)
                .label("end").ret(), "c", TypeRef.BOOLEAN);
        DecompilationException e = assertThrows(DecompilationException.class, () -> build(method));
        assertEquals(ErrorKind.INVALID_CONTROL_FLOW, e.getKind());
    }

    @Test
    void stackUnderflowIsInvalid() {
        MethodId method = metadata.define("Underflow", TypeRef.VOID, new IlBuilder().op(OpCode.POP).ret());
        DecompilationException e = assertThrows(DecompilationException.class, () -> build(method));
        assertEquals(ErrorKind.INVALID_CONTROL_FLOW, e.getKind());
    }

    @Test
    void branchOutOfRangeIsInvalid() {
        MethodId method = metadata.define("Wild", TypeRef.VOID, new IlBuilder().op(OpCode.BR, 42).ret());
        assertThrows(DecompilationException.class, () -> build(method));
    }

    @Test
    void nonVirtualCallOnThisIntoBaseType() {
        int toString = 0x0A000030;
        metadata.symbol(Symbol.method(toString, TypeRef.OBJECT, "ToString", TypeRef.STRING,
                Collections.emptyList(), Collections.emptyList(), false));
        MethodId viaBase = metadata.defineInstance("Describe", TypeRef.STRING, new IlBuilder()
                .ldarg(0).call(toString).ret());
        assertEquals("return base.ToString();", AstPrinter.print(metadata.decompile(viaBase).getBody()));

        MethodId viaThis = metadata.defineInstance("Show", TypeRef.STRING, new IlBuilder()
                .ldarg(0).op(OpCode.CALLVIRT, toString).ret());
        assertEquals("return this.ToString();", AstPrinter.print(metadata.decompile(viaThis).getBody()));
    }
}
