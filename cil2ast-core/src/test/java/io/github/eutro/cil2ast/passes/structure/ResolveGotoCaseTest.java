package io.github.eutro.cil2ast.passes.structure;

import io.github.eutro.cil2ast.IlBuilder;
import io.github.eutro.cil2ast.MethodResult;
import io.github.eutro.cil2ast.MethodTree;
import io.github.eutro.cil2ast.TestMetadata;
import io.github.eutro.cil2ast.api.DecompilerSettings;
import io.github.eutro.cil2ast.api.ErrorKind;
import io.github.eutro.cil2ast.api.MethodId;
import io.github.eutro.cil2ast.api.OpCode;
import io.github.eutro.cil2ast.api.TypeRef;
import io.github.eutro.cil2ast.ast.AstPrinter;
import io.github.eutro.cil2ast.ast.BreakStatement;
import io.github.eutro.cil2ast.ast.CaseLabel;
import io.github.eutro.cil2ast.ast.GotoCaseStatement;
import io.github.eutro.cil2ast.ast.GotoStatement;
import io.github.eutro.cil2ast.ast.LabelStatement;
import io.github.eutro.cil2ast.ast.Statement;
import io.github.eutro.cil2ast.ast.SwitchSection;
import io.github.eutro.cil2ast.ast.SwitchStatement;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.cil2ast.TestTrees.call;
import static io.github.eutro.cil2ast.TestTrees.collect;
import static io.github.eutro.cil2ast.TestTrees.id;
import static io.github.eutro.cil2ast.TestTrees.lines;
import static io.github.eutro.cil2ast.TestTrees.tree;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ResolveGotoCaseTest {
    private static SwitchSection section(List<CaseLabel> labels, Statement... statements) {
        return new SwitchSection(labels, Arrays.asList(statements));
    }

    private static SwitchSection section(long value, Statement... statements) {
        return section(Collections.singletonList(CaseLabel.of(value)), statements);
    }

    private static SwitchSection defaultSection(Statement... statements) {
        return section(Collections.singletonList(CaseLabel.DEFAULT), statements);
    }

    private static MethodTree resolve(Statement... body) {
        return ResolveGotoCase.INSTANCE.run(tree(DecompilerSettings.DEFAULT, body));
    }

    private static boolean hasUnresolved(MethodTree tree) {
        return tree.getDiagnostics().stream().anyMatch(it -> it.getKind() == ErrorKind.UNRESOLVED_GOTO);
    }

    @Test
    void jumpToSiblingSectionBecomesGotoCase() {
        MethodTree tree = resolve(new SwitchStatement(id("x"), Arrays.asList(
                section(1, call("F"), new GotoStatement("L2")),
                section(2, new LabelStatement("L2"), call("G"), BreakStatement.INSTANCE),
                defaultSection(BreakStatement.INSTANCE))));
        assertEquals(lines(
                "switch (x) {",
                "    case 1:",
                "        Program.F();",
                "        goto case 2;",
                "    case 2:",
                "        Program.G();",
                "        break;",
                "    default:",
                "        break;",
                "}"), AstPrinter.print(tree.getBody()));
    }

    @Test
    void jumpToDefaultBecomesGotoDefault() {
        MethodTree tree = resolve(new SwitchStatement(id("x"), Arrays.asList(
                section(1, call("F"), new GotoStatement("D")),
                section(2, call("G"), BreakStatement.INSTANCE),
                defaultSection(new LabelStatement("D"), call("H"), BreakStatement.INSTANCE))));
        String text = AstPrinter.print(tree.getBody());
        assertTrue(text.contains("goto default;"), text);
        assertTrue(!text.contains("D:"), text);
    }

    @Test
    void jumpToNextSectionStacksLabels() {
        MethodTree tree = resolve(new SwitchStatement(id("x"), Arrays.asList(
                section(3, new GotoStatement("L4")),
                section(4, new LabelStatement("L4"), call("F"), BreakStatement.INSTANCE),
                defaultSection(BreakStatement.INSTANCE))));
        SwitchStatement sw = collect(tree.getBody(), Statement.Kind.SWITCH, SwitchStatement.class).get(0);
        assertEquals(2, sw.getSections().size());
        assertEquals(Arrays.asList(CaseLabel.of(3), CaseLabel.of(4)), sw.getSections().get(0).getLabels());
        assertEquals("Program.F();", AstPrinter.print(sw.getSections().get(0).getStatements().get(0)));
    }

    @Test
    void chainOfJumpsResolves() {
        // 1 -> 8, 2 -> 3, 3 -> 5 or on, 4 -> 5, 5 -> 8, 6 -> 5
        MethodTree tree = resolve(new SwitchStatement(id("x"), Arrays.asList(
                section(1, call("A"), new GotoStatement("L8")),
                section(2, call("B"), new GotoStatement("L3")),
                section(3, new LabelStatement("L3"), call("C"),
                        new io.github.eutro.cil2ast.ast.IfElseStatement(id("c"), new GotoStatement("L5"), null),
                        BreakStatement.INSTANCE),
                section(4, call("D"), new GotoStatement("L5")),
                section(5, new LabelStatement("L5"), call("E"), new GotoStatement("L8")),
                section(6, call("F"), new GotoStatement("L5")),
                section(7, BreakStatement.INSTANCE),
                section(8, new LabelStatement("L8"), call("G"), BreakStatement.INSTANCE),
                defaultSection(BreakStatement.INSTANCE))));
        assertTrue(!hasUnresolved(tree));
        assertTrue(collect(tree.getBody(), Statement.Kind.GOTO, GotoStatement.class).isEmpty());
        List<GotoCaseStatement> jumps = collect(tree.getBody(), Statement.Kind.GOTO_CASE, GotoCaseStatement.class);
        assertEquals(6, jumps.size());

        SwitchStatement sw = collect(tree.getBody(), Statement.Kind.SWITCH, SwitchStatement.class).get(0);
        List<SwitchSection> sections = sw.getSections();
        // the break-only section moves after the default
        assertTrue(sections.get(sections.size() - 2).hasDefault());
        assertEquals(Collections.singletonList(CaseLabel.of(7)), sections.get(sections.size() - 1).getLabels());
        assertTrue(collect(tree.getBody(), Statement.Kind.LABEL, LabelStatement.class).isEmpty());
    }

    @Test
    void chainOfJumpsResolvesFromIl() {
        String[] callees = {"A", "B", "C", "D", "E", "F", "G", "H", "Done"};
        int[] tokens = new int[callees.length];
        TestMetadata metadata = new TestMetadata();
        for (int i = 0; i < callees.length; i++) {
            tokens[i] = 0x0A000100 + i;
            metadata.symbol(TestMetadata.staticMethod(tokens[i], TestMetadata.PROGRAM, callees[i], TypeRef.VOID));
        }
        MethodId method = metadata.define("Chain", TypeRef.VOID, new IlBuilder()
                .ldarg(0)
                .switchTo("default", "s1", "s2", "s3", "s4", "s5", "s6", "s7", "s8")
                .branch(OpCode.BR, "default")
                .label("s1").call(tokens[0]).branch(OpCode.BR, "s8")
                .label("s2").call(tokens[1]).branch(OpCode.BR, "s3")
                .label("s3").call(tokens[2]).ldarg(1).branch(OpCode.BRTRUE, "s5").branch(OpCode.BR, "end")
                .label("s4").call(tokens[3]).branch(OpCode.BR, "s5")
                .label("s5").call(tokens[4]).branch(OpCode.BR, "s8")
                .label("s6").call(tokens[5]).branch(OpCode.BR, "s5")
                .label("s7").branch(OpCode.BR, "end")
                .label("s8").call(tokens[6]).branch(OpCode.BR, "end")
                .label("default").call(tokens[7]).branch(OpCode.BR, "end")
                .label("end").call(tokens[8]).ret(), "x", TypeRef.INT32, "c", TypeRef.BOOLEAN);
        MethodResult result = metadata.decompile(method);
        assertTrue(result.isSuccess(), () -> String.valueOf(result.getFailure()));
        String text = AstPrinter.print(result.getBody());
        assertFalse(result.getDiagnostics().stream().anyMatch(it -> it.getKind() == ErrorKind.UNRESOLVED_GOTO), text);
        assertTrue(collect(result.getBody(), Statement.Kind.GOTO, GotoStatement.class).isEmpty(), text);
        assertTrue(collect(result.getBody(), Statement.Kind.LABEL, LabelStatement.class).isEmpty(), text);
        assertEquals(6, collect(result.getBody(), Statement.Kind.GOTO_CASE, GotoCaseStatement.class).size(), text);

        SwitchStatement sw = collect(result.getBody(), Statement.Kind.SWITCH, SwitchStatement.class).get(0);
        List<SwitchSection> sections = sw.getSections();
        SwitchSection last = sections.get(sections.size() - 1);
        assertTrue(sections.get(sections.size() - 2).hasDefault(), text);
        assertEquals(Collections.singletonList(CaseLabel.of(7)), last.getLabels(), text);
        assertEquals(Collections.singletonList(BreakStatement.INSTANCE), last.getStatements(), text);
        assertFalse(AstPrinter.print(sw).contains("Program.Done();"), text);
        assertTrue(text.endsWith("Program.Done();"), text);
    }

    @Test
    void missingCaseLowersSwitch() {
        MethodTree tree = resolve(new SwitchStatement(id("x"), Arrays.asList(
                section(1, new GotoCaseStatement(CaseLabel.of(9))),
                defaultSection(call("F"), BreakStatement.INSTANCE))));
        assertTrue(hasUnresolved(tree));
        assertTrue(collect(tree.getBody(), Statement.Kind.SWITCH, SwitchStatement.class).isEmpty());
        String text = AstPrinter.print(tree.getBody());
        assertTrue(text.startsWith(lines(
                "if (x == 1)",
                "    goto switch_0_case_0;",
                "goto switch_0_case_1;",
                "switch_0_case_0:",
                "goto switch_0_case_1;",
                "switch_0_case_1:",
                "Program.F();")), text);
    }

    @Test
    void loweredSwitchesGetDistinctLabels() {
        MethodTree tree = resolve(
                new SwitchStatement(id("x"), Arrays.asList(
                        section(1, new GotoCaseStatement(CaseLabel.of(9))),
                        defaultSection(BreakStatement.INSTANCE))),
                new SwitchStatement(id("y"), Arrays.asList(
                        section(1, new GotoCaseStatement(CaseLabel.of(9))),
                        defaultSection(BreakStatement.INSTANCE))));
        String text = AstPrinter.print(tree.getBody());
        assertTrue(text.contains("switch_0_case_0:"), text);
        assertTrue(text.contains("switch_1_case_0:"), text);
        List<LabelStatement> labels = collect(tree.getBody(), Statement.Kind.LABEL, LabelStatement.class);
        assertEquals(labels.size(), labels.stream().map(LabelStatement::getLabel).distinct().count());
    }
}
