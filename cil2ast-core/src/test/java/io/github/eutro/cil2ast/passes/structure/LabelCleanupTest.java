package io.github.eutro.cil2ast.passes.structure;

import io.github.eutro.cil2ast.ast.Annotations;
import io.github.eutro.cil2ast.ast.AstPrinter;
import io.github.eutro.cil2ast.ast.BlockStatement;
import io.github.eutro.cil2ast.ast.GotoStatement;
import io.github.eutro.cil2ast.ast.IfElseStatement;
import io.github.eutro.cil2ast.ast.LabelStatement;
import io.github.eutro.cil2ast.ast.Statement;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static io.github.eutro.cil2ast.TestTrees.call;
import static io.github.eutro.cil2ast.TestTrees.id;
import static io.github.eutro.cil2ast.TestTrees.lines;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class LabelCleanupTest {
    private static String clean(Statement... statements) {
        List<Statement> cleaned = LabelCleanup.clean(new Annotations(), Arrays.asList(statements));
        return AstPrinter.print(new BlockStatement(cleaned));
    }

    @Test
    void unreferencedLabelsAreRemoved() {
        assertEquals(lines("Program.F();", "Program.G();"),
                clean(new LabelStatement("IL_0000"), call("F"), new LabelStatement("IL_0005"), call("G")));
    }

    @Test
    void jumpToFollowingLabelIsRemoved() {
        assertEquals(lines("Program.F();", "Program.G();"),
                clean(call("F"), new GotoStatement("L"), new LabelStatement("M"), new LabelStatement("L"), call("G")));
    }

    @Test
    void referencedLabelIsKept() {
        assertEquals(lines(
                        "L:",
                        "Program.F();",
                        "if (c)",
                        "    goto L;",
                        "Program.G();"),
                clean(new LabelStatement("L"), call("F"),
                        new IfElseStatement(id("c"), new GotoStatement("L"), null), call("G")));
    }

    @Test
    void trailingLabelGetsEmptyStatement() {
        String text = clean(new IfElseStatement(id("c"), new GotoStatement("end"), null),
                call("F"), new LabelStatement("end"));
        assertEquals(lines(
                "if (c)",
                "    goto end;",
                "Program.F();",
                "end:",
                ";"), text);
    }
}
