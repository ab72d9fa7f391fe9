package io.github.eutro.cil2ast.passes.switches;

import io.github.eutro.cil2ast.IlBuilder;
import io.github.eutro.cil2ast.MethodResult;
import io.github.eutro.cil2ast.TestMetadata;
import io.github.eutro.cil2ast.TestTrees;
import io.github.eutro.cil2ast.api.ConversionOperator;
import io.github.eutro.cil2ast.api.DecompilerSettings;
import io.github.eutro.cil2ast.api.ErrorKind;
import io.github.eutro.cil2ast.api.MethodId;
import io.github.eutro.cil2ast.api.NameBasedTypeResolver;
import io.github.eutro.cil2ast.api.OpCode;
import io.github.eutro.cil2ast.api.Symbol;
import io.github.eutro.cil2ast.api.TypeRef;
import io.github.eutro.cil2ast.ast.AstPrinter;
import io.github.eutro.cil2ast.ast.BlockStatement;
import io.github.eutro.cil2ast.ast.CaseLabel;
import io.github.eutro.cil2ast.ast.Statement;
import io.github.eutro.cil2ast.ast.SwitchSection;
import io.github.eutro.cil2ast.ast.SwitchStatement;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DetectSwitchesTest {
    private static final TypeRef NULLABLE_INT = TypeRef.nullable(TypeRef.INT32);
    private static final TypeRef MONEY = TypeRef.of("Tests.Money");
    private static final int HAS_VALUE = 0x0A000011;
    private static final int GET_VALUE_OR_DEFAULT = 0x0A000012;
    private static final int STRING_EQUALS = 0x0A000013;
    private static final int COMPUTE_STRING_HASH = 0x0A000014;

    private final TestMetadata metadata = new TestMetadata()
            .symbol(TestMetadata.instanceMethod(HAS_VALUE, NULLABLE_INT, "get_HasValue", TypeRef.BOOLEAN))
            .symbol(TestMetadata.instanceMethod(GET_VALUE_OR_DEFAULT, NULLABLE_INT, "GetValueOrDefault", TypeRef.INT32))
            .symbol(TestMetadata.staticMethod(STRING_EQUALS, TypeRef.STRING, "op_Equality",
                    TypeRef.BOOLEAN, TypeRef.STRING, TypeRef.STRING))
            .symbol(TestMetadata.staticMethod(COMPUTE_STRING_HASH, TypeRef.of("<PrivateImplementationDetails>"),
                    "ComputeStringHash", TypeRef.INT32, TypeRef.STRING));

    private static List<SwitchStatement> switches(MethodResult result) {
        assertTrue(result.isSuccess(), () -> String.valueOf(result.getFailure()));
        return TestTrees.collect(result.getBody(), Statement.Kind.SWITCH, SwitchStatement.class);
    }

    private static void assertLabelsUnique(SwitchStatement sw) {
        Set<CaseLabel> seen = new HashSet<>();
        for (SwitchSection section : sw.getSections()) {
            for (CaseLabel label : section.getLabels()) {
                assertTrue(seen.add(label), () -> "duplicate " + label + " in " + AstPrinter.print(sw));
            }
        }
    }

    private static boolean hasDiagnostic(MethodResult result, ErrorKind kind) {
        return result.getDiagnostics().stream().anyMatch(it -> it.getKind() == kind);
    }

    /**
     * {@code x == 1 ? 10 : x == 5 ? 20 : x == 100 ? 30 : 0}, as a chain of equality tests.
     */
    private MethodId comparisonChain() {
        return metadata.define("Chain", TypeRef.INT32, new IlBuilder()
                .ldarg(0).ldc(1).branch(OpCode.BEQ, "a")
                .ldarg(0).ldc(5).branch(OpCode.BEQ, "b")
                .ldarg(0).ldc(100).branch(OpCode.BEQ, "c")
                .ldc(0).ret()
                .label("a").ldc(10).ret()
                .label("b").ldc(20).ret()
                .label("c").ldc(30).ret(), "x", TypeRef.INT32);
    }

    @Test
    void jumpTableGroupsSharedTargets() {
        MethodId method = metadata.define("Table", TypeRef.INT32, new IlBuilder()
                .ldarg(0)
                .switchTo("a", "b", "a")
                .branch(OpCode.BR, "default")
                .label("a").ldc(10).ret()
                .label("b").ldc(20).ret()
                .label("default").ldc(0).ret(), "x", TypeRef.INT32);
        List<SwitchStatement> found = switches(metadata.decompile(method));
        assertEquals(1, found.size());
        SwitchStatement sw = found.get(0);
        assertEquals("x", AstPrinter.print(sw.getExpression()));
        List<SwitchSection> sections = sw.getSections();
        assertEquals(3, sections.size());
        assertEquals(Arrays.asList(CaseLabel.of(0), CaseLabel.of(2)), sections.get(0).getLabels());
        assertEquals(Collections.singletonList(CaseLabel.of(1)), sections.get(1).getLabels());
        assertTrue(sections.get(2).hasDefault());
        assertEquals("return 10;", AstPrinter.print(sections.get(0).getStatements().get(0)));
        assertEquals("return 0;", AstPrinter.print(sections.get(2).getStatements().get(0)));
    }

    @Test
    void sparseComparisonChainBecomesSwitch() {
        MethodResult result = metadata.decompile(comparisonChain());
        List<SwitchStatement> found = switches(result);
        assertEquals(1, found.size());
        List<SwitchSection> sections = found.get(0).getSections();
        assertEquals(4, sections.size());
        assertEquals(Collections.singletonList(CaseLabel.of(1)), sections.get(0).getLabels());
        assertEquals(Collections.singletonList(CaseLabel.of(5)), sections.get(1).getLabels());
        assertEquals(Collections.singletonList(CaseLabel.of(100)), sections.get(2).getLabels());
        assertTrue(sections.get(3).hasDefault());
        assertFalse(hasDiagnostic(result, ErrorKind.AMBIGUOUS_SWITCH_SHAPE));
    }

    @Test
    void comparisonChainStaysIfsWithoutSparseSwitches() {
        DecompilerSettings settings = DecompilerSettings.builder().setSparseIntegerSwitch(false).build();
        MethodResult result = metadata.decompile(comparisonChain(), settings);
        assertTrue(switches(result).isEmpty());
        assertTrue(hasDiagnostic(result, ErrorKind.AMBIGUOUS_SWITCH_SHAPE));
        assertTrue(AstPrinter.print(result.getBody()).contains("if (x == 1)"));
    }

    @Test
    void sectionBranchingIntoAnotherIsNotASwitch() {
        // return i == 1 || (i == 2 && a);
        MethodId method = metadata.define("Crossing", TypeRef.BOOLEAN, new IlBuilder()
                .ldarg(0).ldc(1).branch(OpCode.BEQ, "true")
                .ldarg(0).ldc(2).branch(OpCode.BNE_UN, "false")
                .ldarg(1).branch(OpCode.BRFALSE, "false")
                .label("true").ldc(1).ret()
                .label("false").ldc(0).ret(), "i", TypeRef.INT32, "a", TypeRef.BOOLEAN);
        MethodResult result = metadata.decompile(method);
        assertTrue(switches(result).isEmpty());
        assertTrue(hasDiagnostic(result, ErrorKind.AMBIGUOUS_SWITCH_SHAPE));
    }

    @Test
    void stringEqualityChainBecomesSwitch() {
        int equals = 0x0A000010;
        metadata.symbol(TestMetadata.staticMethod(equals, TypeRef.STRING, "op_Equality",
                TypeRef.BOOLEAN, TypeRef.STRING, TypeRef.STRING));
        MethodId method = metadata.define("Names", TypeRef.INT32, new IlBuilder()
                .ldarg(0).ldstr("one").call(equals).branch(OpCode.BRTRUE, "one")
                .ldarg(0).ldstr("two").call(equals).branch(OpCode.BRTRUE, "two")
                .ldarg(0).ldstr("three").call(equals).branch(OpCode.BRTRUE, "three")
                .ldc(0).ret()
                .label("one").ldc(1).ret()
                .label("two").ldc(2).ret()
                .label("three").ldc(3).ret(), "s", TypeRef.STRING);
        List<SwitchStatement> found = switches(metadata.decompile(method));
        assertEquals(1, found.size());
        List<SwitchSection> sections = found.get(0).getSections();
        assertEquals(4, sections.size());
        assertEquals(Collections.singletonList(CaseLabel.of("one")), sections.get(0).getLabels());
        assertTrue(sections.get(3).hasDefault());

        DecompilerSettings noStrings = DecompilerSettings.builder().setSwitchStatementOnString(false).build();
        assertTrue(switches(metadata.decompile(method, noStrings)).isEmpty());
    }

    /**
     * {@code switch (x) { case 0: return 10; case 1: return 20; case 2: return 30; default: return 0; }}
     * on an {@code int?}, with null going to {@code nullTarget}.
     */
    private MethodId nullableSwitch(String name, String nullTarget) {
        return metadata.define(name, TypeRef.INT32, new IlBuilder()
                .local("v", TypeRef.INT32)
                .ldarg(0).call(HAS_VALUE).branch(OpCode.BRFALSE, nullTarget)
                .ldarg(0).call(GET_VALUE_OR_DEFAULT).stloc(0)
                .ldloc(0)
                .switchTo("zero", "one", "two")
                .branch(OpCode.BR, "default")
                .label("zero").ldc(10).ret()
                .label("one").ldc(20).ret()
                .label("two").ldc(30).ret()
                .label("default").ldc(0).ret(), "x", NULLABLE_INT);
    }

    @Test
    void nullSharingASectionJoinsItsLabels() {
        MethodResult result = metadata.decompile(nullableSwitch("NullOrZero", "zero"));
        List<SwitchStatement> found = switches(result);
        assertEquals(1, found.size());
        SwitchStatement sw = found.get(0);
        assertEquals("x", AstPrinter.print(sw.getExpression()));
        List<SwitchSection> sections = sw.getSections();
        assertEquals(4, sections.size());
        assertEquals(Arrays.asList(CaseLabel.NULL, CaseLabel.of(0)), sections.get(0).getLabels());
        assertEquals("return 10;", AstPrinter.print(sections.get(0).getStatements().get(0)));
        assertEquals(Collections.singletonList(CaseLabel.of(1)), sections.get(1).getLabels());
        assertEquals(Collections.singletonList(CaseLabel.of(2)), sections.get(2).getLabels());
        assertTrue(sections.get(3).hasDefault());
        assertLabelsUnique(sw);

        String text = AstPrinter.print(result.getBody());
        assertFalse(text.contains("GetValueOrDefault"), text);
        assertFalse(text.contains(" v;"), text);
    }

    @Test
    void nullGoingToDefaultGetsNoLabel() {
        List<SwitchStatement> found = switches(metadata.decompile(nullableSwitch("NullIsDefault", "default")));
        assertEquals(1, found.size());
        SwitchStatement sw = found.get(0);
        List<SwitchSection> sections = sw.getSections();
        assertEquals(4, sections.size());
        for (SwitchSection section : sections) {
            assertFalse(section.getLabels().contains(CaseLabel.NULL), () -> AstPrinter.print(sw));
        }
        assertEquals(Collections.singletonList(CaseLabel.of(0)), sections.get(0).getLabels());
        assertTrue(sections.get(3).hasDefault());
        assertEquals("return 0;", AstPrinter.print(sections.get(3).getStatements().get(0)));
    }

    @Test
    void stringHashBucketsBecomeOneSwitch() {
        MethodId method = metadata.define("Hashed", TypeRef.INT32, new IlBuilder()
                .local("h", TypeRef.INT32)
                .ldarg(0).call(COMPUTE_STRING_HASH).stloc(0)
                .ldloc(0).ldc(1111).branch(OpCode.BEQ, "bucketOne")
                .ldloc(0).ldc(2222).branch(OpCode.BEQ, "bucketTwo")
                .branch(OpCode.BR, "default")
                .label("bucketOne")
                .ldarg(0).ldstr("one").call(STRING_EQUALS).branch(OpCode.BRTRUE, "one")
                .branch(OpCode.BR, "default")
                .label("bucketTwo")
                .ldarg(0).ldstr("two").call(STRING_EQUALS).branch(OpCode.BRTRUE, "two")
                .ldarg(0).ldstr("deux").call(STRING_EQUALS).branch(OpCode.BRTRUE, "two")
                .branch(OpCode.BR, "default")
                .label("one").ldc(1).ret()
                .label("two").ldc(2).ret()
                .label("default").ldc(0).ret(), "s", TypeRef.STRING);
        MethodResult result = metadata.decompile(method);
        List<SwitchStatement> found = switches(result);
        assertEquals(1, found.size());
        SwitchStatement sw = found.get(0);
        assertEquals("s", AstPrinter.print(sw.getExpression()));
        List<SwitchSection> sections = sw.getSections();
        assertEquals(3, sections.size());
        assertEquals(Collections.singletonList(CaseLabel.of("one")), sections.get(0).getLabels());
        assertEquals(new HashSet<>(Arrays.asList(CaseLabel.of("two"), CaseLabel.of("deux"))),
                new HashSet<>(sections.get(1).getLabels()));
        assertTrue(sections.get(2).hasDefault());
        assertLabelsUnique(sw);

        String text = AstPrinter.print(result.getBody());
        assertFalse(text.contains("ComputeStringHash"), text);
        assertFalse(text.contains(" h;"), text);
    }

    @Test
    void conversionOperatorDiscriminantBecomesCast() {
        Symbol explicit = TestMetadata.staticMethod(0x0A000015, MONEY, "op_Explicit", TypeRef.INT32, MONEY);
        Symbol implicit = TestMetadata.staticMethod(0x0A000016, MONEY, "op_Implicit", TypeRef.INT32, MONEY);
        metadata.symbol(explicit).symbol(implicit).resolver(NameBasedTypeResolver.withConversions(Arrays.asList(
                new ConversionOperator(ConversionOperator.Kind.EXPLICIT, explicit),
                new ConversionOperator(ConversionOperator.Kind.IMPLICIT, implicit))));

        for (Symbol operator : Arrays.asList(explicit, implicit)) {
            MethodId method = metadata.define("Converted", TypeRef.INT32, new IlBuilder()
                    .local("t", TypeRef.INT32)
                    .ldarg(0).call(operator.getToken()).stloc(0)
                    .ldloc(0)
                    .switchTo("a", "b", "c")
                    .branch(OpCode.BR, "default")
                    .label("a").ldc(1).ret()
                    .label("b").ldc(2).ret()
                    .label("c").ldc(3).ret()
                    .label("default").ldc(0).ret(), "m", MONEY);
            MethodResult result = metadata.decompile(method);
            List<SwitchStatement> found = switches(result);
            assertEquals(1, found.size());
            assertEquals("(int)m", AstPrinter.print(found.get(0).getExpression()));
            String text = AstPrinter.print(result.getBody());
            assertFalse(text.contains(operator.getName()), text);
            assertFalse(text.contains(" t;"), text);
        }
    }

    @Test
    void inlinedTemporaryIsNotDeclared() {
        MethodId method = metadata.define("Offset", TypeRef.INT32, new IlBuilder()
                .local("t", TypeRef.INT32)
                .ldarg(0).ldc(1).op(OpCode.SUB).stloc(0)
                .ldloc(0)
                .switchTo("a", "b", "c")
                .branch(OpCode.BR, "default")
                .label("a").ldc(1).ret()
                .label("b").ldc(2).ret()
                .label("c").ldc(3).ret()
                .label("default").ldc(0).ret(), "x", TypeRef.INT32);
        MethodResult result = metadata.decompile(method);
        List<SwitchStatement> found = switches(result);
        assertEquals(1, found.size());
        assertEquals("x - 1", AstPrinter.print(found.get(0).getExpression()));
        String text = AstPrinter.print(result.getBody());
        assertFalse(text.contains(" t;"), text);
        assertTrue(text.startsWith("switch (x - 1)"), text);
    }

    @Test
    void valueTestedBeforeTableGetsOneLabel() {
        // 1 is caught by the equality, so the table's entry for it is never used
        MethodId method = metadata.define("Overlap", TypeRef.INT32, new IlBuilder()
                .ldarg(0).ldc(1).branch(OpCode.BEQ, "one")
                .ldarg(0)
                .switchTo("a", "default", "c")
                .branch(OpCode.BR, "default")
                .label("a").ldc(10).ret()
                .label("c").ldc(30).ret()
                .label("one").ldc(40).ret()
                .label("default").ldc(0).ret(), "x", TypeRef.INT32);
        List<SwitchStatement> found = switches(metadata.decompile(method));
        assertEquals(1, found.size());
        SwitchStatement sw = found.get(0);
        assertLabelsUnique(sw);
        int sectionsWithOne = 0;
        for (SwitchSection section : sw.getSections()) {
            if (section.getLabels().contains(CaseLabel.of(1))) {
                sectionsWithOne++;
                assertEquals("return 40;", AstPrinter.print(section.getStatements().get(0)));
            }
        }
        assertEquals(1, sectionsWithOne, () -> AstPrinter.print(sw));

        for (SwitchStatement other : switches(metadata.decompile(comparisonChain()))) {
            assertLabelsUnique(other);
        }
    }

    @Test
    void valueSwitchBecomesSwitchExpression() {
        MethodId method = metadata.define("Name", TypeRef.STRING, new IlBuilder()
                .local("r", TypeRef.STRING)
                .ldarg(0)
                .switchTo("a", "b")
                .branch(OpCode.BR, "default")
                .label("a").ldstr("zero").stloc(0).branch(OpCode.BR, "end")
                .label("b").ldstr("one").stloc(0).branch(OpCode.BR, "end")
                .label("default").ldstr("many").stloc(0).branch(OpCode.BR, "end")
                .label("end").ldloc(0).ret(), "x", TypeRef.INT32);
        MethodResult result = metadata.decompile(method);
        assertTrue(result.isSuccess());
        String text = AstPrinter.print(result.getBody());
        assertTrue(text.contains(TestTrees.lines(
                "r = x switch {",
                "    0 => \"zero\",",
                "    1 => \"one\",",
                "    _ => \"many\"",
                "};")), text);

        DecompilerSettings statements = DecompilerSettings.builder().setSwitchExpressions(false).build();
        MethodResult asStatement = metadata.decompile(method, statements);
        List<SwitchStatement> found = switches(asStatement);
        assertEquals(1, found.size());
        assertEquals(TestTrees.lines("r = \"zero\";", "break;"),
                AstPrinter.print(new BlockStatement(found.get(0).getSections().get(0).getStatements())));
    }
}
