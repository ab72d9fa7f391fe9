package io.github.eutro.cil2ast.passes.switches;

import io.github.eutro.cil2ast.IlBuilder;
import io.github.eutro.cil2ast.MethodInput;
import io.github.eutro.cil2ast.TestMetadata;
import io.github.eutro.cil2ast.api.DecompilerSettings;
import io.github.eutro.cil2ast.api.MethodId;
import io.github.eutro.cil2ast.api.OpCode;
import io.github.eutro.cil2ast.api.TypeRef;
import io.github.eutro.cil2ast.ast.BinaryOperatorExpression;
import io.github.eutro.cil2ast.ast.CaseLabel;
import io.github.eutro.cil2ast.ast.CastExpression;
import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ast.InvocationExpression;
import io.github.eutro.cil2ast.ast.MemberReferenceExpression;
import io.github.eutro.cil2ast.ast.PrimitiveExpression;
import io.github.eutro.cil2ast.ast.UnaryOperatorExpression;
import io.github.eutro.cil2ast.ast.UnaryOperatorType;
import io.github.eutro.cil2ast.cfg.BasicBlock;
import io.github.eutro.cil2ast.cfg.Control;
import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import io.github.eutro.cil2ast.cfg.SwitchCase;
import io.github.eutro.cil2ast.cfg.SwitchConstruct;
import io.github.eutro.cil2ast.passes.IRPass;
import io.github.eutro.cil2ast.passes.convert.BuildControlFlowGraph;
import io.github.eutro.cil2ast.passes.opts.CollapseJumps;
import io.github.eutro.cil2ast.passes.opts.EliminateDeadBlocks;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Interprets a method's graph before and after switch detection, checking every
 * discriminant value still reaches the same return.
 */
public class SwitchRoundTripTest {
    private static final IRPass<MethodInput, ControlFlowGraph> BEFORE =
            BuildControlFlowGraph.INSTANCE
                    .then(EliminateDeadBlocks.INSTANCE)
                    .then(CollapseJumps.INSTANCE);
    private static final IRPass<MethodInput, ControlFlowGraph> AFTER = BEFORE.then(DetectSwitches.INSTANCE);

    private static final TypeRef NULLABLE_INT = TypeRef.nullable(TypeRef.INT32);
    private static final int HAS_VALUE = 0x0A000011;
    private static final int GET_VALUE_OR_DEFAULT = 0x0A000012;

    private final TestMetadata metadata = new TestMetadata()
            .symbol(TestMetadata.instanceMethod(HAS_VALUE, NULLABLE_INT, "get_HasValue", TypeRef.BOOLEAN))
            .symbol(TestMetadata.instanceMethod(GET_VALUE_OR_DEFAULT, NULLABLE_INT, "GetValueOrDefault", TypeRef.INT32));

    private void assertSameMapping(MethodId method, long from, long to) {
        assertSameMapping(method, from, to, false);
    }

    private void assertSameMapping(MethodId method, long from, long to, boolean withNull) {
        MethodInput input = new MethodInput(metadata.context(DecompilerSettings.DEFAULT), method);
        ControlFlowGraph before = BEFORE.run(input);
        ControlFlowGraph after = AFTER.run(input);
        assertNotNull(after.getEntry().getControl().getSwitchConstruct(), "no switch was detected");
        for (long x = from; x <= to; x++) {
            assertEquals(run(before, x), run(after, x), "x = " + x);
        }
        if (withNull) assertEquals(run(before, null), run(after, null), "x = null");
    }

    private static long run(ControlFlowGraph graph, @Nullable Long x) {
        BasicBlock block = graph.getEntry();
        for (int steps = 0; steps < 1000; steps++) {
            Control control = block.getControl();
            switch (control.getKind()) {
                case JUMP:
                    block = control.targets.get(0);
                    break;
                case CONDITIONAL:
                    //noinspection ConstantConditions
                    block = control.targets.get(eval(control.getValue(), x) != 0 ? 0 : 1);
                    break;
                case SWITCH:
                    block = switchTarget(control, x);
                    break;
                case RETURN:
                    //noinspection ConstantConditions
                    return eval(control.getValue(), x);
                default:
                    return fail("unexpected " + control);
            }
        }
        return fail("no return reached");
    }

    private static BasicBlock switchTarget(Control control, @Nullable Long x) {
        SwitchConstruct construct = control.getSwitchConstruct();
        if (construct != null && x == null) {
            for (SwitchCase switchCase : construct.getCases()) {
                if (switchCase.getLabels().contains(CaseLabel.NULL)) return switchCase.getTarget();
            }
            SwitchCase defaultCase = construct.getDefaultCase();
            assertNotNull(defaultCase, "null matches no case");
            return defaultCase.getTarget();
        }
        //noinspection ConstantConditions
        long value = eval(construct == null ? control.getValue() : construct.getDiscriminant(), x);
        if (construct == null) {
            int tableSize = control.targets.size() - 1;
            boolean inTable = value >= 0 && value < tableSize;
            return control.targets.get(inTable ? (int) value : tableSize);
        }
        for (SwitchCase switchCase : construct.getCases()) {
            if (switchCase.getLabels().contains(CaseLabel.of(value))) return switchCase.getTarget();
        }
        SwitchCase defaultCase = construct.getDefaultCase();
        assertNotNull(defaultCase, "value " + value + " matches no case");
        return defaultCase.getTarget();
    }

    private static long eval(@Nullable Expression expr, @Nullable Long x) {
        assertNotNull(expr);
        switch (expr.getKind()) {
            case IDENTIFIER:
                assertNotNull(x, "null read as an integer");
                return x;
            case MEMBER_REFERENCE: {
                String member = ((MemberReferenceExpression) expr).getMember().getName();
                assertEquals("HasValue", member);
                return x != null ? 1 : 0;
            }
            case INVOCATION: {
                String method = ((InvocationExpression) expr).getMethod().getName();
                assertEquals("GetValueOrDefault", method);
                return x == null ? 0 : x;
            }
            case PRIMITIVE: {
                Object value = ((PrimitiveExpression) expr).getValue();
                if (value instanceof Boolean) return (Boolean) value ? 1 : 0;
                return ((Number) value).longValue();
            }
            case CAST:
                return eval(((CastExpression) expr).getExpression(), x);
            case UNARY_OPERATOR: {
                UnaryOperatorExpression unary = (UnaryOperatorExpression) expr;
                long operand = eval(unary.getOperand(), x);
                if (unary.getOperator() == UnaryOperatorType.NOT) return operand == 0 ? 1 : 0;
                if (unary.getOperator() == UnaryOperatorType.MINUS) return -operand;
                return fail("unexpected " + unary.getOperator());
            }
            case BINARY_OPERATOR: {
                BinaryOperatorExpression binary = (BinaryOperatorExpression) expr;
                long l = eval(binary.getLeft(), x);
                long r = eval(binary.getRight(), x);
                switch (binary.getOperator()) {
                    case ADD:
                        return l + r;
                    case SUBTRACT:
                        return l - r;
                    case EQUALITY:
                        return l == r ? 1 : 0;
                    case INEQUALITY:
                        return l != r ? 1 : 0;
                    case LESS_THAN:
                        return l < r ? 1 : 0;
                    case LESS_THAN_OR_EQUAL:
                        return l <= r ? 1 : 0;
                    case GREATER_THAN:
                        return l > r ? 1 : 0;
                    case GREATER_THAN_OR_EQUAL:
                        return l >= r ? 1 : 0;
                    case CONDITIONAL_AND:
                        return l != 0 && r != 0 ? 1 : 0;
                    case CONDITIONAL_OR:
                        return l != 0 || r != 0 ? 1 : 0;
                    default:
                        return fail("unexpected " + binary.getOperator());
                }
            }
            default:
                return fail("cannot evaluate " + expr.getKind());
        }
    }

    @Test
    void offsetJumpTable() {
        MethodId method = metadata.define("Offset", TypeRef.INT32, new IlBuilder()
                .ldarg(0).ldc(10).op(OpCode.SUB)
                .switchTo("a", "b", "a", "c")
                .branch(OpCode.BR, "default")
                .label("a").ldc(1).ret()
                .label("b").ldc(2).ret()
                .label("c").ldc(3).ret()
                .label("default").ldc(0).ret(), "x", TypeRef.INT32);
        assertSameMapping(method, -5, 30);
    }

    @Test
    void comparisonChain() {
        MethodId method = metadata.define("Chain", TypeRef.INT32, new IlBuilder()
                .ldarg(0).ldc(1).branch(OpCode.BEQ, "a")
                .ldarg(0).ldc(5).branch(OpCode.BEQ, "b")
                .ldarg(0).ldc(100).branch(OpCode.BEQ, "a")
                .ldarg(0).ldc(7).branch(OpCode.BEQ, "c")
                .ldc(0).ret()
                .label("a").ldc(10).ret()
                .label("b").ldc(20).ret()
                .label("c").ldc(30).ret(), "x", TypeRef.INT32);
        assertSameMapping(method, -3, 110);
    }

    @Test
    void nullableWithSharedNullSection() {
        MethodId method = metadata.define("NullOrZero", TypeRef.INT32, new IlBuilder()
                .local("v", TypeRef.INT32)
                .ldarg(0).call(HAS_VALUE).branch(OpCode.BRFALSE, "a")
                .ldarg(0).call(GET_VALUE_OR_DEFAULT).stloc(0)
                .ldloc(0)
                .switchTo("a", "b", "c")
                .branch(OpCode.BR, "default")
                .label("a").ldc(1).ret()
                .label("b").ldc(2).ret()
                .label("c").ldc(3).ret()
                .label("default").ldc(0).ret(), "x", NULLABLE_INT);
        assertSameMapping(method, -3, 6, true);
    }

    @Test
    void rangeCheckBeforeJumpTable() {
        MethodId method = metadata.define("Ranged", TypeRef.INT32, new IlBuilder()
                .ldarg(0).ldc(20).branch(OpCode.BEQ, "far")
                .ldarg(0)
                .switchTo("a", "b", "c")
                .branch(OpCode.BR, "default")
                .label("a").ldc(1).ret()
                .label("b").ldc(2).ret()
                .label("c").ldc(3).ret()
                .label("far").ldc(4).ret()
                .label("default").ldc(0).ret(), "x", TypeRef.INT32);
        assertSameMapping(method, -4, 25);
    }
}
