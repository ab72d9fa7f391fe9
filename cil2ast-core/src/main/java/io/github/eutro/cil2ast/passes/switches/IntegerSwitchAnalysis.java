package io.github.eutro.cil2ast.passes.switches;

import io.github.eutro.cil2ast.ast.BinaryOperatorExpression;
import io.github.eutro.cil2ast.ast.BinaryOperatorType;
import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ast.PrimitiveExpression;
import io.github.eutro.cil2ast.ast.UnaryOperatorExpression;
import io.github.eutro.cil2ast.ast.UnaryOperatorType;
import io.github.eutro.cil2ast.cfg.BasicBlock;
import io.github.eutro.cil2ast.cfg.Control;
import io.github.eutro.cil2ast.util.LongSet;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Analyses comparison trees and jump tables on an integer variable.
 */
final class IntegerSwitchAnalysis extends SwitchTreeAnalysis<LongSet> {
    boolean containsTable;
    int tableEntries;

    IntegerSwitchAnalysis(BasicBlock root, @Nullable String variable) {
        super(root, variable);
    }

    @Override
    LongSet universe() {
        return LongSet.UNIVERSE;
    }

    @Override
    @Nullable LongSet analyzeCondition(Expression condition) {
        switch (condition.getKind()) {
            case UNARY_OPERATOR: {
                UnaryOperatorExpression unary = (UnaryOperatorExpression) condition;
                if (unary.getOperator() != UnaryOperatorType.NOT) return null;
                LongSet operand = analyzeCondition(unary.getOperand());
                return operand == null ? null : operand.invert();
            }
            case BINARY_OPERATOR: {
                BinaryOperatorExpression binary = (BinaryOperatorExpression) condition;
                BinaryOperatorType op = binary.getOperator();
                if (!op.isComparison()) return null;
                Long constant = integerValue(binary.getRight());
                Expression operand = binary.getLeft();
                if (constant == null) {
                    constant = integerValue(binary.getLeft());
                    operand = binary.getRight();
                    op = op.swap();
                    if (constant == null || op == null) return null;
                }
                Long delta = offsetOf(operand);
                if (delta == null) return null;
                LongSet values = compare(op, constant);
                return values == null ? null : values.shift(-delta);
            }
            case IDENTIFIER:
                // plain truthiness
                return isVariable(condition) ? LongSet.of(0).invert() : null;
            default:
                return null;
        }
    }

    private static @Nullable LongSet compare(BinaryOperatorType op, long constant) {
        switch (op) {
            case EQUALITY:
                return LongSet.of(constant);
            case INEQUALITY:
                return LongSet.of(constant).invert();
            case LESS_THAN:
                return constant == Long.MIN_VALUE ? LongSet.EMPTY : LongSet.atMost(constant - 1);
            case LESS_THAN_OR_EQUAL:
                return LongSet.atMost(constant);
            case GREATER_THAN:
                return constant == Long.MAX_VALUE ? LongSet.EMPTY : LongSet.atLeast(constant + 1);
            case GREATER_THAN_OR_EQUAL:
                return LongSet.atLeast(constant);
            default:
                return null;
        }
    }

    @Override
    boolean analyzeTable(BasicBlock block, Control control, LongSet input) {
        //noinspection ConstantConditions
        Long delta = offsetOf(control.getValue());
        if (delta == null) return false;
        int entries = control.targets.size() - 1;
        Map<BasicBlock, LongSet> groups = new LinkedHashMap<>();
        for (int i = 0; i < entries; i++) {
            BasicBlock target = control.targets.get(i);
            LongSet value = LongSet.of(i).shift(-delta);
            LongSet existing = groups.get(target);
            groups.put(target, existing == null ? value : existing.union(value));
        }
        LongSet tableValues = LongSet.range(0, entries - 1).shift(-delta);
        BasicBlock defaultTarget = control.targets.get(entries);
        LongSet outside = LongSet.UNIVERSE.except(tableValues);
        LongSet existing = groups.get(defaultTarget);
        groups.put(defaultTarget, existing == null ? outside : existing.union(outside));

        containsTable = true;
        tableEntries += entries;
        for (Map.Entry<BasicBlock, LongSet> entry : groups.entrySet()) {
            LongSet values = entry.getValue().intersect(input);
            // entries excluded by an enclosing range check are dead
            if (values.isEmpty()) continue;
            analyzeTarget(entry.getKey(), values);
        }
        return true;
    }

    /**
     * Match the variable, or the variable plus or minus a constant.
     *
     * @return The constant added to the variable, or null if this is not the variable.
     */
    private @Nullable Long offsetOf(Expression expr) {
        if (expr.getKind() == Expression.Kind.BINARY_OPERATOR) {
            BinaryOperatorExpression binary = (BinaryOperatorExpression) expr;
            BinaryOperatorType op = binary.getOperator();
            if (op != BinaryOperatorType.ADD && op != BinaryOperatorType.SUBTRACT) return null;
            Long constant = integerValue(binary.getRight());
            if (constant == null || !isVariable(binary.getLeft())) return null;
            return op == BinaryOperatorType.ADD ? constant : -constant;
        }
        return isVariable(expr) ? 0L : null;
    }

    static @Nullable Long integerValue(Expression expr) {
        if (expr.getKind() != Expression.Kind.PRIMITIVE) return null;
        Object value = ((PrimitiveExpression) expr).getValue();
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Character) return (long) (Character) value;
        return null;
    }
}
