package io.github.eutro.cil2ast.passes.switches;

import io.github.eutro.cil2ast.api.KnownType;
import io.github.eutro.cil2ast.api.Symbol;
import io.github.eutro.cil2ast.api.TypeRef;
import io.github.eutro.cil2ast.ast.BinaryOperatorExpression;
import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ast.InvocationExpression;
import io.github.eutro.cil2ast.ast.PrimitiveExpression;
import io.github.eutro.cil2ast.ast.UnaryOperatorExpression;
import io.github.eutro.cil2ast.ast.UnaryOperatorType;
import io.github.eutro.cil2ast.cfg.BasicBlock;
import io.github.eutro.cil2ast.util.StringValueSet;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Analyses chains of string comparisons on a variable: {@code ==}, {@code string.Equals},
 * {@code s.Equals("...")} and comparisons with {@code null}.
 */
final class StringSwitchAnalysis extends SwitchTreeAnalysis<StringValueSet> {
    StringSwitchAnalysis(BasicBlock root, @Nullable String variable) {
        super(root, variable);
    }

    @Override
    StringValueSet universe() {
        return StringValueSet.UNIVERSE;
    }

    @Override
    @Nullable StringValueSet analyzeCondition(Expression condition) {
        switch (condition.getKind()) {
            case UNARY_OPERATOR: {
                UnaryOperatorExpression unary = (UnaryOperatorExpression) condition;
                if (unary.getOperator() != UnaryOperatorType.NOT) return null;
                StringValueSet operand = analyzeCondition(unary.getOperand());
                return operand == null ? null : operand.invert();
            }
            case BINARY_OPERATOR: {
                BinaryOperatorExpression binary = (BinaryOperatorExpression) condition;
                switch (binary.getOperator()) {
                    case EQUALITY:
                        return compare(binary.getLeft(), binary.getRight());
                    case INEQUALITY: {
                        StringValueSet values = compare(binary.getLeft(), binary.getRight());
                        return values == null ? null : values.invert();
                    }
                    default:
                        return null;
                }
            }
            case INVOCATION: {
                InvocationExpression invocation = (InvocationExpression) condition;
                Symbol method = invocation.getMethod();
                if (!isStringType(method.getDeclaringType())) return null;
                List<Expression> args = invocation.getArguments();
                if (method.isStatic() && args.size() == 2) {
                    switch (method.getName()) {
                        case "op_Equality":
                        case "Equals":
                            return compare(args.get(0), args.get(1));
                        case "op_Inequality": {
                            StringValueSet values = compare(args.get(0), args.get(1));
                            return values == null ? null : values.invert();
                        }
                        default:
                            return null;
                    }
                }
                if (!method.isStatic() && args.size() == 1 && method.getName().equals("Equals")) {
                    String literal = stringValue(args.get(0));
                    if (literal == null || !isVariable(invocation.getTarget())) return null;
                    return StringValueSet.of(literal);
                }
                return null;
            }
            default:
                return null;
        }
    }

    private @Nullable StringValueSet compare(Expression left, Expression right) {
        StringValueSet constant = constantSet(right);
        Expression operand = left;
        if (constant == null) {
            constant = constantSet(left);
            operand = right;
        }
        if (constant == null || !isVariable(operand)) return null;
        return constant;
    }

    private static @Nullable StringValueSet constantSet(Expression expr) {
        if (PrimitiveExpression.isNull(expr)) return StringValueSet.NULL;
        String value = stringValue(expr);
        return value == null ? null : StringValueSet.of(value);
    }

    static @Nullable String stringValue(Expression expr) {
        if (expr.getKind() != Expression.Kind.PRIMITIVE) return null;
        Object value = ((PrimitiveExpression) expr).getValue();
        return value instanceof String ? (String) value : null;
    }

    static boolean isStringType(@Nullable TypeRef type) {
        return type != null && type.getFullName().equals(KnownType.STRING.getFullName());
    }
}
