package io.github.eutro.cil2ast.passes.normalize;

import io.github.eutro.cil2ast.MethodTree;
import io.github.eutro.cil2ast.api.ConversionOperator;
import io.github.eutro.cil2ast.api.KnownType;
import io.github.eutro.cil2ast.api.Symbol;
import io.github.eutro.cil2ast.api.TypeRef;
import io.github.eutro.cil2ast.api.TypeResolver;
import io.github.eutro.cil2ast.ast.Annotations;
import io.github.eutro.cil2ast.ast.AstRewriter;
import io.github.eutro.cil2ast.ast.BinaryOperatorExpression;
import io.github.eutro.cil2ast.ast.BinaryOperatorType;
import io.github.eutro.cil2ast.ast.CastExpression;
import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ast.InvocationExpression;
import io.github.eutro.cil2ast.ast.PrimitiveExpression;
import io.github.eutro.cil2ast.ast.UnaryOperatorExpression;
import io.github.eutro.cil2ast.ast.UnaryOperatorType;
import io.github.eutro.cil2ast.passes.InPlaceIRPass;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces calls to operator methods with the operators themselves.
 * <p>
 * Binary and unary operator methods become operator expressions annotated with
 * {@link Annotations#USER_DEFINED_OPERATOR}, conversion operators become casts, and,
 * if enabled, {@code string.Concat} becomes a chain of {@code +}.
 * {@code op_Increment} and {@code op_Decrement} are left alone, since they do not assign.
 */
public class ReplaceMethodCallsWithOperators implements InPlaceIRPass<MethodTree> {
    /**
     * A singleton instance of this pass.
     */
    public static final ReplaceMethodCallsWithOperators INSTANCE = new ReplaceMethodCallsWithOperators();

    private static final int MAX_CONCAT_ARGUMENTS = 4;

    @Override
    public void runInPlace(MethodTree tree) {
        Replacer replacer = new Replacer(tree.getAnnotations(),
                tree.getContext().getTypeResolver(),
                tree.getContext().getSettings().isStringConcat());
        tree.setBody(replacer.rewriteBlock(tree.getBody()));
    }

    /**
     * Rewrite a call to a user-defined conversion operator as a cast to its target type.
     *
     * @param resolver The type resolver to look conversion operators up with.
     * @param expr     The expression.
     * @return The cast, or the expression itself if it is not such a call.
     */
    public static Expression convertOperator(TypeResolver resolver, Expression expr) {
        if (expr.getKind() != Expression.Kind.INVOCATION) return expr;
        InvocationExpression invocation = (InvocationExpression) expr;
        Symbol method = invocation.getMethod();
        if (!method.isStatic() || invocation.getArguments().size() != 1) return expr;
        if (!method.getName().equals(ConversionOperator.Kind.IMPLICIT.getMetadataName())
                && !method.getName().equals(ConversionOperator.Kind.EXPLICIT.getMetadataName())) {
            return expr;
        }
        // the operator may be declared on either side of the conversion
        List<TypeRef> owners = new ArrayList<>();
        if (method.getDeclaringType() != null) owners.add(method.getDeclaringType());
        owners.add(method.getParameterTypes().get(0));
        for (TypeRef owner : owners) {
            for (ConversionOperator operator : resolver.getConversionOperators(owner)) {
                if (operator.getMethod().equals(method)) {
                    return new CastExpression(operator.getTargetType(), invocation.getArguments().get(0));
                }
            }
        }
        return expr;
    }

    private static final class Replacer extends AstRewriter {
        private final TypeResolver resolver;
        private final boolean stringConcat;

        Replacer(Annotations annotations, TypeResolver resolver, boolean stringConcat) {
            super(annotations);
            this.resolver = resolver;
            this.stringConcat = stringConcat;
        }

        @Override
        public Expression rewrite(Expression expr) {
            Expression rewritten = rewriteChildren(expr);
            if (rewritten.getKind() != Expression.Kind.INVOCATION) return rewritten;
            InvocationExpression invocation = (InvocationExpression) rewritten;
            Symbol method = invocation.getMethod();
            if (!method.isStatic()) return rewritten;
            List<Expression> args = invocation.getArguments();
            String name = method.getName();

            if (args.size() == 2) {
                BinaryOperatorType binary = BinaryOperatorType.byOperatorMethodName(name);
                if (binary != null) {
                    return userDefined(expr, new BinaryOperatorExpression(args.get(0), binary, args.get(1)), method);
                }
            }
            if (args.size() == 1) {
                UnaryOperatorType unary = UnaryOperatorType.byOperatorMethodName(name);
                if (unary != null
                        && unary != UnaryOperatorType.INCREMENT
                        && unary != UnaryOperatorType.DECREMENT) {
                    return userDefined(expr, new UnaryOperatorExpression(unary, args.get(0)), method);
                }
                Expression cast = convertOperator(resolver, invocation);
                if (cast != invocation) {
                    annotations.copy(expr, cast);
                    return cast;
                }
            }
            if (stringConcat && isConcat(method, args)) {
                Expression chain = args.get(0);
                for (int i = 1; i < args.size(); i++) {
                    chain = new BinaryOperatorExpression(chain, BinaryOperatorType.ADD, args.get(i));
                }
                annotations.copy(expr, chain);
                return chain;
            }
            return rewritten;
        }

        private Expression userDefined(Expression old, Expression replacement, Symbol method) {
            annotations.copy(old, replacement);
            annotations.put(replacement, Annotations.USER_DEFINED_OPERATOR, method);
            return replacement;
        }

        private boolean isConcat(Symbol method, List<Expression> args) {
            TypeRef owner = method.getDeclaringType();
            if (owner == null
                    || !resolver.isKnownType(owner, KnownType.STRING)
                    || !method.getName().equals("Concat")
                    || args.size() < 2
                    || args.size() > MAX_CONCAT_ARGUMENTS
                    || args.size() != method.getParameterTypes().size()) {
                return false;
            }
            // the first + must already be a string concatenation, or it would be an addition
            boolean allStrings = true;
            for (TypeRef parameter : method.getParameterTypes()) {
                if (!resolver.isKnownType(parameter, KnownType.STRING)) {
                    allStrings = false;
                    break;
                }
            }
            return allStrings || isStringLiteral(args.get(0)) || isStringLiteral(args.get(1));
        }

        private static boolean isStringLiteral(Expression expr) {
            return expr.getKind() == Expression.Kind.PRIMITIVE
                    && ((PrimitiveExpression) expr).getValue() instanceof String;
        }
    }
}
