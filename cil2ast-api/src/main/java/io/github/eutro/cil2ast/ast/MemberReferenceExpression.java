package io.github.eutro.cil2ast.ast;

import io.github.eutro.cil2ast.api.Symbol;

/**
 * A field access {@code target.member}. Static fields have a {@link TypeReferenceExpression} target.
 */
public final class MemberReferenceExpression extends Expression {
    private final Expression target;
    private final Symbol member;

    public MemberReferenceExpression(Expression target, Symbol member) {
        this.target = target;
        this.member = member;
    }

    public Expression getTarget() {
        return target;
    }

    public Symbol getMember() {
        return member;
    }

    public MemberReferenceExpression withTarget(Expression target) {
        return target == this.target ? this : new MemberReferenceExpression(target, member);
    }

    @Override
    public Kind getKind() {
        return Kind.MEMBER_REFERENCE;
    }
}
