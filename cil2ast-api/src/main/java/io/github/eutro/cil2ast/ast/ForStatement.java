package io.github.eutro.cil2ast.ast;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * {@code for (initializers; condition; iterators) body}. A missing condition loops forever.
 */
public final class ForStatement extends Statement {
    private final List<Statement> initializers;
    @Nullable
    private final Expression condition;
    private final List<Expression> iterators;
    private final Statement body;

    public ForStatement(List<Statement> initializers,
                        @Nullable Expression condition,
                        List<Expression> iterators,
                        Statement body) {
        this.initializers = Nodes.copy(initializers);
        this.condition = condition;
        this.iterators = Nodes.copy(iterators);
        this.body = body;
    }

    public List<Statement> getInitializers() {
        return initializers;
    }

    public @Nullable Expression getCondition() {
        return condition;
    }

    public List<Expression> getIterators() {
        return iterators;
    }

    public Statement getBody() {
        return body;
    }

    public ForStatement with(List<Statement> initializers,
                             @Nullable Expression condition,
                             List<Expression> iterators,
                             Statement body) {
        if (Nodes.sameElements(initializers, this.initializers)
                && condition == this.condition
                && Nodes.sameElements(iterators, this.iterators)
                && body == this.body) {
            return this;
        }
        return new ForStatement(initializers, condition, iterators, body);
    }

    @Override
    public Kind getKind() {
        return Kind.FOR;
    }
}
