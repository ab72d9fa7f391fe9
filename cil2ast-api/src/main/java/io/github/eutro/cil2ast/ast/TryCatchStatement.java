package io.github.eutro.cil2ast.ast;

import org.jetbrains.annotations.Nullable;

import java.util.List;

public final class TryCatchStatement extends Statement {
    private final BlockStatement tryBlock;
    private final List<CatchClause> catchClauses;
    @Nullable
    private final BlockStatement finallyBlock;

    public TryCatchStatement(BlockStatement tryBlock,
                             List<CatchClause> catchClauses,
                             @Nullable BlockStatement finallyBlock) {
        if (catchClauses.isEmpty() && finallyBlock == null) {
            throw new IllegalArgumentException("try without catch or finally");
        }
        this.tryBlock = tryBlock;
        this.catchClauses = Nodes.copy(catchClauses);
        this.finallyBlock = finallyBlock;
    }

    public BlockStatement getTryBlock() {
        return tryBlock;
    }

    public List<CatchClause> getCatchClauses() {
        return catchClauses;
    }

    public @Nullable BlockStatement getFinallyBlock() {
        return finallyBlock;
    }

    public TryCatchStatement with(BlockStatement tryBlock,
                                  List<CatchClause> catchClauses,
                                  @Nullable BlockStatement finallyBlock) {
        if (tryBlock == this.tryBlock
                && Nodes.sameElements(catchClauses, this.catchClauses)
                && finallyBlock == this.finallyBlock) {
            return this;
        }
        return new TryCatchStatement(tryBlock, catchClauses, finallyBlock);
    }

    @Override
    public Kind getKind() {
        return Kind.TRY_CATCH;
    }
}
