package io.github.eutro.cil2ast.ast;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class BlockStatement extends Statement {
    public static final BlockStatement EMPTY = new BlockStatement(Collections.emptyList());

    private final List<Statement> statements;

    public BlockStatement(List<Statement> statements) {
        this.statements = Nodes.copy(statements);
    }

    public static BlockStatement of(Statement... statements) {
        return new BlockStatement(Arrays.asList(statements));
    }

    /**
     * Wrap a statement in a block, unless it is one already.
     *
     * @param statement The statement.
     * @return The block.
     */
    public static BlockStatement wrap(Statement statement) {
        return statement.getKind() == Kind.BLOCK ? (BlockStatement) statement : of(statement);
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public BlockStatement withStatements(List<Statement> statements) {
        return Nodes.sameElements(statements, this.statements) ? this : new BlockStatement(statements);
    }

    @Override
    public Kind getKind() {
        return Kind.BLOCK;
    }
}
