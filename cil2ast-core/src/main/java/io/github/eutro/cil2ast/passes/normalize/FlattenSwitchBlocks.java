package io.github.eutro.cil2ast.passes.normalize;

import io.github.eutro.cil2ast.MethodTree;
import io.github.eutro.cil2ast.ast.Annotations;
import io.github.eutro.cil2ast.ast.AstQueries;
import io.github.eutro.cil2ast.ast.AstRewriter;
import io.github.eutro.cil2ast.ast.BlockStatement;
import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ast.Statement;
import io.github.eutro.cil2ast.ast.SwitchSection;
import io.github.eutro.cil2ast.passes.InPlaceIRPass;

import java.util.List;

/**
 * Replaces a switch section consisting of a single block with the block's contents,
 * unless the block declares something that would then be visible to the other sections.
 */
public class FlattenSwitchBlocks implements InPlaceIRPass<MethodTree> {
    /**
     * A singleton instance of this pass.
     */
    public static final FlattenSwitchBlocks INSTANCE = new FlattenSwitchBlocks();

    @Override
    public void runInPlace(MethodTree tree) {
        tree.setBody(new Flattener(tree.getAnnotations()).rewriteBlock(tree.getBody()));
    }

    private static final class Flattener extends AstRewriter {
        Flattener(Annotations annotations) {
            super(annotations);
        }

        @Override
        public Expression rewrite(Expression expr) {
            return expr;
        }

        @Override
        protected SwitchSection rewriteSection(SwitchSection section) {
            SwitchSection rewritten = super.rewriteSection(section);
            List<Statement> statements = rewritten.getStatements();
            while (statements.size() == 1 && statements.get(0).getKind() == Statement.Kind.BLOCK) {
                List<Statement> inner = ((BlockStatement) statements.get(0)).getStatements();
                if (inner.isEmpty() || AstQueries.declaresInScope(inner)) break;
                statements = inner;
            }
            return statements == rewritten.getStatements() ? rewritten : rewritten.withStatements(statements);
        }
    }
}
