package io.github.eutro.cil2ast.passes.structure;

import io.github.eutro.cil2ast.ast.Annotations;
import io.github.eutro.cil2ast.ast.AstQueries;
import io.github.eutro.cil2ast.ast.AstRewriter;
import io.github.eutro.cil2ast.ast.EmptyStatement;
import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ast.GotoStatement;
import io.github.eutro.cil2ast.ast.LabelStatement;
import io.github.eutro.cil2ast.ast.Statement;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes labels nothing jumps to, and jumps to the statement that follows anyway.
 */
final class LabelCleanup extends AstRewriter {
    private final Set<String> referenced;
    boolean changed;

    private LabelCleanup(Annotations annotations, Set<String> referenced) {
        super(annotations);
        this.referenced = referenced;
    }

    static List<Statement> clean(Annotations annotations, List<Statement> body) {
        List<Statement> current = body;
        while (true) {
            LabelCleanup cleanup = new LabelCleanup(annotations, referencedLabels(current));
            current = new ArrayList<>(cleanup.rewriteStatements(current));
            if (!cleanup.changed) return current;
        }
    }

    static Set<String> referencedLabels(List<Statement> statements) {
        Set<String> labels = new HashSet<>();
        AstQueries.anyStatement(statements, stmt -> {
            if (stmt.getKind() == Statement.Kind.GOTO) labels.add(((GotoStatement) stmt).getLabel());
            return false;
        });
        return labels;
    }

    @Override
    public Expression rewrite(Expression expr) {
        return expr;
    }

    @Override
    protected List<Statement> rewriteStatements(List<Statement> statements) {
        List<Statement> result = new ArrayList<>(statements.size());
        for (int i = 0; i < statements.size(); i++) {
            Statement stmt = statements.get(i);
            switch (stmt.getKind()) {
                case LABEL:
                    if (!referenced.contains(((LabelStatement) stmt).getLabel())) {
                        changed = true;
                        continue;
                    }
                    break;
                case GOTO: {
                    String label = ((GotoStatement) stmt).getLabel();
                    if (jumpsToNext(statements, i + 1, label)) {
                        changed = true;
                        continue;
                    }
                    break;
                }
                default:
                    break;
            }
            result.add(rewrite(stmt));
        }
        if (!result.isEmpty() && result.get(result.size() - 1).getKind() == Statement.Kind.LABEL) {
            result.add(EmptyStatement.INSTANCE);
        }
        return result;
    }

    private static boolean jumpsToNext(List<Statement> statements, int from, String label) {
        for (int i = from; i < statements.size(); i++) {
            Statement stmt = statements.get(i);
            if (stmt.getKind() != Statement.Kind.LABEL) return false;
            if (((LabelStatement) stmt).getLabel().equals(label)) return true;
        }
        return false;
    }
}
