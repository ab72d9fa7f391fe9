package io.github.eutro.cil2ast.passes.structure;

import io.github.eutro.cil2ast.Diagnostic;
import io.github.eutro.cil2ast.MethodTree;
import io.github.eutro.cil2ast.api.ErrorKind;
import io.github.eutro.cil2ast.ast.Annotations;
import io.github.eutro.cil2ast.ast.AstRewriter;
import io.github.eutro.cil2ast.ast.BinaryOperatorExpression;
import io.github.eutro.cil2ast.ast.BinaryOperatorType;
import io.github.eutro.cil2ast.ast.BlockStatement;
import io.github.eutro.cil2ast.ast.CaseLabel;
import io.github.eutro.cil2ast.ast.EmptyStatement;
import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ast.GotoCaseStatement;
import io.github.eutro.cil2ast.ast.GotoDefaultStatement;
import io.github.eutro.cil2ast.ast.GotoStatement;
import io.github.eutro.cil2ast.ast.IfElseStatement;
import io.github.eutro.cil2ast.ast.LabelStatement;
import io.github.eutro.cil2ast.ast.PrimitiveExpression;
import io.github.eutro.cil2ast.ast.Statement;
import io.github.eutro.cil2ast.ast.SwitchSection;
import io.github.eutro.cil2ast.ast.SwitchStatement;
import io.github.eutro.cil2ast.passes.InPlaceIRPass;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves jumps between the sections of each switch.
 * <p>
 * A section that only jumps to the next section is merged into it. Any other jump to the start of a
 * sibling section becomes {@code goto case} or {@code goto default}. A {@code goto case} whose label no
 * section carries cannot be expressed, so its switch is lowered to conditional jumps to labelled sections.
 * Finally, sections that only {@code break} are moved after the default section.
 */
public class ResolveGotoCase implements InPlaceIRPass<MethodTree> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResolveGotoCase.class);

    /**
     * A singleton instance of this pass.
     */
    public static final ResolveGotoCase INSTANCE = new ResolveGotoCase();

    @Override
    public void runInPlace(MethodTree tree) {
        Resolver resolver = new Resolver(tree);
        List<Statement> body = resolver.rewriteStatements(tree.getBody().getStatements());
        body = LabelCleanup.clean(tree.getAnnotations(), body);
        tree.setBody(tree.getBody().withStatements(body));
    }

    private static final class Resolver extends AstRewriter {
        private final MethodTree tree;
        private final Set<Statement> spliced = Collections.newSetFromMap(new IdentityHashMap<>());
        private int lowered;

        Resolver(MethodTree tree) {
            super(tree.getAnnotations());
            this.tree = tree;
        }

        @Override
        public Expression rewrite(Expression expr) {
            return expr;
        }

        @Override
        protected List<Statement> rewriteStatements(List<Statement> statements) {
            List<Statement> result = new ArrayList<>(statements.size());
            for (Statement statement : statements) {
                Statement rewritten = rewrite(statement);
                if (spliced.contains(rewritten)) {
                    result.addAll(((BlockStatement) rewritten).getStatements());
                } else {
                    result.add(rewritten);
                }
            }
            return result;
        }

        @Override
        public Statement rewrite(Statement stmt) {
            Statement rewritten = rewriteChildren(stmt);
            if (rewritten.getKind() != Statement.Kind.SWITCH) return rewritten;
            SwitchStatement sw = (SwitchStatement) rewritten;
            List<SwitchSection> sections = stackLabels(sw.getSections());
            sections = resolveJumps(sections);
            if (!isResolved(sections)) {
                return lower(sw.getExpression(), sections);
            }
            return keep(stmt, sw.with(sw.getExpression(), moveBreakOnly(sections)));
        }

        private Statement keep(Statement old, Statement rebuilt) {
            annotations.copy(old, rebuilt);
            return rebuilt;
        }

        /**
         * Merge sections that only jump to the next section into it.
         */
        private List<SwitchSection> stackLabels(List<SwitchSection> sections) {
            List<SwitchSection> result = new ArrayList<>();
            List<CaseLabel> pendingLabels = new ArrayList<>();
            List<Statement> pendingLeading = new ArrayList<>();
            for (int i = 0; i < sections.size(); i++) {
                SwitchSection section = sections.get(i);
                List<Statement> leading = leadingLabels(section.getStatements());
                List<Statement> rest = section.getStatements().subList(leading.size(), section.getStatements().size());
                if (i + 1 < sections.size()
                        && rest.size() == 1
                        && rest.get(0).getKind() == Statement.Kind.GOTO
                        && startsWith(sections.get(i + 1), ((GotoStatement) rest.get(0)).getLabel())) {
                    pendingLabels.addAll(section.getLabels());
                    pendingLeading.addAll(leading);
                    continue;
                }
                if (pendingLabels.isEmpty()) {
                    result.add(section);
                    continue;
                }
                List<CaseLabel> labels = new ArrayList<>(pendingLabels);
                labels.addAll(section.getLabels());
                List<Statement> stmts = new ArrayList<>(pendingLeading);
                stmts.addAll(section.getStatements());
                result.add(new SwitchSection(labels, stmts));
                pendingLabels.clear();
                pendingLeading.clear();
            }
            return result;
        }

        private static List<Statement> leadingLabels(List<Statement> statements) {
            int i = 0;
            while (i < statements.size() && statements.get(i).getKind() == Statement.Kind.LABEL) i++;
            return statements.subList(0, i);
        }

        private static boolean startsWith(SwitchSection section, String label) {
            for (Statement stmt : leadingLabels(section.getStatements())) {
                if (((LabelStatement) stmt).getLabel().equals(label)) return true;
            }
            return false;
        }

        private List<SwitchSection> resolveJumps(List<SwitchSection> sections) {
            Map<String, SwitchSection> targets = new HashMap<>();
            for (SwitchSection section : sections) {
                for (Statement stmt : leadingLabels(section.getStatements())) {
                    targets.put(((LabelStatement) stmt).getLabel(), section);
                }
            }
            if (targets.isEmpty()) return sections;
            List<SwitchSection> result = new ArrayList<>();
            SectionJumps jumps = new SectionJumps(annotations, targets);
            for (SwitchSection section : sections) {
                result.add(section.withStatements(jumps.rewriteBlock(new BlockStatement(section.getStatements())).getStatements()));
            }
            return result;
        }

        private boolean isResolved(List<SwitchSection> sections) {
            CaseJumpScan scan = new CaseJumpScan(annotations, sections);
            for (SwitchSection section : sections) {
                scan.rewriteBlock(new BlockStatement(section.getStatements()));
            }
            return !scan.unresolved;
        }

        private static @Nullable SwitchSection findSection(List<SwitchSection> sections, CaseLabel label) {
            for (SwitchSection section : sections) {
                if (section.getLabels().contains(label)) return section;
            }
            return null;
        }

        private static List<SwitchSection> moveBreakOnly(List<SwitchSection> sections) {
            int defaultIndex = -1;
            for (int i = 0; i < sections.size(); i++) {
                if (sections.get(i).hasDefault()) defaultIndex = i;
            }
            if (defaultIndex < 0) return sections;
            List<SwitchSection> moved = new ArrayList<>();
            List<SwitchSection> result = new ArrayList<>();
            for (int i = 0; i < sections.size(); i++) {
                SwitchSection section = sections.get(i);
                if (i < defaultIndex && section.isBreakOnly()) {
                    moved.add(section);
                    continue;
                }
                result.add(section);
                if (i == defaultIndex) result.addAll(moved);
            }
            return result;
        }

        /**
         * Lower a switch to conditional jumps to labelled sections.
         */
        private Statement lower(Expression discriminant, List<SwitchSection> sections) {
            int id = lowered++;
            String end = "switch_end_" + id;
            LOGGER.debug("{}: lowering switch on {} to jumps", tree.getMethodId(), discriminant);
            tree.getDiagnostics().add(new Diagnostic(ErrorKind.UNRESOLVED_GOTO, Diagnostic.NO_OFFSET,
                    "switch on " + discriminant + " jumps to a missing case"));

            Map<SwitchSection, String> names = new HashMap<>();
            for (int i = 0; i < sections.size(); i++) {
                names.put(sections.get(i), "switch_" + id + "_case_" + i);
            }
            SwitchSection defaultSection = findSection(sections, CaseLabel.DEFAULT);
            String fallback = defaultSection == null ? end : names.get(defaultSection);

            List<Statement> stmts = new ArrayList<>();
            for (SwitchSection section : sections) {
                Expression condition = null;
                for (CaseLabel label : section.getLabels()) {
                    if (label.isDefault()) continue;
                    Expression test = new BinaryOperatorExpression(discriminant, BinaryOperatorType.EQUALITY, labelValue(label));
                    condition = condition == null
                            ? test
                            : new BinaryOperatorExpression(condition, BinaryOperatorType.CONDITIONAL_OR, test);
                }
                if (condition != null) {
                    stmts.add(new IfElseStatement(condition, new GotoStatement(names.get(section)), null));
                }
            }
            stmts.add(new GotoStatement(fallback));

            RawSectionJumps raw = new RawSectionJumps(annotations, sections, names, fallback, end);
            for (SwitchSection section : sections) {
                stmts.add(new LabelStatement(names.get(section)));
                stmts.addAll(raw.rewriteBlock(new BlockStatement(section.getStatements())).getStatements());
            }
            stmts.add(new LabelStatement(end));
            stmts.add(EmptyStatement.INSTANCE);
            BlockStatement block = new BlockStatement(stmts);
            spliced.add(block);
            return block;
        }

        private static Expression labelValue(CaseLabel label) {
            switch (label.getKind()) {
                case INTEGER: {
                    long value = label.getIntegerValue();
                    return value == (int) value
                            ? PrimitiveExpression.of((int) value)
                            : new PrimitiveExpression(value);
                }
                case STRING:
                    return new PrimitiveExpression(label.getStringValue());
                case NULL:
                    return PrimitiveExpression.NULL;
                default:
                    throw new IllegalArgumentException(label.toString());
            }
        }
    }

    /**
     * Rewrites jumps to the start of sibling sections, not looking into nested switches.
     */
    private static final class SectionJumps extends AstRewriter {
        private final Map<String, SwitchSection> targets;

        SectionJumps(Annotations annotations, Map<String, SwitchSection> targets) {
            super(annotations);
            this.targets = targets;
        }

        @Override
        public Expression rewrite(Expression expr) {
            return expr;
        }

        @Override
        public Statement rewrite(Statement stmt) {
            switch (stmt.getKind()) {
                case SWITCH:
                    return stmt;
                case GOTO: {
                    SwitchSection target = targets.get(((GotoStatement) stmt).getLabel());
                    if (target == null) return stmt;
                    for (CaseLabel label : target.getLabels()) {
                        if (!label.isDefault()) return new GotoCaseStatement(label);
                    }
                    return GotoDefaultStatement.INSTANCE;
                }
                default:
                    return rewriteChildren(stmt);
            }
        }
    }

    /**
     * Rewrites the jumps of a lowered switch: {@code break} leaves past its end, and case jumps go to section labels.
     */
    private static final class RawSectionJumps extends AstRewriter {
        private final List<SwitchSection> sections;
        private final Map<SwitchSection, String> names;
        private final String fallback;
        private final String end;
        private int loopDepth;

        RawSectionJumps(Annotations annotations,
                        List<SwitchSection> sections,
                        Map<SwitchSection, String> names,
                        String fallback,
                        String end) {
            super(annotations);
            this.sections = sections;
            this.names = names;
            this.fallback = fallback;
            this.end = end;
        }

        @Override
        public Expression rewrite(Expression expr) {
            return expr;
        }

        @Override
        public Statement rewrite(Statement stmt) {
            switch (stmt.getKind()) {
                case BREAK:
                    return loopDepth == 0 ? new GotoStatement(end) : stmt;
                case GOTO_CASE: {
                    SwitchSection target = Resolver.findSection(sections, ((GotoCaseStatement) stmt).getLabel());
                    // a value no case carries goes where the dispatch sends it
                    return new GotoStatement(target == null ? fallback : names.get(target));
                }
                case GOTO_DEFAULT:
                    return new GotoStatement(fallback);
                case SWITCH:
                    return stmt;
                case WHILE:
                case DO_WHILE:
                case FOR: {
                    loopDepth++;
                    try {
                        return rewriteChildren(stmt);
                    } finally {
                        loopDepth--;
                    }
                }
                default:
                    return rewriteChildren(stmt);
            }
        }
    }

    /**
     * Finds {@code goto case} and {@code goto default} jumps of a switch that no section carries the label of.
     */
    private static final class CaseJumpScan extends AstRewriter {
        private final List<SwitchSection> sections;
        boolean unresolved;

        CaseJumpScan(Annotations annotations, List<SwitchSection> sections) {
            super(annotations);
            this.sections = sections;
        }

        @Override
        public Expression rewrite(Expression expr) {
            return expr;
        }

        @Override
        public Statement rewrite(Statement stmt) {
            switch (stmt.getKind()) {
                case SWITCH:
                    return stmt;
                case GOTO_CASE:
                    if (Resolver.findSection(sections, ((GotoCaseStatement) stmt).getLabel()) == null) unresolved = true;
                    return stmt;
                case GOTO_DEFAULT:
                    if (Resolver.findSection(sections, CaseLabel.DEFAULT) == null) unresolved = true;
                    return stmt;
                default:
                    return rewriteChildren(stmt);
            }
        }
    }
}
