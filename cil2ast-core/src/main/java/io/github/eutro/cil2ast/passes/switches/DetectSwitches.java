package io.github.eutro.cil2ast.passes.switches;

import io.github.eutro.cil2ast.api.DecompilerSettings;
import io.github.eutro.cil2ast.api.ErrorKind;
import io.github.eutro.cil2ast.api.Symbol;
import io.github.eutro.cil2ast.api.TypeRef;
import io.github.eutro.cil2ast.ast.AssignmentExpression;
import io.github.eutro.cil2ast.ast.AssignmentOperatorType;
import io.github.eutro.cil2ast.ast.AstQueries;
import io.github.eutro.cil2ast.ast.CaseLabel;
import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ast.ExpressionStatement;
import io.github.eutro.cil2ast.ast.IdentifierExpression;
import io.github.eutro.cil2ast.ast.InvocationExpression;
import io.github.eutro.cil2ast.ast.MemberReferenceExpression;
import io.github.eutro.cil2ast.ast.Statement;
import io.github.eutro.cil2ast.ast.UnaryOperatorExpression;
import io.github.eutro.cil2ast.ast.UnaryOperatorType;
import io.github.eutro.cil2ast.cfg.BasicBlock;
import io.github.eutro.cil2ast.cfg.Control;
import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import io.github.eutro.cil2ast.cfg.SwitchCase;
import io.github.eutro.cil2ast.cfg.SwitchConstruct;
import io.github.eutro.cil2ast.ext.CfgExts;
import io.github.eutro.cil2ast.ext.MetadataState;
import io.github.eutro.cil2ast.passes.InPlaceIRPass;
import io.github.eutro.cil2ast.passes.normalize.ReplaceMethodCallsWithOperators;
import io.github.eutro.cil2ast.util.GraphWalker;
import io.github.eutro.cil2ast.util.LongSet;
import io.github.eutro.cil2ast.util.StringValueSet;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites comparison trees, jump tables and string comparison chains on one variable
 * into a single {@link Control.Kind#SWITCH} control holding a {@link SwitchConstruct}.
 * <p>
 * Trees are found from their root, visiting blocks in reverse post-order so a tree is
 * never split by recognising one of its subtrees first. A tree that looks like a switch
 * but fails the acceptance policy is left as it is, and recorded as
 * {@link ErrorKind#AMBIGUOUS_SWITCH_SHAPE}.
 * <p>
 * Any jump table left over afterwards becomes a switch with one case per table entry.
 */
public class DetectSwitches implements InPlaceIRPass<ControlFlowGraph> {
    private static final Logger LOGGER = LoggerFactory.getLogger(DetectSwitches.class);

    /**
     * A singleton instance of this pass.
     */
    public static final DetectSwitches INSTANCE = new DetectSwitches();

    /**
     * Sections with more values than this are taken to be the default section.
     */
    public static final int MAX_VALUES_PER_SECTION = 100;

    /**
     * The most jump table entries allowed per distinct case value.
     */
    public static final int JUMP_TABLE_SPARSITY_LIMIT = 4;

    private static final String COMPUTE_STRING_HASH = "ComputeStringHash";

    private static final class Candidate {
        final BasicBlock root;
        Expression discriminant;
        final List<SwitchCase> cases = new ArrayList<>();
        final Set<BasicBlock> removed = new LinkedHashSet<>();
        int removedStatements;
        /**
         * Locals that only the replaced code used.
         */
        final Set<String> unusedLocals = new LinkedHashSet<>();

        Candidate(BasicBlock root, Expression discriminant) {
            this.root = root;
            this.discriminant = discriminant;
        }
    }

    @Override
    public void runInPlace(ControlFlowGraph graph) {
        MetadataState ms = graph.getExtOrThrow(CfgExts.METADATA_STATE);
        ms.ensureValid(graph, MetadataState.PREDS, MetadataState.DOMS, MetadataState.POST_DOMS);
        DecompilerSettings settings = graph.getContext().getSettings();

        boolean changed = false;
        for (BasicBlock block : GraphWalker.handlerAwareWalker(graph).reversePostOrder()) {
            if (block.getGraph() != graph) continue;
            Control control = block.getControl();
            if (control.getKind() != Control.Kind.CONDITIONAL
                    && (control.getKind() != Control.Kind.SWITCH || control.getSwitchConstruct() != null)) {
                continue;
            }
            Candidate candidate = detect(graph, block, settings);
            if (candidate != null) {
                apply(graph, candidate);
                changed = true;
                ms.graphChanged();
                ms.ensureValid(graph, MetadataState.PREDS, MetadataState.DOMS, MetadataState.POST_DOMS);
            }
        }

        for (BasicBlock block : graph.blocks) {
            Control control = block.getControl();
            if (control.getKind() == Control.Kind.SWITCH && control.getSwitchConstruct() == null) {
                block.setControl(Control.switchOn(fromJumpTable(control)));
                changed = true;
            }
        }
        if (changed) {
            ms.graphChanged();
            ms.ensureValid(graph, MetadataState.PREDS);
        }

        if (settings.isSwitchExpressions()) {
            for (BasicBlock block : graph.blocks) {
                SwitchConstruct construct = block.getControl().getSwitchConstruct();
                if (construct != null) dischargeAsValue(block, construct);
            }
        }
    }

    private static @Nullable Candidate detect(ControlFlowGraph graph, BasicBlock root, DecompilerSettings settings) {
        Candidate candidate = null;
        if (settings.isSwitchStatementOnString()) {
            candidate = detectHashDispatch(graph, root);
            if (candidate == null) candidate = detectStringChain(graph, root);
        }
        if (candidate == null) candidate = detectNullable(graph, root, settings);
        if (candidate == null) candidate = detectInteger(graph, root, settings);
        return candidate;
    }

    private static void apply(ControlFlowGraph graph, Candidate candidate) {
        BasicBlock root = candidate.root;
        List<Statement> statements = root.getStatements();
        for (int i = 0; i < candidate.removedStatements; i++) {
            statements.remove(statements.size() - 1);
        }
        SwitchConstruct construct = new SwitchConstruct(candidate.discriminant, candidate.cases);
        root.setControl(Control.switchOn(construct));
        for (BasicBlock block : candidate.removed) {
            graph.removeBlock(block);
        }
        for (String local : candidate.unusedLocals) {
            if (graph.getLocalType(local) != null && uses(graph.blocks, local) == 0) {
                graph.removeLocal(local);
            }
        }
        LOGGER.debug("{}: switch at {}: {}", graph.getMethodId(), root.getLabel(), construct);
    }

    private static void reject(ControlFlowGraph graph, BasicBlock root, String reason) {
        graph.addDiagnostic(ErrorKind.AMBIGUOUS_SWITCH_SHAPE, root.getOffset(),
                "not a switch at " + root.getLabel() + ": " + reason);
    }

    // integers

    private static @Nullable Candidate detectInteger(ControlFlowGraph graph, BasicBlock root, DecompilerSettings settings) {
        IntegerSwitchAnalysis analysis = new IntegerSwitchAnalysis(root, null);
        if (!analysis.analyze()) return null;
        if (analysis.innerBlocks.isEmpty() && !analysis.containsTable) return null;

        BasicBlock defaultTarget = findDefault(analysis.sections);
        String reason = defaultTarget == null
                ? "no single section can be the default"
                : checkInteger(analysis, settings, defaultTarget, 0);
        if (reason == null) reason = checkExits(root, analysis.sections.keySet(), analysis.innerBlocks);
        if (reason != null) {
            reject(graph, root, reason);
            return null;
        }

        //noinspection ConstantConditions
        Candidate candidate = new Candidate(root, new IdentifierExpression(analysis.variable));
        candidate.removed.addAll(analysis.innerBlocks);
        addIntegerCases(candidate, analysis.sections, defaultTarget, null);
        inlineDiscriminant(graph, candidate, analysis.variable);
        return candidate;
    }

    private static @Nullable BasicBlock findDefault(Map<BasicBlock, LongSet> sections) {
        BasicBlock defaultTarget = null;
        for (Map.Entry<BasicBlock, LongSet> entry : sections.entrySet()) {
            if (entry.getValue().count() > MAX_VALUES_PER_SECTION) {
                if (defaultTarget != null) return null;
                defaultTarget = entry.getKey();
            }
        }
        return defaultTarget;
    }

    private static @Nullable String checkInteger(IntegerSwitchAnalysis analysis,
                                                 DecompilerSettings settings,
                                                 BasicBlock defaultTarget,
                                                 int extraSections) {
        long distinctValues = 0;
        int intervals = 0;
        for (Map.Entry<BasicBlock, LongSet> entry : analysis.sections.entrySet()) {
            if (entry.getKey() == defaultTarget) continue;
            distinctValues += entry.getValue().count();
            intervals += entry.getValue().intervalCount();
        }
        if (analysis.containsTable) {
            if (analysis.tableEntries > JUMP_TABLE_SPARSITY_LIMIT * distinctValues) {
                return "jump table with " + analysis.tableEntries + " entries for "
                        + distinctValues + " values is too sparse";
            }
            return null;
        }
        if (!settings.isSparseIntegerSwitch()) return "comparison trees are not switches";
        if (analysis.sections.size() + extraSections < 3) return "only two sections";
        if (analysis.ifCount < intervals) {
            return analysis.ifCount + " comparisons cannot select " + intervals + " ranges";
        }
        return checkCrossing(analysis.root, analysis.sections.keySet());
    }

    private static void addIntegerCases(Candidate candidate,
                                        Map<BasicBlock, LongSet> sections,
                                        BasicBlock defaultTarget,
                                        @Nullable BasicBlock nullTarget) {
        List<SwitchCase> cases = new ArrayList<>();
        boolean nullPlaced = nullTarget == null || nullTarget == defaultTarget;
        SwitchCase nullCase = null;
        for (Map.Entry<BasicBlock, LongSet> entry : sections.entrySet()) {
            if (entry.getKey() == defaultTarget) continue;
            List<CaseLabel> labels = new ArrayList<>();
            if (!nullPlaced && entry.getKey() == nullTarget) {
                labels.add(CaseLabel.NULL);
                nullPlaced = true;
            }
            for (long value : entry.getValue().values()) {
                labels.add(CaseLabel.of(value));
            }
            SwitchCase switchCase = new SwitchCase(labels, false, entry.getKey());
            if (labels.get(0) == CaseLabel.NULL) {
                nullCase = switchCase;
            } else {
                cases.add(switchCase);
            }
        }
        cases.sort(Comparator.comparingLong(it -> it.getLabels().get(0).getIntegerValue()));
        if (!nullPlaced) {
            nullCase = new SwitchCase(Collections.singletonList(CaseLabel.NULL), false, nullTarget);
        }
        if (nullCase != null) candidate.cases.add(nullCase);
        candidate.cases.addAll(cases);
        candidate.cases.add(new SwitchCase(Collections.emptyList(), true, defaultTarget));
    }

    // nullable integers

    private static @Nullable Candidate detectNullable(ControlFlowGraph graph, BasicBlock root, DecompilerSettings settings) {
        Control control = root.getControl();
        if (control.getKind() != Control.Kind.CONDITIONAL) return null;
        //noinspection ConstantConditions
        Expression condition = control.getValue();
        boolean negated = false;
        if (condition.getKind() == Expression.Kind.UNARY_OPERATOR
                && ((UnaryOperatorExpression) condition).getOperator() == UnaryOperatorType.NOT) {
            condition = ((UnaryOperatorExpression) condition).getOperand();
            negated = true;
        }
        String nullable = hasValueTarget(condition);
        if (nullable == null) return null;
        BasicBlock valueBlock = control.targets.get(negated ? 1 : 0);
        BasicBlock nullTarget = control.targets.get(negated ? 0 : 1);
        if (valueBlock == root
                || valueBlock.predecessors().size() != 1
                || valueBlock.getStatements().size() != 1
                || graph.isRegionEntry(valueBlock)
                || !graph.inSameRegions(valueBlock, root)) {
            return null;
        }

        String value = getValueOrDefault(valueBlock.getStatements().get(0), nullable);
        if (value == null) return null;
        IntegerSwitchAnalysis analysis = new IntegerSwitchAnalysis(valueBlock, value);
        if (!analysis.analyze()) return null;

        BasicBlock defaultTarget = findDefault(analysis.sections);
        boolean separateNull = defaultTarget != null
                && nullTarget != defaultTarget
                && !analysis.sections.containsKey(nullTarget);
        String reason = defaultTarget == null
                ? "no single section can be the default"
                : checkInteger(analysis, settings, defaultTarget, separateNull ? 1 : 0);
        Set<BasicBlock> targets = new LinkedHashSet<>(analysis.sections.keySet());
        targets.add(nullTarget);
        List<BasicBlock> inner = new ArrayList<>(analysis.innerBlocks);
        inner.add(valueBlock);
        if (reason == null) reason = checkExits(root, targets, inner);
        if (reason != null) {
            reject(graph, root, reason);
            return null;
        }

        Candidate candidate = new Candidate(root, new IdentifierExpression(nullable));
        candidate.removed.addAll(inner);
        if (uses(graph.blocks, value) != uses(candidate.removed, value)) return null;
        candidate.unusedLocals.add(value);
        addIntegerCases(candidate, analysis.sections, defaultTarget, nullTarget);
        inlineDiscriminant(graph, candidate, nullable);
        return candidate;
    }

    private static @Nullable String hasValueTarget(Expression condition) {
        if (condition.getKind() != Expression.Kind.MEMBER_REFERENCE) return null;
        MemberReferenceExpression member = (MemberReferenceExpression) condition;
        if (!member.getMember().getName().equals("HasValue")) return null;
        Expression target = member.getTarget();
        return target.getKind() == Expression.Kind.IDENTIFIER ? ((IdentifierExpression) target).getName() : null;
    }

    private static @Nullable String getValueOrDefault(Statement statement, String nullable) {
        AssignmentExpression assignment = simpleAssignment(statement);
        if (assignment == null || assignment.getRight().getKind() != Expression.Kind.INVOCATION) return null;
        InvocationExpression invocation = (InvocationExpression) assignment.getRight();
        if (!invocation.getMethod().getName().equals("GetValueOrDefault")
                || !invocation.getArguments().isEmpty()
                || !IdentifierExpression.isNamed(invocation.getTarget(), nullable)) {
            return null;
        }
        return ((IdentifierExpression) assignment.getLeft()).getName();
    }

    // strings

    private static @Nullable Candidate detectStringChain(ControlFlowGraph graph, BasicBlock root) {
        if (root.getControl().getKind() != Control.Kind.CONDITIONAL) return null;
        StringSwitchAnalysis analysis = new StringSwitchAnalysis(root, null);
        if (!analysis.analyze() || analysis.innerBlocks.isEmpty()) return null;
        //noinspection ConstantConditions
        if (!StringSwitchAnalysis.isStringType(variableType(graph, analysis.variable))) return null;

        BasicBlock defaultTarget = null;
        boolean anyString = false;
        String reason = null;
        for (Map.Entry<BasicBlock, StringValueSet> entry : analysis.sections.entrySet()) {
            StringValueSet values = entry.getValue();
            if (values.isCofinite()) {
                if (defaultTarget != null) {
                    reason = "more than one default section";
                    break;
                }
                defaultTarget = entry.getKey();
            } else if (!values.strings().isEmpty()) {
                anyString = true;
            }
        }
        if (!anyString) return null;
        if (reason == null && analysis.sections.size() < 3) reason = "only two sections";
        if (reason == null) reason = checkCrossing(root, analysis.sections.keySet());
        if (reason == null) reason = checkExits(root, analysis.sections.keySet(), analysis.innerBlocks);
        if (reason != null) {
            reject(graph, root, reason);
            return null;
        }

        Candidate candidate = new Candidate(root, new IdentifierExpression(analysis.variable));
        candidate.removed.addAll(analysis.innerBlocks);
        addStringCases(candidate, analysis.sections, defaultTarget);
        inlineDiscriminant(graph, candidate, analysis.variable);
        return candidate;
    }

    private static void addStringCases(Candidate candidate,
                                       Map<BasicBlock, StringValueSet> sections,
                                       @Nullable BasicBlock defaultTarget) {
        for (Map.Entry<BasicBlock, StringValueSet> entry : sections.entrySet()) {
            if (entry.getKey() == defaultTarget) continue;
            StringValueSet values = entry.getValue();
            List<CaseLabel> labels = new ArrayList<>();
            if (values.containsNull()) labels.add(CaseLabel.NULL);
            for (String value : values.strings()) {
                labels.add(CaseLabel.of(value));
            }
            candidate.cases.add(new SwitchCase(labels, false, entry.getKey()));
        }
        if (defaultTarget != null) {
            candidate.cases.add(new SwitchCase(Collections.emptyList(), true, defaultTarget));
        }
    }

    /**
     * Detect a dispatch on {@code ComputeStringHash(s)}, whose leaves are chains of comparisons on {@code s}.
     * <p>
     * The comparisons on the hash are not analysed: a string reaching a bucket has the bucket's hash,
     * and every other string reaches the default, so the buckets alone determine the cases.
     */
    private static @Nullable Candidate detectHashDispatch(ControlFlowGraph graph, BasicBlock root) {
        List<Statement> statements = root.getStatements();
        if (statements.isEmpty()) return null;
        AssignmentExpression hashAssignment = simpleAssignment(statements.get(statements.size() - 1));
        if (hashAssignment == null || hashAssignment.getRight().getKind() != Expression.Kind.INVOCATION) return null;
        InvocationExpression hashCall = (InvocationExpression) hashAssignment.getRight();
        if (!hashCall.getMethod().getName().equals(COMPUTE_STRING_HASH)
                || hashCall.getArguments().size() != 1
                || hashCall.getArguments().get(0).getKind() != Expression.Kind.IDENTIFIER) {
            return null;
        }
        String hash = ((IdentifierExpression) hashAssignment.getLeft()).getName();
        String string = ((IdentifierExpression) hashCall.getArguments().get(0)).getName();
        if (!mentionsOnly(root.getControl(), hash)) return null;

        Set<BasicBlock> hashTree = new LinkedHashSet<>();
        List<BasicBlock> leaves = new ArrayList<>();
        Deque<BasicBlock> worklist = new ArrayDeque<>();
        hashTree.add(root);
        worklist.add(root);
        StringSwitchAnalysis shape = new StringSwitchAnalysis(root, string);
        while (!worklist.isEmpty()) {
            for (BasicBlock target : worklist.pop().successors()) {
                if (hashTree.contains(target) || leaves.contains(target)) continue;
                if (target != root && shape.isInnerCandidate(target) && mentionsOnly(target.getControl(), hash)) {
                    hashTree.add(target);
                    worklist.add(target);
                } else {
                    leaves.add(target);
                }
            }
        }

        BasicBlock defaultTarget = null;
        Map<BasicBlock, StringValueSet> sections = new LinkedHashMap<>();
        Set<BasicBlock> removed = new LinkedHashSet<>(hashTree);
        removed.remove(root);
        List<BasicBlock> defaults = new ArrayList<>();
        for (BasicBlock leaf : leaves) {
            StringSwitchAnalysis bucket = new StringSwitchAnalysis(leaf, string);
            if (leaf == root
                    || !bucket.isInnerCandidate(leaf)
                    || !graph.inSameRegions(leaf, root)
                    || !bucket.analyze()) {
                defaults.add(leaf);
                continue;
            }
            removed.add(leaf);
            removed.addAll(bucket.innerBlocks);
            for (Map.Entry<BasicBlock, StringValueSet> entry : bucket.sections.entrySet()) {
                StringValueSet values = entry.getValue();
                if (values.isCofinite()) {
                    defaults.add(entry.getKey());
                } else {
                    StringValueSet existing = sections.get(entry.getKey());
                    sections.put(entry.getKey(), existing == null ? values : existing.union(values));
                }
            }
        }
        for (BasicBlock block : defaults) {
            if (defaultTarget == null) {
                defaultTarget = block;
            } else if (defaultTarget != block) {
                reject(graph, root, "string hash dispatch with more than one default");
                return null;
            }
        }
        if (sections.isEmpty() || defaultTarget == null || sections.containsKey(defaultTarget)) return null;

        Candidate candidate = new Candidate(root, new IdentifierExpression(string));
        candidate.removed.addAll(removed);
        candidate.removedStatements = 1;
        int hashUses = uses(candidate.removed, hash) + uses(root.getControl(), hash) + 1;
        if (uses(graph.blocks, hash) != hashUses) return null;
        candidate.unusedLocals.add(hash);

        Set<BasicBlock> targets = new LinkedHashSet<>(sections.keySet());
        targets.add(defaultTarget);
        String reason = checkExits(root, targets, candidate.removed);
        if (reason != null) {
            reject(graph, root, reason);
            return null;
        }

        List<BasicBlock> order = new ArrayList<>(sections.keySet());
        List<BasicBlock> blocks = graph.blocks;
        order.sort(Comparator.comparingInt(blocks::indexOf));
        Map<BasicBlock, StringValueSet> sorted = new LinkedHashMap<>();
        for (BasicBlock block : order) {
            sorted.put(block, sections.get(block));
        }
        addStringCases(candidate, sorted, defaultTarget);
        inlineDiscriminant(graph, candidate, string);
        return candidate;
    }

    private static boolean mentionsOnly(Control control, String name) {
        Expression value = control.getValue();
        if (value == null || control.getKind() == Control.Kind.RETURN || control.getKind() == Control.Kind.THROW) {
            return false;
        }
        if (control.getSwitchConstruct() != null) return false;
        boolean[] mentions = {false};
        boolean other = AstQueries.anySubExpression(value, it -> {
            switch (it.getKind()) {
                case IDENTIFIER:
                    if (((IdentifierExpression) it).getName().equals(name)) {
                        mentions[0] = true;
                        return false;
                    }
                    return true;
                case INVOCATION:
                case ASSIGNMENT:
                case OBJECT_CREATE:
                    return true;
                default:
                    return false;
            }
        });
        return mentions[0] && !other;
    }

    // shape checks

    /**
     * Reject trees where the code of one section branches into the entry of another, such as
     * {@code if (i == 1 || (i == 2 && a))}, where the {@code a} test is a section of its own.
     */
    private static @Nullable String checkCrossing(BasicBlock root, Collection<BasicBlock> targets) {
        BasicBlock follow = root.getNullable(CfgExts.IPDOM);
        for (BasicBlock target : targets) {
            if (target == follow || !target.isDominatedBy(root)) continue;
            Set<BasicBlock> seen = new HashSet<>();
            Deque<BasicBlock> worklist = new ArrayDeque<>();
            seen.add(target);
            worklist.add(target);
            while (!worklist.isEmpty()) {
                for (BasicBlock next : worklist.pop().successors()) {
                    if (next != target && next != follow && targets.contains(next) && next.isDominatedBy(root)) {
                        return "section " + target.getLabel() + " branches into section " + next.getLabel();
                    }
                    if (next.isDominatedBy(target) && seen.add(next)) worklist.add(next);
                }
            }
        }
        return null;
    }

    /**
     * Reject switches whose cases leave to more than one place, which would need a {@code goto}.
     * Jumps back to blocks enclosing the switch and paths that end the method don't count.
     */
    private static @Nullable String checkExits(BasicBlock root,
                                               Collection<BasicBlock> targets,
                                               Collection<BasicBlock> inner) {
        BasicBlock follow = root.getNullable(CfgExts.IPDOM);
        Set<BasicBlock> region = new HashSet<>(inner);
        region.add(root);
        Deque<BasicBlock> worklist = new ArrayDeque<>();
        for (BasicBlock target : targets) {
            if (inRegion(target, root, follow) && region.add(target)) worklist.add(target);
        }
        Set<BasicBlock> exits = new LinkedHashSet<>();
        while (!worklist.isEmpty()) {
            for (BasicBlock next : worklist.pop().successors()) {
                if (region.contains(next)) continue;
                if (inRegion(next, root, follow)) {
                    region.add(next);
                    worklist.add(next);
                } else if (next != follow && !root.isDominatedBy(next) && !next.isTrivialExit()) {
                    exits.add(next);
                }
            }
        }
        for (BasicBlock target : targets) {
            if (!region.contains(target) && target != follow && !root.isDominatedBy(target) && !target.isTrivialExit()) {
                exits.add(target);
            }
        }
        int allowed = follow == null ? 1 : 0;
        if (exits.size() > allowed) {
            StringBuilder sb = new StringBuilder("cases leave to");
            for (BasicBlock exit : exits) {
                sb.append(' ').append(exit.getLabel());
            }
            return sb.toString();
        }
        return null;
    }

    private static boolean inRegion(BasicBlock block, BasicBlock root, @Nullable BasicBlock follow) {
        return block.isDominatedBy(root) && (follow == null || !block.isDominatedBy(follow));
    }

    // discriminants

    /**
     * Replace the discriminant with the value assigned to it by the last statement of the root,
     * if it is used nowhere else.
     */
    private static void inlineDiscriminant(ControlFlowGraph graph, Candidate candidate, String name) {
        List<Statement> statements = candidate.root.getStatements();
        int index = statements.size() - 1 - candidate.removedStatements;
        if (index < 0) return;
        AssignmentExpression assignment = simpleAssignment(statements.get(index));
        if (assignment == null || !IdentifierExpression.isNamed(assignment.getLeft(), name)) return;

        int treeUses = uses(candidate.root.getControl(), name) + uses(candidate.removed, name);
        for (int i = index; i < statements.size(); i++) {
            treeUses += uses(statements.get(i), name);
        }
        if (uses(graph.blocks, name) != treeUses) return;
        candidate.discriminant = ReplaceMethodCallsWithOperators.convertOperator(
                graph.getContext().getTypeResolver(), assignment.getRight());
        candidate.removedStatements++;
        candidate.unusedLocals.add(name);
    }

    private static @Nullable TypeRef variableType(ControlFlowGraph graph, String name) {
        TypeRef local = graph.getLocalType(name);
        if (local != null) return local;
        Symbol method = graph.getMethod();
        int index = method.getParameterNames().indexOf(name);
        return index < 0 ? null : method.getParameterTypes().get(index);
    }

    private static @Nullable AssignmentExpression simpleAssignment(Statement statement) {
        if (statement.getKind() != Statement.Kind.EXPRESSION) return null;
        Expression expr = ((ExpressionStatement) statement).getExpression();
        if (expr.getKind() != Expression.Kind.ASSIGNMENT) return null;
        AssignmentExpression assignment = (AssignmentExpression) expr;
        if (assignment.getOperator() != AssignmentOperatorType.ASSIGN
                || assignment.getLeft().getKind() != Expression.Kind.IDENTIFIER) {
            return null;
        }
        return assignment;
    }

    // uses

    static int uses(Expression expr, String name) {
        int[] count = {0};
        AstQueries.anySubExpression(expr, it -> {
            if (IdentifierExpression.isNamed(it, name)) count[0]++;
            return false;
        });
        return count[0];
    }

    static int uses(Statement statement, String name) {
        if (statement.getKind() == Statement.Kind.EXPRESSION) {
            return uses(((ExpressionStatement) statement).getExpression(), name);
        }
        throw new IllegalStateException("unexpected statement in a block: " + statement.getKind());
    }

    static int uses(Control control, String name) {
        Expression value = control.getValue();
        return value == null ? 0 : uses(value, name);
    }

    static int uses(Collection<BasicBlock> blocks, String name) {
        int count = 0;
        for (BasicBlock block : blocks) {
            for (Statement statement : block.getStatements()) {
                count += uses(statement, name);
            }
            count += uses(block.getControl(), name);
        }
        return count;
    }

    // leftovers

    static SwitchConstruct fromJumpTable(Control control) {
        int entries = control.targets.size() - 1;
        BasicBlock defaultTarget = control.targets.get(entries);
        Map<BasicBlock, List<CaseLabel>> labels = new LinkedHashMap<>();
        for (int i = 0; i < entries; i++) {
            BasicBlock target = control.targets.get(i);
            if (target == defaultTarget) continue;
            labels.computeIfAbsent(target, $ -> new ArrayList<>()).add(CaseLabel.of(i));
        }
        List<SwitchCase> cases = new ArrayList<>();
        for (Map.Entry<BasicBlock, List<CaseLabel>> entry : labels.entrySet()) {
            cases.add(new SwitchCase(entry.getValue(), false, entry.getKey()));
        }
        cases.add(new SwitchCase(Collections.emptyList(), true, defaultTarget));
        //noinspection ConstantConditions
        return new SwitchConstruct(control.getValue(), cases);
    }

    /**
     * Mark a switch whose every case only assigns one variable and continues to the same block.
     */
    private static void dischargeAsValue(BasicBlock block, SwitchConstruct construct) {
        if (construct.getDefaultCase() == null || construct.getCases().size() < 2) return;
        String variable = null;
        BasicBlock follow = null;
        for (SwitchCase switchCase : construct.getCases()) {
            BasicBlock target = switchCase.getTarget();
            if (target == block
                    || target.predecessors().size() != 1
                    || target.getStatements().size() != 1
                    || target.getControl().getKind() != Control.Kind.JUMP) {
                return;
            }
            AssignmentExpression assignment = simpleAssignment(target.getStatements().get(0));
            if (assignment == null) return;
            String name = ((IdentifierExpression) assignment.getLeft()).getName();
            if (uses(assignment.getRight(), name) != 0) return;
            BasicBlock next = target.getControl().targets.get(0);
            if (variable == null) {
                variable = name;
                follow = next;
            } else if (!variable.equals(name) || follow != next) {
                return;
            }
        }
        //noinspection ConstantConditions
        construct.dischargeAsValue(variable, follow);
    }
}
