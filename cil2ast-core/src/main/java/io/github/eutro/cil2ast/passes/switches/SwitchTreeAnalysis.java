package io.github.eutro.cil2ast.passes.switches;

import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ast.IdentifierExpression;
import io.github.eutro.cil2ast.cfg.BasicBlock;
import io.github.eutro.cil2ast.cfg.Control;
import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import io.github.eutro.cil2ast.util.ValueSet;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Analyses a tree of conditional branches on one variable, computing for each block leaving the tree
 * the set of values of the variable that reach it.
 * <p>
 * The tree starts at a root block, and extends into each target that has no other predecessor,
 * no statements, and a condition on the same variable that narrows down the values reaching it.
 *
 * @param <S> The type of value sets.
 */
abstract class SwitchTreeAnalysis<S extends ValueSet<S>> {
    final BasicBlock root;
    @Nullable
    String variable;
    /**
     * Blocks of the tree other than the root, which are removed if the tree becomes a switch.
     */
    final List<BasicBlock> innerBlocks = new ArrayList<>();
    /**
     * The blocks leaving the tree, with the values that reach each, in the order they were found.
     */
    final Map<BasicBlock, S> sections = new LinkedHashMap<>();
    int ifCount;

    SwitchTreeAnalysis(BasicBlock root, @Nullable String variable) {
        this.root = root;
        this.variable = variable;
    }

    /**
     * The set of all values.
     */
    abstract S universe();

    /**
     * Get the values of the variable for which a condition is true.
     *
     * @param condition The condition.
     * @return The values, or null if this is not a condition on the variable.
     */
    abstract @Nullable S analyzeCondition(Expression condition);

    /**
     * Analyse a block ending in a raw jump table.
     *
     * @return Whether the block was analysed.
     */
    boolean analyzeTable(BasicBlock block, Control control, S input) {
        return false;
    }

    /**
     * Analyse the tree from the root.
     *
     * @return Whether the root is a condition on a variable.
     */
    boolean analyze() {
        return analyzeBlock(root, universe());
    }

    boolean analyzeBlock(BasicBlock block, S input) {
        if (block != root && !isInnerCandidate(block)) return false;
        Control control = block.getControl();
        switch (control.getKind()) {
            case CONDITIONAL: {
                //noinspection ConstantConditions
                S trueValues = analyzeCondition(control.getValue());
                if (trueValues == null) return false;
                trueValues = trueValues.intersect(input);
                if (trueValues.isEmpty() || trueValues.equals(input)) return false;
                ifCount++;
                analyzeTarget(control.targets.get(0), trueValues);
                analyzeTarget(control.targets.get(1), input.except(trueValues));
                return true;
            }
            case SWITCH:
                if (control.getSwitchConstruct() != null) return false;
                return analyzeTable(block, control, input);
            default:
                return false;
        }
    }

    void analyzeTarget(BasicBlock target, S values) {
        if (target != root && analyzeBlock(target, values)) {
            innerBlocks.add(target);
        } else {
            addSection(target, values);
        }
    }

    void addSection(BasicBlock target, S values) {
        S existing = sections.get(target);
        sections.put(target, existing == null ? values : existing.union(values));
    }

    boolean isInnerCandidate(BasicBlock block) {
        ControlFlowGraph graph = block.getGraph();
        return block.predecessors().size() == 1
                && block.getStatements().isEmpty()
                && block != graph.getEntry()
                && !graph.isRegionEntry(block)
                && graph.inSameRegions(block, root);
    }

    /**
     * Check whether an expression is the variable, fixing the variable if it isn't known yet.
     */
    boolean isVariable(Expression expr) {
        if (expr.getKind() != Expression.Kind.IDENTIFIER) return false;
        String name = ((IdentifierExpression) expr).getName();
        if (variable == null) {
            variable = name;
            return true;
        }
        return variable.equals(name);
    }
}
