package io.github.eutro.cil2ast.passes.opts;

import io.github.eutro.cil2ast.ast.AstQueries;
import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.cfg.BasicBlock;
import io.github.eutro.cil2ast.cfg.Control;
import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import io.github.eutro.cil2ast.ext.CfgExts;
import io.github.eutro.cil2ast.ext.MetadataState;
import io.github.eutro.cil2ast.passes.InPlaceIRPass;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass which collapses empty blocks or simple jumps where they are unnecessary.
 * <p>
 * Empty blocks that only jump elsewhere are bypassed, a block that jumps to a block with no other
 * predecessor absorbs it, and a conditional branch with one target becomes a jump.
 */
public class CollapseJumps implements InPlaceIRPass<ControlFlowGraph> {
    /**
     * A singleton instance of this pass.
     */
    public static final CollapseJumps INSTANCE = new CollapseJumps();

    @Override
    public void runInPlace(ControlFlowGraph graph) {
        MetadataState ms = graph.getExtOrThrow(CfgExts.METADATA_STATE);
        boolean changed = false;
        for (BasicBlock block : new ArrayList<>(graph.blocks)) {
            if (block.getGraph() != graph || !isTrampoline(graph, block)) continue;
            BasicBlock target = block.getControl().targets.get(0);
            for (BasicBlock other : graph.blocks) {
                if (other != block) other.getControl().replaceTarget(block, target);
            }
            graph.removeBlock(block);
            changed = true;
        }

        for (BasicBlock block : graph.blocks) {
            Control control = block.getControl();
            if (control.getKind() != Control.Kind.CONDITIONAL) continue;
            //noinspection ConstantConditions
            if (control.targets.get(0) == control.targets.get(1) && isPure(control.getValue())) {
                block.setControl(Control.jump(control.targets.get(0)));
                changed = true;
            }
        }

        if (changed) ms.graphChanged();
        ms.ensureValid(graph, MetadataState.PREDS);
        List<BasicBlock> killed = new ArrayList<>();
        for (BasicBlock block : graph.blocks) {
            if (killed.contains(block)) continue;
            while (block.getControl().getKind() == Control.Kind.JUMP) {
                BasicBlock target = block.getControl().targets.get(0);
                if (target == block
                        || target == graph.getEntry()
                        || target.predecessors().size() != 1
                        || graph.isRegionEntry(target)
                        || !graph.inSameRegions(block, target)) {
                    break;
                }
                block.getStatements().addAll(target.getStatements());
                target.getStatements().clear();
                block.setControl(target.getControl());
                killed.add(target);
            }
        }
        for (BasicBlock block : killed) {
            graph.removeBlock(block);
            changed = true;
        }

        if (changed) ms.graphChanged();
    }

    private static boolean isTrampoline(ControlFlowGraph graph, BasicBlock block) {
        if (!block.getStatements().isEmpty() || block == graph.getEntry()) return false;
        Control control = block.getControl();
        if (control.getKind() != Control.Kind.JUMP) return false;
        BasicBlock target = control.targets.get(0);
        return target != block && !graph.isRegionEntry(block) && graph.inSameRegions(block, target);
    }

    private static boolean isPure(Expression condition) {
        return !AstQueries.anySubExpression(condition, it -> {
            switch (it.getKind()) {
                case INVOCATION:
                case ASSIGNMENT:
                case OBJECT_CREATE:
                case INDEXER:
                    return true;
                default:
                    return false;
            }
        });
    }
}
