package io.github.eutro.cil2ast.passes.opts;

import io.github.eutro.cil2ast.cfg.BasicBlock;
import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import io.github.eutro.cil2ast.cfg.ProtectedRegion;
import io.github.eutro.cil2ast.ext.CfgExts;
import io.github.eutro.cil2ast.passes.InPlaceIRPass;
import io.github.eutro.cil2ast.util.GraphWalker;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A pass that removes any blocks unreachable from the entry block, or from the handlers
 * of reachable protected regions.
 * <p>
 * Removed blocks are recorded on the graph, so they are emitted as comment stubs.
 */
public class EliminateDeadBlocks implements InPlaceIRPass<ControlFlowGraph> {
    /**
     * An instance of this pass.
     */
    public static final EliminateDeadBlocks INSTANCE = new EliminateDeadBlocks();

    @Override
    public void runInPlace(ControlFlowGraph graph) {
        Set<BasicBlock> live = new HashSet<>(GraphWalker.blockWalker(graph).preOrder().toList());
        boolean grew = true;
        while (grew) {
            grew = false;
            for (ProtectedRegion region : graph.getRegions()) {
                if (!live.contains(region.getHandlerEntry()) && live.contains(region.getTryEntry())) {
                    live.addAll(new GraphWalker<>(region.getHandlerEntry(), BasicBlock::successors).preOrder().toList());
                    grew = true;
                }
            }
        }

        graph.getRegions().removeIf(region -> !live.contains(region.getTryEntry()));
        List<BasicBlock> dead = new ArrayList<>();
        for (BasicBlock block : graph.blocks) {
            if (!live.contains(block)) dead.add(block);
        }
        for (BasicBlock block : dead) {
            graph.markUnreachable(block);
        }
        if (!dead.isEmpty()) {
            graph.getExtOrThrow(CfgExts.METADATA_STATE).graphChanged();
        }
    }
}
