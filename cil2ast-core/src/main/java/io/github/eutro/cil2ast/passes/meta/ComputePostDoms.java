package io.github.eutro.cil2ast.passes.meta;

import io.github.eutro.cil2ast.cfg.BasicBlock;
import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import io.github.eutro.cil2ast.ext.CfgExts;
import io.github.eutro.cil2ast.ext.MetadataState;
import io.github.eutro.cil2ast.passes.InPlaceIRPass;
import io.github.eutro.cil2ast.util.Dominators;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Computes {@link CfgExts#IPDOM} for each block.
 * <p>
 * Post-dominators are the dominators of the reversed graph, rooted at a virtual exit
 * that every terminal block flows into. Blocks that cannot reach an exit, such as those in
 * infinite loops, have no immediate post-dominator.
 */
public class ComputePostDoms implements InPlaceIRPass<ControlFlowGraph> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePostDoms INSTANCE = new ComputePostDoms();

    @Override
    public void runInPlace(ControlFlowGraph graph) {
        MetadataState ms = graph.getExtOrThrow(CfgExts.METADATA_STATE);

        List<BasicBlock> blocks = graph.blocks;
        Map<BasicBlock, Integer> indices = ComputeDoms.indexBlocks(blocks);
        int exit = blocks.size();
        List<List<Integer>> reversed = new ArrayList<>();
        for (int i = 0; i <= exit; i++) {
            reversed.add(new ArrayList<>());
        }
        for (int i = 0; i < exit; i++) {
            BasicBlock block = blocks.get(i);
            if (block.getControl().isTerminal()) {
                reversed.get(exit).add(i);
            }
            for (BasicBlock target : block.successors()) {
                List<Integer> preds = reversed.get(indices.get(target));
                if (!preds.contains(i)) preds.add(i);
            }
        }
        int[][] succ = new int[exit + 1][];
        for (int i = 0; i <= exit; i++) {
            succ[i] = ComputeDoms.toArray(reversed.get(i));
        }

        int[] ipdoms = Dominators.compute(succ, exit);
        for (int i = 0; i < exit; i++) {
            BasicBlock block = blocks.get(i);
            if (ipdoms[i] == -1 || ipdoms[i] == exit) {
                block.removeExt(CfgExts.IPDOM);
            } else {
                block.attachExt(CfgExts.IPDOM, blocks.get(ipdoms[i]));
            }
        }

        ms.validate(MetadataState.POST_DOMS);
    }
}
