package io.github.eutro.cil2ast.passes.meta;

import io.github.eutro.cil2ast.cfg.BasicBlock;
import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import io.github.eutro.cil2ast.cfg.ProtectedRegion;
import io.github.eutro.cil2ast.ext.CfgExts;
import io.github.eutro.cil2ast.ext.MetadataState;
import io.github.eutro.cil2ast.passes.InPlaceIRPass;
import io.github.eutro.cil2ast.util.Dominators;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes {@link CfgExts#IDOM} for each block.
 * <p>
 * Every protected block is treated as having an edge to its handler, so the entry of a
 * try region dominates its handlers and the code after it.
 */
public class ComputeDoms implements InPlaceIRPass<ControlFlowGraph> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeDoms INSTANCE = new ComputeDoms();

    @Override
    public void runInPlace(ControlFlowGraph graph) {
        MetadataState ms = graph.getExtOrThrow(CfgExts.METADATA_STATE);

        List<BasicBlock> blocks = graph.blocks;
        Map<BasicBlock, Integer> indices = indexBlocks(blocks);
        int[][] succ = new int[blocks.size()][];
        for (int i = 0; i < blocks.size(); i++) {
            BasicBlock block = blocks.get(i);
            List<Integer> targets = new ArrayList<>();
            for (BasicBlock target : block.successors()) {
                targets.add(indices.get(target));
            }
            for (ProtectedRegion region : graph.getRegions()) {
                if (region.getTryBlocks().contains(block)) {
                    targets.add(indices.get(region.getHandlerEntry()));
                }
            }
            succ[i] = toArray(targets);
        }

        int[] idoms = Dominators.compute(succ, 0);
        for (int i = 0; i < blocks.size(); i++) {
            BasicBlock block = blocks.get(i);
            if (idoms[i] == -1) {
                block.removeExt(CfgExts.IDOM);
            } else {
                block.attachExt(CfgExts.IDOM, blocks.get(idoms[i]));
            }
        }

        ms.validate(MetadataState.DOMS);
    }

    static Map<BasicBlock, Integer> indexBlocks(List<BasicBlock> blocks) {
        Map<BasicBlock, Integer> indices = new IdentityHashMap<>();
        for (int i = 0; i < blocks.size(); i++) {
            indices.put(blocks.get(i), i);
        }
        return indices;
    }

    static int[] toArray(List<Integer> ls) {
        int[] arr = new int[ls.size()];
        for (int i = 0; i < arr.length; i++) {
            arr[i] = ls.get(i);
        }
        return arr;
    }
}
