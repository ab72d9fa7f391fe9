package io.github.eutro.cil2ast.passes.meta;

import io.github.eutro.cil2ast.cfg.BasicBlock;
import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import io.github.eutro.cil2ast.ext.CfgExts;
import io.github.eutro.cil2ast.ext.MetadataState;
import io.github.eutro.cil2ast.passes.InPlaceIRPass;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes {@link CfgExts#PREDS} for each block.
 * <p>
 * Each predecessor is listed once, even if it reaches the block by several edges,
 * as jump table entries can.
 */
public class ComputePreds implements InPlaceIRPass<ControlFlowGraph> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(ControlFlowGraph graph) {
        MetadataState ms = graph.getExtOrThrow(CfgExts.METADATA_STATE);

        for (BasicBlock block : graph.blocks) {
            block.attachExt(CfgExts.PREDS, new ArrayList<>());
        }
        for (BasicBlock block : graph.blocks) {
            for (BasicBlock target : block.successors()) {
                List<BasicBlock> preds = target.getNullable(CfgExts.PREDS);
                if (preds == null) {
                    throw new IllegalStateException(block.getLabel() + " targets " + target.getLabel()
                            + ", which is not in the graph");
                }
                if (!preds.contains(block)) preds.add(block);
            }
        }

        ms.validate(MetadataState.PREDS);
    }
}
