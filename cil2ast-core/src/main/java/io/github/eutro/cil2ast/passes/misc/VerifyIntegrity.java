package io.github.eutro.cil2ast.passes.misc;

import io.github.eutro.cil2ast.cfg.BasicBlock;
import io.github.eutro.cil2ast.cfg.Control;
import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import io.github.eutro.cil2ast.cfg.ProtectedRegion;
import io.github.eutro.cil2ast.cfg.SwitchConstruct;
import io.github.eutro.cil2ast.ext.CfgExts;
import io.github.eutro.cil2ast.passes.InPlaceIRPass;

import java.util.HashSet;
import java.util.Set;

/**
 * A pass that checks the internal consistency of a graph, throwing if it is broken.
 * <p>
 * This finds bugs in the passes, not in the input, so failures are {@link IllegalStateException}s.
 */
public class VerifyIntegrity implements InPlaceIRPass<ControlFlowGraph> {
    /**
     * An instance of this pass.
     */
    public static final VerifyIntegrity INSTANCE = new VerifyIntegrity();

    @Override
    public void runInPlace(ControlFlowGraph graph) {
        Set<BasicBlock> blocks = new HashSet<>(graph.blocks);
        if (blocks.size() != graph.blocks.size()) {
            throw new IllegalStateException("duplicate blocks in " + graph.getMethodId());
        }
        Set<String> labels = new HashSet<>();
        for (BasicBlock block : graph.blocks) {
            if (!labels.add(block.getLabel())) {
                throw new IllegalStateException("duplicate label " + block.getLabel());
            }
            if (block.getGraph() != graph) {
                throw new IllegalStateException(block.getLabel() + " is not owned by its graph");
            }
            Control control = block.getControl();
            if (control == null) {
                throw new IllegalStateException(block.getLabel() + " has no control");
            }
            if (control.getNullable(CfgExts.OWNING_BLOCK) != block) {
                throw new IllegalStateException(block.getLabel() + " does not own its control");
            }
            for (BasicBlock target : control.targets) {
                if (!blocks.contains(target)) {
                    throw new IllegalStateException(block.getLabel() + " targets " + target.getLabel()
                            + ", which is not in the graph");
                }
            }
            SwitchConstruct sw = control.getSwitchConstruct();
            if (sw != null && !sw.getTargets().equals(control.targets)) {
                throw new IllegalStateException(block.getLabel() + " has switch targets out of sync");
            }
        }
        for (ProtectedRegion region : graph.getRegions()) {
            if (!blocks.containsAll(region.getTryBlocks()) || !blocks.containsAll(region.getHandlerBlocks())) {
                throw new IllegalStateException(region + " refers to blocks outside the graph");
            }
        }
    }
}
