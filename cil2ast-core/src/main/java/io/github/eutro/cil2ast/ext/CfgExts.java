package io.github.eutro.cil2ast.ext;

import io.github.eutro.cil2ast.cfg.BasicBlock;
import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import io.github.eutro.cil2ast.cfg.LoopConstruct;

import java.util.List;

/**
 * Exts attached to control flow graphs and their blocks.
 */
public class CfgExts {
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");
    public static final Ext<ControlFlowGraph> OWNING_GRAPH = Ext.create(ControlFlowGraph.class, "OWNING_GRAPH");
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");

    /**
     * The ordinary predecessors of a block. Exception handler edges are not included.
     */
    public static final Ext<List<BasicBlock>> PREDS = Ext.create(List.class, "PREDS");
    /**
     * The immediate dominator of a block, absent on the entry block.
     */
    public static final Ext<BasicBlock> IDOM = Ext.create(BasicBlock.class, "IDOM");
    /**
     * The immediate post-dominator of a block, absent if it is only post-dominated by the method exit.
     */
    public static final Ext<BasicBlock> IPDOM = Ext.create(BasicBlock.class, "IPDOM");
    /**
     * The loop a block is the header of.
     */
    public static final Ext<LoopConstruct> LOOP = Ext.create(LoopConstruct.class, "LOOP");
}
