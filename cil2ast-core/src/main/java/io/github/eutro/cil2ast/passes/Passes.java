package io.github.eutro.cil2ast.passes;

import io.github.eutro.cil2ast.MethodInput;
import io.github.eutro.cil2ast.MethodTree;
import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import io.github.eutro.cil2ast.passes.convert.BuildControlFlowGraph;
import io.github.eutro.cil2ast.passes.misc.VerifyIntegrity;
import io.github.eutro.cil2ast.passes.normalize.FlattenSwitchBlocks;
import io.github.eutro.cil2ast.passes.normalize.IntroduceForInitializers;
import io.github.eutro.cil2ast.passes.normalize.IntroduceSwitchExpressions;
import io.github.eutro.cil2ast.passes.normalize.NormalizeBlockStatements;
import io.github.eutro.cil2ast.passes.normalize.PrettifyAssignments;
import io.github.eutro.cil2ast.passes.normalize.ReplaceMethodCallsWithOperators;
import io.github.eutro.cil2ast.passes.opts.CollapseJumps;
import io.github.eutro.cil2ast.passes.opts.EliminateDeadBlocks;
import io.github.eutro.cil2ast.passes.structure.ResolveGotoCase;
import io.github.eutro.cil2ast.passes.structure.StructureControlFlow;
import io.github.eutro.cil2ast.passes.switches.DetectSwitches;

/**
 * The pre-composed stages of the decompiler.
 */
public class Passes {
    /**
     * Build a graph and simplify it, ready for structuring.
     */
    public static final IRPass<MethodInput, ControlFlowGraph> GRAPH =
            BuildControlFlowGraph.INSTANCE
                    .then(EliminateDeadBlocks.INSTANCE)
                    .then(CollapseJumps.INSTANCE)
                    .then(DetectSwitches.INSTANCE)
                    .then(VerifyIntegrity.INSTANCE);

    /**
     * Passes that clean up a freshly structured tree. Running them twice changes nothing.
     */
    public static final IRPass<MethodTree, MethodTree> NORMALIZE =
            FlattenSwitchBlocks.INSTANCE
                    .then(ReplaceMethodCallsWithOperators.INSTANCE)
                    .then(PrettifyAssignments.INSTANCE)
                    .then(IntroduceForInitializers.INSTANCE)
                    .then(IntroduceSwitchExpressions.INSTANCE)
                    .then(NormalizeBlockStatements.INSTANCE);

    /**
     * Turn a graph into a finished tree.
     */
    public static final IRPass<ControlFlowGraph, MethodTree> STRUCTURE =
            StructureControlFlow.INSTANCE
                    .then(ResolveGotoCase.INSTANCE)
                    .then(NORMALIZE);
}
