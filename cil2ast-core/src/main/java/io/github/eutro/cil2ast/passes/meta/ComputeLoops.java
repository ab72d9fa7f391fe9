package io.github.eutro.cil2ast.passes.meta;

import io.github.eutro.cil2ast.api.TypeRef;
import io.github.eutro.cil2ast.ast.AssignmentExpression;
import io.github.eutro.cil2ast.ast.BinaryOperatorExpression;
import io.github.eutro.cil2ast.ast.BinaryOperatorType;
import io.github.eutro.cil2ast.ast.ExpressionStatement;
import io.github.eutro.cil2ast.ast.IdentifierExpression;
import io.github.eutro.cil2ast.ast.PrimitiveExpression;
import io.github.eutro.cil2ast.cfg.BasicBlock;
import io.github.eutro.cil2ast.cfg.Control;
import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import io.github.eutro.cil2ast.cfg.LoopConstruct;
import io.github.eutro.cil2ast.cfg.ProtectedRegion;
import io.github.eutro.cil2ast.ext.CfgExts;
import io.github.eutro.cil2ast.ext.MetadataState;
import io.github.eutro.cil2ast.passes.InPlaceIRPass;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds natural loops and computes {@link CfgExts#LOOP} for each loop header.
 * <p>
 * A block is a loop header if a depth-first walk finds an edge to it while it is still in progress,
 * from a block it dominates. The loop body is the natural loop of all such back edges, extended
 * with exit paths that only the loop can reach and that end the method.
 * <p>
 * A loop that would still have more than one exit is rewritten so it has only one:
 * each exit edge goes through a stub that sets a {@code loopExit_N} flag,
 * and a dispatch on the flag after the loop goes to the original target.
 */
public class ComputeLoops implements InPlaceIRPass<ControlFlowGraph> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ComputeLoops.class);

    /**
     * A singleton instance of this pass.
     */
    public static final ComputeLoops INSTANCE = new ComputeLoops();

    private enum State {
        IN_PROGRESS,
        DONE,
    }

    @Override
    public void runInPlace(ControlFlowGraph graph) {
        MetadataState ms = graph.getExtOrThrow(CfgExts.METADATA_STATE);
        // stubs from the single exit rewrite, which belong to the loop of each header
        Map<BasicBlock, Set<BasicBlock>> exitStubs = new HashMap<>();

        while (true) {
            ms.ensureValid(graph, MetadataState.PREDS, MetadataState.DOMS);
            for (BasicBlock block : graph.blocks) {
                block.removeExt(CfgExts.LOOP);
            }

            Map<BasicBlock, Integer> order = ComputeDoms.indexBlocks(graph.blocks);
            boolean changed = false;
            for (Map.Entry<BasicBlock, List<BasicBlock>> entry : findBackEdges(graph).entrySet()) {
                BasicBlock header = entry.getKey();
                List<BasicBlock> latches = entry.getValue();
                latches.sort(Comparator.comparing(order::get));
                Set<BasicBlock> stubs = exitStubs.computeIfAbsent(header, $ -> new LinkedHashSet<>());
                if (!analyseLoop(graph, header, latches, stubs, order)) {
                    changed = true;
                    break;
                }
            }
            if (!changed) break;
            ms.graphChanged();
        }

        ms.ensureValid(graph, MetadataState.POST_DOMS);
        ms.validate(MetadataState.LOOPS);
    }

    private static Map<BasicBlock, List<BasicBlock>> findBackEdges(ControlFlowGraph graph) {
        Map<BasicBlock, List<BasicBlock>> backEdges = new LinkedHashMap<>();
        Map<BasicBlock, State> states = new HashMap<>();
        List<BasicBlock> roots = new ArrayList<>();
        roots.add(graph.getEntry());
        for (ProtectedRegion region : graph.getRegions()) {
            roots.add(region.getHandlerEntry());
        }

        Deque<BasicBlock> nodes = new ArrayDeque<>();
        Deque<Iterator<BasicBlock>> stack = new ArrayDeque<>();
        for (BasicBlock root : roots) {
            if (states.containsKey(root)) continue;
            states.put(root, State.IN_PROGRESS);
            nodes.push(root);
            stack.push(root.successors().iterator());
            while (!stack.isEmpty()) {
                Iterator<BasicBlock> iter = stack.peek();
                BasicBlock source = nodes.peek();
                if (!iter.hasNext()) {
                    states.put(source, State.DONE);
                    stack.pop();
                    nodes.pop();
                    continue;
                }
                BasicBlock target = iter.next();
                State state = states.get(target);
                if (state == null) {
                    states.put(target, State.IN_PROGRESS);
                    nodes.push(target);
                    stack.push(target.successors().iterator());
                } else if (state == State.IN_PROGRESS && source.isDominatedBy(target)) {
                    List<BasicBlock> latches = backEdges.computeIfAbsent(target, $ -> new ArrayList<>());
                    if (!latches.contains(source)) latches.add(source);
                }
                // an edge to an in-progress block that does not dominate its source
                // makes the graph irreducible there, and is left as a goto
            }
        }
        return backEdges;
    }

    /**
     * Compute the loop of a header, attaching it, or rewrite the graph so it has a single exit.
     *
     * @return True if the loop was attached, false if the graph was changed instead.
     */
    private static boolean analyseLoop(ControlFlowGraph graph,
                                       BasicBlock header,
                                       List<BasicBlock> latches,
                                       Set<BasicBlock> stubs,
                                       Map<BasicBlock, Integer> order) {
        Set<BasicBlock> body = naturalLoop(header, latches);
        body.addAll(stubs);

        Set<BasicBlock> exits = new LinkedHashSet<>();
        for (BasicBlock block : body) {
            for (BasicBlock target : block.successors()) {
                if (!body.contains(target) && !target.isTrivialExit()) {
                    exits.add(target);
                }
            }
        }
        List<BasicBlock> sortedExits = new ArrayList<>(exits);
        sortedExits.sort(Comparator.comparing(order::get));

        Map<BasicBlock, Set<BasicBlock>> closures = new HashMap<>();
        List<BasicBlock> open = new ArrayList<>();
        for (BasicBlock exit : sortedExits) {
            Set<BasicBlock> closure = reach(exit);
            closures.put(exit, closure);
            boolean absorbable = true;
            for (BasicBlock block : closure) {
                if (!block.isDominatedBy(header)) {
                    absorbable = false;
                    break;
                }
            }
            if (!absorbable) open.add(exit);
        }

        BasicBlock breakTarget;
        if (open.size() == 1) {
            breakTarget = open.get(0);
        } else if (open.isEmpty()) {
            breakTarget = preferredBreak(header, latches, sortedExits);
        } else {
            breakTarget = null;
        }

        if (breakTarget != null) {
            Set<BasicBlock> afterLoop = closures.get(breakTarget);
            Set<BasicBlock> absorbed = new LinkedHashSet<>();
            boolean disjoint = true;
            for (BasicBlock exit : sortedExits) {
                if (exit == breakTarget) continue;
                Set<BasicBlock> closure = closures.get(exit);
                for (BasicBlock block : closure) {
                    if (afterLoop.contains(block)) {
                        disjoint = false;
                        break;
                    }
                }
                absorbed.addAll(closure);
            }
            if (disjoint) {
                body.addAll(absorbed);
                header.attachExt(CfgExts.LOOP, new LoopConstruct(header, body, latches, breakTarget));
                return true;
            }
        } else if (sortedExits.isEmpty()) {
            header.attachExt(CfgExts.LOOP, new LoopConstruct(header, body, latches, null));
            return true;
        }

        // exits whose paths merge with the code after the loop must all go through the dispatch
        List<BasicBlock> redirected = new ArrayList<>();
        for (BasicBlock exit : sortedExits) {
            if (open.contains(exit)) {
                redirected.add(exit);
                continue;
            }
            boolean merges = false;
            for (BasicBlock other : open) {
                for (BasicBlock block : closures.get(exit)) {
                    if (closures.get(other).contains(block)) {
                        merges = true;
                        break;
                    }
                }
            }
            if (merges || open.isEmpty()) redirected.add(exit);
        }
        introduceExitFlag(graph, header, body, redirected, stubs);
        return false;
    }

    private static @Nullable BasicBlock preferredBreak(BasicBlock header,
                                                       List<BasicBlock> latches,
                                                       List<BasicBlock> exits) {
        if (exits.isEmpty()) return null;
        for (BasicBlock target : header.successors()) {
            if (exits.contains(target)) return target;
        }
        for (BasicBlock latch : latches) {
            for (BasicBlock target : latch.successors()) {
                if (exits.contains(target)) return target;
            }
        }
        return exits.get(exits.size() - 1);
    }

    private static Set<BasicBlock> naturalLoop(BasicBlock header, List<BasicBlock> latches) {
        Set<BasicBlock> body = new LinkedHashSet<>();
        body.add(header);
        Deque<BasicBlock> worklist = new ArrayDeque<>();
        for (BasicBlock latch : latches) {
            if (body.add(latch)) worklist.add(latch);
        }
        while (!worklist.isEmpty()) {
            BasicBlock block = worklist.pop();
            for (BasicBlock pred : block.predecessors()) {
                if (pred.isDominatedBy(header) && body.add(pred)) {
                    worklist.add(pred);
                }
            }
        }
        return body;
    }

    private static Set<BasicBlock> reach(BasicBlock from) {
        Set<BasicBlock> seen = new LinkedHashSet<>();
        Deque<BasicBlock> worklist = new ArrayDeque<>();
        seen.add(from);
        worklist.add(from);
        while (!worklist.isEmpty()) {
            for (BasicBlock target : worklist.pop().successors()) {
                if (!target.isTrivialExit() && seen.add(target)) {
                    worklist.add(target);
                }
            }
        }
        return seen;
    }

    private static void introduceExitFlag(ControlFlowGraph graph,
                                          BasicBlock header,
                                          Set<BasicBlock> body,
                                          List<BasicBlock> exits,
                                          Set<BasicBlock> stubs) {
        String flag = graph.newSyntheticLocal("loopExit", TypeRef.INT32);
        LOGGER.debug("{}: loop {} has {} exits, dispatching on {}",
                graph.getMethodId(), header.getLabel(), exits.size(), flag);

        List<BasicBlock> added = new ArrayList<>();
        BasicBlock dispatch = graph.newSyntheticBlock();
        added.add(dispatch);
        for (int i = 0; i < exits.size(); i++) {
            BasicBlock exit = exits.get(i);
            BasicBlock stub = graph.newSyntheticBlock();
            stub.getStatements().add(new ExpressionStatement(new AssignmentExpression(
                    new IdentifierExpression(flag),
                    PrimitiveExpression.of(i))));
            stub.setControl(Control.jump(dispatch));
            for (BasicBlock block : body) {
                block.getControl().replaceTarget(exit, stub);
            }
            stubs.add(stub);
            added.add(stub);
        }

        BasicBlock current = dispatch;
        if (exits.size() == 1) {
            current.setControl(Control.jump(exits.get(0)));
        } else {
            for (int i = 0; i < exits.size() - 1; i++) {
                BasicBlock next;
                if (i == exits.size() - 2) {
                    next = exits.get(i + 1);
                } else {
                    next = graph.newSyntheticBlock();
                    added.add(next);
                }
                current.setControl(Control.conditional(
                        new BinaryOperatorExpression(
                                new IdentifierExpression(flag),
                                BinaryOperatorType.EQUALITY,
                                PrimitiveExpression.of(i)),
                        exits.get(i),
                        next));
                current = next;
            }
        }

        for (ProtectedRegion region : graph.getRegions()) {
            if (region.getTryBlocks().contains(header)) region.getTryBlocks().addAll(added);
            if (region.getHandlerBlocks().contains(header)) region.getHandlerBlocks().addAll(added);
        }
    }
}
