package io.github.eutro.cil2ast.passes.structure;

import io.github.eutro.cil2ast.MethodTree;
import io.github.eutro.cil2ast.api.DecompilationException;
import io.github.eutro.cil2ast.api.ErrorKind;
import io.github.eutro.cil2ast.api.ExceptionRegion;
import io.github.eutro.cil2ast.api.Instruction;
import io.github.eutro.cil2ast.ast.AssignmentExpression;
import io.github.eutro.cil2ast.ast.AstQueries;
import io.github.eutro.cil2ast.ast.BlockStatement;
import io.github.eutro.cil2ast.ast.BreakStatement;
import io.github.eutro.cil2ast.ast.CatchClause;
import io.github.eutro.cil2ast.ast.CommentStatement;
import io.github.eutro.cil2ast.ast.Conditions;
import io.github.eutro.cil2ast.ast.ContinueStatement;
import io.github.eutro.cil2ast.ast.DoWhileStatement;
import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ast.ExpressionStatement;
import io.github.eutro.cil2ast.ast.ForStatement;
import io.github.eutro.cil2ast.ast.GotoStatement;
import io.github.eutro.cil2ast.ast.IdentifierExpression;
import io.github.eutro.cil2ast.ast.IfElseStatement;
import io.github.eutro.cil2ast.ast.LabelStatement;
import io.github.eutro.cil2ast.ast.PrimitiveExpression;
import io.github.eutro.cil2ast.ast.ReturnStatement;
import io.github.eutro.cil2ast.ast.Statement;
import io.github.eutro.cil2ast.ast.SwitchExpression;
import io.github.eutro.cil2ast.ast.SwitchExpressionSection;
import io.github.eutro.cil2ast.ast.SwitchSection;
import io.github.eutro.cil2ast.ast.SwitchStatement;
import io.github.eutro.cil2ast.ast.ThrowStatement;
import io.github.eutro.cil2ast.ast.TryCatchStatement;
import io.github.eutro.cil2ast.ast.WhileStatement;
import io.github.eutro.cil2ast.cfg.BasicBlock;
import io.github.eutro.cil2ast.cfg.Control;
import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import io.github.eutro.cil2ast.cfg.LoopConstruct;
import io.github.eutro.cil2ast.cfg.ProtectedRegion;
import io.github.eutro.cil2ast.cfg.SwitchCase;
import io.github.eutro.cil2ast.cfg.SwitchConstruct;
import io.github.eutro.cil2ast.ext.CfgExts;
import io.github.eutro.cil2ast.ext.MetadataState;
import io.github.eutro.cil2ast.passes.IRPass;
import io.github.eutro.cil2ast.util.GraphWalker;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a control flow graph into a statement tree.
 * <p>
 * Blocks are placed by walking the dominator tree. A block with a single forward predecessor is emitted
 * inline where that predecessor branches to it. A block with several forward predecessors is emitted after
 * the code of its immediate dominator, which reaches it by falling through, {@code break}, {@code continue}
 * or, failing those, {@code goto}. Loops, switches and protected regions are emitted at their header,
 * switch and try entry blocks respectively, and reserve the blocks that belong after or inside them.
 */
public class StructureControlFlow implements IRPass<ControlFlowGraph, MethodTree> {
    private static final Logger LOGGER = LoggerFactory.getLogger(StructureControlFlow.class);

    /**
     * A singleton instance of this pass.
     */
    public static final StructureControlFlow INSTANCE = new StructureControlFlow();

    @Override
    public MethodTree run(ControlFlowGraph graph) {
        MetadataState ms = graph.getExtOrThrow(CfgExts.METADATA_STATE);
        ms.ensureValid(graph, MetadataState.PREDS, MetadataState.DOMS, MetadataState.POST_DOMS, MetadataState.LOOPS);

        Structurer structurer = new Structurer(graph);
        List<Statement> body = new ArrayList<>(graph.getDeclarations());
        body.addAll(structurer.emitTree(graph.getEntry(), new Ctx(null, null, false)));

        for (BasicBlock block : new ArrayList<>(graph.blocks)) {
            if (!structurer.emitted.contains(block)) {
                LOGGER.debug("{}: block {} was not structured", graph.getMethodId(), block.getLabel());
                graph.markUnreachable(block);
            }
        }

        body = LabelCleanup.clean(graph.getAnnotations(), body);
        removeTrailingReturn(body);
        List<Integer> unreachable = new ArrayList<>(graph.getUnreachableOffsets());
        Collections.sort(unreachable);
        for (int offset : unreachable) {
            body.add(new CommentStatement("unreachable code at " + Instruction.formatOffset(offset)));
        }

        return new MethodTree(graph.getMethodId(),
                graph.getContext(),
                graph.getAnnotations(),
                graph.getDiagnostics(),
                new BlockStatement(body));
    }

    private static void removeTrailingReturn(List<Statement> body) {
        int last = body.size() - 1;
        if (last < 0) return;
        Statement stmt = body.get(last);
        if (stmt.getKind() != Statement.Kind.RETURN || ((ReturnStatement) stmt).getExpression() != null) return;
        // a label needs a statement after it
        if (last > 0 && body.get(last - 1).getKind() == Statement.Kind.LABEL) return;
        body.remove(last);
    }

    /**
     * The innermost statement that {@code break} or {@code continue} binds to.
     */
    private static final class Scope {
        @Nullable
        final Scope parent;
        final boolean isLoop;
        @Nullable
        final BasicBlock breakTarget;
        @Nullable
        final BasicBlock continueTarget;
        /**
         * The latch of a do-while loop, whose condition is emitted by the loop itself.
         */
        @Nullable
        final BasicBlock conditionLatch;

        Scope(@Nullable Scope parent,
              boolean isLoop,
              @Nullable BasicBlock breakTarget,
              @Nullable BasicBlock continueTarget,
              @Nullable BasicBlock conditionLatch) {
            this.parent = parent;
            this.isLoop = isLoop;
            this.breakTarget = breakTarget;
            this.continueTarget = continueTarget;
            this.conditionLatch = conditionLatch;
        }

        @Nullable Scope innermostLoop() {
            Scope scope = this;
            while (scope != null && !scope.isLoop) scope = scope.parent;
            return scope;
        }
    }

    /**
     * Where emitted code is.
     */
    private static final class Ctx {
        /**
         * The block that is reached when the code completes normally, or null at the end of the method or a finally.
         */
        @Nullable
        final BasicBlock next;
        @Nullable
        final Scope scope;
        final boolean inFault;

        Ctx(@Nullable BasicBlock next, @Nullable Scope scope, boolean inFault) {
            this.next = next;
            this.scope = scope;
            this.inFault = inFault;
        }

        Ctx withNext(@Nullable BasicBlock next) {
            return next == this.next ? this : new Ctx(next, scope, inFault);
        }

        Ctx withScope(Scope scope, @Nullable BasicBlock next) {
            return new Ctx(next, scope, inFault);
        }
    }

    private interface Emitter {
        List<Statement> emit(Ctx ctx);
    }

    private static final class Structurer {
        final ControlFlowGraph graph;
        final Map<BasicBlock, Integer> rpo = new HashMap<>();
        final Map<BasicBlock, List<BasicBlock>> children = new HashMap<>();
        final Map<BasicBlock, Integer> forwardPreds = new HashMap<>();
        final Set<ProtectedRegion> ignoredRegions = new HashSet<>();
        final Set<ProtectedRegion> emittedRegions = new HashSet<>();
        /**
         * Blocks emitted by a construct rather than by their dominator or predecessor.
         */
        final Set<BasicBlock> reserved = new HashSet<>();
        final Map<BasicBlock, BasicBlock> afterLoop = new HashMap<>();
        final Map<BasicBlock, BasicBlock> follows = new HashMap<>();
        final Set<BasicBlock> emitted = new HashSet<>();

        Structurer(ControlFlowGraph graph) {
            this.graph = graph;
            List<BasicBlock> order = GraphWalker.handlerAwareWalker(graph).reversePostOrder();
            for (int i = 0; i < order.size(); i++) {
                rpo.put(order.get(i), i);
            }
            for (BasicBlock block : graph.blocks) {
                BasicBlock idom = block.getNullable(CfgExts.IDOM);
                if (idom != null) children.computeIfAbsent(idom, $ -> new ArrayList<>()).add(block);
                int count = 0;
                for (BasicBlock pred : block.predecessors()) {
                    if (!isBackEdge(pred, block)) count++;
                }
                forwardPreds.put(block, count);
            }
            for (List<BasicBlock> list : children.values()) {
                list.sort(Comparator.comparing(this::rpoIndex));
            }

            for (ProtectedRegion region : graph.getRegions()) {
                if (!isStructurable(region)) {
                    LOGGER.debug("{}: region {} is not structured", graph.getMethodId(), region);
                    ignoredRegions.add(region);
                }
            }
            reserveLoopExits();
            reserveSections();
        }

        int rpoIndex(BasicBlock block) {
            Integer index = rpo.get(block);
            return index == null ? Integer.MAX_VALUE : index;
        }

        static boolean isBackEdge(BasicBlock from, BasicBlock to) {
            LoopConstruct loop = to.getNullable(CfgExts.LOOP);
            return loop != null && loop.getLatches().contains(from);
        }

        boolean isDuplicatedExit(BasicBlock block) {
            return block.isTrivialExit() && forwardPreds.get(block) > 1;
        }

        private boolean isStructurable(ProtectedRegion region) {
            if (region.getKind() == ExceptionRegion.Kind.FILTER) return false;
            for (BasicBlock block : region.getTryBlocks()) {
                if (block == region.getTryEntry()) continue;
                for (BasicBlock pred : block.predecessors()) {
                    if (!region.getTryBlocks().contains(pred)) return false;
                }
            }
            for (BasicBlock block : region.getHandlerBlocks()) {
                for (BasicBlock pred : block.predecessors()) {
                    if (block == region.getHandlerEntry() || !region.getHandlerBlocks().contains(pred)) return false;
                }
            }
            return true;
        }

        private void reserveLoopExits() {
            for (BasicBlock header : graph.blocks) {
                LoopConstruct loop = header.getNullable(CfgExts.LOOP);
                if (loop == null) continue;
                BasicBlock exit = loop.getBreakTarget();
                if (exit == null
                        || !exit.isDominatedBy(header)
                        || isDuplicatedExit(exit)
                        || !canPlace(header, exit, Collections.emptySet())) {
                    continue;
                }
                // the outermost loop leaving to a block places it
                BasicBlock existing = afterLoop.get(exit);
                if (existing == null || existing.isDominatedBy(header)) {
                    afterLoop.put(exit, header);
                }
            }
            reserved.addAll(afterLoop.keySet());
        }

        private void reserveSections() {
            for (BasicBlock block : graph.blocks) {
                SwitchConstruct sc = block.getControl().getSwitchConstruct();
                if (sc == null) continue;
                if (sc.getDischargeKind() == SwitchConstruct.DischargeKind.EXPRESSION_VALUE) {
                    reserved.addAll(sc.getTargets());
                    continue;
                }
                BasicBlock follow = findFollow(block, sc);
                follows.put(block, follow);
                for (BasicBlock target : sc.getTargets()) {
                    if (isSectionBlock(block, target, follow)) reserved.add(target);
                }
            }
        }

        /**
         * Find the block a switch's sections break to.
         * <p>
         * In a loop, the post-dominator may be the latch or lie outside the loop, where sections
         * go by leaving the switch some other way. The follow is then the block inside the loop
         * that the most case targets reach.
         */
        private @Nullable BasicBlock findFollow(BasicBlock block, SwitchConstruct sc) {
            BasicBlock ipdom = block.getNullable(CfgExts.IPDOM);
            LoopConstruct loop = innermostLoop(block);
            if (ipdom != null && !leavesLoop(loop, ipdom)) return ipdom;

            Map<BasicBlock, Integer> reachedBy = new HashMap<>();
            for (BasicBlock target : sc.getTargets()) {
                Set<BasicBlock> seen = new HashSet<>();
                Deque<BasicBlock> worklist = new ArrayDeque<>();
                seen.add(target);
                worklist.add(target);
                while (!worklist.isEmpty()) {
                    BasicBlock reached = worklist.pop();
                    if (reached == block
                            || reached.isTrivialExit()
                            || leavesLoop(loop, reached)
                            || !reached.isDominatedBy(block)) {
                        continue;
                    }
                    reachedBy.merge(reached, 1, Integer::sum);
                    for (BasicBlock successor : reached.successors()) {
                        if (!isBackEdge(reached, successor) && seen.add(successor)) worklist.add(successor);
                    }
                }
            }

            BasicBlock best = null;
            int bestCount = 1;
            for (Map.Entry<BasicBlock, Integer> entry : reachedBy.entrySet()) {
                int count = entry.getValue();
                if (count > bestCount || count == bestCount && best != null && rpoIndex(entry.getKey()) < rpoIndex(best)) {
                    best = entry.getKey();
                    bestCount = count;
                }
            }
            return best == null ? ipdom : best;
        }

        /**
         * Whether control reaching a block leaves the innermost loop's body, or goes round it again.
         */
        static boolean leavesLoop(@Nullable LoopConstruct loop, BasicBlock block) {
            return loop != null
                    && (block == loop.getHeader()
                    || block == loop.getBreakTarget()
                    || loop.getLatches().contains(block)
                    || !loop.contains(block));
        }

        boolean isSectionBlock(BasicBlock block, BasicBlock target, @Nullable BasicBlock follow) {
            return target != follow
                    && target.getNullable(CfgExts.IDOM) == block
                    && !isDuplicatedExit(target)
                    && !afterLoop.containsKey(target)
                    && !leavesLoop(innermostLoop(block), target)
                    && canPlace(block, target, Collections.emptySet());
        }

        boolean inTry(ProtectedRegion region, BasicBlock block) {
            return region.getTryBlocks().contains(block);
        }

        /**
         * Check whether code for a block may be placed where code for another is, treating that block as
         * outside some regions.
         */
        boolean canPlace(BasicBlock at, BasicBlock block, Set<ProtectedRegion> leaving) {
            for (ProtectedRegion region : graph.getRegions()) {
                if (ignoredRegions.contains(region)) continue;
                boolean atTry = !leaving.contains(region) && inTry(region, at);
                boolean atHandler = !leaving.contains(region) && region.getHandlerBlocks().contains(at);
                boolean blockTry = inTry(region, block);
                if (atTry != blockTry && !(blockTry && region.getTryEntry() == block)) return false;
                if (atHandler != region.getHandlerBlocks().contains(block)) return false;
            }
            return true;
        }

        List<BasicBlock> mergeChildren(BasicBlock block) {
            List<BasicBlock> merges = new ArrayList<>();
            List<BasicBlock> kids = children.get(block);
            if (kids == null) return merges;
            for (BasicBlock child : kids) {
                if (forwardPreds.get(child) > 1
                        && !reserved.contains(child)
                        && !emitted.contains(child)
                        && !isDuplicatedExit(child)
                        && canPlace(block, child, Collections.emptySet())) {
                    merges.add(child);
                }
            }
            return merges;
        }

        /**
         * Emit a block and everything placed with it.
         */
        List<Statement> emitTree(BasicBlock block, Ctx ctx) {
            if (!emitted.add(block)) {
                throw new DecompilationException(ErrorKind.INVALID_CONTROL_FLOW, "block " + block.getLabel() + " emitted twice");
            }
            List<Statement> stmts = new ArrayList<>();
            stmts.add(new LabelStatement(block.getLabel()));
            stmts.addAll(emitAt(block, ctx, openRegions(block), block.getNullable(CfgExts.LOOP), mergeChildren(block)));
            return stmts;
        }

        private List<List<ProtectedRegion>> openRegions(BasicBlock block) {
            List<ProtectedRegion> entered = new ArrayList<>();
            for (ProtectedRegion region : graph.getRegions()) {
                if (region.getTryEntry() == block && !ignoredRegions.contains(region) && !emittedRegions.contains(region)) {
                    entered.add(region);
                }
            }
            List<List<ProtectedRegion>> groups = new ArrayList<>();
            for (ProtectedRegion region : entered) {
                List<ProtectedRegion> group = null;
                for (List<ProtectedRegion> existing : groups) {
                    ExceptionRegion first = existing.get(0).getRegion();
                    if (first.getTryStart() == region.getRegion().getTryStart()
                            && first.getTryEnd() == region.getRegion().getTryEnd()) {
                        group = existing;
                        break;
                    }
                }
                if (group == null) {
                    group = new ArrayList<>();
                    groups.add(group);
                }
                group.add(region);
            }
            // outermost first
            groups.sort(Comparator.comparing((List<ProtectedRegion> it) -> it.get(0).getRegion().getTryEnd()).reversed());
            return groups;
        }

        private List<Statement> emitAt(BasicBlock block,
                                       Ctx ctx,
                                       List<List<ProtectedRegion>> regions,
                                       @Nullable LoopConstruct loop,
                                       List<BasicBlock> merges) {
            if (!regions.isEmpty() && (loop == null || regions.get(0).get(0).getTryBlocks().containsAll(loop.getBody()))) {
                List<ProtectedRegion> group = regions.get(0);
                List<List<ProtectedRegion>> rest = regions.subList(1, regions.size());
                return emitTry(block, ctx, group, rest, loop, merges);
            }
            if (loop != null) {
                List<BasicBlock> inside = new ArrayList<>();
                List<BasicBlock> outside = new ArrayList<>();
                for (BasicBlock merge : merges) {
                    (loop.contains(merge) ? inside : outside).add(merge);
                }
                return within(outside, ctx, c -> emitLoop(block, c, regions, loop, inside));
            }
            return within(merges, ctx, c -> emitBlock(block, c));
        }

        /**
         * Emit code followed by blocks it reaches, the block with the highest reverse post-order index last.
         */
        private List<Statement> within(List<BasicBlock> following, Ctx ctx, Emitter base) {
            if (following.isEmpty()) return base.emit(ctx);
            BasicBlock last = following.get(following.size() - 1);
            List<Statement> stmts = new ArrayList<>(within(following.subList(0, following.size() - 1), ctx.withNext(last), base));
            stmts.addAll(emitTree(last, ctx));
            return stmts;
        }

        private List<Statement> emitBlock(BasicBlock block, Ctx ctx) {
            List<Statement> stmts = new ArrayList<>(block.getStatements());
            Scope scope = ctx.scope;
            if (scope != null && scope.conditionLatch == block) return stmts;
            stmts.addAll(emitControl(block, ctx));
            return stmts;
        }

        private List<Statement> emitControl(BasicBlock block, Ctx ctx) {
            Control control = block.getControl();
            switch (control.getKind()) {
                case JUMP:
                case LEAVE:
                    return emitBranch(block, control.targets.get(0), ctx);
                case CONDITIONAL:
                    //noinspection ConstantConditions
                    return emitConditional(block, control.getValue(), control.targets.get(0), control.targets.get(1), ctx);
                case SWITCH: {
                    SwitchConstruct sc = control.getSwitchConstruct();
                    if (sc == null) {
                        throw new DecompilationException(ErrorKind.INVALID_CONTROL_FLOW,
                                "unrecognised jump table at " + block.getLabel());
                    }
                    if (sc.getDischargeKind() == SwitchConstruct.DischargeKind.EXPRESSION_VALUE) {
                        return emitSwitchExpression(block, sc, ctx);
                    }
                    return emitSwitch(block, sc, ctx);
                }
                case RETURN:
                case THROW:
                    return Collections.singletonList(exitStatement(control));
                case END_FINALLY:
                    return ctx.inFault
                            ? Collections.singletonList(ThrowStatement.RETHROW)
                            : Collections.emptyList();
                case EXIT:
                    return Collections.singletonList(ReturnStatement.VOID);
                default:
                    throw new IllegalStateException(control.getKind().name());
            }
        }

        private static Statement exitStatement(Control control) {
            if (control.getKind() == Control.Kind.RETURN) {
                Expression value = control.getValue();
                return value == null ? ReturnStatement.VOID : new ReturnStatement(value);
            }
            Expression value = control.getValue();
            return value == null ? ThrowStatement.RETHROW : new ThrowStatement(value);
        }

        List<Statement> emitBranch(BasicBlock from, BasicBlock target, Ctx ctx) {
            if (target == ctx.next) return Collections.emptyList();
            Scope scope = ctx.scope;
            if (scope != null) {
                Scope loop = scope.innermostLoop();
                if (loop != null && target == loop.continueTarget) {
                    return Collections.singletonList(ContinueStatement.INSTANCE);
                }
                if (target == scope.breakTarget) {
                    return Collections.singletonList(BreakStatement.INSTANCE);
                }
            }
            if (target.isTrivialExit()) {
                if (isDuplicatedExit(target) || !canInline(from, target)) {
                    emitted.add(target);
                    return Collections.singletonList(exitStatement(target.getControl()));
                }
            }
            if (canInline(from, target)) {
                return emitTree(target, ctx);
            }
            return Collections.singletonList(new GotoStatement(target.getLabel()));
        }

        private boolean canInline(BasicBlock from, BasicBlock target) {
            return !emitted.contains(target)
                    && !reserved.contains(target)
                    && forwardPreds.get(target) <= 1
                    && !isBackEdge(from, target)
                    && canPlace(from, target, Collections.emptySet());
        }

        private List<Statement> emitConditional(BasicBlock block,
                                                Expression condition,
                                                BasicBlock ifTrue,
                                                BasicBlock ifFalse,
                                                Ctx ctx) {
            List<Statement> taken = emitBranch(block, ifTrue, ctx);
            List<Statement> notTaken = emitBranch(block, ifFalse, ctx);
            if (taken.isEmpty() && notTaken.isEmpty()) {
                if (condition.getKind() == Expression.Kind.PRIMITIVE
                        || condition.getKind() == Expression.Kind.IDENTIFIER) {
                    return Collections.emptyList();
                }
                return Collections.singletonList(new IfElseStatement(condition, BlockStatement.EMPTY, null));
            }
            if (notTaken.isEmpty()) {
                return Collections.singletonList(new IfElseStatement(condition, new BlockStatement(taken), null));
            }
            Expression negated = Conditions.not(condition);
            if (taken.isEmpty()) {
                return Collections.singletonList(new IfElseStatement(negated, new BlockStatement(notTaken), null));
            }

            // a branch that exits becomes a guard, the shorter one if both do
            List<Statement> stmts = new ArrayList<>();
            boolean takenExits = !AstQueries.canCompleteNormally(taken);
            if (!AstQueries.canCompleteNormally(notTaken) && (!takenExits || countStatements(notTaken) <= countStatements(taken))) {
                stmts.add(new IfElseStatement(negated, new BlockStatement(notTaken), null));
                stmts.addAll(taken);
            } else if (takenExits) {
                stmts.add(new IfElseStatement(condition, new BlockStatement(taken), null));
                stmts.addAll(notTaken);
            } else {
                stmts.add(new IfElseStatement(negated, new BlockStatement(notTaken), new BlockStatement(taken)));
            }
            return stmts;
        }

        private static int countStatements(List<Statement> stmts) {
            int count = 0;
            for (Statement stmt : stmts) {
                if (stmt.getKind() != Statement.Kind.LABEL) count++;
            }
            return count;
        }

        private List<Statement> emitSwitch(BasicBlock block, SwitchConstruct sc, Ctx ctx) {
            BasicBlock follow = follows.get(block);
            Scope scope = new Scope(ctx.scope, false, follow, null, null);
            Ctx sectionCtx = ctx.withScope(scope, follow);
            List<SwitchSection> sections = new ArrayList<>();
            for (SwitchCase switchCase : sc.getCases()) {
                BasicBlock target = switchCase.getTarget();
                if (switchCase.isDefault() && target == follow) continue;
                List<Statement> body;
                if (reserved.contains(target) && !emitted.contains(target) && isSectionBlock(block, target, follow)) {
                    body = new ArrayList<>(emitTree(target, sectionCtx));
                } else {
                    body = new ArrayList<>(emitBranch(block, target, sectionCtx));
                }
                if (AstQueries.canCompleteNormally(body)) body.add(BreakStatement.INSTANCE);
                sections.add(new SwitchSection(switchCase.getSectionLabels(), body));
            }
            List<Statement> stmts = new ArrayList<>();
            stmts.add(new SwitchStatement(sc.getDiscriminant(), sections));
            if (follow != null) stmts.addAll(emitBranch(block, follow, ctx));
            return stmts;
        }

        private List<Statement> emitSwitchExpression(BasicBlock block, SwitchConstruct sc, Ctx ctx) {
            List<SwitchExpressionSection> sections = new ArrayList<>();
            for (SwitchCase switchCase : sc.getCases()) {
                BasicBlock target = switchCase.getTarget();
                emitted.add(target);
                ExpressionStatement stmt = (ExpressionStatement) target.getStatements().get(0);
                AssignmentExpression assignment = (AssignmentExpression) stmt.getExpression();
                sections.add(new SwitchExpressionSection(switchCase.getSectionLabels(), assignment.getRight()));
            }
            //noinspection ConstantConditions
            Expression value = new AssignmentExpression(
                    new IdentifierExpression(sc.getAssignedVariable()),
                    new SwitchExpression(sc.getDiscriminant(), sections));
            List<Statement> stmts = new ArrayList<>();
            stmts.add(new ExpressionStatement(value));
            //noinspection ConstantConditions
            stmts.addAll(emitBranch(block, sc.getValueFollow(), ctx));
            return stmts;
        }

        private List<Statement> emitLoop(BasicBlock header,
                                         Ctx ctx,
                                         List<List<ProtectedRegion>> regions,
                                         LoopConstruct loop,
                                         List<BasicBlock> inside) {
            BasicBlock exit = loop.getBreakTarget();
            Control control = header.getControl();
            BasicBlock latch = loop.getLatches().size() == 1 ? loop.getLatches().get(0) : null;
            BasicBlock whileExit = exit == null ? trivialExit(loop, header) : exit;
            BasicBlock doWhileExit = exit == null && latch != null ? trivialExit(loop, latch) : exit;
            Statement stmt;

            BasicBlock bodyEntry = null;
            if (header.getStatements().isEmpty()
                    && control.getKind() == Control.Kind.CONDITIONAL
                    && whileExit != null
                    && regions.isEmpty()
                    && inside.isEmpty()) {
                BasicBlock t0 = control.targets.get(0);
                BasicBlock t1 = control.targets.get(1);
                if (t0 == whileExit && t1 != header && loop.contains(t1)) bodyEntry = t1;
                else if (t1 == whileExit && t0 != header && loop.contains(t0)) bodyEntry = t0;
            }

            if (bodyEntry != null) {
                exit = whileExit;
                //noinspection ConstantConditions
                Expression condition = control.targets.get(0) == bodyEntry
                        ? control.getValue()
                        : Conditions.not(control.getValue());
                if (latch != null && isForLatch(loop, latch)) {
                    loop.setShape(LoopConstruct.Kind.FOR, latch);
                    emitted.add(latch);
                    Ctx bodyCtx = ctx.withScope(new Scope(ctx.scope, true, exit, latch, null), latch);
                    List<Expression> iterators = new ArrayList<>();
                    for (Statement iterator : latch.getStatements()) {
                        iterators.add(((ExpressionStatement) iterator).getExpression());
                    }
                    List<Statement> body = emitBranch(header, bodyEntry, bodyCtx);
                    stmt = new ForStatement(Collections.emptyList(), condition, iterators, new BlockStatement(body));
                } else {
                    loop.setShape(LoopConstruct.Kind.WHILE, header);
                    Ctx bodyCtx = ctx.withScope(new Scope(ctx.scope, true, exit, header, null), header);
                    List<Statement> body = emitBranch(header, bodyEntry, bodyCtx);
                    stmt = new WhileStatement(condition, new BlockStatement(body));
                }
            } else if (latch != null
                    && doWhileExit != null
                    && (latch != header || regions.isEmpty())
                    && isDoWhileLatch(loop, latch, doWhileExit)) {
                exit = doWhileExit;
                loop.setShape(LoopConstruct.Kind.DO_WHILE, latch);
                Control latchControl = latch.getControl();
                //noinspection ConstantConditions
                Expression condition = latchControl.targets.get(0) == header
                        ? latchControl.getValue()
                        : Conditions.not(latchControl.getValue());
                List<BasicBlock> merges = new ArrayList<>(inside);
                if (latch != header) {
                    emitted.add(latch);
                    merges.remove(latch);
                }
                Ctx bodyCtx = ctx.withScope(new Scope(ctx.scope, true, exit, latch, latch), latch);
                List<Statement> body = within(merges, bodyCtx, c -> emitAt(header, c, regions, null, Collections.emptyList()));
                stmt = new DoWhileStatement(new BlockStatement(body), condition);
            } else {
                loop.setShape(LoopConstruct.Kind.WHILE, header);
                Ctx bodyCtx = ctx.withScope(new Scope(ctx.scope, true, exit, header, null), header);
                List<Statement> body = within(inside, bodyCtx, c -> emitAt(header, c, regions, null, Collections.emptyList()));
                stmt = new WhileStatement(PrimitiveExpression.TRUE, new BlockStatement(body));
            }

            List<Statement> stmts = new ArrayList<>();
            stmts.add(stmt);
            if (exit != null) {
                if (afterLoop.get(exit) == header && !emitted.contains(exit)) {
                    stmts.addAll(emitTree(exit, ctx));
                } else {
                    stmts.addAll(emitBranch(header, exit, ctx));
                }
            }
            return stmts;
        }

        private boolean isForLatch(LoopConstruct loop, BasicBlock latch) {
            if (latch == loop.getHeader()
                    || latch.getControl().getKind() != Control.Kind.JUMP
                    || latch.getStatements().isEmpty()
                    || latch.predecessors().size() < 2
                    || reserved.contains(latch)) {
                return false;
            }
            for (Statement stmt : latch.getStatements()) {
                if (stmt.getKind() != Statement.Kind.EXPRESSION) return false;
            }
            // continue must reach the latch from every predecessor
            for (BasicBlock pred : latch.predecessors()) {
                if (innermostLoop(pred) != loop) return false;
            }
            return true;
        }

        /**
         * Find the trivial exit a conditional header or latch leaves to, which is not a break target
         * since it may be copied into the loop.
         */
        private @Nullable BasicBlock trivialExit(LoopConstruct loop, BasicBlock block) {
            Control control = block.getControl();
            if (control.getKind() != Control.Kind.CONDITIONAL) return null;
            for (BasicBlock target : control.targets) {
                if (target != loop.getHeader() && target.isTrivialExit() && !loop.contains(target)) return target;
            }
            return null;
        }

        private boolean isDoWhileLatch(LoopConstruct loop, BasicBlock latch, BasicBlock exit) {
            Control control = latch.getControl();
            if (control.getKind() != Control.Kind.CONDITIONAL) return false;
            BasicBlock header = loop.getHeader();
            boolean shape = (control.targets.get(0) == header && control.targets.get(1) == exit)
                    || (control.targets.get(1) == header && control.targets.get(0) == exit);
            if (!shape || reserved.contains(latch)) return false;
            if (latch == header) return true;
            return latch.getStatements().isEmpty()
                    && graph.inSameRegions(latch, header)
                    && innermostLoop(latch) == loop;
        }

        private @Nullable LoopConstruct innermostLoop(BasicBlock block) {
            LoopConstruct best = null;
            for (BasicBlock header : graph.blocks) {
                LoopConstruct loop = header.getNullable(CfgExts.LOOP);
                if (loop != null && loop.contains(block) && (best == null || best.getBody().size() > loop.getBody().size())) {
                    best = loop;
                }
            }
            return best;
        }

        private List<Statement> emitTry(BasicBlock entry,
                                        Ctx ctx,
                                        List<ProtectedRegion> group,
                                        List<List<ProtectedRegion>> rest,
                                        @Nullable LoopConstruct loop,
                                        List<BasicBlock> merges) {
            emittedRegions.addAll(group);
            Set<ProtectedRegion> leaving = new HashSet<>(group);
            Set<BasicBlock> regionBlocks = new HashSet<>();
            for (ProtectedRegion region : group) {
                regionBlocks.addAll(region.getTryBlocks());
                regionBlocks.addAll(region.getHandlerBlocks());
            }

            BasicBlock continuation = findContinuation(group.get(0), regionBlocks);
            List<BasicBlock> after = new ArrayList<>();
            for (BasicBlock block : graph.blocks) {
                BasicBlock idom = block.getNullable(CfgExts.IDOM);
                if (idom != null
                        && regionBlocks.contains(idom)
                        && !regionBlocks.contains(block)
                        && !reserved.contains(block)
                        && !emitted.contains(block)
                        && !isDuplicatedExit(block)
                        && forwardPreds.get(block) > 0
                        && canPlace(entry, block, leaving)) {
                    after.add(block);
                }
            }
            after.sort(Comparator.comparing(this::rpoIndex));
            if (continuation != null && after.remove(continuation)) after.add(0, continuation);
            reserved.addAll(after);

            BasicBlock next = after.isEmpty() ? continuation : after.get(0);
            if (next == null) next = ctx.next;
            Ctx inner = ctx.withNext(next);
            List<Statement> tryBody = emitAt(entry, inner, new ArrayList<>(rest), loop, merges);

            List<CatchClause> catches = new ArrayList<>();
            BlockStatement finallyBlock = null;
            for (ProtectedRegion region : group) {
                BasicBlock handler = region.getHandlerEntry();
                switch (region.getKind()) {
                    case CATCH:
                        catches.add(new CatchClause(region.getCatchType(),
                                region.getExceptionVariable(),
                                new BlockStatement(emitTree(handler, inner))));
                        break;
                    case FAULT:
                        catches.add(new CatchClause(null, null,
                                new BlockStatement(emitTree(handler, new Ctx(null, ctx.scope, true)))));
                        break;
                    case FINALLY:
                        finallyBlock = new BlockStatement(emitTree(handler, new Ctx(null, null, false)));
                        break;
                    default:
                        throw new IllegalStateException(region.getKind().name());
                }
            }

            BlockStatement tryBlock = new BlockStatement(tryBody);
            TryCatchStatement stmt;
            Statement only = singleTry(tryBody);
            if (catches.isEmpty() && finallyBlock != null && only != null) {
                // try { try { } catch { } } finally { } reads as one statement
                TryCatchStatement innerTry = (TryCatchStatement) only;
                stmt = new TryCatchStatement(innerTry.getTryBlock(), innerTry.getCatchClauses(), finallyBlock);
            } else {
                stmt = new TryCatchStatement(tryBlock, catches, finallyBlock);
            }

            List<Statement> stmts = new ArrayList<>();
            stmts.add(stmt);
            if (continuation != null && (after.isEmpty() || after.get(0) != continuation)) {
                stmts.addAll(emitBranch(entry, continuation, ctx.withNext(after.isEmpty() ? ctx.next : after.get(0))));
            }
            for (int i = 0; i < after.size(); i++) {
                BasicBlock block = after.get(i);
                if (emitted.contains(block)) continue;
                stmts.addAll(emitTree(block, ctx.withNext(i + 1 < after.size() ? after.get(i + 1) : ctx.next)));
            }
            return stmts;
        }

        private static @Nullable Statement singleTry(List<Statement> body) {
            Statement only = null;
            for (Statement stmt : body) {
                if (stmt.getKind() == Statement.Kind.LABEL) continue;
                if (only != null) return null;
                only = stmt;
            }
            if (only == null || only.getKind() != Statement.Kind.TRY_CATCH) return null;
            TryCatchStatement tc = (TryCatchStatement) only;
            return tc.getFinallyBlock() == null && !tc.getCatchClauses().isEmpty() ? tc : null;
        }

        /**
         * Find the block most leaves out of a region go to.
         */
        private @Nullable BasicBlock findContinuation(ProtectedRegion region, Set<BasicBlock> regionBlocks) {
            Map<BasicBlock, Integer> counts = new LinkedHashMap<>();
            for (BasicBlock block : regionBlocks) {
                for (BasicBlock target : block.successors()) {
                    if (!regionBlocks.contains(target)) {
                        counts.merge(target, 1, Integer::sum);
                    }
                }
            }
            BasicBlock best = null;
            int bestCount = 0;
            for (Map.Entry<BasicBlock, Integer> entry : counts.entrySet()) {
                if (entry.getValue() > bestCount) {
                    best = entry.getKey();
                    bestCount = entry.getValue();
                }
            }
            if (best != null) {
                LOGGER.trace("{}: {} continues at {}", graph.getMethodId(), region, best.getLabel());
            }
            return best;
        }
    }
}
