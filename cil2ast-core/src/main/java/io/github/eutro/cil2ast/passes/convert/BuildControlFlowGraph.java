package io.github.eutro.cil2ast.passes.convert;

import io.github.eutro.cil2ast.DecompilerContext;
import io.github.eutro.cil2ast.MethodInput;
import io.github.eutro.cil2ast.api.DecompilationException;
import io.github.eutro.cil2ast.api.ErrorKind;
import io.github.eutro.cil2ast.api.ExceptionRegion;
import io.github.eutro.cil2ast.api.Instruction;
import io.github.eutro.cil2ast.api.InstructionStream;
import io.github.eutro.cil2ast.api.KnownType;
import io.github.eutro.cil2ast.api.LocalVariable;
import io.github.eutro.cil2ast.api.MetadataSource;
import io.github.eutro.cil2ast.api.OpCode;
import io.github.eutro.cil2ast.api.Symbol;
import io.github.eutro.cil2ast.api.TypeRef;
import io.github.eutro.cil2ast.api.TypeResolver;
import io.github.eutro.cil2ast.ast.Annotations;
import io.github.eutro.cil2ast.ast.AssignmentExpression;
import io.github.eutro.cil2ast.ast.AstQueries;
import io.github.eutro.cil2ast.ast.BaseReferenceExpression;
import io.github.eutro.cil2ast.ast.BinaryOperatorExpression;
import io.github.eutro.cil2ast.ast.BinaryOperatorType;
import io.github.eutro.cil2ast.ast.CastExpression;
import io.github.eutro.cil2ast.ast.Conditions;
import io.github.eutro.cil2ast.ast.Expression;
import io.github.eutro.cil2ast.ast.ExpressionStatement;
import io.github.eutro.cil2ast.ast.IdentifierExpression;
import io.github.eutro.cil2ast.ast.IndexerExpression;
import io.github.eutro.cil2ast.ast.InvocationExpression;
import io.github.eutro.cil2ast.ast.MemberReferenceExpression;
import io.github.eutro.cil2ast.ast.ObjectCreateExpression;
import io.github.eutro.cil2ast.ast.PrimitiveExpression;
import io.github.eutro.cil2ast.ast.Statement;
import io.github.eutro.cil2ast.ast.ThisReferenceExpression;
import io.github.eutro.cil2ast.ast.TypeReferenceExpression;
import io.github.eutro.cil2ast.ast.UnaryOperatorExpression;
import io.github.eutro.cil2ast.ast.UnaryOperatorType;
import io.github.eutro.cil2ast.cfg.BasicBlock;
import io.github.eutro.cil2ast.cfg.Control;
import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import io.github.eutro.cil2ast.cfg.ProtectedRegion;
import io.github.eutro.cil2ast.passes.IRPass;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Converts the instruction stream of a method into a {@link ControlFlowGraph}.
 * <p>
 * Each block's stack code is lifted into statements by simulating the evaluation stack.
 * Values still on the stack at the end of a block are stored into {@code stack_N} locals,
 * one per stack depth, which the successor blocks start with on their stacks.
 *
 * @see ErrorKind#INVALID_CONTROL_FLOW
 */
public class BuildControlFlowGraph implements IRPass<MethodInput, ControlFlowGraph> {
    private static final Logger LOGGER = LoggerFactory.getLogger(BuildControlFlowGraph.class);

    /**
     * An instance of this pass.
     */
    public static final BuildControlFlowGraph INSTANCE = new BuildControlFlowGraph();

    private static final TypeRef ARRAY = TypeRef.of("System.Array");

    @Override
    public ControlFlowGraph run(MethodInput input) {
        DecompilerContext context = input.getContext();
        MetadataSource metadata = context.getMetadata();
        Symbol method = metadata.getMethod(input.getMethodId());
        InstructionStream body = metadata.getMethodBody(input.getMethodId());
        List<ExceptionRegion> regions = metadata.getExceptionRegions(input.getMethodId());
        ControlFlowGraph graph = new ControlFlowGraph(input.getMethodId(), method, context);
        new ConvertState(graph, body, regions).convert();
        LOGGER.debug("built graph of {} with {} blocks", input.getMethodId(), graph.blocks.size());
        return graph;
    }

    static DecompilationException invalid(String message) {
        return new DecompilationException(ErrorKind.INVALID_CONTROL_FLOW, message);
    }

    /**
     * A value on the simulated evaluation stack.
     */
    static class StackValue {
        final Expression expr;
        final TypeRef type;

        StackValue(Expression expr, TypeRef type) {
            this.expr = expr;
            this.type = type;
        }

        @Override
        public String toString() {
            return expr + " : " + type;
        }
    }

    static class ConvertState {
        final ControlFlowGraph graph;
        final InstructionStream body;
        final List<Instruction> insns;
        final List<ExceptionRegion> exceptionRegions;
        final Symbol method;
        final MetadataSource metadata;
        final TypeResolver types;
        final Map<Integer, LocalVariable> locals = new HashMap<>();

        final TreeSet<Integer> leaders = new TreeSet<>();
        final Map<Integer, BasicBlock> blocksByOffset = new HashMap<>();
        final Map<BasicBlock, List<TypeRef>> entryStacks = new HashMap<>();
        final Map<BasicBlock, String> catchVariables = new HashMap<>();

        // per block
        List<StackValue> stack;
        BasicBlock block;
        int offset;

        ConvertState(ControlFlowGraph graph, InstructionStream body, List<ExceptionRegion> exceptionRegions) {
            this.graph = graph;
            this.body = body;
            this.insns = body.getInstructions();
            this.exceptionRegions = exceptionRegions;
            this.method = graph.getMethod();
            this.metadata = graph.getContext().getMetadata();
            this.types = graph.getContext().getTypeResolver();
        }

        void convert() {
            if (insns.isEmpty()) {
                throw invalid("empty method body");
            }
            for (LocalVariable local : body.getLocals()) {
                locals.put(local.getIndex(), local);
                graph.declareLocal(local.getName(), local.getType());
            }

            findLeaders();
            for (int leader : leaders) {
                blocksByOffset.put(leader, graph.newBlock(leader));
            }
            mapRegions();

            PriorityQueue<BasicBlock> worklist = new PriorityQueue<>(Comparator.comparingInt(BasicBlock::getOffset));
            Set<BasicBlock> queued = new HashSet<>();
            BasicBlock entry = graph.getEntry();
            entryStacks.put(entry, Collections.emptyList());
            worklist.add(entry);
            queued.add(entry);
            for (ProtectedRegion region : graph.getRegions()) {
                BasicBlock handler = region.getHandlerEntry();
                if (queued.add(handler)) worklist.add(handler);
            }
            while (!worklist.isEmpty()) {
                BasicBlock next = worklist.poll();
                liftBlock(next);
                for (BasicBlock target : next.successors()) {
                    if (queued.add(target)) worklist.add(target);
                }
            }

            for (BasicBlock unreached : graph.blocks) {
                if (unreached.getControl() == null) {
                    // never lifted, so removed as dead code later
                    unreached.setControl(Control.exit());
                }
            }
        }

        void findLeaders() {
            int codeSize = body.getCodeSize();
            leaders.add(insns.get(0).getOffset());
            for (int i = 0; i < insns.size(); i++) {
                Instruction insn = insns.get(i);
                switch (insn.getOpCode().getOperandType()) {
                    case BRANCH_TARGET:
                        leaders.add(checkTarget(insn, insn.getIntOperand()));
                        break;
                    case SWITCH_TABLE:
                        for (int target : insn.getSwitchTargets()) {
                            leaders.add(checkTarget(insn, target));
                        }
                        break;
                    default:
                        break;
                }
                if (insn.getOpCode().getFlowControl().endsBlock() && i + 1 < insns.size()) {
                    leaders.add(insns.get(i + 1).getOffset());
                }
            }
            for (ExceptionRegion region : exceptionRegions) {
                int[] boundaries = {
                        region.getTryStart(), region.getTryEnd(),
                        region.getHandlerStart(), region.getHandlerEnd(),
                };
                for (int i = 0; i < boundaries.length; i++) {
                    int boundary = boundaries[i];
                    boolean isEnd = (i & 1) == 1;
                    if (isEnd && boundary >= codeSize) continue;
                    if (body.indexOf(boundary) < 0) {
                        throw invalid("exception region boundary " + Instruction.formatOffset(boundary)
                                + " is not an instruction boundary in " + region);
                    }
                    leaders.add(boundary);
                }
            }
        }

        int checkTarget(Instruction insn, int target) {
            if (target < 0 || target >= body.getCodeSize()) {
                throw invalid("branch target " + Instruction.formatOffset(target)
                        + " of " + insn + " is outside the method");
            }
            if (body.indexOf(target) < 0) {
                throw invalid("branch target " + Instruction.formatOffset(target)
                        + " of " + insn + " is not an instruction boundary");
            }
            return target;
        }

        void mapRegions() {
            for (ExceptionRegion region : exceptionRegions) {
                BasicBlock tryEntry = blocksByOffset.get(region.getTryStart());
                BasicBlock handlerEntry = blocksByOffset.get(region.getHandlerStart());
                String exceptionVariable = null;
                if (region.getKind() == ExceptionRegion.Kind.CATCH || region.getKind() == ExceptionRegion.Kind.FILTER) {
                    TypeRef catchType = region.getCatchType() == null ? TypeRef.of("System.Exception") : region.getCatchType();
                    exceptionVariable = graph.newCatchVariable(catchType);
                    catchVariables.put(handlerEntry, exceptionVariable);
                    entryStacks.put(handlerEntry, Collections.singletonList(catchType));
                } else {
                    entryStacks.put(handlerEntry, Collections.emptyList());
                }
                ProtectedRegion protectedRegion = new ProtectedRegion(region, tryEntry, handlerEntry, exceptionVariable);
                for (BasicBlock block : graph.blocks) {
                    if (region.tryContains(block.getOffset())) protectedRegion.getTryBlocks().add(block);
                    if (region.handlerContains(block.getOffset())) protectedRegion.getHandlerBlocks().add(block);
                }
                graph.getRegions().add(protectedRegion);
            }
        }

        // lifting

        void liftBlock(BasicBlock block) {
            this.block = block;
            List<TypeRef> entryStack = entryStacks.get(block);
            stack = new ArrayList<>();
            String catchVariable = catchVariables.get(block);
            if (catchVariable != null) {
                stack.add(new StackValue(new IdentifierExpression(catchVariable), entryStack.get(0)));
            } else {
                for (int depth = 0; depth < entryStack.size(); depth++) {
                    stack.add(new StackValue(new IdentifierExpression(stackVar(depth)), entryStack.get(depth)));
                }
            }

            int start = body.indexOf(block.getOffset());
            Integer nextLeader = leaders.higher(block.getOffset());
            int end = nextLeader == null ? insns.size() : body.indexOf(nextLeader);
            BasicBlock fallthrough = nextLeader == null ? null : blocksByOffset.get(nextLeader);
            for (int i = start; i < end; i++) {
                Instruction insn = insns.get(i);
                offset = insn.getOffset();
                Control control = liftInsn(insn, fallthrough);
                if (control != null) {
                    finishBlock(control);
                    return;
                }
            }
            offset = block.getOffset();
            finishBlock(fallthrough == null ? Control.exit() : Control.fallthrough(fallthrough));
        }

        @Nullable
        Control liftInsn(Instruction insn, @Nullable BasicBlock fallthrough) {
            OpCode op = insn.getOpCode();
            switch (op) {
                case NOP:
                    return null;
                case LDARG:
                    push(loadArg(insn.getIntOperand()));
                    return null;
                case STARG: {
                    StackValue arg = loadArg(insn.getIntOperand());
                    emitAssign(arg.expr, coerce(pop(), arg.type));
                    return null;
                }
                case LDLOC: {
                    LocalVariable local = local(insn.getIntOperand());
                    push(new IdentifierExpression(local.getName()), local.getType());
                    return null;
                }
                case STLOC: {
                    LocalVariable local = local(insn.getIntOperand());
                    emitAssign(new IdentifierExpression(local.getName()), coerce(pop(), local.getType()));
                    return null;
                }
                case LDC_I4:
                    push(new PrimitiveExpression(insn.getIntOperand()), TypeRef.INT32);
                    return null;
                case LDC_I8:
                    push(new PrimitiveExpression(((Number) insn.getOperand()).longValue()), TypeRef.INT64);
                    return null;
                case LDC_R8:
                    push(new PrimitiveExpression(((Number) insn.getOperand()).doubleValue()), TypeRef.DOUBLE);
                    return null;
                case LDSTR:
                    push(new PrimitiveExpression(insn.getOperand()), TypeRef.STRING);
                    return null;
                case LDNULL:
                    push(PrimitiveExpression.NULL, TypeRef.OBJECT);
                    return null;
                case LDFLD: {
                    Symbol field = resolve(insn);
                    Expression target = pop().expr;
                    push(new MemberReferenceExpression(target, field), field.getType());
                    return null;
                }
                case STFLD: {
                    Symbol field = resolve(insn);
                    StackValue value = pop();
                    Expression target = pop().expr;
                    emitAssign(new MemberReferenceExpression(target, field), coerce(value, field.getType()));
                    return null;
                }
                case LDSFLD: {
                    Symbol field = resolve(insn);
                    push(new MemberReferenceExpression(staticTarget(field), field), field.getType());
                    return null;
                }
                case STSFLD: {
                    Symbol field = resolve(insn);
                    emitAssign(new MemberReferenceExpression(staticTarget(field), field), coerce(pop(), field.getType()));
                    return null;
                }
                case LDELEM: {
                    Expression index = pop().expr;
                    Expression array = pop().expr;
                    push(new IndexerExpression(array, index), TypeRef.OBJECT);
                    return null;
                }
                case STELEM: {
                    Expression value = pop().expr;
                    Expression index = pop().expr;
                    Expression array = pop().expr;
                    emitAssign(new IndexerExpression(array, index), value);
                    return null;
                }
                case LDLEN: {
                    Expression array = pop().expr;
                    push(new MemberReferenceExpression(array,
                            Symbol.field(0, ARRAY, "Length", TypeRef.INT32, false)), TypeRef.INT32);
                    return null;
                }
                case CALL:
                    liftCall(resolve(insn), false);
                    return null;
                case CALLVIRT:
                    liftCall(resolve(insn), true);
                    return null;
                case NEWOBJ: {
                    Symbol ctor = resolve(insn);
                    List<Expression> args = popArgs(ctor);
                    TypeRef type = ctor.getDeclaringType() == null ? TypeRef.OBJECT : ctor.getDeclaringType();
                    push(new ObjectCreateExpression(ctor, args), type);
                    return null;
                }
                case ADD:
                    binary(BinaryOperatorType.ADD);
                    return null;
                case SUB:
                    binary(BinaryOperatorType.SUBTRACT);
                    return null;
                case MUL:
                    binary(BinaryOperatorType.MULTIPLY);
                    return null;
                case DIV:
                    binary(BinaryOperatorType.DIVIDE);
                    return null;
                case REM:
                    binary(BinaryOperatorType.MODULUS);
                    return null;
                case AND:
                    binary(BinaryOperatorType.BITWISE_AND);
                    return null;
                case OR:
                    binary(BinaryOperatorType.BITWISE_OR);
                    return null;
                case XOR:
                    binary(BinaryOperatorType.EXCLUSIVE_OR);
                    return null;
                case SHL:
                    binary(BinaryOperatorType.SHIFT_LEFT);
                    return null;
                case SHR:
                    binary(BinaryOperatorType.SHIFT_RIGHT);
                    return null;
                case NEG: {
                    StackValue value = pop();
                    push(new UnaryOperatorExpression(UnaryOperatorType.MINUS, value.expr), value.type);
                    return null;
                }
                case NOT: {
                    StackValue value = pop();
                    push(new UnaryOperatorExpression(UnaryOperatorType.BITWISE_NOT, value.expr), value.type);
                    return null;
                }
                case CEQ: {
                    StackValue right = pop();
                    StackValue left = pop();
                    push(equality(left, right, true), TypeRef.BOOLEAN);
                    return null;
                }
                case CGT: {
                    StackValue right = pop();
                    StackValue left = pop();
                    if (PrimitiveExpression.isNull(right.expr)) {
                        // cgt.un against null is the usual null check
                        push(equality(left, right, false), TypeRef.BOOLEAN);
                    } else {
                        push(new BinaryOperatorExpression(left.expr, BinaryOperatorType.GREATER_THAN, right.expr), TypeRef.BOOLEAN);
                    }
                    return null;
                }
                case CLT: {
                    StackValue right = pop();
                    StackValue left = pop();
                    push(new BinaryOperatorExpression(left.expr, BinaryOperatorType.LESS_THAN, right.expr), TypeRef.BOOLEAN);
                    return null;
                }
                case CASTCLASS:
                case CONV:
                case UNBOX_ANY: {
                    TypeRef type = resolve(insn).getType();
                    push(new CastExpression(type, pop().expr), type);
                    return null;
                }
                case BOX:
                    resolve(insn);
                    return null;
                case DUP: {
                    StackValue value = pop();
                    if (!isSimple(value.expr)) {
                        value = spill(stack.size(), value);
                    }
                    push(value);
                    push(value);
                    return null;
                }
                case POP: {
                    StackValue value = pop();
                    if (hasSideEffects(value.expr)) {
                        emit(new ExpressionStatement(value.expr));
                    }
                    return null;
                }
                case BR:
                    return Control.jump(target(insn.getIntOperand()));
                case BRTRUE:
                case BRFALSE: {
                    StackValue value = pop();
                    Expression condition = op == OpCode.BRTRUE ? truthy(value) : falsy(value);
                    return Control.conditional(condition, target(insn.getIntOperand()), next(insn, fallthrough));
                }
                case BEQ:
                case BNE_UN: {
                    StackValue right = pop();
                    StackValue left = pop();
                    return Control.conditional(equality(left, right, op == OpCode.BEQ),
                            target(insn.getIntOperand()), next(insn, fallthrough));
                }
                case BLT:
                case BGT:
                case BLE:
                case BGE: {
                    StackValue right = pop();
                    StackValue left = pop();
                    BinaryOperatorType cmp = op == OpCode.BLT ? BinaryOperatorType.LESS_THAN
                            : op == OpCode.BGT ? BinaryOperatorType.GREATER_THAN
                            : op == OpCode.BLE ? BinaryOperatorType.LESS_THAN_OR_EQUAL
                            : BinaryOperatorType.GREATER_THAN_OR_EQUAL;
                    return Control.conditional(new BinaryOperatorExpression(left.expr, cmp, right.expr),
                            target(insn.getIntOperand()), next(insn, fallthrough));
                }
                case SWITCH: {
                    Expression value = pop().expr;
                    List<BasicBlock> table = new ArrayList<>();
                    for (int target : insn.getSwitchTargets()) {
                        table.add(target(target));
                    }
                    return Control.jumpTable(value, table, next(insn, fallthrough));
                }
                case RET:
                    if (method.returnsVoid()) return Control.ret(null);
                    return Control.ret(coerce(pop(), method.getType()));
                case THROW:
                    return Control.doThrow(pop().expr);
                case RETHROW:
                    return Control.doThrow(null);
                case LEAVE:
                    // leave empties the evaluation stack
                    stack.clear();
                    return Control.leave(target(insn.getIntOperand()));
                case ENDFINALLY:
                    stack.clear();
                    return Control.endFinally();
                default:
                    throw new IllegalStateException("unknown opcode " + op);
            }
        }

        void liftCall(Symbol callee, boolean virtual) {
            List<Expression> args = popArgs(callee);
            Expression target = callee.isStatic() ? staticTarget(callee) : pop().expr;
            if (!virtual && target.getKind() == Expression.Kind.THIS_REFERENCE
                    && callee.getDeclaringType() != null
                    && !callee.getDeclaringType().equals(method.getDeclaringType())) {
                // non-virtual call on this into a base type
                target = BaseReferenceExpression.INSTANCE;
            }
            String name = callee.getName();
            TypeRef declaring = callee.getDeclaringType() == null ? TypeRef.OBJECT : callee.getDeclaringType();
            if (name.startsWith("get_") && args.isEmpty() && !callee.returnsVoid()) {
                Symbol property = Symbol.field(callee.getToken(), declaring, name.substring(4), callee.getType(), callee.isStatic());
                push(new MemberReferenceExpression(target, property), callee.getType());
            } else if (name.startsWith("set_") && args.size() == 1 && callee.returnsVoid()) {
                Symbol property = Symbol.field(callee.getToken(), declaring, name.substring(4),
                        callee.getParameterTypes().get(0), callee.isStatic());
                emitAssign(new MemberReferenceExpression(target, property), args.get(0));
            } else {
                InvocationExpression invocation = new InvocationExpression(target, callee, args);
                if (callee.returnsVoid()) {
                    emit(new ExpressionStatement(invocation));
                } else {
                    push(invocation, callee.getType());
                }
            }
        }

        List<Expression> popArgs(Symbol callee) {
            List<TypeRef> parameterTypes = callee.getParameterTypes();
            Expression[] args = new Expression[parameterTypes.size()];
            for (int i = args.length - 1; i >= 0; i--) {
                args[i] = coerce(pop(), parameterTypes.get(i));
            }
            List<Expression> ls = new ArrayList<>(args.length);
            Collections.addAll(ls, args);
            return ls;
        }

        void binary(BinaryOperatorType op) {
            StackValue right = pop();
            StackValue left = pop();
            push(new BinaryOperatorExpression(left.expr, op, right.expr), left.type);
        }

        // values

        StackValue loadArg(int index) {
            if (!method.isStatic()) {
                if (index == 0) {
                    TypeRef type = method.getDeclaringType() == null ? TypeRef.OBJECT : method.getDeclaringType();
                    return new StackValue(ThisReferenceExpression.INSTANCE, type);
                }
                index--;
            }
            List<String> names = method.getParameterNames();
            if (index < 0 || index >= names.size()) {
                throw invalid("argument " + index + " out of range at " + Instruction.formatOffset(offset));
            }
            return new StackValue(new IdentifierExpression(names.get(index)), method.getParameterTypes().get(index));
        }

        LocalVariable local(int index) {
            LocalVariable local = locals.get(index);
            if (local == null) {
                throw invalid("local " + index + " out of range at " + Instruction.formatOffset(offset));
            }
            return local;
        }

        Symbol resolve(Instruction insn) {
            return metadata.resolveSymbol(insn.getIntOperand());
        }

        Expression staticTarget(Symbol member) {
            TypeRef declaring = member.getDeclaringType();
            return new TypeReferenceExpression(declaring == null ? TypeRef.OBJECT : declaring);
        }

        boolean isBoolean(TypeRef type) {
            return types.isKnownType(type, KnownType.BOOLEAN);
        }

        boolean isIntegral(TypeRef type) {
            KnownType known = KnownType.byFullName(type.getFullName());
            return known != null && known.isIntegral();
        }

        /**
         * Convert integer literals to booleans where a boolean is expected.
         */
        Expression coerce(StackValue value, TypeRef type) {
            if (isBoolean(type) && !isBoolean(value.type)) {
                if (PrimitiveExpression.isInteger(value.expr, 0)) return PrimitiveExpression.FALSE;
                if (PrimitiveExpression.isInteger(value.expr, 1)) return PrimitiveExpression.TRUE;
            }
            return value.expr;
        }

        Expression truthy(StackValue value) {
            if (isBoolean(value.type)) return value.expr;
            if (isIntegral(value.type)) {
                return new BinaryOperatorExpression(value.expr, BinaryOperatorType.INEQUALITY, PrimitiveExpression.of(0));
            }
            return new BinaryOperatorExpression(value.expr, BinaryOperatorType.INEQUALITY, PrimitiveExpression.NULL);
        }

        Expression falsy(StackValue value) {
            if (isBoolean(value.type)) return Conditions.not(value.expr);
            if (isIntegral(value.type)) {
                return new BinaryOperatorExpression(value.expr, BinaryOperatorType.EQUALITY, PrimitiveExpression.of(0));
            }
            return new BinaryOperatorExpression(value.expr, BinaryOperatorType.EQUALITY, PrimitiveExpression.NULL);
        }

        Expression equality(StackValue left, StackValue right, boolean equal) {
            if (isBoolean(left.type) && (PrimitiveExpression.isInteger(right.expr, 0)
                    || Boolean.FALSE.equals(valueOf(right.expr)))) {
                return equal ? Conditions.not(left.expr) : left.expr;
            }
            return new BinaryOperatorExpression(left.expr,
                    equal ? BinaryOperatorType.EQUALITY : BinaryOperatorType.INEQUALITY,
                    right.expr);
        }

        @Nullable
        static Object valueOf(Expression expr) {
            return expr.getKind() == Expression.Kind.PRIMITIVE ? ((PrimitiveExpression) expr).getValue() : null;
        }

        static boolean isSimple(Expression expr) {
            switch (expr.getKind()) {
                case PRIMITIVE:
                case THIS_REFERENCE:
                case IDENTIFIER:
                    return true;
                default:
                    return false;
            }
        }

        static boolean hasSideEffects(Expression expr) {
            return AstQueries.anySubExpression(expr, it -> {
                switch (it.getKind()) {
                    case INVOCATION:
                    case OBJECT_CREATE:
                    case ASSIGNMENT:
                        return true;
                    default:
                        return false;
                }
            });
        }

        // stack

        void push(Expression expr, TypeRef type) {
            stack.add(new StackValue(expr, type));
        }

        void push(StackValue value) {
            stack.add(value);
        }

        StackValue pop() {
            if (stack.isEmpty()) {
                throw invalid("stack underflow at " + Instruction.formatOffset(offset));
            }
            return stack.remove(stack.size() - 1);
        }

        static String stackVar(int depth) {
            return "stack_" + depth;
        }

        /**
         * Store a value into the local for its stack depth.
         *
         * @param depth The depth the value would have on the stack.
         * @param value The value.
         * @return The value of the local.
         */
        StackValue spill(int depth, StackValue value) {
            String name = stackVar(depth);
            declareStackVar(name, value.type);
            addStatement(new ExpressionStatement(new AssignmentExpression(new IdentifierExpression(name), value.expr)));
            return new StackValue(new IdentifierExpression(name), value.type);
        }

        void declareStackVar(String name, TypeRef type) {
            if (graph.getLocalType(name) == null) {
                graph.declareLocal(name, type);
            } else {
                graph.widenLocal(name, type);
            }
        }

        /**
         * Spill every pending value whose evaluation could be affected by the statement,
         * so values are evaluated in the order the instructions compute them.
         */
        void flushFor(Statement stmt) {
            Set<String> written = writtenNames(stmt);
            for (int depth = 0; depth < stack.size(); depth++) {
                StackValue value = stack.get(depth);
                Expression expr = value.expr;
                boolean flush;
                if (expr.getKind() == Expression.Kind.IDENTIFIER) {
                    flush = written.contains(((IdentifierExpression) expr).getName());
                } else {
                    flush = !isSimple(expr);
                }
                if (flush) {
                    stack.set(depth, spill(depth, value));
                }
            }
        }

        static Set<String> writtenNames(Statement stmt) {
            Set<String> written = new HashSet<>();
            if (stmt.getKind() == Statement.Kind.EXPRESSION) {
                AstQueries.anySubExpression(((ExpressionStatement) stmt).getExpression(), it -> {
                    if (it.getKind() == Expression.Kind.ASSIGNMENT) {
                        Expression left = ((AssignmentExpression) it).getLeft();
                        if (left.getKind() == Expression.Kind.IDENTIFIER) {
                            written.add(((IdentifierExpression) left).getName());
                        }
                    }
                    return false;
                });
            }
            return written;
        }

        void emitAssign(Expression left, Expression right) {
            emit(new ExpressionStatement(new AssignmentExpression(left, right)));
        }

        void emit(Statement stmt) {
            flushFor(stmt);
            addStatement(stmt);
        }

        void addStatement(Statement stmt) {
            graph.getAnnotations().put(stmt, Annotations.IL_OFFSET, offset);
            block.getStatements().add(stmt);
        }

        // control

        BasicBlock target(int target) {
            BasicBlock targetBlock = blocksByOffset.get(target);
            if (targetBlock == null) {
                throw invalid("no block at " + Instruction.formatOffset(target));
            }
            return targetBlock;
        }

        BasicBlock next(Instruction insn, @Nullable BasicBlock fallthrough) {
            if (fallthrough == null) {
                throw invalid(insn + " falls off the end of the method");
            }
            return fallthrough;
        }

        /**
         * Spill the remaining stack for the successors, and end the block.
         */
        void finishBlock(Control control) {
            List<String> reassigned = new ArrayList<>();
            for (int depth = 0; depth < stack.size(); depth++) {
                if (!IdentifierExpression.isNamed(stack.get(depth).expr, stackVar(depth))) {
                    reassigned.add(stackVar(depth));
                }
            }

            Expression value = control.getValue();
            boolean hazard = value != null && mentionsAny(value, reassigned);
            for (int depth = 0; depth < stack.size() && !hazard; depth++) {
                for (int later = depth + 1; later < stack.size(); later++) {
                    if (mentionsAny(stack.get(later).expr, Collections.singletonList(stackVar(depth)))) {
                        hazard = true;
                        break;
                    }
                }
            }

            if (hazard) {
                // evaluate everything into temporaries before any stack local is overwritten
                List<StackValue> temps = new ArrayList<>();
                for (StackValue stackValue : stack) {
                    temps.add(toTemp(stackValue));
                }
                if (value != null) {
                    control.setValue(toTemp(new StackValue(value, TypeRef.OBJECT)).expr);
                }
                stack = temps;
            }
            for (int depth = 0; depth < stack.size(); depth++) {
                StackValue stackValue = stack.get(depth);
                if (!IdentifierExpression.isNamed(stackValue.expr, stackVar(depth))) {
                    spill(depth, stackValue);
                } else {
                    declareStackVar(stackVar(depth), stackValue.type);
                }
            }

            List<TypeRef> exitTypes = new ArrayList<>();
            for (StackValue stackValue : stack) {
                exitTypes.add(stackValue.type);
            }
            for (BasicBlock target : control.targets) {
                List<TypeRef> existing = entryStacks.get(target);
                if (existing == null) {
                    entryStacks.put(target, exitTypes);
                } else if (existing.size() != exitTypes.size()) {
                    throw invalid("stack height mismatch at " + target.getLabel()
                            + ": " + existing.size() + " and " + exitTypes.size());
                }
            }
            block.setControl(control);
        }

        StackValue toTemp(StackValue value) {
            if (isSimple(value.expr) && !isStackVar(value.expr)) return value;
            String name = graph.newSyntheticLocal("tmp", value.type);
            addStatement(new ExpressionStatement(new AssignmentExpression(new IdentifierExpression(name), value.expr)));
            return new StackValue(new IdentifierExpression(name), value.type);
        }

        static boolean isStackVar(Expression expr) {
            return expr.getKind() == Expression.Kind.IDENTIFIER
                    && ((IdentifierExpression) expr).getName().startsWith("stack_");
        }

        static boolean mentionsAny(Expression expr, List<String> names) {
            if (names.isEmpty()) return false;
            return AstQueries.anySubExpression(expr, it -> it.getKind() == Expression.Kind.IDENTIFIER
                    && names.contains(((IdentifierExpression) it).getName()));
        }
    }
}
