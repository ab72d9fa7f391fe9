package io.github.eutro.cil2ast;

import io.github.eutro.cil2ast.api.ExceptionRegion;
import io.github.eutro.cil2ast.api.Instruction;
import io.github.eutro.cil2ast.api.InstructionStream;
import io.github.eutro.cil2ast.api.LocalVariable;
import io.github.eutro.cil2ast.api.OpCode;
import io.github.eutro.cil2ast.api.TypeRef;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles method bodies for tests. Each instruction is one byte long, so offsets are instruction indices.
 * Branch targets are named labels, resolved when the body is built.
 */
public final class IlBuilder {
    private final List<OpCode> ops = new ArrayList<>();
    private final List<Object> operands = new ArrayList<>();
    private final Map<String, Integer> labels = new HashMap<>();
    private final List<LocalVariable> locals = new ArrayList<>();
    private final List<String[]> regionLabels = new ArrayList<>();
    private final List<ExceptionRegion.Kind> regionKinds = new ArrayList<>();
    private final List<TypeRef> regionTypes = new ArrayList<>();

    public IlBuilder local(String name, TypeRef type) {
        locals.add(new LocalVariable(locals.size(), name, type));
        return this;
    }

    /**
     * Name the offset of the next instruction.
     */
    public IlBuilder label(String name) {
        if (labels.put(name, ops.size()) != null) throw new IllegalArgumentException("duplicate label " + name);
        return this;
    }

    public IlBuilder op(OpCode op) {
        return op(op, null);
    }

    public IlBuilder op(OpCode op, @Nullable Object operand) {
        ops.add(op);
        operands.add(operand);
        return this;
    }

    public IlBuilder ldarg(int index) {
        return op(OpCode.LDARG, index);
    }

    public IlBuilder ldloc(int index) {
        return op(OpCode.LDLOC, index);
    }

    public IlBuilder stloc(int index) {
        return op(OpCode.STLOC, index);
    }

    public IlBuilder ldc(int value) {
        return op(OpCode.LDC_I4, value);
    }

    public IlBuilder ldstr(String value) {
        return op(OpCode.LDSTR, value);
    }

    public IlBuilder call(int token) {
        return op(OpCode.CALL, token);
    }

    public IlBuilder branch(OpCode op, String label) {
        return op(op, new LabelRef(label));
    }

    public IlBuilder switchTo(String... targets) {
        return op(OpCode.SWITCH, targets);
    }

    public IlBuilder ret() {
        return op(OpCode.RET);
    }

    /**
     * Add an exception region bounded by labels. An end label may name the end of the method.
     */
    public IlBuilder region(ExceptionRegion.Kind kind,
                            String tryStart, String tryEnd,
                            String handlerStart, String handlerEnd,
                            @Nullable TypeRef catchType) {
        regionKinds.add(kind);
        regionLabels.add(new String[]{tryStart, tryEnd, handlerStart, handlerEnd});
        regionTypes.add(catchType);
        return this;
    }

    public InstructionStream build() {
        List<Instruction> insns = new ArrayList<>();
        for (int i = 0; i < ops.size(); i++) {
            Object operand = operands.get(i);
            if (operand instanceof LabelRef) {
                operand = resolve(((LabelRef) operand).name);
            } else if (operand instanceof String[]) {
                String[] names = (String[]) operand;
                int[] targets = new int[names.length];
                for (int j = 0; j < names.length; j++) {
                    targets[j] = resolve(names[j]);
                }
                operand = targets;
            }
            insns.add(new Instruction(i, ops.get(i), operand));
        }
        return new InstructionStream(insns, locals);
    }

    public List<ExceptionRegion> regions() {
        List<ExceptionRegion> regions = new ArrayList<>();
        for (int i = 0; i < regionKinds.size(); i++) {
            String[] names = regionLabels.get(i);
            regions.add(new ExceptionRegion(regionKinds.get(i),
                    resolve(names[0]), resolve(names[1]),
                    resolve(names[2]), resolve(names[3]),
                    regionTypes.get(i)));
        }
        return regions;
    }

    private int resolve(String label) {
        Integer offset = labels.get(label);
        if (offset == null) throw new IllegalArgumentException("undefined label " + label);
        return offset;
    }

    private static final class LabelRef {
        final String name;

        LabelRef(String name) {
            this.name = name;
        }
    }
}
