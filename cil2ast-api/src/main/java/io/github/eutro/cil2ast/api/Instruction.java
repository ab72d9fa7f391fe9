package io.github.eutro.cil2ast.api;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * A single CIL instruction at a given IL offset.
 */
public final class Instruction {
    private final int offset;
    private final OpCode opCode;
    @Nullable
    private final Object operand;

    /**
     * Construct an instruction.
     *
     * @param offset  The IL offset of the instruction.
     * @param opCode  The opcode.
     * @param operand The operand, whose type must match {@link OpCode#getOperandType()}.
     */
    public Instruction(int offset, OpCode opCode, @Nullable Object operand) {
        this.offset = offset;
        this.opCode = opCode;
        this.operand = operand;
    }

    public int getOffset() {
        return offset;
    }

    public OpCode getOpCode() {
        return opCode;
    }

    public @Nullable Object getOperand() {
        return operand;
    }

    /**
     * Get the operand as an int, for variable indices, tokens, 32-bit constants and branch targets.
     *
     * @return The operand.
     */
    public int getIntOperand() {
        return ((Number) operandOrThrow()).intValue();
    }

    /**
     * Get the jump table of a {@link OpCode#SWITCH} instruction.
     *
     * @return The target offsets.
     */
    public int[] getSwitchTargets() {
        return (int[]) operandOrThrow();
    }

    private Object operandOrThrow() {
        if (operand == null) {
            throw new IllegalStateException(opCode.getMnemonic() + " at " + formatOffset(offset) + " has no operand");
        }
        return operand;
    }

    /**
     * Format an IL offset the usual way.
     *
     * @param offset The offset.
     * @return The formatted offset, e.g. {@code IL_001a}.
     */
    public static String formatOffset(int offset) {
        return String.format("IL_%04x", offset);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(formatOffset(offset)).append(": ").append(opCode.getMnemonic());
        if (operand != null) {
            sb.append(' ');
            switch (opCode.getOperandType()) {
                case BRANCH_TARGET:
                    sb.append(formatOffset(getIntOperand()));
                    break;
                case SWITCH_TABLE:
                    int[] targets = getSwitchTargets();
                    String[] formatted = new String[targets.length];
                    for (int i = 0; i < targets.length; i++) {
                        formatted[i] = formatOffset(targets[i]);
                    }
                    sb.append(Arrays.toString(formatted));
                    break;
                case STRING:
                    sb.append('"').append(operand).append('"');
                    break;
                case TOKEN:
                    sb.append(String.format("%08x", getIntOperand()));
                    break;
                default:
                    sb.append(operand);
            }
        }
        return sb.toString();
    }
}
