package io.github.eutro.cil2ast.api;

/**
 * The CIL opcodes understood by the graph builder.
 * <p>
 * Short and long branch forms, and the typed variants of loads, stores and conversions,
 * are folded into one opcode each; the metadata layer is expected to normalise them.
 */
public enum OpCode {
    NOP("nop", OperandType.NONE, FlowControl.NEXT),
    LDARG("ldarg", OperandType.VARIABLE, FlowControl.NEXT),
    STARG("starg", OperandType.VARIABLE, FlowControl.NEXT),
    LDLOC("ldloc", OperandType.VARIABLE, FlowControl.NEXT),
    STLOC("stloc", OperandType.VARIABLE, FlowControl.NEXT),
    LDC_I4("ldc.i4", OperandType.INT32, FlowControl.NEXT),
    LDC_I8("ldc.i8", OperandType.INT64, FlowControl.NEXT),
    LDC_R8("ldc.r8", OperandType.FLOAT64, FlowControl.NEXT),
    LDSTR("ldstr", OperandType.STRING, FlowControl.NEXT),
    LDNULL("ldnull", OperandType.NONE, FlowControl.NEXT),
    LDFLD("ldfld", OperandType.TOKEN, FlowControl.NEXT),
    STFLD("stfld", OperandType.TOKEN, FlowControl.NEXT),
    LDSFLD("ldsfld", OperandType.TOKEN, FlowControl.NEXT),
    STSFLD("stsfld", OperandType.TOKEN, FlowControl.NEXT),
    LDELEM("ldelem", OperandType.NONE, FlowControl.NEXT),
    STELEM("stelem", OperandType.NONE, FlowControl.NEXT),
    LDLEN("ldlen", OperandType.NONE, FlowControl.NEXT),
    CALL("call", OperandType.TOKEN, FlowControl.NEXT),
    CALLVIRT("callvirt", OperandType.TOKEN, FlowControl.NEXT),
    NEWOBJ("newobj", OperandType.TOKEN, FlowControl.NEXT),
    ADD("add", OperandType.NONE, FlowControl.NEXT),
    SUB("sub", OperandType.NONE, FlowControl.NEXT),
    MUL("mul", OperandType.NONE, FlowControl.NEXT),
    DIV("div", OperandType.NONE, FlowControl.NEXT),
    REM("rem", OperandType.NONE, FlowControl.NEXT),
    AND("and", OperandType.NONE, FlowControl.NEXT),
    OR("or", OperandType.NONE, FlowControl.NEXT),
    XOR("xor", OperandType.NONE, FlowControl.NEXT),
    SHL("shl", OperandType.NONE, FlowControl.NEXT),
    SHR("shr", OperandType.NONE, FlowControl.NEXT),
    NEG("neg", OperandType.NONE, FlowControl.NEXT),
    NOT("not", OperandType.NONE, FlowControl.NEXT),
    CEQ("ceq", OperandType.NONE, FlowControl.NEXT),
    CGT("cgt", OperandType.NONE, FlowControl.NEXT),
    CLT("clt", OperandType.NONE, FlowControl.NEXT),
    CASTCLASS("castclass", OperandType.TOKEN, FlowControl.NEXT),
    CONV("conv", OperandType.TOKEN, FlowControl.NEXT),
    BOX("box", OperandType.TOKEN, FlowControl.NEXT),
    UNBOX_ANY("unbox.any", OperandType.TOKEN, FlowControl.NEXT),
    DUP("dup", OperandType.NONE, FlowControl.NEXT),
    POP("pop", OperandType.NONE, FlowControl.NEXT),
    BR("br", OperandType.BRANCH_TARGET, FlowControl.BRANCH),
    BRTRUE("brtrue", OperandType.BRANCH_TARGET, FlowControl.COND_BRANCH),
    BRFALSE("brfalse", OperandType.BRANCH_TARGET, FlowControl.COND_BRANCH),
    BEQ("beq", OperandType.BRANCH_TARGET, FlowControl.COND_BRANCH),
    BNE_UN("bne.un", OperandType.BRANCH_TARGET, FlowControl.COND_BRANCH),
    BLT("blt", OperandType.BRANCH_TARGET, FlowControl.COND_BRANCH),
    BGT("bgt", OperandType.BRANCH_TARGET, FlowControl.COND_BRANCH),
    BLE("ble", OperandType.BRANCH_TARGET, FlowControl.COND_BRANCH),
    BGE("bge", OperandType.BRANCH_TARGET, FlowControl.COND_BRANCH),
    SWITCH("switch", OperandType.SWITCH_TABLE, FlowControl.SWITCH),
    RET("ret", OperandType.NONE, FlowControl.RETURN),
    THROW("throw", OperandType.NONE, FlowControl.THROW),
    RETHROW("rethrow", OperandType.NONE, FlowControl.THROW),
    LEAVE("leave", OperandType.BRANCH_TARGET, FlowControl.LEAVE),
    ENDFINALLY("endfinally", OperandType.NONE, FlowControl.END_FINALLY);

    /**
     * The kind of operand an opcode takes.
     */
    public enum OperandType {
        NONE,
        INT32,
        INT64,
        FLOAT64,
        STRING,
        /**
         * A metadata token, resolved through {@link MetadataSource#resolveSymbol(int)}.
         */
        TOKEN,
        /**
         * A local or argument index.
         */
        VARIABLE,
        /**
         * An IL offset.
         */
        BRANCH_TARGET,
        /**
         * An array of IL offsets.
         */
        SWITCH_TABLE,
    }

    /**
     * How an opcode affects control flow.
     */
    public enum FlowControl {
        NEXT,
        BRANCH,
        COND_BRANCH,
        SWITCH,
        RETURN,
        THROW,
        LEAVE,
        END_FINALLY;

        /**
         * Whether an instruction with this flow control ends a basic block.
         *
         * @return Whether it ends a block.
         */
        public boolean endsBlock() {
            return this != NEXT;
        }
    }

    private final String mnemonic;
    private final OperandType operandType;
    private final FlowControl flowControl;

    OpCode(String mnemonic, OperandType operandType, FlowControl flowControl) {
        this.mnemonic = mnemonic;
        this.operandType = operandType;
        this.flowControl = flowControl;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    public OperandType getOperandType() {
        return operandType;
    }

    public FlowControl getFlowControl() {
        return flowControl;
    }
}
