package io.github.eutro.cil2ast.ast;

import org.jetbrains.annotations.Nullable;

public enum UnaryOperatorType {
    NOT("!", "op_LogicalNot", false),
    BITWISE_NOT("~", "op_OnesComplement", false),
    MINUS("-", "op_UnaryNegation", false),
    PLUS("+", "op_UnaryPlus", false),
    INCREMENT("++", "op_Increment", false),
    DECREMENT("--", "op_Decrement", false),
    POST_INCREMENT("++", null, true),
    POST_DECREMENT("--", null, true),
    ;

    private final String token;
    @Nullable
    private final String operatorMethodName;
    private final boolean postfix;

    UnaryOperatorType(String token, @Nullable String operatorMethodName, boolean postfix) {
        this.token = token;
        this.operatorMethodName = operatorMethodName;
        this.postfix = postfix;
    }

    public String getToken() {
        return token;
    }

    public @Nullable String getOperatorMethodName() {
        return operatorMethodName;
    }

    public boolean isPostfix() {
        return postfix;
    }

    public static @Nullable UnaryOperatorType byOperatorMethodName(String methodName) {
        for (UnaryOperatorType type : values()) {
            if (methodName.equals(type.operatorMethodName)) return type;
        }
        return null;
    }
}
