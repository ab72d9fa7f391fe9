package io.github.eutro.cil2ast.api;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Types that the decompiler core needs to recognise by identity.
 */
public enum KnownType {
    VOID("System.Void", "void"),
    BOOLEAN("System.Boolean", "bool"),
    CHAR("System.Char", "char"),
    SBYTE("System.SByte", "sbyte"),
    BYTE("System.Byte", "byte"),
    INT16("System.Int16", "short"),
    UINT16("System.UInt16", "ushort"),
    INT32("System.Int32", "int"),
    UINT32("System.UInt32", "uint"),
    INT64("System.Int64", "long"),
    UINT64("System.UInt64", "ulong"),
    SINGLE("System.Single", "float"),
    DOUBLE("System.Double", "double"),
    DECIMAL("System.Decimal", "decimal"),
    STRING("System.String", "string"),
    OBJECT("System.Object", "object"),
    NULLABLE("System.Nullable`1", null),
    /**
     * The compiler-generated class holding {@code ComputeStringHash}.
     */
    PRIVATE_IMPLEMENTATION_DETAILS("<PrivateImplementationDetails>", null),
    ;

    private static final Map<String, KnownType> BY_NAME = new HashMap<>();

    static {
        for (KnownType type : values()) {
            BY_NAME.put(type.fullName, type);
        }
    }

    private final String fullName;
    @Nullable
    private final String keyword;

    KnownType(String fullName, @Nullable String keyword) {
        this.fullName = fullName;
        this.keyword = keyword;
    }

    public String getFullName() {
        return fullName;
    }

    /**
     * Get the C# keyword for this type, if it has one.
     *
     * @return The keyword, or null.
     */
    public @Nullable String getKeyword() {
        return keyword;
    }

    /**
     * Whether values of this type are integers that a switch can dispatch on.
     *
     * @return Whether this is an integral type.
     */
    public boolean isIntegral() {
        switch (this) {
            case BOOLEAN:
            case CHAR:
            case SBYTE:
            case BYTE:
            case INT16:
            case UINT16:
            case INT32:
            case UINT32:
            case INT64:
            case UINT64:
                return true;
            default:
                return false;
        }
    }

    /**
     * Look up a known type by full name.
     *
     * @param fullName The full name.
     * @return The known type, or null if the name is not known.
     */
    public static @Nullable KnownType byFullName(String fullName) {
        return BY_NAME.get(fullName);
    }
}
