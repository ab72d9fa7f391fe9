package io.github.eutro.cil2ast.api;

import java.util.List;

/**
 * Read-only access to the metadata of a loaded assembly.
 * <p>
 * Implementations must tolerate concurrent calls, since methods are decompiled in parallel.
 */
public interface MetadataSource {
    /**
     * Get the symbol of a method definition, supplying its parameters and return type.
     *
     * @param method The method.
     * @return The method symbol.
     */
    Symbol getMethod(MethodId method);

    /**
     * Get the flat body of a method.
     *
     * @param method The method.
     * @return The instructions and locals of the body.
     */
    InstructionStream getMethodBody(MethodId method);

    /**
     * Get the exception handling clauses of a method body, innermost first.
     *
     * @param method The method.
     * @return The regions.
     */
    List<ExceptionRegion> getExceptionRegions(MethodId method);

    /**
     * Resolve a metadata token.
     *
     * @param token The token.
     * @return The symbol.
     * @throws DecompilationException with {@link ErrorKind#INVALID_CONTROL_FLOW} if the token is invalid.
     */
    Symbol resolveSymbol(int token);
}
