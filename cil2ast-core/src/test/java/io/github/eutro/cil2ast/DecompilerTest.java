package io.github.eutro.cil2ast;

import io.github.eutro.cil2ast.api.CancellationToken;
import io.github.eutro.cil2ast.api.DecompilerSettings;
import io.github.eutro.cil2ast.api.ErrorKind;
import io.github.eutro.cil2ast.api.MethodId;
import io.github.eutro.cil2ast.api.OpCode;
import io.github.eutro.cil2ast.api.TypeRef;
import io.github.eutro.cil2ast.ast.AstPrinter;
import io.github.eutro.cil2ast.ast.BlockStatement;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DecompilerTest {
    private final TestMetadata metadata = new TestMetadata();

    private MethodId identity() {
        return metadata.define("Identity", TypeRef.INT32, new IlBuilder().ldarg(0).ret(), "x", TypeRef.INT32);
    }

    private MethodId broken() {
        return metadata.define("Broken", TypeRef.VOID, new IlBuilder().op(OpCode.BR, 99).ret());
    }

    @Test
    void simpleMethod() {
        MethodResult result = metadata.decompile(identity());
        assertTrue(result.isSuccess());
        assertEquals("return x;", AstPrinter.print(result.getBody()));
        assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    void invalidBranchTargetFailsTheMethod() {
        MethodResult result = metadata.decompile(broken());
        assertFalse(result.isSuccess());
        assertNotNull(result.getFailure());
        assertEquals(ErrorKind.INVALID_CONTROL_FLOW, result.getFailure().getKind());
        assertTrue(AstPrinter.print(result.getBody()).startsWith("// decompilation failed: "));
    }

    @Test
    void decompileAllKeepsInputOrder() {
        List<MethodId> methods = Arrays.asList(identity(), broken(), identity());
        Map<MethodId, BlockStatement> emitted = new LinkedHashMap<>();
        Decompiler decompiler = new Decompiler(metadata.context(DecompilerSettings.DEFAULT));
        DecompilationReport report = decompiler.decompileAll(methods, emitted::put, Runnable::run, CancellationToken.NONE);

        assertEquals(3, report.getResults().size());
        List<MethodId> order = new ArrayList<>();
        for (MethodResult result : report.getResults()) order.add(result.getMethodId());
        assertEquals(methods, order);
        assertEquals(1, report.getFailures().size());
        assertEquals(2, report.getSuccesses().size());
        assertEquals(1, report.countFailures(ErrorKind.INVALID_CONTROL_FLOW));
        assertEquals(methods, new ArrayList<>(emitted.keySet()));
    }

    @Test
    void unexpectedExceptionFailsOnlyItsMethod() {
        MethodId missing = new MethodId(0x06FFFFFF, "Missing");
        MethodId present = identity();
        Map<MethodId, BlockStatement> emitted = new LinkedHashMap<>();
        Decompiler decompiler = new Decompiler(metadata.context(DecompilerSettings.DEFAULT));
        DecompilationReport report = decompiler.decompileAll(Arrays.asList(missing, present),
                emitted::put, Runnable::run, CancellationToken.NONE);

        assertEquals(2, report.getResults().size());
        MethodResult failed = report.getResults().get(0);
        assertFalse(failed.isSuccess());
        assertNotNull(failed.getFailure());
        assertEquals(ErrorKind.INVALID_CONTROL_FLOW, failed.getFailure().getKind());
        assertTrue(failed.getFailure().getCause() instanceof IllegalArgumentException);
        assertTrue(report.getResults().get(1).isSuccess());
        assertEquals(Arrays.asList(missing, present), new ArrayList<>(emitted.keySet()));
        assertEquals("return x;", AstPrinter.print(emitted.get(present)));
    }

    @Test
    void decompileAllInParallel() {
        List<MethodId> methods = new ArrayList<>();
        for (int i = 0; i < 32; i++) methods.add(identity());
        List<MethodId> emitted = new ArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            Decompiler decompiler = new Decompiler(metadata.context(DecompilerSettings.DEFAULT));
            DecompilationReport report = decompiler.decompileAll(methods,
                    (method, body) -> emitted.add(method), executor, CancellationToken.NONE);
            assertTrue(report.getFailures().isEmpty());
        } finally {
            executor.shutdown();
        }
        assertEquals(methods, emitted);
    }

    @Test
    void cancelledMethodsAreSkipped() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        List<MethodId> emitted = new ArrayList<>();
        Decompiler decompiler = new Decompiler(metadata.context(DecompilerSettings.DEFAULT));
        DecompilationReport report = decompiler.decompileAll(Arrays.asList(identity(), identity()),
                (method, body) -> emitted.add(method), Runnable::run, token);
        assertEquals(2, report.countFailures(ErrorKind.CANCELLED));
        assertTrue(emitted.isEmpty());
    }
}
