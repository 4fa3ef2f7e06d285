package com.deepansh.kernel.sandbox;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.capability.CapabilityMatcher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.EnvironmentAccess;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.ResourceLimits;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.io.IOAccess;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs untrusted JavaScript modules in a fresh, locked-down GraalJS context per call.
 *
 * Two meters run at the same time and independently of each other:
 * <ul>
 *   <li>a statement limit inside the engine, which traps a compute loop deterministically;</li>
 *   <li>a wall-clock bound enforced from the calling thread, which cancels the context and
 *       interrupts the worker even when the guest is parked inside a host call.</li>
 * </ul>
 * The calling thread also polls the worker's heap allocation while it waits, and the worker
 * checks it again at every host call and before returning. Crossing the ceiling cancels the
 * context and fails the run with MEMORY_EXCEEDED.
 * The context has no IO, threads, processes, native access or host class lookup. The only
 * host object is a {@link HostBridge}, wrapped by a frozen {@code kernel.call} helper.
 *
 * Every failure is reported as a {@link SandboxException} with a {@link SandboxErrorKind};
 * the context is closed on every path.
 */
@Component
@Slf4j
public class SandboxExecutor {

    private static final String PRELUDE = """
            (function (host) {
              globalThis.kernel = Object.freeze({
                call: function (method, params) {
                  return JSON.parse(host.call(String(method), JSON.stringify(params === undefined ? {} : params)));
                }
              });
            })(globalThis.__host);
            delete globalThis.__host;
            """;

    private static final String INVOKE = """
            (function (fn, input) { return JSON.stringify(fn(JSON.parse(input))); })
            """;

    private static final long MEMORY_POLL_MS = 5;

    private final HostFunctionRegistry hostFunctions;
    private final ObjectMapper objectMapper;

    public SandboxExecutor(HostFunctionRegistry hostFunctions, ObjectMapper objectMapper) {
        this.hostFunctions = hostFunctions;
        this.objectMapper = objectMapper;
    }

    /** Runs raw module source with no manifest requirements. */
    public SandboxOutput run(byte[] moduleSource, JsonNode input, List<Capability> grant, SandboxBudget budget) {
        return run(SandboxModule.anonymous(new String(moduleSource, StandardCharsets.UTF_8)), input, grant, budget);
    }

    public SandboxOutput run(SandboxModule module, JsonNode input, List<Capability> grant, SandboxBudget budget) {
        for (Capability required : module.requiredCapabilities()) {
            if (!CapabilityMatcher.matchesAny(grant, required)) {
                throw new SandboxException(SandboxErrorKind.CAPABILITY_DENIED,
                        "Module " + module.name() + " requires " + required);
            }
        }

        String inputJson = toJson(input);
        AllocationMeter memory = new AllocationMeter(budget.maxMemoryBytes());
        HostBridge bridge = new HostBridge(hostFunctions.all(), grant, objectMapper, memory);
        bridge.record(inputJson.length());

        RunState state = new RunState();
        ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "sandbox-" + module.name());
            t.setDaemon(true);
            return t;
        });
        long start = System.nanoTime();
        long deadline = start + budget.timeout().toNanos();
        try {
            Future<String> future = worker.submit(() -> execute(module, inputJson, bridge, memory, budget, state));
            String resultJson;
            try {
                resultJson = await(future, deadline, memory);
            } catch (TimeoutException e) {
                state.timedOut.set(true);
                future.cancel(true);
                cancel(state.context.get());
                log.warn("Sandbox module {} timed out after {}ms", module.name(), budget.timeout().toMillis());
                throw new SandboxException(SandboxErrorKind.TIMEOUT,
                        "Module exceeded wall-clock budget of " + budget.timeout().toMillis() + "ms");
            } catch (MemoryCeilingException e) {
                state.memoryExceeded.set(true);
                future.cancel(true);
                cancel(state.context.get());
                log.warn("Sandbox module {} stopped after allocating {} bytes (ceiling {})",
                        module.name(), e.allocated, memory.ceiling());
                throw new SandboxException(SandboxErrorKind.MEMORY_EXCEEDED, memory.describe());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                state.timedOut.set(true);
                future.cancel(true);
                cancel(state.context.get());
                throw new SandboxException(SandboxErrorKind.TIMEOUT, "Sandbox run interrupted by caller");
            } catch (ExecutionException e) {
                SandboxException failure = classify(e.getCause(), state, memory, budget);
                log.info("Sandbox module {} failed [{}]: {}", module.name(), failure.getKind(), failure.getMessage());
                throw failure;
            }

            JsonNode output = parseOutput(resultJson);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            log.debug("Sandbox module {} finished in {}ms ({} host calls)", module.name(), elapsedMs, bridge.hostCalls());
            return new SandboxOutput(output, elapsedMs, bridge.hostCalls(), bridge.boundaryBytes());
        } finally {
            worker.shutdownNow();
        }
    }

    /** Waits for the worker, checking its allocation every few milliseconds until the deadline. */
    private String await(Future<String> future, long deadline, AllocationMeter memory)
            throws InterruptedException, ExecutionException, TimeoutException, MemoryCeilingException {
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new TimeoutException();
            }
            try {
                return future.get(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(MEMORY_POLL_MS)),
                        TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                long allocated = memory.allocated();
                if (allocated > memory.ceiling()) {
                    throw new MemoryCeilingException(allocated);
                }
            }
        }
    }

    private String execute(SandboxModule module, String inputJson, HostBridge bridge,
                           AllocationMeter memory, SandboxBudget budget, RunState state) {
        Context.Builder builder = Context.newBuilder("js")
                .allowHostAccess(HostAccess.EXPLICIT)
                .allowHostClassLookup(name -> false)
                .allowIO(IOAccess.NONE)
                .allowNativeAccess(false)
                .allowCreateThread(false)
                .allowCreateProcess(false)
                .allowEnvironmentAccess(EnvironmentAccess.NONE)
                .option("engine.WarnInterpreterOnly", "false");
        if (budget.fuelLimit() > 0) {
            builder.resourceLimits(ResourceLimits.newBuilder()
                    .statementLimit(budget.fuelLimit(), null)
                    .onLimit(event -> state.fuelExhausted.set(true))
                    .build());
        }

        try (Context context = builder.build()) {
            state.context.set(context);
            context.getBindings("js").putMember("__host", bridge);
            context.eval("js", PRELUDE);

            Source source = Source.newBuilder("js", module.source(), module.name() + ".js").buildLiteral();
            Value program = context.parse(source);

            state.phase.set(SandboxErrorKind.INSTANTIATION);
            memory.start();
            program.execute();

            Value entry = context.getBindings("js").getMember("execute");
            if (entry == null || !entry.canExecute()) {
                throw new SandboxException(SandboxErrorKind.ABI_ERROR,
                        "Module does not define a global execute(input) function");
            }

            state.phase.set(SandboxErrorKind.EXECUTION);
            Value result = context.eval("js", INVOKE).execute(entry, inputJson);
            if (!result.isString()) {
                throw new SandboxException(SandboxErrorKind.ABI_ERROR,
                        "execute(input) must return a JSON-serializable value");
            }
            String json = result.asString();
            bridge.record(json.length());
            memory.check();
            return json;
        }
    }

    private SandboxException classify(Throwable cause, RunState state, AllocationMeter memory, SandboxBudget budget) {
        if (state.timedOut.get()) {
            return new SandboxException(SandboxErrorKind.TIMEOUT,
                    "Module exceeded wall-clock budget of " + budget.timeout().toMillis() + "ms");
        }
        if (state.fuelExhausted.get()) {
            return new SandboxException(SandboxErrorKind.FUEL_EXHAUSTED,
                    "Module exhausted its budget of " + budget.fuelLimit() + " statements");
        }
        if (state.memoryExceeded.get() || cause instanceof OutOfMemoryError) {
            return new SandboxException(SandboxErrorKind.MEMORY_EXCEEDED, memory.describe());
        }
        if (cause instanceof SandboxException sandboxException) {
            return sandboxException;
        }
        if (cause instanceof PolyglotException pe) {
            if (pe.isHostException() && pe.asHostException() instanceof SandboxException hostFailure) {
                return hostFailure;
            }
            if (pe.isCancelled()) {
                return new SandboxException(SandboxErrorKind.TIMEOUT, "Module execution was cancelled", pe);
            }
            if (pe.isResourceExhausted()) {
                return new SandboxException(SandboxErrorKind.MEMORY_EXCEEDED, pe.getMessage(), pe);
            }
            if (pe.isSyntaxError()) {
                return new SandboxException(SandboxErrorKind.COMPILATION, pe.getMessage(), pe);
            }
            return new SandboxException(state.phase.get(), pe.getMessage(), pe);
        }
        return new SandboxException(state.phase.get(),
                cause != null ? cause.getMessage() : "Sandbox run failed", cause);
    }

    private JsonNode parseOutput(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SandboxException(SandboxErrorKind.ABI_ERROR, "Module returned malformed JSON", e);
        }
    }

    private String toJson(JsonNode input) {
        try {
            return objectMapper.writeValueAsString(input != null ? input : objectMapper.createObjectNode());
        } catch (JsonProcessingException e) {
            throw new SandboxException(SandboxErrorKind.ABI_ERROR, "Input is not serializable", e);
        }
    }

    /**
     * Cancels a running context from outside its thread. Closing blocks until the guest
     * unwinds, so it happens on a separate daemon thread.
     */
    private void cancel(Context context) {
        if (context == null) return;
        Thread reaper = new Thread(() -> {
            try {
                context.close(true);
            } catch (RuntimeException e) {
                log.debug("Sandbox context close after timeout: {}", e.getMessage());
            }
        }, "sandbox-reaper");
        reaper.setDaemon(true);
        reaper.start();
    }

    private static final class RunState {
        final AtomicBoolean fuelExhausted = new AtomicBoolean();
        final AtomicBoolean timedOut = new AtomicBoolean();
        final AtomicBoolean memoryExceeded = new AtomicBoolean();
        final AtomicReference<Context> context = new AtomicReference<>();
        final AtomicReference<SandboxErrorKind> phase = new AtomicReference<>(SandboxErrorKind.COMPILATION);
    }

    private static final class MemoryCeilingException extends Exception {
        final long allocated;

        MemoryCeilingException(long allocated) {
            super(null, null, false, false);
            this.allocated = allocated;
        }
    }
}
