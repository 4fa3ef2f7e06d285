package com.deepansh.kernel.sandbox;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.capability.CapabilityMatcher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.graalvm.polyglot.HostAccess;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The only host object a sandboxed module can see. Every call is checked against the
 * run's capability grant before the host function runs; denials and host errors come
 * back to the guest as {@code {"error": ...}} values.
 *
 * Two conditions are not returned as values: crossing the memory ceiling and being
 * interrupted by the wall-clock timer. Both throw {@link SandboxException} so the run ends.
 * Host calls run on the guest's thread, so what a host function allocates is charged to
 * the run as well.
 */
@Slf4j
public class HostBridge {

    private final Map<String, HostFunction> functions;
    private final List<Capability> grant;
    private final ObjectMapper objectMapper;
    private final AllocationMeter memory;

    private final AtomicLong bytes = new AtomicLong();
    private final AtomicInteger calls = new AtomicInteger();

    HostBridge(Map<String, HostFunction> functions, List<Capability> grant,
               ObjectMapper objectMapper, AllocationMeter memory) {
        this.functions = functions;
        this.grant = List.copyOf(grant);
        this.objectMapper = objectMapper;
        this.memory = memory;
    }

    @HostAccess.Export
    public String call(String method, String paramsJson) {
        calls.incrementAndGet();
        record(method.length() + (paramsJson != null ? paramsJson.length() : 0));
        checkInterrupted();
        memory.check();

        HostFunction function = functions.get(method);
        if (function == null) {
            return error("Unknown host function '" + method + "'. Available: " + functions.keySet(), false);
        }

        JsonNode params;
        try {
            params = paramsJson == null ? objectMapper.createObjectNode() : objectMapper.readTree(paramsJson);
        } catch (JsonProcessingException e) {
            return error("Malformed params for " + method, false);
        }

        List<Capability> required;
        try {
            required = function.requirements().apply(params);
        } catch (RuntimeException e) {
            return error(e.getMessage(), false);
        }
        for (Capability capability : required) {
            if (!CapabilityMatcher.matchesAny(grant, capability)) {
                log.info("Sandbox host call denied [{}]: missing {}", method, capability);
                return error("Capability denied: " + method + " requires " + capability, true);
            }
        }

        try {
            JsonNode result = function.handler().handle(params);
            ObjectNode envelope = objectMapper.createObjectNode();
            envelope.set("ok", result);
            String out = envelope.toString();
            record(out.length());
            memory.check();
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException(SandboxErrorKind.TIMEOUT, "Host call " + method + " interrupted");
        } catch (SandboxException e) {
            throw e;
        } catch (Exception e) {
            log.debug("Host function {} failed: {}", method, e.getMessage());
            return error(e.getMessage(), false);
        }
    }

    /** Characters moved across the boundary, reported with the run's output. */
    void record(long amount) {
        bytes.addAndGet(amount);
    }

    public int hostCalls() {
        return calls.get();
    }

    public long boundaryBytes() {
        return bytes.get();
    }

    private void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new SandboxException(SandboxErrorKind.TIMEOUT, "Sandbox run interrupted");
        }
    }

    private String error(String message, boolean denied) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("error", message != null ? message : "Host call failed");
        if (denied) node.put("denied", true);
        return node.toString();
    }
}
