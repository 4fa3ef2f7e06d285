package com.deepansh.kernel.tool;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.capability.CapabilityCheck;
import com.deepansh.kernel.capability.CapabilityManager;
import com.deepansh.kernel.config.KernelProperties;
import com.deepansh.kernel.model.ToolCall;
import com.deepansh.kernel.sandbox.SandboxBudget;
import com.deepansh.kernel.sandbox.SandboxException;
import com.deepansh.kernel.sandbox.SandboxExecutor;
import com.deepansh.kernel.sandbox.SandboxOutput;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Executes tool calls for the agent loop. Never throws for a tool problem: unknown tools,
 * capability denials, depth refusals, exceptions, sandbox errors and timeouts all become
 * error-flagged {@link ToolOutcome}s.
 *
 * Every call runs on the tool executor under one hard timeout, measured from the moment it
 * starts. A call still running at the deadline is cancelled with interruption and reported
 * as a timeout.
 */
@Component
@Slf4j
public class ToolDispatcher {

    private static final long SATURATED_BACKOFF_MS = 50;

    private final ToolRegistry registry;
    private final CapabilityManager capabilityManager;
    private final SandboxExecutor sandboxExecutor;
    private final KernelProperties properties;
    private final ObjectMapper objectMapper;
    private final AsyncTaskExecutor executor;

    public ToolDispatcher(ToolRegistry registry,
                          CapabilityManager capabilityManager,
                          SandboxExecutor sandboxExecutor,
                          KernelProperties properties,
                          ObjectMapper objectMapper,
                          @Qualifier("toolTaskExecutor") AsyncTaskExecutor executor) {
        this.registry = registry;
        this.capabilityManager = capabilityManager;
        this.sandboxExecutor = sandboxExecutor;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    /**
     * Dispatches {@code calls} with at most {@code maxConcurrent} in flight; the rest wait on
     * the calling thread and take no pool thread until they start. Outcomes come back in issue
     * order, whatever order the calls finish in.
     *
     * Each call's timeout runs from the moment it starts. When the shared pool is saturated,
     * waiting calls are held back until a thread frees up rather than failed.
     *
     * @throws InterruptedException if the calling turn is cancelled; running calls are cancelled too
     */
    public List<ToolOutcome> dispatchAll(List<ToolCall> calls, ToolContext context, int maxConcurrent)
            throws InterruptedException {
        ToolOutcome[] outcomes = new ToolOutcome[calls.size()];
        Deque<PreparedCall> waiting = new ArrayDeque<>();
        for (int i = 0; i < calls.size(); i++) {
            Object prepared = prepare(i, calls.get(i), context);
            if (prepared instanceof ToolOutcome refused) {
                outcomes[i] = refused;
            } else {
                waiting.add((PreparedCall) prepared);
            }
        }

        int limit = Math.max(1, maxConcurrent);
        long timeoutMs = properties.getTools().getTimeoutMs();
        CompletionService<String> completions = new ExecutorCompletionService<>(executor);
        Map<Future<String>, RunningCall> running = new HashMap<>();
        try {
            while (!waiting.isEmpty() || !running.isEmpty()) {
                while (!waiting.isEmpty() && running.size() < limit) {
                    PreparedCall next = waiting.peek();
                    Future<String> future;
                    try {
                        future = completions.submit(() -> invoke(next.route(), next.args(), context));
                    } catch (TaskRejectedException e) {
                        log.warn("Tool executor saturated, holding {} call(s) [agent={}]",
                                waiting.size(), context.agentId());
                        if (running.isEmpty()) {
                            Thread.sleep(SATURATED_BACKOFF_MS);
                        }
                        break;
                    }
                    waiting.poll();
                    running.put(future, new RunningCall(next, System.currentTimeMillis()));
                }
                if (running.isEmpty()) continue;

                long nextDeadline = running.values().stream()
                        .mapToLong(r -> r.startedAt() + timeoutMs)
                        .min().getAsLong();
                Future<String> done = completions.poll(
                        Math.max(0, nextDeadline - System.currentTimeMillis()), TimeUnit.MILLISECONDS);
                if (done != null) {
                    RunningCall finished = running.remove(done);
                    if (finished != null) {
                        outcomes[finished.call().index()] = collect(finished, done, context);
                    }
                }
                expireOverdue(running, outcomes, timeoutMs, context);
            }
        } catch (InterruptedException e) {
            running.keySet().forEach(f -> f.cancel(true));
            throw e;
        }
        return Arrays.asList(outcomes);
    }

    /** Runs one call to completion or timeout. */
    public ToolOutcome dispatch(ToolCall call, ToolContext context) {
        try {
            return dispatchAll(List.of(call), context, 1).get(0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolOutcome.failure(call.getId(), call.getToolName(), "ERROR: Tool call cancelled");
        }
    }

    /** Resolves and authorizes a call; returns either a {@link PreparedCall} or a refusal outcome. */
    private Object prepare(int index, ToolCall call, ToolContext context) {
        String name = call.getToolName();
        Map<String, Object> args = call.getArguments() != null ? call.getArguments() : Map.of();

        ToolRoute route = registry.resolve(name).orElse(null);
        if (route == null) {
            log.warn("Unknown tool requested [agent={}, tool={}]", context.agentId(), name);
            return ToolOutcome.failure(call.getId(), name,
                    "ERROR: Unknown tool '" + name + "'. Available tools: " + registry.toolNames());
        }

        CapabilityCheck check = authorize(route, args, context.agentId());
        if (!check.granted()) {
            log.info("Tool call denied [agent={}, tool={}]: {}", context.agentId(), name, check.reason());
            return ToolOutcome.failure(call.getId(), name, "CAPABILITY_DENIED: " + check.reason());
        }

        if (route.kind() == ToolKind.SUB_AGENT && context.depth() >= properties.getTools().getMaxAgentDepth()) {
            log.warn("Agent call depth limit reached [agent={}, depth={}]", context.agentId(), context.depth());
            return ToolOutcome.failure(call.getId(), name,
                    "ERROR: Maximum agent call depth (" + properties.getTools().getMaxAgentDepth() + ") reached");
        }
        return new PreparedCall(index, call, route, args);
    }

    private ToolOutcome collect(RunningCall running, Future<String> done, ToolContext context)
            throws InterruptedException {
        ToolCall call = running.call().call();
        String name = call.getToolName();
        long latency = System.currentTimeMillis() - running.startedAt();
        try {
            String result = done.get();
            log.info("Tool [{}] completed in {}ms [agent={}]", name, latency, context.agentId());
            return ToolOutcome.success(call.getId(), name, truncate(result), latency);
        } catch (CancellationException e) {
            return ToolOutcome.failure(call.getId(), name, "ERROR: Tool call cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            String message = cause instanceof SandboxException se
                    ? "SANDBOX_ERROR[" + se.getKind() + "]: " + se.getMessage()
                    : "ERROR: " + rootMessage(e);
            log.info("Tool [{}] failed [agent={}]: {}", name, context.agentId(), message);
            return new ToolOutcome(call.getId(), name, truncate(message), true, latency);
        }
    }

    /** Cancels, with interruption, every call that has run past its timeout. */
    private void expireOverdue(Map<Future<String>, RunningCall> running, ToolOutcome[] outcomes,
                               long timeoutMs, ToolContext context) throws InterruptedException {
        long now = System.currentTimeMillis();
        Iterator<Map.Entry<Future<String>, RunningCall>> it = running.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Future<String>, RunningCall> entry = it.next();
            RunningCall call = entry.getValue();
            if (now - call.startedAt() < timeoutMs) continue;

            it.remove();
            Future<String> future = entry.getKey();
            int index = call.call().index();
            if (future.isDone()) {
                outcomes[index] = collect(call, future, context);
                continue;
            }
            future.cancel(true);
            String name = call.call().call().getToolName();
            log.warn("Tool [{}] timed out after {}ms [agent={}]", name, timeoutMs, context.agentId());
            outcomes[index] = ToolOutcome.failure(call.call().call().getId(), name,
                    "TIMEOUT: Tool '" + name + "' did not finish within " + timeoutMs + "ms");
        }
    }

    private CapabilityCheck authorize(ToolRoute route, Map<String, Object> args, String agentId) {
        CapabilityCheck invoke = capabilityManager.check(agentId, Capability.toolInvoke(route.name()));
        if (!invoke.granted()) return invoke;

        List<Capability> required;
        try {
            required = switch (route.kind()) {
                case BUILTIN, SUB_AGENT -> route.tool().requiredCapabilities(args);
                case SANDBOX -> route.module().requiredCapabilities();
            };
        } catch (IllegalArgumentException | SecurityException e) {
            return CapabilityCheck.deny(e.getMessage());
        }
        return capabilityManager.checkAll(agentId, required);
    }

    private String invoke(ToolRoute route, Map<String, Object> args, ToolContext context) throws Exception {
        return switch (route.kind()) {
            case BUILTIN, SUB_AGENT -> route.tool().execute(args, context);
            case SANDBOX -> {
                SandboxOutput output = sandboxExecutor.run(route.module(),
                        objectMapper.valueToTree(args),
                        capabilityManager.list(context.agentId()),
                        SandboxBudget.from(properties.getSandbox()));
                yield output.output().isTextual() ? output.output().asText() : output.output().toString();
            }
        };
    }

    private String truncate(String result) {
        if (result == null) return "";
        int max = properties.getTools().getMaxResultChars();
        if (result.length() <= max) return result;
        return result.substring(0, max) + "\n...[truncated " + (result.length() - max) + " chars]";
    }

    private static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }

    private record PreparedCall(int index, ToolCall call, ToolRoute route, Map<String, Object> args) {
    }

    private record RunningCall(PreparedCall call, long startedAt) {
    }
}
