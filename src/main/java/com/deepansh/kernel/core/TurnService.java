package com.deepansh.kernel.core;

import com.deepansh.kernel.model.TurnResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Entry point for running turns. Enforces one running turn per agent, since a session has
 * a single writer, and keeps the cancellation handle for each running turn.
 */
@Service
@Slf4j
public class TurnService implements TurnRunner {

    private final AgentLoop agentLoop;
    private final Map<String, CancellationToken> running = new ConcurrentHashMap<>();

    public TurnService(AgentLoop agentLoop) {
        this.agentLoop = agentLoop;
    }

    /** Orchestrator turn at depth 0. */
    public TurnResult run(String agentId, String input) {
        return execute(agentId, input, 0, null);
    }

    public TurnResult runStreaming(String agentId, String input, Consumer<String> onText) {
        return execute(agentId, input, 0, onText);
    }

    @Override
    public TurnResult runTurn(String agentId, String input, int depth) {
        return execute(agentId, input, depth, null);
    }

    /** @return false when no turn was running for the agent */
    public boolean cancel(String agentId) {
        CancellationToken token = running.get(agentId);
        if (token == null) return false;
        log.info("Cancelling turn [agent={}]", agentId);
        token.cancel();
        return true;
    }

    public boolean isRunning(String agentId) {
        return running.containsKey(agentId);
    }

    private TurnResult execute(String agentId, String input, int depth, Consumer<String> onText) {
        CancellationToken token = new CancellationToken(Thread.currentThread());
        if (running.putIfAbsent(agentId, token) != null) {
            throw new AgentBusyException(agentId);
        }
        try {
            return agentLoop.runTurn(agentId, input, depth, token, onText);
        } finally {
            running.remove(agentId, token);
            if (token.isCancelled()) {
                // A cancel that raced the end of the turn must not leak into the caller's thread
                Thread.interrupted();
            }
        }
    }
}
