package com.deepansh.kernel.agent;

import com.deepansh.kernel.core.TurnRunner;
import com.deepansh.kernel.model.TurnResult;
import com.deepansh.kernel.tool.ToolContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/**
 * Agent-to-agent calls made from tools. The target runs a full turn one level deeper
 * than the caller; its reply text becomes the tool result.
 */
@Component
@Slf4j
public class SubAgentGateway {

    private final AgentManager agentManager;
    private final TurnRunner turnRunner;

    public SubAgentGateway(AgentManager agentManager, @Lazy TurnRunner turnRunner) {
        this.agentManager = agentManager;
        this.turnRunner = turnRunner;
    }

    public String send(ToolContext caller, String targetId, String message) {
        agentManager.get(targetId);
        log.info("Agent message [from={}, to={}, depth={}]", caller.agentId(), targetId, caller.depth() + 1);
        TurnResult result = turnRunner.runTurn(targetId, message, caller.depth() + 1);
        return describe(targetId, result);
    }

    /** Spawns a child of the caller and, when {@code message} is given, runs its first turn. */
    public String spawn(ToolContext caller, AgentManifest manifest, String message) {
        AgentRecord child = agentManager.spawn(manifest, caller.agentId());
        String spawned = "Spawned agent '" + child.getName() + "' with id " + child.getAgentId();
        if (message == null || message.isBlank()) {
            return spawned;
        }
        TurnResult result = turnRunner.runTurn(child.getAgentId(), message, caller.depth() + 1);
        return spawned + "\n\n" + describe(child.getAgentId(), result);
    }

    public String kill(ToolContext caller, String targetId) {
        AgentRecord target = agentManager.get(targetId);
        agentManager.kill(targetId);
        log.info("Agent killed by agent [killer={}, target={}]", caller.agentId(), targetId);
        return "Killed agent '" + target.getName() + "' (" + targetId + ")";
    }

    private static String describe(String agentId, TurnResult result) {
        if (result.isCompleted()) {
            return result.getText() != null ? result.getText() : "";
        }
        return "ERROR: Agent " + agentId + " turn failed (" + result.getFailureReason() + "): "
                + result.getErrorMessage();
    }
}
