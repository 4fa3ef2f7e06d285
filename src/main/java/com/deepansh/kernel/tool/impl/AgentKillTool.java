package com.deepansh.kernel.tool.impl;

import com.deepansh.kernel.agent.SubAgentGateway;
import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.tool.AgentTool;
import com.deepansh.kernel.tool.ToolContext;
import com.deepansh.kernel.tool.ToolKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class AgentKillTool implements AgentTool {

    private final SubAgentGateway gateway;

    public AgentKillTool(SubAgentGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public String getName() {
        return "agent_kill";
    }

    @Override
    public String getDescription() {
        return "Terminate another agent, dropping its session, quota window and capabilities.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "agent_id", Map.of("type", "string", "description", "Id of the agent to terminate")
                ),
                "required", List.of("agent_id")
        );
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.SUB_AGENT;
    }

    @Override
    public List<Capability> requiredCapabilities(Map<String, Object> arguments) {
        return List.of(Capability.agentKill(ToolArgs.required(arguments, "agent_id")));
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) {
        String target = ToolArgs.required(arguments, "agent_id");
        if (target.equals(context.agentId())) {
            throw new IllegalArgumentException("An agent cannot kill itself");
        }
        return gateway.kill(context, target);
    }
}
