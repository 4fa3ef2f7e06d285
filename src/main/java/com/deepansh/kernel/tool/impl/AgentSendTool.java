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
public class AgentSendTool implements AgentTool {

    private final SubAgentGateway gateway;

    public AgentSendTool(SubAgentGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public String getName() {
        return "agent_send";
    }

    @Override
    public String getDescription() {
        return """
                Send a message to another agent and wait for its reply.
                The other agent runs a full turn with its own tools and capabilities.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "agent_id", Map.of("type", "string", "description", "Id of the agent to message"),
                        "message", Map.of("type", "string", "description", "Message for the agent")
                ),
                "required", List.of("agent_id", "message")
        );
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.SUB_AGENT;
    }

    @Override
    public List<Capability> requiredCapabilities(Map<String, Object> arguments) {
        return List.of(Capability.agentMessage(ToolArgs.required(arguments, "agent_id")));
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) {
        return gateway.send(context,
                ToolArgs.required(arguments, "agent_id"),
                ToolArgs.required(arguments, "message"));
    }
}
