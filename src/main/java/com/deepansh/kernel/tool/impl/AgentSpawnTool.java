package com.deepansh.kernel.tool.impl;

import com.deepansh.kernel.agent.AgentManifest;
import com.deepansh.kernel.agent.SubAgentGateway;
import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.tool.AgentTool;
import com.deepansh.kernel.tool.ToolContext;
import com.deepansh.kernel.tool.ToolKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Spawns a child agent. The child's capabilities must be covered by the caller's own;
 * asking for more fails the call with a privilege escalation error.
 */
@Component
public class AgentSpawnTool implements AgentTool {

    private final SubAgentGateway gateway;
    private final ObjectMapper objectMapper;

    public AgentSpawnTool(SubAgentGateway gateway, ObjectMapper objectMapper) {
        this.gateway = gateway;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "agent_spawn";
    }

    @Override
    public String getDescription() {
        return """
                Spawn a child agent with a subset of your own capabilities.
                Capabilities are objects like {"type": "FILE_READ", "value": "/docs/*"}.
                If 'message' is given the child runs it as its first turn and the reply is returned.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "name", Map.of("type", "string", "description", "Name for the child agent"),
                        "system_prompt", Map.of("type", "string", "description", "System prompt for the child"),
                        "capabilities", Map.of(
                                "type", "array",
                                "description", "Capabilities to grant the child",
                                "items", Map.of("type", "object")),
                        "message", Map.of("type", "string", "description", "Optional first message")
                ),
                "required", List.of("name")
        );
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.SUB_AGENT;
    }

    @Override
    public List<Capability> requiredCapabilities(Map<String, Object> arguments) {
        return List.of(Capability.agentSpawn());
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) {
        Object rawCapabilities = arguments.get("capabilities");
        List<Capability> capabilities = rawCapabilities == null
                ? List.of()
                : List.of(objectMapper.convertValue(rawCapabilities, Capability[].class));

        AgentManifest manifest = AgentManifest.builder()
                .name(ToolArgs.required(arguments, "name"))
                .systemPrompt(ToolArgs.optional(arguments, "system_prompt", null))
                .capabilities(capabilities)
                .build();
        return gateway.spawn(context, manifest, ToolArgs.optional(arguments, "message", null));
    }
}
