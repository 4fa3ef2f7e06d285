package com.deepansh.kernel.tool;

import com.deepansh.kernel.sandbox.SandboxModule;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Immutable snapshot of a tool's schema sent to the LLM.
 * Decouples the LLM serialization format from the tool implementation.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema;

    @JsonIgnore
    private ToolKind kind;

    public static ToolDefinition from(AgentTool tool) {
        return ToolDefinition.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .inputSchema(tool.getInputSchema())
                .kind(tool.getKind())
                .build();
    }

    public static ToolDefinition from(SandboxModule module) {
        return ToolDefinition.builder()
                .name(module.name())
                .description(module.description())
                .inputSchema(module.inputSchema())
                .kind(ToolKind.SANDBOX)
                .build();
    }

    /**
     * OpenAI function-calling format:
     * { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toOpenAiSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description != null ? description : "",
                        "parameters", inputSchema
                )
        );
    }
}
