package com.deepansh.kernel.tool.impl;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.memory.SharedMemory;
import com.deepansh.kernel.tool.AgentTool;
import com.deepansh.kernel.tool.ToolContext;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class MemoryStoreTool implements AgentTool {

    private final SharedMemory memory;

    public MemoryStoreTool(SharedMemory memory) {
        this.memory = memory;
    }

    @Override
    public String getName() {
        return "memory_store";
    }

    @Override
    public String getDescription() {
        return """
                Store a value in the memory namespace shared with other agents.
                Use '/'-separated keys, e.g. 'project/status'. Overwrites any existing value.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "key", Map.of("type", "string", "description", "Memory key"),
                        "value", Map.of("type", "string", "description", "Value to store")
                ),
                "required", List.of("key", "value")
        );
    }

    @Override
    public List<Capability> requiredCapabilities(Map<String, Object> arguments) {
        return List.of(Capability.memoryWrite(ToolArgs.required(arguments, "key")));
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) {
        String key = ToolArgs.required(arguments, "key");
        String value = ToolArgs.optional(arguments, "value", "");
        memory.put(key, value);
        return "Stored '" + key + "' (" + value.length() + " chars)";
    }
}
