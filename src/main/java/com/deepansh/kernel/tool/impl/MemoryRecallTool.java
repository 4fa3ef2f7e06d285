package com.deepansh.kernel.tool.impl;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.memory.SharedMemory;
import com.deepansh.kernel.tool.AgentTool;
import com.deepansh.kernel.tool.ToolContext;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Reads one key, or lists keys under a prefix. Listing needs MemoryRead on
 * {@code prefix*}, so a grant of {@code MemoryRead("project/*")} lists project/ only.
 */
@Component
public class MemoryRecallTool implements AgentTool {

    private final SharedMemory memory;

    public MemoryRecallTool(SharedMemory memory) {
        this.memory = memory;
    }

    @Override
    public String getName() {
        return "memory_recall";
    }

    @Override
    public String getDescription() {
        return "Read a value from the shared memory namespace by key, or list keys starting with a prefix.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "key", Map.of("type", "string", "description", "Exact key to read"),
                        "prefix", Map.of("type", "string", "description", "List keys starting with this prefix instead")
                )
        );
    }

    @Override
    public List<Capability> requiredCapabilities(Map<String, Object> arguments) {
        String key = ToolArgs.optional(arguments, "key", "");
        if (!key.isBlank()) {
            return List.of(Capability.memoryRead(key));
        }
        return List.of(Capability.memoryRead(ToolArgs.optional(arguments, "prefix", "") + "*"));
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) {
        String key = ToolArgs.optional(arguments, "key", "");
        if (!key.isBlank()) {
            return memory.get(key).orElse("No value stored for '" + key + "'");
        }
        List<String> keys = memory.keys(ToolArgs.optional(arguments, "prefix", ""));
        return keys.isEmpty() ? "No keys found." : String.join("\n", keys);
    }
}
