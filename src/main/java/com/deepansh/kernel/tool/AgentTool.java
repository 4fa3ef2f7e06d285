package com.deepansh.kernel.tool;

import com.deepansh.kernel.capability.Capability;

import java.util.List;
import java.util.Map;

/**
 * Contract every in-process tool implements.
 *
 * The {@link #getInputSchema()} return value is serialized as JSON Schema
 * and sent to the LLM so it knows exactly how to invoke the tool.
 *
 * Errors are thrown, not returned. The dispatcher turns any exception into an
 * error-flagged tool result, so the loop stays alive and the model can adapt.
 */
public interface AgentTool {

    /** Unique snake_case name the LLM uses to invoke this tool */
    String getName();

    /**
     * Human-readable description. This is the primary signal the LLM uses
     * to decide when to call this tool.
     */
    String getDescription();

    Map<String, Object> getInputSchema();

    default ToolKind getKind() {
        return ToolKind.BUILTIN;
    }

    /**
     * Capabilities this particular call needs on top of {@code ToolInvoke(name)},
     * e.g. {@code FileRead("/notes/a.md")} for a read of notes/a.md.
     * May throw {@link IllegalArgumentException} for unusable arguments.
     */
    default List<Capability> requiredCapabilities(Map<String, Object> arguments) {
        return List.of();
    }

    String execute(Map<String, Object> arguments, ToolContext context) throws Exception;
}
