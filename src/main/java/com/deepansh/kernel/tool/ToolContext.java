package com.deepansh.kernel.tool;

/**
 * Who is calling a tool and how deep in the agent call chain. Depth 0 is a turn
 * started by the orchestrator; each agent-to-agent hop adds one.
 */
public record ToolContext(String agentId, String sessionId, int depth) {
}
