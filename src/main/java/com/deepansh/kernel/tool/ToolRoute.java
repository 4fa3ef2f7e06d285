package com.deepansh.kernel.tool;

import com.deepansh.kernel.sandbox.SandboxModule;

/**
 * Resolved dispatch target for one tool name. Exactly one of {@code tool} and
 * {@code module} is set, depending on {@code kind}.
 */
public record ToolRoute(ToolKind kind, AgentTool tool, SandboxModule module) {

    public static ToolRoute of(AgentTool tool) {
        if (tool.getKind() == ToolKind.SANDBOX) {
            throw new IllegalArgumentException("In-process tool " + tool.getName() + " cannot be SANDBOX kind");
        }
        return new ToolRoute(tool.getKind(), tool, null);
    }

    public static ToolRoute of(SandboxModule module) {
        return new ToolRoute(ToolKind.SANDBOX, null, module);
    }

    public String name() {
        return kind == ToolKind.SANDBOX ? module.name() : tool.getName();
    }
}
