package com.deepansh.kernel.tool;

import com.deepansh.kernel.model.ContentBlock;

/**
 * Result of one dispatch, ready to go back to the model. Errors of every kind
 * (denied, blocked, timed out, failed) are outcomes with {@code error = true}.
 */
public record ToolOutcome(String toolUseId, String toolName, String content, boolean error, long latencyMs) {

    public static ToolOutcome success(String toolUseId, String toolName, String content, long latencyMs) {
        return new ToolOutcome(toolUseId, toolName, content, false, latencyMs);
    }

    public static ToolOutcome failure(String toolUseId, String toolName, String content) {
        return new ToolOutcome(toolUseId, toolName, content, true, 0);
    }

    public ContentBlock toResultBlock() {
        return ContentBlock.toolResult(toolUseId, content, error);
    }
}
