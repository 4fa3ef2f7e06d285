package com.deepansh.kernel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A requested tool invocation. Created from the driver response and consumed
 * within the same loop iteration; never persisted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /** ID assigned by the model, echoed back as the tool_result's tool_use_id */
    private String id;

    private String toolName;

    private Map<String, Object> arguments;

    /** Set by the loop before dispatch */
    private String agentId;

    private int depth;

    public ContentBlock toToolUseBlock() {
        return ContentBlock.toolUse(id, toolName, arguments);
    }
}
