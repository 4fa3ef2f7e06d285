package com.deepansh.kernel.model;

import com.deepansh.kernel.tool.ToolDefinition;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class LlmRequest {

    private String model;
    private String systemPrompt;
    private List<Message> messages;
    private List<ToolDefinition> tools;
    private int maxTokens;
}
