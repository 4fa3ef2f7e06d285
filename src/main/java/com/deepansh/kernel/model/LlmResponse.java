package com.deepansh.kernel.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class LlmResponse {

    /** May be null when the model only requested tools */
    private String text;

    @Builder.Default
    private List<ToolCall> toolCalls = new ArrayList<>();

    @Builder.Default
    private StopReason stopReason = StopReason.END_TURN;

    @Builder.Default
    private int inputTokens = 0;

    @Builder.Default
    private int outputTokens = 0;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
