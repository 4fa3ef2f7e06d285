package com.deepansh.kernel.core;

import com.deepansh.kernel.model.Message;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Holds all mutable state for a single turn.
 * Passed through the loop instead of scattered fields on AgentLoop.
 */
@Data
@Builder
public class AgentContext {

    private String agentId;
    private String sessionId;
    private int depth;
    private String model;
    private String systemPrompt;
    private int maxTokens;
    private int maxConcurrentTools;

    private List<Message> messages;
    private TurnState state;
    private int iteration;
    private int continuations;

    /** Text gathered across continuation re-prompts */
    @Builder.Default
    private StringBuilder partialText = new StringBuilder();
}
