package com.deepansh.kernel.session;

import com.deepansh.kernel.model.Message;
import com.deepansh.kernel.tool.ToolDefinition;

import java.util.List;

/** Character-count heuristic for token footprints. Cheap enough to run every iteration. */
public final class TokenEstimator {

    private TokenEstimator() {
    }

    public static long estimate(List<Message> messages, int charsPerToken) {
        long chars = 0;
        for (Message message : messages) {
            chars += message.charLength();
        }
        return chars / Math.max(1, charsPerToken);
    }

    public static long estimate(String systemPrompt, List<Message> messages,
                                List<ToolDefinition> tools, int charsPerToken) {
        long chars = systemPrompt != null ? systemPrompt.length() : 0;
        for (Message message : messages) {
            chars += message.charLength();
        }
        for (ToolDefinition tool : tools) {
            chars += tool.getName().length()
                    + (tool.getDescription() != null ? tool.getDescription().length() : 0)
                    + (tool.getInputSchema() != null ? tool.getInputSchema().toString().length() : 0);
        }
        return chars / Math.max(1, charsPerToken);
    }
}
