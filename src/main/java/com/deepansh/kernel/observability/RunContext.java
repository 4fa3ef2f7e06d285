package com.deepansh.kernel.observability;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable per-turn context for collecting observability data.
 * Created at the start of each turn, populated throughout, then turned into
 * the turn result and the usage event.
 *
 * Kept separate from AgentContext (which holds conversation state)
 * so accounting concerns don't bleed into the core loop.
 */
@Data
public class RunContext {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<ToolCallRecord> toolCallRecords = new ArrayList<>();

    private long inputTokens;
    private long outputTokens;
    private int driverCalls;

    public void recordToolCall(String toolName, long latencyMs, boolean error) {
        toolCallRecords.add(new ToolCallRecord(toolName, latencyMs, error));
    }

    public void addTokens(long in, long out) {
        this.inputTokens += in;
        this.outputTokens += out;
        this.driverCalls++;
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public long totalTokens() {
        return inputTokens + outputTokens;
    }

    public List<String> toolNames() {
        return toolCallRecords.stream().map(ToolCallRecord::toolName).toList();
    }

    public record ToolCallRecord(String toolName, long latencyMs, boolean error) {}
}
