package com.deepansh.kernel.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one agent turn as seen by the orchestrator.
 * Locally recovered tool errors never show up here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnResult {

    private String agentId;
    private TurnStatus status;

    /** Null unless status = FAILED */
    private FailureReason failureReason;
    private String errorMessage;

    /** Set when failureReason = QUOTA_EXCEEDED */
    private Instant quotaResetAt;

    private String text;
    private long tokensIn;
    private long tokensOut;
    private int iterations;
    private double costUsd;
    private boolean maxIterationsReached;

    @Builder.Default
    private List<String> toolCallsExecuted = new ArrayList<>();

    @JsonIgnore
    public boolean isCompleted() {
        return status == TurnStatus.COMPLETED;
    }
}
