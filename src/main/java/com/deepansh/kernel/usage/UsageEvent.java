package com.deepansh.kernel.usage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One record per finished turn, for external accounting and display.
 */
@Document(collection = "usage_events")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageEvent {

    @Id
    private String id;

    @Indexed
    private String agentId;

    private String sessionId;
    private String model;

    /** COMPLETED or FAILED */
    private String status;
    private String failureReason;

    private long tokensIn;
    private long tokensOut;
    private double costEstimateUsd;

    private int iterations;
    private int toolCalls;
    private long latencyMs;

    @CreatedDate
    private Instant createdAt;
}
