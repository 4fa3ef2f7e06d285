package com.deepansh.kernel.quota;

import com.deepansh.kernel.exception.AgentException;
import lombok.Getter;

import java.time.Instant;

/**
 * Turn-fatal. Never retried automatically: token availability does not change
 * before {@link #getResetAt()}.
 */
@Getter
public class QuotaExceededException extends AgentException {

    private final String agentId;
    private final long requested;
    private final long remaining;
    private final Instant resetAt;

    public QuotaExceededException(String agentId, long requested, long remaining, Instant resetAt) {
        super(String.format("Token quota exceeded for agent %s: requested %d, remaining %d, resets at %s",
                agentId, requested, remaining, resetAt));
        this.agentId = agentId;
        this.requested = requested;
        this.remaining = remaining;
        this.resetAt = resetAt;
    }
}
