package com.deepansh.kernel.llm;

import com.deepansh.kernel.exception.AgentException;

import java.time.Duration;
import java.util.Optional;

/** 429 / 503 / 529 from the provider. Retried with backoff by the resilient driver. */
public class RateLimitedException extends AgentException {

    private final Duration retryAfter;

    public RateLimitedException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
