package com.deepansh.kernel.quota;

import java.time.Duration;
import java.time.Instant;

/**
 * One agent's hourly token window. The window is anchored to the first reservation
 * after a reset; until then {@code windowStart} is null.
 *
 * Not thread-safe on its own; {@link QuotaScheduler} synchronizes on the instance.
 */
class QuotaWindow {

    private final long limit;
    private final Duration length;
    private long consumed;
    private Instant windowStart;

    QuotaWindow(long limit, Duration length) {
        this.limit = limit;
        this.length = length;
    }

    /** Resets the counter once {@code now} is past windowStart + length. */
    boolean expireIfNeeded(Instant now) {
        if (windowStart != null && now.isAfter(windowStart.plus(length))) {
            consumed = 0;
            windowStart = null;
            return true;
        }
        return false;
    }

    boolean fits(long tokens) {
        return consumed + tokens <= limit;
    }

    void consume(long tokens, Instant now) {
        if (windowStart == null) {
            windowStart = now;
        }
        consumed += tokens;
    }

    void refund(long tokens) {
        consumed = Math.max(0, consumed - tokens);
    }

    Instant resetAt(Instant now) {
        return (windowStart != null ? windowStart : now).plus(length);
    }

    long limit() {
        return limit;
    }

    long consumed() {
        return consumed;
    }

    long remaining() {
        return Math.max(0, limit - consumed);
    }

    Instant windowStart() {
        return windowStart;
    }
}
