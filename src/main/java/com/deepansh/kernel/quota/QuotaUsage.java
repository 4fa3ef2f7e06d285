package com.deepansh.kernel.quota;

import java.time.Instant;

/** Point-in-time view of an agent's quota window. {@code windowStart} is null before first use. */
public record QuotaUsage(String agentId, long limit, long consumed, Instant windowStart, Instant resetAt) {
}
