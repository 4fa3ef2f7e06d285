package com.deepansh.kernel.quota;

import com.deepansh.kernel.config.KernelProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-agent rolling token accounting.
 *
 * {@link #reserve} is an atomic check-and-increment per agent: either the whole
 * amount fits and is consumed, or nothing changes and {@link QuotaExceededException}
 * is thrown. Different agents never contend with each other.
 */
@Component
@Slf4j
public class QuotaScheduler {

    private final Map<String, QuotaWindow> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final KernelProperties properties;

    public QuotaScheduler(Clock clock, KernelProperties properties) {
        this.clock = clock;
        this.properties = properties;
    }

    public void register(String agentId, long hourlyTokenLimit) {
        windows.put(agentId, new QuotaWindow(hourlyTokenLimit, windowLength()));
        log.debug("Quota window registered [agent={}, limit={}]", agentId, hourlyTokenLimit);
    }

    public void remove(String agentId) {
        windows.remove(agentId);
    }

    public void reserve(String agentId, long tokens) {
        QuotaWindow window = window(agentId);
        synchronized (window) {
            Instant now = clock.instant();
            window.expireIfNeeded(now);
            if (!window.fits(tokens)) {
                Instant resetAt = window.resetAt(now);
                log.warn("Quota exceeded [agent={}, requested={}, consumed={}, limit={}, resetAt={}]",
                        agentId, tokens, window.consumed(), window.limit(), resetAt);
                throw new QuotaExceededException(agentId, tokens, window.remaining(), resetAt);
            }
            window.consume(tokens, now);
        }
    }

    public void resetIfExpired(String agentId) {
        QuotaWindow window = window(agentId);
        synchronized (window) {
            if (window.expireIfNeeded(clock.instant())) {
                log.debug("Quota window reset [agent={}]", agentId);
            }
        }
    }

    /**
     * Reconciles a reservation with the tokens actually used. Over-estimates are refunded;
     * under-estimates are charged even if that pushes the window past its limit, since the
     * tokens are already spent.
     */
    public void settle(String agentId, long reserved, long actual) {
        QuotaWindow window = windows.get(agentId);
        if (window == null) return;
        synchronized (window) {
            if (actual < reserved) {
                window.refund(reserved - actual);
            } else if (actual > reserved) {
                window.consume(actual - reserved, clock.instant());
            }
        }
    }

    public QuotaUsage usage(String agentId) {
        QuotaWindow window = window(agentId);
        synchronized (window) {
            Instant now = clock.instant();
            window.expireIfNeeded(now);
            return new QuotaUsage(agentId, window.limit(), window.consumed(),
                    window.windowStart(), window.resetAt(now));
        }
    }

    private QuotaWindow window(String agentId) {
        return windows.computeIfAbsent(agentId,
                id -> new QuotaWindow(properties.getQuota().getDefaultHourlyTokens(), windowLength()));
    }

    private Duration windowLength() {
        return Duration.ofSeconds(properties.getQuota().getWindowSeconds());
    }
}
