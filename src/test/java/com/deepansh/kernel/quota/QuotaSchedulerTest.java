package com.deepansh.kernel.quota;

import com.deepansh.kernel.config.KernelProperties;
import com.deepansh.kernel.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuotaSchedulerTest {

    private static final Instant START = Instant.parse("2026-01-01T10:00:00Z");

    private MutableClock clock;
    private QuotaScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        scheduler = new QuotaScheduler(clock, new KernelProperties());
        scheduler.register("agent", 100);
    }

    @Test
    void reserve_withinLimit_consumes() {
        scheduler.reserve("agent", 60);
        scheduler.reserve("agent", 40);

        QuotaUsage usage = scheduler.usage("agent");
        assertThat(usage.consumed()).isEqualTo(100);
        assertThat(usage.windowStart()).isEqualTo(START);
    }

    @Test
    void reserve_overLimit_throwsAndConsumesNothing() {
        scheduler.reserve("agent", 70);

        assertThatThrownBy(() -> scheduler.reserve("agent", 31))
                .isInstanceOf(QuotaExceededException.class)
                .satisfies(e -> {
                    QuotaExceededException q = (QuotaExceededException) e;
                    assertThat(q.getRemaining()).isEqualTo(30);
                    assertThat(q.getResetAt()).isEqualTo(START.plusSeconds(3600));
                });
        assertThat(scheduler.usage("agent").consumed()).isEqualTo(70);
    }

    @Test
    void reserve_afterWindowExpires_startsFresh() {
        scheduler.reserve("agent", 100);
        clock.advance(Duration.ofSeconds(3601));

        scheduler.reserve("agent", 90);

        QuotaUsage usage = scheduler.usage("agent");
        assertThat(usage.consumed()).isEqualTo(90);
        assertThat(usage.windowStart()).isEqualTo(START.plusSeconds(3601));
    }

    @Test
    void reserve_justBeforeExpiry_isStillLimited() {
        scheduler.reserve("agent", 100);
        clock.advance(Duration.ofSeconds(3599));

        assertThatThrownBy(() -> scheduler.reserve("agent", 1)).isInstanceOf(QuotaExceededException.class);
    }

    @Test
    void settle_refundsOverEstimate() {
        scheduler.reserve("agent", 80);
        scheduler.settle("agent", 80, 30);

        assertThat(scheduler.usage("agent").consumed()).isEqualTo(30);
    }

    @Test
    void settle_chargesUnderEstimateEvenPastLimit() {
        scheduler.reserve("agent", 90);
        scheduler.settle("agent", 90, 120);

        assertThat(scheduler.usage("agent").consumed()).isEqualTo(120);
        assertThatThrownBy(() -> scheduler.reserve("agent", 1)).isInstanceOf(QuotaExceededException.class);
    }

    @Test
    void agentsHaveIndependentWindows() {
        scheduler.register("other", 10);
        scheduler.reserve("agent", 100);

        scheduler.reserve("other", 10);
        assertThat(scheduler.usage("other").consumed()).isEqualTo(10);
    }

    @Test
    void usage_beforeFirstUse_hasNoWindowStart() {
        QuotaUsage usage = scheduler.usage("agent");
        assertThat(usage.windowStart()).isNull();
        assertThat(usage.limit()).isEqualTo(100);
    }
}
