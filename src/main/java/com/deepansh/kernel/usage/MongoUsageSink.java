package com.deepansh.kernel.usage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Persists usage events to MongoDB on the usage executor; never blocks the turn.
 * A failed write is logged and dropped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MongoUsageSink implements UsageSink {

    private final UsageEventRepository repository;

    @Override
    @Async("usageTaskExecutor")
    public void record(UsageEvent event) {
        try {
            repository.save(event);
            log.info("Usage recorded [agent={}, status={}, in={}, out={}, cost=${}]",
                    event.getAgentId(), event.getStatus(), event.getTokensIn(), event.getTokensOut(),
                    String.format("%.6f", event.getCostEstimateUsd()));
        } catch (Exception e) {
            log.error("Failed to persist usage event [agent={}]", event.getAgentId(), e);
        }
    }
}
