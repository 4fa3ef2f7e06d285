package com.deepansh.kernel.usage;

/** Receives one event per finished turn. Must not block the caller. */
public interface UsageSink {

    void record(UsageEvent event);
}
