package com.deepansh.kernel.sandbox;

import lombok.extern.slf4j.Slf4j;

import java.lang.management.ManagementFactory;

/**
 * Heap bytes allocated by one sandbox worker thread since the guest started running.
 * Read by the worker itself at host calls and on return, and polled by the watchdog
 * while the guest runs.
 *
 * Counts allocation, not live heap, so a guest that churns through garbage is charged
 * for all of it.
 */
@Slf4j
class AllocationMeter {

    private static final com.sun.management.ThreadMXBean THREADS = threadBean();

    private final long ceiling;
    private volatile long threadId = -1;
    private volatile long baseline;

    AllocationMeter(long ceiling) {
        this.ceiling = ceiling;
    }

    /** Binds the meter to the calling thread and zeroes it. */
    void start() {
        if (THREADS == null) return;
        long id = Thread.currentThread().getId();
        baseline = THREADS.getThreadAllocatedBytes(id);
        threadId = id;
    }

    long allocated() {
        long id = threadId;
        if (THREADS == null || id < 0) return 0;
        long now = THREADS.getThreadAllocatedBytes(id);
        return now < 0 ? 0 : Math.max(0, now - baseline);
    }

    boolean exceeded() {
        return allocated() > ceiling;
    }

    /** Throws MEMORY_EXCEEDED once the ceiling is crossed. */
    void check() {
        if (exceeded()) {
            throw new SandboxException(SandboxErrorKind.MEMORY_EXCEEDED, describe());
        }
    }

    long ceiling() {
        return ceiling;
    }

    String describe() {
        return "Module exceeded memory ceiling of " + ceiling + " bytes";
    }

    private static com.sun.management.ThreadMXBean threadBean() {
        if (ManagementFactory.getThreadMXBean() instanceof com.sun.management.ThreadMXBean bean
                && bean.isThreadAllocatedMemorySupported()) {
            if (!bean.isThreadAllocatedMemoryEnabled()) {
                bean.setThreadAllocatedMemoryEnabled(true);
            }
            return bean;
        }
        log.warn("Per-thread allocation accounting is not available on this JVM; sandbox memory ceiling is not enforced");
        return null;
    }
}
