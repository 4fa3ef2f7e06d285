package com.deepansh.kernel.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancels one running turn. Cancelling sets the flag and interrupts the thread running
 * the turn, which wakes it from tool and sandbox waits; the loop checks the flag between
 * phases.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Thread owner;

    public CancellationToken(Thread owner) {
        this.owner = owner;
    }

    public static CancellationToken none() {
        return new CancellationToken(null);
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true) && owner != null) {
            owner.interrupt();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(String agentId) {
        if (cancelled.get()) {
            throw new TurnCancelledException(agentId);
        }
    }
}
