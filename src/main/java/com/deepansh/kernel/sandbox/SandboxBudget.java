package com.deepansh.kernel.sandbox;

import com.deepansh.kernel.config.KernelProperties;

import java.time.Duration;

/**
 * The two independent meters applied to one run, plus the memory ceiling.
 *
 * @param fuelLimit      guest statements allowed; 0 disables instruction metering
 * @param timeout        wall-clock bound, enforced from outside the guest thread
 * @param maxMemoryBytes ceiling on heap allocated by the guest thread during one run
 */
public record SandboxBudget(long fuelLimit, Duration timeout, long maxMemoryBytes) {

    public SandboxBudget {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Sandbox timeout must be positive");
        }
        if (fuelLimit < 0 || maxMemoryBytes <= 0) {
            throw new IllegalArgumentException("Sandbox limits must be non-negative");
        }
    }

    public static SandboxBudget from(KernelProperties.Sandbox config) {
        return new SandboxBudget(config.getFuelLimit(), Duration.ofMillis(config.getTimeoutMs()),
                config.getMaxMemoryBytes());
    }
}
