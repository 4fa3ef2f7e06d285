package com.deepansh.kernel.usage;

import com.deepansh.kernel.config.KernelProperties;
import org.springframework.stereotype.Component;

/** USD estimate from the per-model rate table; unknown models use the default rate. */
@Component
public class CostEstimator {

    private final KernelProperties.Usage config;

    public CostEstimator(KernelProperties properties) {
        this.config = properties.getUsage();
    }

    public double estimate(String model, long tokensIn, long tokensOut) {
        KernelProperties.Usage.ModelRate rate = config.getRates().getOrDefault(model, config.getDefaultRate());
        return tokensIn * rate.getInputPerMillion() / 1_000_000d
                + tokensOut * rate.getOutputPerMillion() / 1_000_000d;
    }
}
