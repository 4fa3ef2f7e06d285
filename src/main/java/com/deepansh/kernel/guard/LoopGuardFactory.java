package com.deepansh.kernel.guard;

import com.deepansh.kernel.config.KernelProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/** Hands out a fresh {@link LoopGuard} per run. */
@Component
public class LoopGuardFactory {

    private final KernelProperties properties;
    private final ObjectMapper objectMapper;

    public LoopGuardFactory(KernelProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public LoopGuard newRun() {
        return new LoopGuard(properties.getLoopGuard(), objectMapper);
    }
}
