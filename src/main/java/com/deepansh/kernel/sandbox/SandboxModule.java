package com.deepansh.kernel.sandbox;

import com.deepansh.kernel.capability.Capability;

import java.util.List;
import java.util.Map;

/**
 * An untrusted tool module. {@code source} is JavaScript that defines a global
 * {@code execute(input)} function returning a JSON-serializable value; host services
 * are reached through {@code kernel.call(method, params)}.
 *
 * @param requiredCapabilities checked against the caller's grant before the source is even parsed
 */
public record SandboxModule(String name,
                            String description,
                            String source,
                            List<Capability> requiredCapabilities,
                            Map<String, Object> inputSchema) {

    public SandboxModule {
        requiredCapabilities = requiredCapabilities != null ? List.copyOf(requiredCapabilities) : List.of();
        inputSchema = inputSchema != null ? inputSchema : Map.of("type", "object", "properties", Map.of());
    }

    public static SandboxModule anonymous(String source) {
        return new SandboxModule("anonymous", "", source, List.of(), null);
    }
}
