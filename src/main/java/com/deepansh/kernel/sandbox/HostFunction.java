package com.deepansh.kernel.sandbox;

import com.deepansh.kernel.capability.Capability;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.function.Function;

/**
 * A service the host exposes to sandboxed modules.
 *
 * @param requirements capabilities a call with the given params needs; all must be covered
 *                     by the run's grant before {@code handler} is invoked
 */
public record HostFunction(String name,
                           Function<JsonNode, List<Capability>> requirements,
                           Handler handler) {

    @FunctionalInterface
    public interface Handler {
        JsonNode handle(JsonNode params) throws Exception;
    }

    public static HostFunction unrestricted(String name, Handler handler) {
        return new HostFunction(name, params -> List.of(), handler);
    }
}
