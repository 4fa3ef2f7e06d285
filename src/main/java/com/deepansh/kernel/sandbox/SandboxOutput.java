package com.deepansh.kernel.sandbox;

import com.fasterxml.jackson.databind.JsonNode;

public record SandboxOutput(JsonNode output, long elapsedMs, int hostCalls, long boundaryBytes) {
}
