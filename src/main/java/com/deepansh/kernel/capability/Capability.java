package com.deepansh.kernel.capability;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * An immutable permission grant, e.g. {@code FileRead("/data/*")} or {@code LlmMaxTokens(4096)}.
 *
 * {@code value} holds the pattern or target for pattern-scoped types and is null otherwise;
 * {@code bound} is only meaningful for {@link CapabilityType#LLM_MAX_TOKENS}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Capability(CapabilityType type, String value, Long bound) {

    public Capability {
        Objects.requireNonNull(type, "type");
        switch (type.scope()) {
            case PATTERN -> {
                if (value == null || value.isBlank()) {
                    throw new IllegalArgumentException(type + " requires a pattern");
                }
                bound = null;
            }
            case NONE -> {
                value = null;
                bound = null;
            }
            case BOUND -> {
                if (bound == null || bound < 0) {
                    throw new IllegalArgumentException(type + " requires a non-negative bound");
                }
                value = null;
            }
        }
    }

    public static Capability fileRead(String pattern)     { return new Capability(CapabilityType.FILE_READ, pattern, null); }
    public static Capability fileWrite(String pattern)    { return new Capability(CapabilityType.FILE_WRITE, pattern, null); }
    public static Capability netConnect(String hostPort)  { return new Capability(CapabilityType.NET_CONNECT, hostPort, null); }
    public static Capability toolInvoke(String name)      { return new Capability(CapabilityType.TOOL_INVOKE, name, null); }
    public static Capability toolAll()                    { return new Capability(CapabilityType.TOOL_ALL, null, null); }
    public static Capability agentSpawn()                 { return new Capability(CapabilityType.AGENT_SPAWN, null, null); }
    public static Capability agentMessage(String pattern) { return new Capability(CapabilityType.AGENT_MESSAGE, pattern, null); }
    public static Capability agentKill(String pattern)    { return new Capability(CapabilityType.AGENT_KILL, pattern, null); }
    public static Capability memoryRead(String scope)     { return new Capability(CapabilityType.MEMORY_READ, scope, null); }
    public static Capability memoryWrite(String scope)    { return new Capability(CapabilityType.MEMORY_WRITE, scope, null); }
    public static Capability shellExec(String pattern)    { return new Capability(CapabilityType.SHELL_EXEC, pattern, null); }
    public static Capability llmMaxTokens(long max)       { return new Capability(CapabilityType.LLM_MAX_TOKENS, null, max); }

    @Override
    public String toString() {
        return switch (type.scope()) {
            case PATTERN -> type + "(" + value + ")";
            case NONE -> type.toString();
            case BOUND -> type + "(" + bound + ")";
        };
    }
}
