package com.deepansh.kernel.capability;

/**
 * Kinds of permission an agent can hold. {@link Scope} says how the
 * capability's value participates in matching.
 */
public enum CapabilityType {

    FILE_READ(Scope.PATTERN),
    FILE_WRITE(Scope.PATTERN),
    NET_CONNECT(Scope.PATTERN),
    TOOL_INVOKE(Scope.PATTERN),
    TOOL_ALL(Scope.NONE),
    AGENT_SPAWN(Scope.NONE),
    AGENT_MESSAGE(Scope.PATTERN),
    AGENT_KILL(Scope.PATTERN),
    MEMORY_READ(Scope.PATTERN),
    MEMORY_WRITE(Scope.PATTERN),
    SHELL_EXEC(Scope.PATTERN),
    LLM_MAX_TOKENS(Scope.BOUND);

    public enum Scope {
        /** Value is a glob pattern (when granted) or a concrete target (when required) */
        PATTERN,
        /** No value; presence is the grant */
        NONE,
        /** Numeric upper bound */
        BOUND
    }

    private final Scope scope;

    CapabilityType(Scope scope) {
        this.scope = scope;
    }

    public Scope scope() {
        return scope;
    }
}
