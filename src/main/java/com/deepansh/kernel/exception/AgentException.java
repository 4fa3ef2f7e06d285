package com.deepansh.kernel.exception;

/**
 * Base unchecked exception for the kernel.
 * Subclasses distinguish the cases the HTTP layer and the loop treat differently.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
