package com.deepansh.kernel.core;

import com.deepansh.kernel.exception.AgentException;

/** A turn is already running for this agent; its session has a single writer. */
public class AgentBusyException extends AgentException {

    public AgentBusyException(String agentId) {
        super("Agent " + agentId + " is already running a turn");
    }
}
