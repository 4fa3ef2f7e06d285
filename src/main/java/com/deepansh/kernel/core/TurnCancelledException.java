package com.deepansh.kernel.core;

import com.deepansh.kernel.exception.AgentException;

public class TurnCancelledException extends AgentException {

    public TurnCancelledException(String agentId) {
        super("Turn cancelled for agent " + agentId);
    }
}
