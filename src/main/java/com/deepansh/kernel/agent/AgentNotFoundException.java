package com.deepansh.kernel.agent;

import com.deepansh.kernel.exception.AgentException;

public class AgentNotFoundException extends AgentException {

    public AgentNotFoundException(String agentId) {
        super("Agent not found: " + agentId);
    }
}
