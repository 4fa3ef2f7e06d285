package com.deepansh.kernel.capability;

import com.deepansh.kernel.exception.AgentException;

public class CapabilityDeniedException extends AgentException {

    public CapabilityDeniedException(String message) {
        super(message);
    }
}
