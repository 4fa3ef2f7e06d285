package com.deepansh.kernel.capability;

import com.deepansh.kernel.exception.AgentException;

public class PrivilegeEscalationException extends AgentException {

    public PrivilegeEscalationException(String message) {
        super(message);
    }
}
