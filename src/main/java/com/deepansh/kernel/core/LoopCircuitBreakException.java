package com.deepansh.kernel.core;

import com.deepansh.kernel.exception.AgentException;

/** The loop guard tripped: too many tool calls in one turn. Turn-fatal. */
public class LoopCircuitBreakException extends AgentException {

    public LoopCircuitBreakException(int totalCalls) {
        super("Loop guard circuit break after " + totalCalls + " tool calls in one turn");
    }
}
