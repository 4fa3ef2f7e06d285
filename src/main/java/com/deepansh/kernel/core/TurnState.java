package com.deepansh.kernel.core;

public enum TurnState {
    DRAFTING,
    TOOL_EXECUTING,
    COMPLETED,
    FAILED
}
