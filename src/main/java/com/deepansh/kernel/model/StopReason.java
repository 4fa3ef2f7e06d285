package com.deepansh.kernel.model;

public enum StopReason {
    END_TURN,
    TOOL_USE,
    MAX_TOKENS
}
