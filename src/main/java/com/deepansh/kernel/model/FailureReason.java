package com.deepansh.kernel.model;

/**
 * Why a turn ended in {@link TurnStatus#FAILED}. Lets the caller decide
 * whether to retry later, alert, or terminate the agent.
 */
public enum FailureReason {
    QUOTA_EXCEEDED,
    CIRCUIT_BREAK,
    DRIVER_FAILURE,
    CANCELLED,
    INTERNAL
}
