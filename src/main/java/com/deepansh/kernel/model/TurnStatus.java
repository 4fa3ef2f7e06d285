package com.deepansh.kernel.model;

public enum TurnStatus {
    COMPLETED,
    FAILED
}
