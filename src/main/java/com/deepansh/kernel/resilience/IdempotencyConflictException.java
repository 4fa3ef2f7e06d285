package com.deepansh.kernel.resilience;

import com.deepansh.kernel.exception.AgentException;

/** Another request holding the same idempotency key is still running. */
public class IdempotencyConflictException extends AgentException {

    public IdempotencyConflictException(String idempotencyKey) {
        super("A request with idempotency key '" + idempotencyKey + "' is already in progress");
    }
}
