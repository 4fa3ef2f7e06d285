package com.deepansh.kernel.llm;

import com.deepansh.kernel.exception.AgentException;

/** Driver failure that ends the turn. */
public class LlmDriverException extends AgentException {

    public LlmDriverException(String message) {
        super(message);
    }

    public LlmDriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
