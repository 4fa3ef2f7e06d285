package com.deepansh.kernel.sandbox;

import com.deepansh.kernel.exception.AgentException;
import lombok.Getter;

@Getter
public class SandboxException extends AgentException {

    private final SandboxErrorKind kind;

    public SandboxException(SandboxErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SandboxException(SandboxErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
