package com.autonomous.orchestrator.exception;

import lombok.Getter;

/**
 * Raised for definitional mistakes in how the queue or pool is driven.
 * Never retried; execution failures are reported as task state instead.
 */
@Getter
public class OrchestrationException extends RuntimeException {
    private final ErrorKind kind;

    public OrchestrationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
