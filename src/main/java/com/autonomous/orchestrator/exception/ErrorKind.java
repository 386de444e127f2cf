package com.autonomous.orchestrator.exception;

public enum ErrorKind {
    INVALID_TASK,
    DUPLICATE_TASK,
    TASK_NOT_FOUND,
    ILLEGAL_TRANSITION,
    INVALID_AGENT,
    DUPLICATE_AGENT,
    UNKNOWN_AGENT,
    AGENT_BUSY
}
