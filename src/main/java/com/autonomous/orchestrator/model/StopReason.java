package com.autonomous.orchestrator.model;

public enum StopReason {
    COMPLETED,
    NO_TASKS,
    DEADLOCK,
    ITERATION_LIMIT,
    CONVERGED
}
