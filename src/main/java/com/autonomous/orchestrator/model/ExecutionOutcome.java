package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionOutcome {
    private boolean success;
    private Object result;
    private String error;
    private Double costUsd;

    public static ExecutionOutcome success(Object result) {
        return ExecutionOutcome.builder().success(true).result(result).build();
    }

    public static ExecutionOutcome failure(String error) {
        return ExecutionOutcome.builder().success(false).error(error).build();
    }
}
