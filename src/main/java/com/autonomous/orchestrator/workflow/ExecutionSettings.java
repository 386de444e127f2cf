package com.autonomous.orchestrator.workflow;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class ExecutionSettings {
    @Builder.Default
    private final int maxParallel = 3;
    @Builder.Default
    private final int maxIterations = 10;
    // convergence is advisory unless this is set
    @Builder.Default
    private final boolean honorConvergence = false;
    @Builder.Default
    private final String phase = "execution";

    public static ExecutionSettings defaults() {
        return ExecutionSettings.builder().build();
    }
}
