package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectResult {
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_INCOMPLETE = "incomplete";

    private String objective;
    private int tasksTotal;
    private int tasksCompleted;
    private int tasksFailed;
    private int iterations;
    private double durationSeconds;
    private String status;
    private StopReason stopReason;
    private int loopsDetected;

    public boolean isCompleted() {
        return STATUS_COMPLETED.equals(status);
    }
}
