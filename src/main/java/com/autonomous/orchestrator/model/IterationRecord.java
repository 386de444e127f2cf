package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IterationRecord {
    private int iteration;
    private Double coverage;
    private Double qualityScore;
    private int tasksCompleted;
}
