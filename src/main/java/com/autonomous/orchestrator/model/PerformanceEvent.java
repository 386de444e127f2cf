package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceEvent {
    private Instant timestamp;
    private String agentName;
    private String taskId;
    private String phase;
    private boolean success;
    private double durationSeconds;
    private Double costUsd;
}
