package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressSnapshot {
    private QueueStatusSummary queue;
    private PoolStatus agentPool;
    private List<Task> tasksInQueue;
}
