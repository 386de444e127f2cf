package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolStatus {
    private int totalAgents;
    private int availableAgents;
    private int busyAgents;
    // agent name -> current task id, busy agents only
    private Map<String, String> assignments;
}
