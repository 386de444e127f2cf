package com.autonomous.orchestrator.model;

import lombok.Data;

@Data
public class AgentStats {
    private final String agentName;
    private int succeeded;
    private int failed;
    private double totalDurationSeconds;
    private double totalCostUsd;

    public int getTotal() {
        return succeeded + failed;
    }

    public double getAverageDurationSeconds() {
        return getTotal() == 0 ? 0.0 : totalDurationSeconds / getTotal();
    }

    public double getSuccessRate() {
        return getTotal() == 0 ? 0.0 : (double) succeeded / getTotal();
    }
}
