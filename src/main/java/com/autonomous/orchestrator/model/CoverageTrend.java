package com.autonomous.orchestrator.model;

public enum CoverageTrend {
    IMPROVING,
    DECLINING,
    STABLE,
    INSUFFICIENT_DATA
}
