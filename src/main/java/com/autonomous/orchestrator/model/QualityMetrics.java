package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityMetrics {
    public static final String STATUS_NO_DATA = "no_data";
    public static final String STATUS_OK = "ok";

    private String status;
    private int iterations;
    private Double currentCoverage;
    private Double currentQualityScore;
    private int totalTasksCompleted;
    private CoverageTrend coverageTrend;

    public static QualityMetrics noData() {
        return QualityMetrics.builder()
            .status(STATUS_NO_DATA)
            .coverageTrend(CoverageTrend.INSUFFICIENT_DATA)
            .build();
    }
}
