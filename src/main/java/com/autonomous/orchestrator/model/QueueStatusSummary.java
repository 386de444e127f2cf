package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Task counts by status. A blocked task is pending but can never become ready,
 * and is counted only under {@code blocked}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatusSummary {
    private int total;
    private int pending;
    private int inProgress;
    private int completed;
    private int failed;
    private int blocked;

    public int bucketSum() {
        return pending + inProgress + completed + failed + blocked;
    }
}
