package com.autonomous.orchestrator.workflow;

import com.autonomous.orchestrator.model.IterationRecord;
import com.autonomous.orchestrator.model.PerformanceEvent;

/**
 * Sink for task and iteration metrics. Failures inside a recorder are logged
 * by the executor and never stop a run.
 */
public interface PerformanceRecorder {

    PerformanceRecorder NO_OP = event -> {
    };

    void recordTaskPerformance(PerformanceEvent event);

    default void recordIteration(IterationRecord record) {
    }
}
