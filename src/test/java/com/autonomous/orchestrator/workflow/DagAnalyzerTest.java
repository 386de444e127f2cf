package com.autonomous.orchestrator.workflow;

import com.autonomous.orchestrator.model.Task;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DagAnalyzerTest {

    private final DagAnalyzer analyzer = new DagAnalyzer();

    @Test
    void shouldMeasureLinearChain() {
        DagAnalyzer.DagMetrics metrics = analyzer.analyze(List.of(
            task("t1"),
            task("t2", "t1"),
            task("t3", "t2")
        ));

        assertEquals(3, metrics.getTaskCount());
        assertEquals(1, metrics.getMaxParallelism());
        assertEquals(3, metrics.getCriticalPathLength());
        assertFalse(metrics.isHasCycle());
    }

    @Test
    void shouldMeasureDiamondWidth() {
        DagAnalyzer.DagMetrics metrics = analyzer.analyze(List.of(
            task("t1"),
            task("t2", "t1"),
            task("t3", "t1"),
            task("t4", "t2", "t3")
        ));

        assertEquals(2, metrics.getMaxParallelism());
        assertEquals(3, metrics.getCriticalPathLength());
        assertEquals(0, metrics.getMissingDependencies());
    }

    @Test
    void shouldMarkCycle() {
        DagAnalyzer.DagMetrics metrics = analyzer.analyze(List.of(
            task("t1", "t3"),
            task("t2", "t1"),
            task("t3", "t2")
        ));

        assertTrue(metrics.isHasCycle());
    }

    @Test
    void shouldCountMissingDependencies() {
        DagAnalyzer.DagMetrics metrics = analyzer.analyze(List.of(
            task("t1", "ghost"),
            task("t2", "t1", "phantom")
        ));

        assertEquals(2, metrics.getMissingDependencies());
        assertEquals(2, metrics.getCriticalPathLength());
        assertFalse(metrics.isHasCycle());
    }

    @Test
    void shouldReturnEmptyMetricsForNoTasks() {
        DagAnalyzer.DagMetrics metrics = analyzer.analyze(List.of());

        assertEquals(0, metrics.getTaskCount());
        assertEquals(0, metrics.getCriticalPathLength());
    }

    private Task task(String id, String... deps) {
        Task task = new Task();
        task.setId(id);
        task.setDescription("task " + id);
        task.setDependencies(new ArrayList<>(List.of(deps)));
        return task;
    }
}
