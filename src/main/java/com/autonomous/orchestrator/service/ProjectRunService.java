package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.AgentProfile;
import com.autonomous.orchestrator.model.ProgressSnapshot;
import com.autonomous.orchestrator.model.ProjectResult;
import com.autonomous.orchestrator.workflow.AgentPool;
import com.autonomous.orchestrator.workflow.ExecutionSettings;
import com.autonomous.orchestrator.workflow.MultiAgentExecutor;
import com.autonomous.orchestrator.workflow.QualityMonitor;
import com.autonomous.orchestrator.workflow.QualityProbe;
import com.autonomous.orchestrator.workflow.Supervisor;
import com.autonomous.orchestrator.workflow.TaskQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for running an objective. Every run gets its own queue, pool and
 * monitor; only the thread pool and the performance sink are shared.
 */
@Slf4j
@Service
public class ProjectRunService {

    @Value("${orchestrator.executor.max-parallel:3}")
    private int maxParallel = 3;

    @Value("${orchestrator.executor.max-iterations:10}")
    private int maxIterations = 10;

    @Value("${orchestrator.executor.honor-convergence:false}")
    private boolean honorConvergence;

    @Value("${orchestrator.executor.phase:execution}")
    private String phase = "execution";

    @Value("${orchestrator.quality.min-coverage-improvement:0.05}")
    private double minCoverageImprovement = QualityMonitor.DEFAULT_MIN_COVERAGE_IMPROVEMENT;

    @Value("${orchestrator.quality.max-iterations-without-improvement:3}")
    private int maxIterationsWithoutImprovement = QualityMonitor.DEFAULT_MAX_ITERATIONS_WITHOUT_IMPROVEMENT;

    @Value("${orchestrator.quality.similarity-threshold:0.95}")
    private double similarityThreshold = QualityMonitor.DEFAULT_SIMILARITY_THRESHOLD;

    private final RosterLoaderService rosterLoader;
    private final PerformanceTrackerService performanceTracker;
    private final ExecutorService taskExecutionPool;

    private volatile MultiAgentExecutor lastExecutor;

    public ProjectRunService(RosterLoaderService rosterLoader,
                             PerformanceTrackerService performanceTracker,
                             ExecutorService taskExecutionPool) {
        this.rosterLoader = rosterLoader;
        this.performanceTracker = performanceTracker;
        this.taskExecutionPool = taskExecutionPool;
    }

    public void setMaxParallel(int maxParallel) {
        this.maxParallel = maxParallel;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public void setHonorConvergence(boolean honorConvergence) {
        this.honorConvergence = honorConvergence;
    }

    public ProjectResult runProject(String objective, Supervisor supervisor) {
        return runProject(objective, supervisor, QualityProbe.NONE, Map.of());
    }

    public ProjectResult runProject(String objective, Supervisor supervisor, QualityProbe probe) {
        return runProject(objective, supervisor, probe, Map.of());
    }

    /**
     * @param handles per-agent execution handles, keyed by profile name
     */
    public ProjectResult runProject(String objective, Supervisor supervisor, QualityProbe probe,
                                    Map<String, ?> handles) {
        MultiAgentExecutor executor = newExecutor(supervisor, probe, handles);
        lastExecutor = executor;
        log.info("Starting project: objective=\"{}\", agents={}, maxParallel={}, maxIterations={}",
            objective, executor.getAgentPool().size(), maxParallel, maxIterations);
        return executor.executeProject(objective);
    }

    public MultiAgentExecutor newExecutor(Supervisor supervisor, QualityProbe probe, Map<String, ?> handles) {
        List<AgentProfile> roster = rosterLoader.loadRoster();
        ExecutionSettings settings = ExecutionSettings.builder()
            .maxParallel(maxParallel)
            .maxIterations(maxIterations)
            .honorConvergence(honorConvergence)
            .phase(phase)
            .build();
        return new MultiAgentExecutor(
            supervisor,
            new AgentPool(roster, handles),
            new TaskQueue(),
            new QualityMonitor(minCoverageImprovement, maxIterationsWithoutImprovement, similarityThreshold),
            performanceTracker,
            taskExecutionPool,
            settings,
            probe
        );
    }

    /**
     * Latest snapshot published by the most recent run; safe to poll while that run is in flight.
     */
    public Optional<ProgressSnapshot> getProgress() {
        MultiAgentExecutor executor = lastExecutor;
        return executor == null ? Optional.empty() : Optional.of(executor.getProgress());
    }
}
