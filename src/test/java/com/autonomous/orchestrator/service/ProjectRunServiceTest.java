package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.AgentInstance;
import com.autonomous.orchestrator.model.AgentProfile;
import com.autonomous.orchestrator.model.ExecutionOutcome;
import com.autonomous.orchestrator.model.ProgressSnapshot;
import com.autonomous.orchestrator.model.ProjectResult;
import com.autonomous.orchestrator.model.StopReason;
import com.autonomous.orchestrator.model.SubtaskSpec;
import com.autonomous.orchestrator.workflow.MultiAgentExecutor;
import com.autonomous.orchestrator.workflow.QualityProbe;
import com.autonomous.orchestrator.workflow.Supervisor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProjectRunServiceTest {

    @Mock
    private RosterLoaderService rosterLoader;

    private PerformanceTrackerService performanceTracker;
    private ExecutorService threadPool;
    private ProjectRunService runService;

    @BeforeEach
    void setUp() {
        performanceTracker = new PerformanceTrackerService();
        performanceTracker.setPersist(false);
        threadPool = Executors.newFixedThreadPool(2);
        runService = new ProjectRunService(rosterLoader, performanceTracker, threadPool);
    }

    @AfterEach
    void tearDown() {
        threadPool.shutdownNow();
    }

    @Test
    void shouldRunObjectiveAgainstLoadedRoster() {
        when(rosterLoader.loadRoster()).thenReturn(List.of(AgentProfile.of("python-expert", "python")));
        RecordingSupervisor supervisor = new RecordingSupervisor();

        ProjectResult result = runService.runProject("Build a CLI", supervisor);

        assertEquals(StopReason.COMPLETED, result.getStopReason());
        assertEquals(2, result.getTasksCompleted());
        assertEquals("python-expert", supervisor.agentsByTask.get("parse"));
        assertEquals(2, performanceTracker.getAgentStats("python-expert").orElseThrow().getSucceeded());
        verify(rosterLoader, times(1)).loadRoster();
    }

    @Test
    void shouldPassHandlesToAgents() {
        when(rosterLoader.loadRoster()).thenReturn(List.of(AgentProfile.of("python-expert", "python")));
        RecordingSupervisor supervisor = new RecordingSupervisor();

        runService.runProject("Build a CLI", supervisor, QualityProbe.NONE, Map.of("python-expert", "session-42"));

        assertEquals("session-42", supervisor.handlesByAgent.get("python-expert"));
    }

    @Test
    void shouldApplyConfiguredLimits() {
        when(rosterLoader.loadRoster()).thenReturn(List.of());
        runService.setMaxParallel(1);
        runService.setMaxIterations(1);

        ProjectResult result = runService.runProject("Build a CLI", new RecordingSupervisor());

        assertEquals(StopReason.ITERATION_LIMIT, result.getStopReason());
        assertEquals(1, result.getTasksCompleted());
    }

    @Test
    void shouldBuildFreshComponentsPerRun() {
        when(rosterLoader.loadRoster()).thenReturn(List.of());

        MultiAgentExecutor first = runService.newExecutor(new RecordingSupervisor(), QualityProbe.NONE, Map.of());
        MultiAgentExecutor second = runService.newExecutor(new RecordingSupervisor(), QualityProbe.NONE, Map.of());

        assertNotSame(first.getTaskQueue(), second.getTaskQueue());
        assertNotSame(first.getAgentPool(), second.getAgentPool());
        assertNotSame(first.getQualityMonitor(), second.getQualityMonitor());
        assertFalse(first.getSettings().isHonorConvergence());
    }

    @Test
    void shouldExposeProgressOfLastRun() {
        assertTrue(runService.getProgress().isEmpty());
        when(rosterLoader.loadRoster()).thenReturn(List.of());

        runService.runProject("Build a CLI", new RecordingSupervisor());
        ProgressSnapshot progress = runService.getProgress().orElseThrow();

        assertEquals(2, progress.getQueue().getCompleted());
    }

    private static class RecordingSupervisor implements Supervisor {
        private final Map<String, String> agentsByTask = new ConcurrentHashMap<>();
        private final Map<String, Object> handlesByAgent = new ConcurrentHashMap<>();

        @Override
        public List<SubtaskSpec> decompose(String objective) {
            return List.of(
                SubtaskSpec.of("parse", "Parse arguments"),
                SubtaskSpec.of("run", "Run the command", "parse")
            );
        }

        @Override
        public ExecutionOutcome execute(String taskId, String description, AgentInstance agent) {
            agentsByTask.put(taskId, agent.getName());
            if (agent.getHandle() != null) {
                handlesByAgent.put(agent.getName(), agent.getHandle());
            }
            return ExecutionOutcome.success(description + " done");
        }
    }
}
