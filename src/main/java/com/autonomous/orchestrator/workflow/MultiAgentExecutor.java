package com.autonomous.orchestrator.workflow;

import com.autonomous.orchestrator.model.AgentInstance;
import com.autonomous.orchestrator.model.AgentProfile;
import com.autonomous.orchestrator.model.ContinuationDecision;
import com.autonomous.orchestrator.model.ExecutionOutcome;
import com.autonomous.orchestrator.model.IterationRecord;
import com.autonomous.orchestrator.model.PerformanceEvent;
import com.autonomous.orchestrator.model.ProgressSnapshot;
import com.autonomous.orchestrator.model.ProjectResult;
import com.autonomous.orchestrator.model.StopReason;
import com.autonomous.orchestrator.model.SubtaskSpec;
import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Runs one objective to completion across an agent pool.
 * <p>
 * Flow:
 * <pre>
 * decompose(objective) -> register subtasks
 * while (queue incomplete and iterations left) {
 *     ready = queue.readyTasks()
 *     none ready and none running -> deadlock, stop
 *     take up to maxParallel, assign agents, mark in progress
 *     execute the batch concurrently and wait for all of it
 *     apply outcomes, record the iteration
 * }
 * </pre>
 * Queue, pool and monitor are only touched from the calling thread. Worker
 * threads run {@link Supervisor#execute} on a copy of the agent and hand back
 * outcomes. Other threads see progress through the snapshot the calling thread
 * publishes after registration, after each assignment and after each batch.
 */
@Slf4j
public class MultiAgentExecutor {

    /** Executes every task when the roster is empty. */
    public static final String FALLBACK_AGENT = "supervisor";

    private final Supervisor supervisor;
    @Getter
    private final AgentPool agentPool;
    @Getter
    private final TaskQueue taskQueue;
    @Getter
    private final QualityMonitor qualityMonitor;
    private final PerformanceRecorder performanceRecorder;
    private final ExecutorService executorService;
    @Getter
    private final ExecutionSettings settings;
    private final QualityProbe qualityProbe;

    private final AgentInstance fallbackAgent;
    private final DagAnalyzer dagAnalyzer = new DagAnalyzer();

    private volatile ProgressSnapshot progress;

    public MultiAgentExecutor(Supervisor supervisor,
                              AgentPool agentPool,
                              TaskQueue taskQueue,
                              QualityMonitor qualityMonitor,
                              PerformanceRecorder performanceRecorder,
                              ExecutorService executorService,
                              ExecutionSettings settings,
                              QualityProbe qualityProbe) {
        if (settings.getMaxParallel() < 1) {
            throw new IllegalArgumentException("maxParallel must be at least 1, got " + settings.getMaxParallel());
        }
        if (settings.getMaxIterations() < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + settings.getMaxIterations());
        }
        this.supervisor = supervisor;
        this.agentPool = agentPool;
        this.taskQueue = taskQueue;
        this.qualityMonitor = qualityMonitor;
        this.performanceRecorder = performanceRecorder == null ? PerformanceRecorder.NO_OP : performanceRecorder;
        this.executorService = executorService;
        this.settings = settings;
        this.qualityProbe = qualityProbe == null ? QualityProbe.NONE : qualityProbe;
        this.fallbackAgent = new AgentInstance(FALLBACK_AGENT, AgentProfile.of(FALLBACK_AGENT), supervisor);
        publishProgress();
    }

    public ProjectResult executeProject(String objective) {
        long startedAt = System.nanoTime();

        List<SubtaskSpec> subtasks = supervisor.decompose(objective);
        if (subtasks != null) {
            for (SubtaskSpec subtask : subtasks) {
                taskQueue.addTask(subtask.getTaskId(), subtask.getDescription(),
                    subtask.getDependencies(), subtask.getRequiredCapabilities());
            }
        }
        DagAnalyzer.DagMetrics metrics = dagAnalyzer.analyze(taskQueue.getAllTasks());
        log.info("Objective decomposed: tasks={}, width={}, depth={}, missingDeps={}, cycle={}",
            metrics.getTaskCount(), metrics.getMaxParallelism(), metrics.getCriticalPathLength(),
            metrics.getMissingDependencies(), metrics.isHasCycle());
        publishProgress();

        if (taskQueue.size() == 0) {
            return buildResult(objective, 0, 0, startedAt, StopReason.NO_TASKS);
        }

        int iteration = 0;
        int loopsDetected = 0;
        StopReason stopReason = null;

        while (!taskQueue.isComplete() && iteration < settings.getMaxIterations()) {
            iteration++;

            List<Task> ready = taskQueue.getReadyTasks();
            if (ready.isEmpty()) {
                if (taskQueue.countByStatus(TaskStatus.IN_PROGRESS) == 0) {
                    log.warn("Deadlock at iteration {}: no ready tasks, blocked={}, failed={}",
                        iteration, taskQueue.getBlockedTaskIds(), taskQueue.countByStatus(TaskStatus.FAILED));
                    stopReason = StopReason.DEADLOCK;
                    break;
                }
                continue;
            }

            List<Dispatch> batch = assignBatch(ready);
            log.info("Iteration {}: dispatching {} of {} ready tasks", iteration, batch.size(), ready.size());
            publishProgress();

            List<DispatchResult> results = runBatch(batch);
            int completedInBatch = 0;
            for (DispatchResult result : results) {
                if (applyResult(result)) {
                    completedInBatch++;
                    if (qualityMonitor.detectLoop(repetitionKey(result.getDispatch().getTask()),
                        String.valueOf(result.getOutcome().getResult()))) {
                        loopsDetected++;
                    }
                }
            }
            publishProgress();

            IterationRecord record = qualityMonitor.recordIteration(
                iteration, measureCoverage(iteration), null, completedInBatch);
            notifyIteration(record);

            ContinuationDecision decision = qualityMonitor.shouldContinue(iteration);
            if (!decision.isShouldContinue()) {
                if (settings.isHonorConvergence()) {
                    log.info("Stopping at iteration {}: {}", iteration, decision.getReason());
                    stopReason = StopReason.CONVERGED;
                    break;
                }
                log.info("Convergence check advised stopping ({}), continuing", decision.getReason());
            }
        }

        if (stopReason == null) {
            stopReason = taskQueue.isComplete() ? StopReason.COMPLETED : StopReason.ITERATION_LIMIT;
        }
        ProjectResult result = buildResult(objective, iteration, loopsDetected, startedAt, stopReason);
        log.info("Project finished: status={}, reason={}, completed={}/{}, failed={}, iterations={}",
            result.getStatus(), stopReason, result.getTasksCompleted(), result.getTasksTotal(),
            result.getTasksFailed(), iteration);
        return result;
    }

    /**
     * Safe to call from any thread. Returns the latest snapshot published by
     * the thread running {@link #executeProject}.
     */
    public ProgressSnapshot getProgress() {
        return progress;
    }

    private void publishProgress() {
        progress = ProgressSnapshot.builder()
            .queue(taskQueue.getStatusSummary())
            .agentPool(agentPool.getPoolStatus())
            .tasksInQueue(taskQueue.getAllTasks())
            .build();
    }

    private List<Dispatch> assignBatch(List<Task> ready) {
        List<Dispatch> batch = new ArrayList<>();
        for (Task task : ready) {
            if (batch.size() >= settings.getMaxParallel()) {
                break;
            }
            Optional<AgentInstance> agent = selectAgent(task);
            if (agent.isEmpty()) {
                log.debug("No free agent for task {}, deferring", task.getId());
                break;
            }
            taskQueue.markInProgress(task.getId(), agent.get().getName());
            batch.add(new Dispatch(task, agent.get()));
        }
        return batch;
    }

    /**
     * Tasks with required capabilities go to the best matching free agent. When
     * no free agent matches, and for tasks without requirements, the first free
     * agent in roster order takes the task.
     */
    private Optional<AgentInstance> selectAgent(Task task) {
        if (usesFallbackAgent()) {
            AgentInstance view = fallbackAgent.copy();
            view.setCurrentTask(task.getId());
            return Optional.of(view);
        }
        Optional<String> agentName = Optional.empty();
        if (!task.getRequiredCapabilities().isEmpty()) {
            agentName = agentPool.findBestAgent(task.getRequiredCapabilities(), settings.getPhase());
        }
        if (agentName.isEmpty()) {
            agentName = agentPool.getAvailableAgents().stream().findFirst().map(AgentInstance::getName);
        }
        return agentName.map(name -> agentPool.assignTaskToAgent(task.getId(), name));
    }

    private List<DispatchResult> runBatch(List<Dispatch> batch) {
        Semaphore permits = new Semaphore(settings.getMaxParallel());
        List<CompletableFuture<DispatchResult>> futures = new ArrayList<>();
        for (Dispatch dispatch : batch) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                permits.acquireUninterruptibly();
                try {
                    return invoke(dispatch);
                } finally {
                    permits.release();
                }
            }, executorService));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<DispatchResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<DispatchResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private DispatchResult invoke(Dispatch dispatch) {
        Task task = dispatch.getTask();
        long startedAt = System.nanoTime();
        ExecutionOutcome outcome;
        try {
            outcome = supervisor.execute(task.getId(), task.getDescription(), dispatch.getAgent());
            if (outcome == null) {
                outcome = ExecutionOutcome.failure("Supervisor returned no outcome");
            }
        } catch (Throwable e) {
            log.warn("Task execution threw: taskId={}, agent={}", task.getId(), dispatch.getAgent().getName(), e);
            outcome = ExecutionOutcome.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        return new DispatchResult(dispatch, outcome, secondsSince(startedAt));
    }

    /**
     * @return true when the task completed
     */
    private boolean applyResult(DispatchResult result) {
        Task task = result.getDispatch().getTask();
        AgentInstance agent = result.getDispatch().getAgent();
        ExecutionOutcome outcome = result.getOutcome();

        if (outcome.isSuccess()) {
            taskQueue.markComplete(task.getId(), outcome.getResult());
        } else {
            log.warn("Task {} failed on agent {}: {}", task.getId(), agent.getName(), outcome.getError());
            taskQueue.markFailed(task.getId(), outcome.getError());
        }
        releaseAgent(agent, outcome.isSuccess());

        recordPerformance(PerformanceEvent.builder()
            .timestamp(Instant.now())
            .agentName(agent.getName())
            .taskId(task.getId())
            .phase(settings.getPhase())
            .success(outcome.isSuccess())
            .durationSeconds(result.getDurationSeconds())
            .costUsd(outcome.getCostUsd())
            .build());
        return outcome.isSuccess();
    }

    private void releaseAgent(AgentInstance agent, boolean success) {
        if (!usesFallbackAgent()) {
            agentPool.markTaskComplete(agent.getName(), success);
        } else if (success) {
            fallbackAgent.setTasksCompleted(fallbackAgent.getTasksCompleted() + 1);
        } else {
            fallbackAgent.setTasksFailed(fallbackAgent.getTasksFailed() + 1);
        }
    }

    private boolean usesFallbackAgent() {
        return agentPool.size() == 0;
    }

    // retries arrive under new ids, so repeats are keyed by what was asked
    private String repetitionKey(Task task) {
        return task.getDescription() == null ? task.getId() : task.getDescription();
    }

    private Double measureCoverage(int iteration) {
        try {
            OptionalDouble coverage = qualityProbe.measureCoverage(iteration);
            return coverage.isPresent() ? coverage.getAsDouble() : null;
        } catch (RuntimeException e) {
            log.warn("Coverage probe failed at iteration {}", iteration, e);
            return null;
        }
    }

    private void recordPerformance(PerformanceEvent event) {
        try {
            performanceRecorder.recordTaskPerformance(event);
        } catch (RuntimeException e) {
            log.warn("Performance recorder rejected event for task {}", event.getTaskId(), e);
        }
    }

    private void notifyIteration(IterationRecord record) {
        try {
            performanceRecorder.recordIteration(record);
        } catch (RuntimeException e) {
            log.warn("Performance recorder rejected iteration {}", record.getIteration(), e);
        }
    }

    private ProjectResult buildResult(String objective, int iterations, int loopsDetected,
                                      long startedAt, StopReason stopReason) {
        boolean complete = taskQueue.isComplete();
        return ProjectResult.builder()
            .objective(objective)
            .tasksTotal(taskQueue.size())
            .tasksCompleted(taskQueue.countByStatus(TaskStatus.COMPLETED))
            .tasksFailed(taskQueue.countByStatus(TaskStatus.FAILED))
            .iterations(iterations)
            .durationSeconds(secondsSince(startedAt))
            .status(complete ? ProjectResult.STATUS_COMPLETED : ProjectResult.STATUS_INCOMPLETE)
            .stopReason(stopReason)
            .loopsDetected(loopsDetected)
            .build();
    }

    private static double secondsSince(long startedAtNanos) {
        return (System.nanoTime() - startedAtNanos) / 1_000_000_000.0;
    }

    @Getter
    @AllArgsConstructor
    private static final class Dispatch {
        private final Task task;
        private final AgentInstance agent;
    }

    @Getter
    @AllArgsConstructor
    private static final class DispatchResult {
        private final Dispatch dispatch;
        private final ExecutionOutcome outcome;
        private final double durationSeconds;
    }
}
