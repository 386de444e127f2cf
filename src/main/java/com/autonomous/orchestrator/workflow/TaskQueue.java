package com.autonomous.orchestrator.workflow;

import com.autonomous.orchestrator.exception.ErrorKind;
import com.autonomous.orchestrator.exception.OrchestrationException;
import com.autonomous.orchestrator.model.QueueStatusSummary;
import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dependency graph of tasks for a single run.
 * <p>
 * Tasks move PENDING -> IN_PROGRESS -> COMPLETED | FAILED and never go back.
 * A task is ready when it is pending and every dependency is completed. A
 * dependency on an id the queue does not know keeps the task pending for good;
 * it shows up in the {@code blocked} bucket of {@link #getStatusSummary()}.
 * <p>
 * Not thread-safe. The executor's control loop is the only writer.
 */
@Slf4j
public class TaskQueue {

    private final Map<String, Task> tasks = new LinkedHashMap<>();

    public Task addTask(String taskId, String description, List<String> dependencies) {
        return addTask(taskId, description, dependencies, List.of());
    }

    public Task addTask(String taskId, String description, List<String> dependencies,
                        List<String> requiredCapabilities) {
        if (taskId == null || taskId.isBlank()) {
            throw new OrchestrationException(ErrorKind.INVALID_TASK, "Task id must not be blank");
        }
        if (tasks.containsKey(taskId)) {
            throw new OrchestrationException(ErrorKind.DUPLICATE_TASK, "Task already registered: " + taskId);
        }

        Task task = new Task();
        task.setId(taskId);
        task.setDescription(description);
        if (dependencies != null) {
            task.setDependencies(new ArrayList<>(new LinkedHashSet<>(dependencies)));
        }
        if (requiredCapabilities != null) {
            task.setRequiredCapabilities(new ArrayList<>(requiredCapabilities));
        }
        task.setCreatedAt(Instant.now());
        tasks.put(taskId, task);

        log.debug("Task added: id={}, deps={}", taskId, task.getDependencies());
        return task.copy();
    }

    public List<Task> getReadyTasks() {
        List<Task> ready = new ArrayList<>();
        for (Task task : tasks.values()) {
            if (isReady(task)) {
                ready.add(task.copy());
            }
        }
        return ready;
    }

    public Task markInProgress(String taskId, String agentName) {
        Task task = require(taskId);
        if (task.getStatus() != TaskStatus.PENDING) {
            throw illegalTransition(task, TaskStatus.IN_PROGRESS);
        }
        if (!isReady(task)) {
            throw new OrchestrationException(ErrorKind.ILLEGAL_TRANSITION,
                "Task " + taskId + " has unfinished dependencies: " + task.getDependencies());
        }
        task.setStatus(TaskStatus.IN_PROGRESS);
        task.setAssignedAgent(agentName);
        task.setStartedAt(Instant.now());
        log.debug("Task started: id={}, agent={}", taskId, agentName);
        return task.copy();
    }

    public Task markComplete(String taskId, Object result) {
        Task task = requireInProgress(taskId, TaskStatus.COMPLETED);
        task.setStatus(TaskStatus.COMPLETED);
        task.setResult(result);
        task.setCompletedAt(Instant.now());
        log.debug("Task completed: id={}", taskId);
        return task.copy();
    }

    public Task markFailed(String taskId, String errorMessage) {
        Task task = requireInProgress(taskId, TaskStatus.FAILED);
        task.setStatus(TaskStatus.FAILED);
        task.setErrorMessage(errorMessage);
        task.setCompletedAt(Instant.now());
        log.debug("Task failed: id={}, error={}", taskId, errorMessage);
        return task.copy();
    }

    public boolean isComplete() {
        return tasks.values().stream().allMatch(task -> task.getStatus() == TaskStatus.COMPLETED);
    }

    public boolean hasFailures() {
        return countByStatus(TaskStatus.FAILED) > 0;
    }

    public int countByStatus(TaskStatus status) {
        return (int) tasks.values().stream().filter(task -> task.getStatus() == status).count();
    }

    public int size() {
        return tasks.size();
    }

    public Optional<Task> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId)).map(Task::copy);
    }

    public List<Task> getAllTasks() {
        List<Task> all = new ArrayList<>(tasks.size());
        for (Task task : tasks.values()) {
            all.add(task.copy());
        }
        return all;
    }

    /**
     * Pending tasks that can never become ready: a dependency is unknown,
     * failed, blocked itself, or part of a dependency cycle.
     */
    public List<String> getBlockedTaskIds() {
        Map<String, Boolean> memo = new HashMap<>();
        List<String> blocked = new ArrayList<>();
        for (Task task : tasks.values()) {
            if (task.getStatus() == TaskStatus.PENDING && !canEventuallyRun(task.getId(), memo)) {
                blocked.add(task.getId());
            }
        }
        return blocked;
    }

    public QueueStatusSummary getStatusSummary() {
        int blocked = getBlockedTaskIds().size();
        return QueueStatusSummary.builder()
            .total(tasks.size())
            .pending(countByStatus(TaskStatus.PENDING) - blocked)
            .inProgress(countByStatus(TaskStatus.IN_PROGRESS))
            .completed(countByStatus(TaskStatus.COMPLETED))
            .failed(countByStatus(TaskStatus.FAILED))
            .blocked(blocked)
            .build();
    }

    private boolean isReady(Task task) {
        if (task.getStatus() != TaskStatus.PENDING) {
            return false;
        }
        for (String dependency : task.getDependencies()) {
            Task upstream = tasks.get(dependency);
            if (upstream == null || upstream.getStatus() != TaskStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    // memo: FALSE is written before descending, so a cycle resolves to "cannot run"
    private boolean canEventuallyRun(String taskId, Map<String, Boolean> memo) {
        Boolean known = memo.get(taskId);
        if (known != null) {
            return known;
        }
        Task task = tasks.get(taskId);
        if (task == null || task.getStatus() == TaskStatus.FAILED) {
            return false;
        }
        if (task.getStatus() != TaskStatus.PENDING) {
            return true;
        }
        memo.put(taskId, Boolean.FALSE);
        boolean runnable = true;
        for (String dependency : task.getDependencies()) {
            if (!canEventuallyRun(dependency, memo)) {
                runnable = false;
                break;
            }
        }
        memo.put(taskId, runnable);
        return runnable;
    }

    private Task require(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new OrchestrationException(ErrorKind.TASK_NOT_FOUND, "Unknown task: " + taskId);
        }
        return task;
    }

    private Task requireInProgress(String taskId, TaskStatus target) {
        Task task = require(taskId);
        if (task.getStatus() != TaskStatus.IN_PROGRESS) {
            throw illegalTransition(task, target);
        }
        return task;
    }

    private OrchestrationException illegalTransition(Task task, TaskStatus target) {
        return new OrchestrationException(ErrorKind.ILLEGAL_TRANSITION,
            String.format("Task %s cannot move from %s to %s", task.getId(), task.getStatus(), target));
    }
}
