package com.autonomous.orchestrator.workflow;

import com.autonomous.orchestrator.exception.ErrorKind;
import com.autonomous.orchestrator.exception.OrchestrationException;
import com.autonomous.orchestrator.model.QueueStatusSummary;
import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TaskQueueTest {

    private TaskQueue queue;

    @BeforeEach
    void setUp() {
        queue = new TaskQueue();
    }

    @Test
    void shouldReleaseDiamondInDependencyOrder() {
        queue.addTask("A", "Set up project", List.of());
        queue.addTask("B", "Write models", List.of("A"));
        queue.addTask("C", "Write services", List.of("A"));
        queue.addTask("D", "Wire everything", List.of("B", "C"));

        assertEquals(List.of("A"), readyIds());

        finish("A");
        assertEquals(List.of("B", "C"), readyIds());

        finish("B");
        assertEquals(List.of("C"), readyIds());

        finish("C");
        assertEquals(List.of("D"), readyIds());

        finish("D");
        assertTrue(readyIds().isEmpty());
        assertTrue(queue.isComplete());
    }

    @Test
    void shouldRejectDuplicateTaskId() {
        queue.addTask("task1", "First", List.of());

        OrchestrationException error = assertThrows(OrchestrationException.class,
            () -> queue.addTask("task1", "Second", List.of()));

        assertEquals(ErrorKind.DUPLICATE_TASK, error.getKind());
        assertEquals("First", queue.getTask("task1").orElseThrow().getDescription());
    }

    @Test
    void shouldRejectBlankTaskId() {
        OrchestrationException error = assertThrows(OrchestrationException.class,
            () -> queue.addTask(" ", "Nameless", List.of()));

        assertEquals(ErrorKind.INVALID_TASK, error.getKind());
    }

    @Test
    void shouldDropRepeatedDependencyIds() {
        queue.addTask("task1", "Base", List.of());
        Task task = queue.addTask("task2", "Depends twice", List.of("task1", "task1"));

        assertEquals(List.of("task1"), task.getDependencies());
    }

    @Test
    void shouldRecordAgentAndTimestampsThroughLifecycle() {
        queue.addTask("task1", "Test task", List.of());

        Task started = queue.markInProgress("task1", "agent1");
        assertEquals(TaskStatus.IN_PROGRESS, started.getStatus());
        assertEquals("agent1", started.getAssignedAgent());
        assertNotNull(started.getStartedAt());

        Task done = queue.markComplete("task1", "output");
        assertEquals(TaskStatus.COMPLETED, done.getStatus());
        assertEquals("output", done.getResult());
        assertNotNull(done.getCompletedAt());
    }

    @Test
    void shouldMarkTaskFailedWithError() {
        queue.addTask("task1", "Test task", List.of());
        queue.markInProgress("task1", "agent1");

        queue.markFailed("task1", "Error message");

        Task task = queue.getTask("task1").orElseThrow();
        assertEquals(TaskStatus.FAILED, task.getStatus());
        assertEquals("Error message", task.getErrorMessage());
        assertNotNull(task.getCompletedAt());
        assertTrue(queue.hasFailures());
    }

    @Test
    void shouldRejectDoubleCompletion() {
        queue.addTask("task1", "Test task", List.of());
        finish("task1");

        OrchestrationException error = assertThrows(OrchestrationException.class,
            () -> queue.markComplete("task1", "again"));

        assertEquals(ErrorKind.ILLEGAL_TRANSITION, error.getKind());
        assertEquals(1, queue.getStatusSummary().getCompleted());
    }

    @Test
    void shouldRejectCompletingPendingTask() {
        queue.addTask("task1", "Test task", List.of());

        assertThrows(OrchestrationException.class, () -> queue.markComplete("task1", null));
        assertThrows(OrchestrationException.class, () -> queue.markFailed("task1", "nope"));
        assertEquals(TaskStatus.PENDING, queue.getTask("task1").orElseThrow().getStatus());
    }

    @Test
    void shouldRejectRestartingFinishedTask() {
        queue.addTask("task1", "Test task", List.of());
        queue.markInProgress("task1", "agent1");
        queue.markFailed("task1", "boom");

        OrchestrationException error = assertThrows(OrchestrationException.class,
            () -> queue.markInProgress("task1", "agent2"));

        assertEquals(ErrorKind.ILLEGAL_TRANSITION, error.getKind());
        assertEquals(TaskStatus.FAILED, queue.getTask("task1").orElseThrow().getStatus());
    }

    @Test
    void shouldRejectStartingTaskWithOpenDependencies() {
        queue.addTask("task1", "Base", List.of());
        queue.addTask("task2", "Next", List.of("task1"));

        assertThrows(OrchestrationException.class, () -> queue.markInProgress("task2", "agent1"));
    }

    @Test
    void shouldFailTransitionsOnUnknownTask() {
        OrchestrationException error = assertThrows(OrchestrationException.class,
            () -> queue.markInProgress("ghost", "agent1"));

        assertEquals(ErrorKind.TASK_NOT_FOUND, error.getKind());
        assertTrue(queue.getTask("ghost").isEmpty());
    }

    @Test
    void shouldSummarizeStatusCounts() {
        queue.addTask("task1", "Task 1", List.of());
        queue.addTask("task2", "Task 2", List.of());
        queue.addTask("task3", "Task 3", List.of());

        queue.markInProgress("task1", "agent1");
        finish("task2");

        QueueStatusSummary summary = queue.getStatusSummary();

        assertEquals(3, summary.getTotal());
        assertEquals(1, summary.getPending());
        assertEquals(1, summary.getInProgress());
        assertEquals(1, summary.getCompleted());
        assertEquals(0, summary.getFailed());
        assertEquals(0, summary.getBlocked());
    }

    @Test
    void shouldKeepMissingDependencyBlockedForever() {
        queue.addTask("task1", "Needs a typo", List.of("tsak0"));
        queue.addTask("task2", "Independent", List.of());

        finish("task2");

        assertTrue(queue.getReadyTasks().isEmpty());
        assertFalse(queue.isComplete());
        assertEquals(List.of("task1"), queue.getBlockedTaskIds());

        QueueStatusSummary summary = queue.getStatusSummary();
        assertEquals(1, summary.getBlocked());
        assertEquals(0, summary.getPending());
        assertEquals(summary.getTotal(), summary.bucketSum());
    }

    @Test
    void shouldTreatFailedDependencyAndItsDescendantsAsBlocked() {
        queue.addTask("build", "Build", List.of());
        queue.addTask("test", "Test", List.of("build"));
        queue.addTask("release", "Release", List.of("test"));
        queue.addTask("docs", "Docs", List.of());

        queue.markInProgress("build", "agent1");
        queue.markFailed("build", "compiler error");

        assertEquals(List.of("docs"), readyIds());
        assertEquals(List.of("test", "release"), queue.getBlockedTaskIds());
    }

    @Test
    void shouldTreatDependencyCycleAsBlocked() {
        queue.addTask("a", "A", List.of("c"));
        queue.addTask("b", "B", List.of("a"));
        queue.addTask("c", "C", List.of("b"));

        assertTrue(queue.getReadyTasks().isEmpty());
        assertEquals(3, queue.getStatusSummary().getBlocked());
    }

    @Test
    void shouldTreatEmptyQueueAsComplete() {
        assertTrue(queue.isComplete());
        assertFalse(queue.hasFailures());
        assertEquals(0, queue.getStatusSummary().getTotal());
    }

    @Test
    void shouldNotCountFailedTasksAsComplete() {
        queue.addTask("task1", "Task 1", List.of());
        queue.markInProgress("task1", "agent1");
        queue.markFailed("task1", "boom");

        assertFalse(queue.isComplete());
    }

    @Test
    void shouldHandOutCopiesOnly() {
        queue.addTask("task1", "Task 1", List.of());

        Task copy = queue.getAllTasks().get(0);
        copy.setStatus(TaskStatus.COMPLETED);
        copy.getDependencies().add("tampered");

        Task stored = queue.getTask("task1").orElseThrow();
        assertEquals(TaskStatus.PENDING, stored.getStatus());
        assertTrue(stored.getDependencies().isEmpty());
    }

    @Test
    void shouldOnlyReleaseTasksWhoseDependenciesCompletedOnRandomGraphs() {
        for (long seed = 1; seed <= 25; seed++) {
            Random random = new Random(seed);
            TaskQueue graph = new TaskQueue();
            int size = 5 + random.nextInt(20);
            for (int i = 0; i < size; i++) {
                List<String> deps = new ArrayList<>();
                for (int j = 0; j < i; j++) {
                    if (random.nextInt(4) == 0) {
                        deps.add("t" + j);
                    }
                }
                if (random.nextInt(10) == 0) {
                    deps.add("missing" + i);
                }
                graph.addTask("t" + i, "task " + i, deps);
            }

            for (int step = 0; step < size * 2; step++) {
                Map<String, TaskStatus> statuses = graph.getAllTasks().stream()
                    .collect(Collectors.toMap(Task::getId, Task::getStatus, (a, b) -> a, HashMap::new));
                List<Task> ready = graph.getReadyTasks();
                for (Task task : ready) {
                    assertEquals(TaskStatus.PENDING, task.getStatus());
                    for (String dep : task.getDependencies()) {
                        assertEquals(TaskStatus.COMPLETED, statuses.get(dep),
                            "seed " + seed + ": " + task.getId() + " released before " + dep);
                    }
                }
                QueueStatusSummary summary = graph.getStatusSummary();
                assertEquals(summary.getTotal(), summary.bucketSum(), "seed " + seed);

                if (ready.isEmpty()) {
                    break;
                }
                Task next = ready.get(random.nextInt(ready.size()));
                graph.markInProgress(next.getId(), "agent");
                if (random.nextInt(5) == 0) {
                    graph.markFailed(next.getId(), "random failure");
                } else {
                    graph.markComplete(next.getId(), "ok");
                }
            }
        }
    }

    private List<String> readyIds() {
        return queue.getReadyTasks().stream().map(Task::getId).collect(Collectors.toList());
    }

    private void finish(String taskId) {
        queue.markInProgress(taskId, "agent1");
        queue.markComplete(taskId, "done");
    }
}
