package com.autonomous.orchestrator.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class Task {
    private String id;
    private String description;
    private List<String> dependencies = new ArrayList<>();
    private List<String> requiredCapabilities = new ArrayList<>();
    private TaskStatus status = TaskStatus.PENDING;
    private String assignedAgent;
    private Object result;
    private String errorMessage;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    /**
     * Detached copy handed out to callers; the queue keeps the original.
     */
    public Task copy() {
        Task copy = new Task();
        copy.setId(id);
        copy.setDescription(description);
        copy.setDependencies(new ArrayList<>(dependencies));
        copy.setRequiredCapabilities(new ArrayList<>(requiredCapabilities));
        copy.setStatus(status);
        copy.setAssignedAgent(assignedAgent);
        copy.setResult(result);
        copy.setErrorMessage(errorMessage);
        copy.setCreatedAt(createdAt);
        copy.setStartedAt(startedAt);
        copy.setCompletedAt(completedAt);
        return copy;
    }
}
