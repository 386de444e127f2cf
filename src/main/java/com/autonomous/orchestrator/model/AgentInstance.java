package com.autonomous.orchestrator.model;

import lombok.Data;

import java.util.List;

/**
 * Worker state. The pool keeps the live instance and hands out copies, so
 * changes made to a returned instance never reach the pool.
 */
@Data
public class AgentInstance {
    private final String name;
    private final AgentProfile profile;
    private final Object handle;
    private String currentTask;
    private int tasksCompleted;
    private int tasksFailed;

    public boolean isAvailable() {
        return currentTask == null;
    }

    public List<String> getCapabilities() {
        return profile.getCapabilities() == null ? List.of() : profile.getCapabilities();
    }

    public boolean hasPhaseAffinity(String phase) {
        return phase != null && profile.getPhaseAffinity() != null && profile.getPhaseAffinity().contains(phase);
    }

    public AgentInstance copy() {
        AgentInstance copy = new AgentInstance(name, profile, handle);
        copy.setCurrentTask(currentTask);
        copy.setTasksCompleted(tasksCompleted);
        copy.setTasksFailed(tasksFailed);
        return copy;
    }

    // the +1 keeps untried agents below agents with a clean record
    public double getSuccessRatio() {
        return (double) tasksCompleted / (tasksCompleted + tasksFailed + 1);
    }
}
