package com.autonomous.orchestrator.workflow;

import com.autonomous.orchestrator.model.AgentInstance;
import com.autonomous.orchestrator.model.ExecutionOutcome;
import com.autonomous.orchestrator.model.SubtaskSpec;

import java.util.List;

/**
 * Planning and execution strategy plugged into {@link MultiAgentExecutor}.
 */
public interface Supervisor {

    /**
     * Splits an objective into subtasks. Task ids must be unique within the result.
     */
    List<SubtaskSpec> decompose(String objective);

    /**
     * Runs one task on the given agent. May block for a long time; called from
     * worker threads, so implementations must not touch the queue or pool.
     * Thrown exceptions are treated the same as a failed outcome.
     */
    ExecutionOutcome execute(String taskId, String description, AgentInstance agent);
}
