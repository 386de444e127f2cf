package com.autonomous.orchestrator.workflow;

import com.autonomous.orchestrator.exception.ErrorKind;
import com.autonomous.orchestrator.exception.OrchestrationException;
import com.autonomous.orchestrator.model.AgentInstance;
import com.autonomous.orchestrator.model.AgentProfile;
import com.autonomous.orchestrator.model.PoolStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed roster of agents for one run. Each agent holds at most one task at a time.
 * Every accessor returns copies; only assignment and release change an agent.
 */
@Slf4j
public class AgentPool {

    private final Map<String, AgentInstance> agents = new LinkedHashMap<>();

    public AgentPool(List<AgentProfile> roster) {
        this(roster, Map.of());
    }

    /**
     * @param roster  agent profiles in declaration order; the order is the final tie-break in selection
     * @param handles opaque execution handles keyed by agent name, passed through to the supervisor
     */
    public AgentPool(List<AgentProfile> roster, Map<String, ?> handles) {
        if (roster == null) {
            return;
        }
        Map<String, ?> byName = handles == null ? Map.of() : handles;
        for (AgentProfile profile : roster) {
            String name = profile.getName();
            if (name == null || name.isBlank()) {
                throw new OrchestrationException(ErrorKind.INVALID_AGENT, "Agent profile without a name");
            }
            if (agents.containsKey(name)) {
                throw new OrchestrationException(ErrorKind.DUPLICATE_AGENT, "Agent declared twice: " + name);
            }
            agents.put(name, new AgentInstance(name, profile, byName.get(name)));
        }
        log.debug("Agent pool created with {} agents: {}", agents.size(), agents.keySet());
    }

    public List<AgentInstance> getAvailableAgents() {
        List<AgentInstance> available = new ArrayList<>();
        for (AgentInstance agent : availableAgents()) {
            available.add(agent.copy());
        }
        return available;
    }

    public Optional<AgentInstance> getAgent(String agentName) {
        return Optional.ofNullable(agents.get(agentName)).map(AgentInstance::copy);
    }

    public Collection<AgentInstance> getAllAgents() {
        List<AgentInstance> all = new ArrayList<>(agents.size());
        for (AgentInstance agent : agents.values()) {
            all.add(agent.copy());
        }
        return all;
    }

    public int size() {
        return agents.size();
    }

    public AgentInstance assignTaskToAgent(String taskId, String agentName) {
        AgentInstance agent = require(agentName);
        if (!agent.isAvailable()) {
            throw new OrchestrationException(ErrorKind.AGENT_BUSY,
                String.format("Agent %s is already working on %s", agentName, agent.getCurrentTask()));
        }
        agent.setCurrentTask(taskId);
        log.debug("Assigned task {} to agent {}", taskId, agentName);
        return agent.copy();
    }

    public void markTaskComplete(String agentName, boolean success) {
        AgentInstance agent = require(agentName);
        if (agent.isAvailable()) {
            throw new OrchestrationException(ErrorKind.ILLEGAL_TRANSITION,
                "Agent " + agentName + " has no task to release");
        }
        agent.setCurrentTask(null);
        if (success) {
            agent.setTasksCompleted(agent.getTasksCompleted() + 1);
        } else {
            agent.setTasksFailed(agent.getTasksFailed() + 1);
        }
    }

    /**
     * Picks the available agent with the most matching capabilities, then the
     * best success ratio, then phase affinity, then roster order.
     *
     * @return empty when no available agent shares a capability with the request
     */
    public Optional<String> findBestAgent(List<String> requiredCapabilities, String phase) {
        Set<String> required = requiredCapabilities == null ? Set.of() : new HashSet<>(requiredCapabilities);

        AgentInstance best = null;
        int bestOverlap = 0;
        for (AgentInstance agent : availableAgents()) {
            int overlap = overlap(agent, required);
            if (overlap == 0) {
                continue;
            }
            if (best == null || isBetter(agent, overlap, best, bestOverlap, phase)) {
                best = agent;
                bestOverlap = overlap;
            }
        }
        return Optional.ofNullable(best).map(AgentInstance::getName);
    }

    public Optional<String> findBestAgent(List<String> requiredCapabilities) {
        return findBestAgent(requiredCapabilities, null);
    }

    public PoolStatus getPoolStatus() {
        Map<String, String> assignments = new LinkedHashMap<>();
        for (AgentInstance agent : agents.values()) {
            if (!agent.isAvailable()) {
                assignments.put(agent.getName(), agent.getCurrentTask());
            }
        }
        return PoolStatus.builder()
            .totalAgents(agents.size())
            .availableAgents(agents.size() - assignments.size())
            .busyAgents(assignments.size())
            .assignments(assignments)
            .build();
    }

    private List<AgentInstance> availableAgents() {
        List<AgentInstance> available = new ArrayList<>();
        for (AgentInstance agent : agents.values()) {
            if (agent.isAvailable()) {
                available.add(agent);
            }
        }
        return available;
    }

    // strict comparison only, so an equal candidate never displaces an earlier one
    private boolean isBetter(AgentInstance candidate, int candidateOverlap,
                             AgentInstance current, int currentOverlap, String phase) {
        if (candidateOverlap != currentOverlap) {
            return candidateOverlap > currentOverlap;
        }
        int byRatio = Double.compare(candidate.getSuccessRatio(), current.getSuccessRatio());
        if (byRatio != 0) {
            return byRatio > 0;
        }
        return candidate.hasPhaseAffinity(phase) && !current.hasPhaseAffinity(phase);
    }

    private int overlap(AgentInstance agent, Set<String> required) {
        int count = 0;
        for (String capability : new HashSet<>(agent.getCapabilities())) {
            if (required.contains(capability)) {
                count++;
            }
        }
        return count;
    }

    private AgentInstance require(String agentName) {
        AgentInstance agent = agents.get(agentName);
        if (agent == null) {
            throw new OrchestrationException(ErrorKind.UNKNOWN_AGENT, "Unknown agent: " + agentName);
        }
        return agent;
    }
}
