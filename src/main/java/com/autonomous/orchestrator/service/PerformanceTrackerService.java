package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.AgentStats;
import com.autonomous.orchestrator.model.IterationRecord;
import com.autonomous.orchestrator.model.PerformanceEvent;
import com.autonomous.orchestrator.workflow.PerformanceRecorder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Default performance sink. Keeps per-agent aggregates in memory and appends
 * every task event to {@code performance.jsonl} under the data path.
 */
@Slf4j
@Service
public class PerformanceTrackerService implements PerformanceRecorder {

    static final String EVENTS_FILE = "performance.jsonl";

    @Value("${orchestrator.data.path:data}")
    private String dataPath;

    @Value("${orchestrator.performance.persist:true}")
    private boolean persist = true;

    private final ObjectMapper mapper;
    private final List<PerformanceEvent> events = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, AgentStats> statsByAgent = new LinkedHashMap<>();

    public PerformanceTrackerService() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void setDataPath(String path) {
        this.dataPath = path;
    }

    public void setPersist(boolean persist) {
        this.persist = persist;
    }

    @Override
    public void recordTaskPerformance(PerformanceEvent event) {
        events.add(event);
        synchronized (statsByAgent) {
            AgentStats stats = statsByAgent.computeIfAbsent(event.getAgentName(), AgentStats::new);
            if (event.isSuccess()) {
                stats.setSucceeded(stats.getSucceeded() + 1);
            } else {
                stats.setFailed(stats.getFailed() + 1);
            }
            stats.setTotalDurationSeconds(stats.getTotalDurationSeconds() + event.getDurationSeconds());
            if (event.getCostUsd() != null) {
                stats.setTotalCostUsd(stats.getTotalCostUsd() + event.getCostUsd());
            }
        }
        if (persist) {
            persistEvent(event);
        }
    }

    @Override
    public void recordIteration(IterationRecord record) {
        log.debug("Iteration {} recorded: completed={}, coverage={}",
            record.getIteration(), record.getTasksCompleted(), record.getCoverage());
    }

    public List<PerformanceEvent> getEvents() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    public Optional<AgentStats> getAgentStats(String agentName) {
        synchronized (statsByAgent) {
            return Optional.ofNullable(statsByAgent.get(agentName));
        }
    }

    public double getTotalCost() {
        synchronized (events) {
            return events.stream()
                .filter(event -> event.getCostUsd() != null)
                .mapToDouble(PerformanceEvent::getCostUsd)
                .sum();
        }
    }

    public String formatAgentSummary(String agentName) {
        return getAgentStats(agentName)
            .map(stats -> String.format(Locale.ROOT, "%s: %d/%d succeeded, avg %.1fs, $%.2f",
                agentName,
                stats.getSucceeded(),
                stats.getTotal(),
                stats.getAverageDurationSeconds(),
                stats.getTotalCostUsd()))
            .orElse(agentName + ": no tasks recorded");
    }

    /**
     * Reads back every well-formed event from the events file. Malformed lines are skipped.
     */
    public List<PerformanceEvent> loadPersistedEvents() {
        Path eventsFile = Paths.get(dataPath, EVENTS_FILE);
        if (!Files.exists(eventsFile)) {
            return List.of();
        }
        List<PerformanceEvent> loaded = new ArrayList<>();
        try (Stream<String> lines = Files.lines(eventsFile)) {
            lines.forEach(line -> {
                try {
                    loaded.add(mapper.readValue(line, PerformanceEvent.class));
                } catch (IOException e) {
                    log.debug("Skipping malformed performance line: {}", e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Failed to read performance events from {}: {}", eventsFile, e.getMessage());
        }
        return loaded;
    }

    private void persistEvent(PerformanceEvent event) {
        try {
            Path eventsFile = Paths.get(dataPath, EVENTS_FILE);
            Files.createDirectories(eventsFile.getParent());

            String json = mapper.writeValueAsString(event);
            synchronized (this) {
                Files.writeString(eventsFile, json + "\n",
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
        } catch (IOException e) {
            log.warn("Failed to persist performance event for task {}: {}", event.getTaskId(), e.getMessage());
        }
    }
}
