package com.autonomous.orchestrator.workflow;

import com.autonomous.orchestrator.model.Task;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural metrics of a task graph, used for logging only. Dependencies on
 * unknown ids are ignored here; the queue reports those as blocked.
 */
public class DagAnalyzer {

    public DagMetrics analyze(Collection<Task> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return DagMetrics.empty();
        }

        Map<String, Task> taskMap = new LinkedHashMap<>();
        for (Task task : tasks) {
            taskMap.put(task.getId(), task);
        }

        Map<String, Integer> indegree = new HashMap<>();
        Map<String, List<String>> downstream = new HashMap<>();
        int missingDependencies = 0;
        for (String taskId : taskMap.keySet()) {
            indegree.put(taskId, 0);
            downstream.put(taskId, new ArrayList<>());
        }
        for (Task task : taskMap.values()) {
            for (String dep : task.getDependencies()) {
                if (!taskMap.containsKey(dep)) {
                    missingDependencies++;
                    continue;
                }
                indegree.merge(task.getId(), 1, Integer::sum);
                downstream.get(dep).add(task.getId());
            }
        }

        // Kahn's algorithm, level by level
        ArrayDeque<String> queue = new ArrayDeque<>();
        for (String taskId : taskMap.keySet()) {
            if (indegree.get(taskId) == 0) {
                queue.add(taskId);
            }
        }

        int visited = 0;
        int maxWidth = 0;
        int depth = 0;
        while (!queue.isEmpty()) {
            int width = queue.size();
            maxWidth = Math.max(maxWidth, width);
            depth++;
            for (int i = 0; i < width; i++) {
                String taskId = queue.removeFirst();
                visited++;
                for (String next : downstream.get(taskId)) {
                    if (indegree.merge(next, -1, Integer::sum) == 0) {
                        queue.addLast(next);
                    }
                }
            }
        }

        return DagMetrics.builder()
            .taskCount(taskMap.size())
            .maxParallelism(maxWidth)
            .criticalPathLength(depth)
            .missingDependencies(missingDependencies)
            .hasCycle(visited < taskMap.size())
            .build();
    }

    @Data
    @Builder
    public static class DagMetrics {
        private int taskCount;
        private int maxParallelism;
        private int criticalPathLength;
        private int missingDependencies;
        private boolean hasCycle;

        public static DagMetrics empty() {
            return DagMetrics.builder().build();
        }
    }
}
