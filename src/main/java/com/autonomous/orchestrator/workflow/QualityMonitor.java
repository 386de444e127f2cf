package com.autonomous.orchestrator.workflow;

import com.autonomous.orchestrator.model.ContinuationDecision;
import com.autonomous.orchestrator.model.CoverageTrend;
import com.autonomous.orchestrator.model.IterationRecord;
import com.autonomous.orchestrator.model.QualityMetrics;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tracks per-iteration coverage to decide whether another iteration is worth
 * running, and fingerprints task outputs to spot an agent repeating itself.
 * Output comparison is exact: only byte-identical outputs count as repeats.
 */
@Slf4j
@Getter
public class QualityMonitor {

    public static final double DEFAULT_MIN_COVERAGE_IMPROVEMENT = 0.05;
    public static final int DEFAULT_MAX_ITERATIONS_WITHOUT_IMPROVEMENT = 3;
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.95;

    private static final int TREND_WINDOW = 3;

    private final double minCoverageImprovement;
    private final int maxIterationsWithoutImprovement;
    private final double similarityThreshold;

    @Getter(AccessLevel.NONE)
    private final List<IterationRecord> iterationHistory = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final List<Double> coverageHistory = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final Map<String, Set<String>> outputHashes = new HashMap<>();

    public QualityMonitor() {
        this(DEFAULT_MIN_COVERAGE_IMPROVEMENT, DEFAULT_MAX_ITERATIONS_WITHOUT_IMPROVEMENT, DEFAULT_SIMILARITY_THRESHOLD);
    }

    public QualityMonitor(double minCoverageImprovement, int maxIterationsWithoutImprovement,
                          double similarityThreshold) {
        this.minCoverageImprovement = minCoverageImprovement;
        this.maxIterationsWithoutImprovement = Math.max(2, maxIterationsWithoutImprovement);
        this.similarityThreshold = similarityThreshold;
    }

    public IterationRecord recordIteration(int iteration, Double coverage, Double qualityScore, int tasksCompleted) {
        IterationRecord record = new IterationRecord(iteration, coverage, qualityScore, tasksCompleted);
        iterationHistory.add(record);
        if (coverage != null) {
            coverageHistory.add(coverage);
        }
        return record;
    }

    /**
     * @return 1.0 if this exact output was already seen for the task, otherwise 0.0
     */
    public double checkOutputSimilarity(String taskId, String output) {
        String hash = sha256(output == null ? "" : output);
        Set<String> seen = outputHashes.computeIfAbsent(taskId, key -> new HashSet<>());
        return seen.add(hash) ? 0.0 : 1.0;
    }

    public boolean detectLoop(String taskId, String output) {
        boolean loop = checkOutputSimilarity(taskId, output) >= similarityThreshold;
        if (loop) {
            log.warn("Repeated output detected for task {}", taskId);
        }
        return loop;
    }

    public ContinuationDecision shouldContinue(int iteration) {
        if (iterationHistory.size() < 2) {
            return new ContinuationDecision(true, ContinuationDecision.INSUFFICIENT_DATA);
        }

        if (coverageHistory.size() >= maxIterationsWithoutImprovement) {
            List<Double> recent = coverageHistory.subList(
                coverageHistory.size() - maxIterationsWithoutImprovement, coverageHistory.size());
            boolean stalled = true;
            for (int i = 0; i + 1 < recent.size(); i++) {
                if (recent.get(i + 1) - recent.get(i) >= minCoverageImprovement) {
                    stalled = false;
                    break;
                }
            }
            if (stalled) {
                log.info("Coverage stalled at iteration {}: last samples {}", iteration, recent);
                return new ContinuationDecision(false, String.format(
                    "No coverage improvement in %d iterations", maxIterationsWithoutImprovement));
            }
        }

        return new ContinuationDecision(true, ContinuationDecision.QUALITY_IMPROVING);
    }

    public QualityMetrics getQualityMetrics() {
        if (iterationHistory.isEmpty()) {
            return QualityMetrics.noData();
        }
        IterationRecord latest = iterationHistory.get(iterationHistory.size() - 1);
        int totalCompleted = iterationHistory.stream().mapToInt(IterationRecord::getTasksCompleted).sum();
        return QualityMetrics.builder()
            .status(QualityMetrics.STATUS_OK)
            .iterations(iterationHistory.size())
            .currentCoverage(latest.getCoverage())
            .currentQualityScore(latest.getQualityScore())
            .totalTasksCompleted(totalCompleted)
            .coverageTrend(calculateTrend(coverageHistory))
            .build();
    }

    public List<IterationRecord> getIterationHistory() {
        return List.copyOf(iterationHistory);
    }

    static CoverageTrend calculateTrend(List<Double> values) {
        if (values.size() < 2) {
            return CoverageTrend.INSUFFICIENT_DATA;
        }
        List<Double> recent = values.subList(Math.max(0, values.size() - TREND_WINDOW), values.size());

        boolean rising = true;
        boolean falling = true;
        for (int i = 0; i + 1 < recent.size(); i++) {
            double delta = recent.get(i + 1) - recent.get(i);
            rising &= delta > 0;
            falling &= delta < 0;
        }
        if (rising) {
            return CoverageTrend.IMPROVING;
        }
        if (falling) {
            return CoverageTrend.DECLINING;
        }
        return CoverageTrend.STABLE;
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
