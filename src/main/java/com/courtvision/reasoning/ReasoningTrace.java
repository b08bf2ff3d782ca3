package com.courtvision.reasoning;

import java.time.Instant;
import java.util.*;

/**
 * Record of how one question was routed: the stages it went through, their timings
 * and the signals each stage reported.
 *
 * Holds only a length/hash summary of the question, never its text.
 */
public class ReasoningTrace {

    private final String traceId;
    private final Instant timestamp;
    private final String querySummary;
    private final List<ReasoningStep> steps;
    private final Map<String, Object> metrics;
    private long totalDurationMs;
    private boolean completed;

    public ReasoningTrace(String querySummary) {
        this.traceId = UUID.randomUUID().toString().substring(0, 8);
        this.timestamp = Instant.now();
        this.querySummary = querySummary;
        this.steps = new ArrayList<>();
        this.metrics = new LinkedHashMap<>();
        this.totalDurationMs = 0;
        this.completed = false;
    }

    public void addStep(ReasoningStep step) {
        steps.add(step);
        totalDurationMs += step.durationMs();
    }

    public void addMetric(String key, Object value) {
        metrics.put(key, value);
    }

    public void complete() {
        this.completed = true;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getQuerySummary() {
        return querySummary;
    }

    public List<ReasoningStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public boolean isCompleted() {
        return completed;
    }

    /**
     * Convert to a map for JSON serialization.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("traceId", traceId);
        map.put("timestamp", timestamp.toString());
        map.put("query", querySummary);
        map.put("totalDurationMs", totalDurationMs);
        map.put("completed", completed);

        List<Map<String, Object>> stepMaps = new ArrayList<>();
        for (ReasoningStep step : steps) {
            Map<String, Object> stepMap = new LinkedHashMap<>();
            stepMap.put("type", step.type().name().toLowerCase(Locale.ROOT));
            stepMap.put("label", step.label());
            stepMap.put("detail", step.detail());
            stepMap.put("durationMs", step.durationMs());
            if (!step.data().isEmpty()) {
                stepMap.put("data", step.data());
            }
            stepMaps.add(stepMap);
        }
        map.put("steps", stepMaps);

        if (!metrics.isEmpty()) {
            map.put("metrics", metrics);
        }
        return map;
    }

    /**
     * Get a summary string for logging.
     */
    public String getSummary() {
        return String.format("Trace[%s]: %d steps, %dms total, %s",
                traceId, steps.size(), totalDurationMs, completed ? "COMPLETED" : "IN_PROGRESS");
    }
}
