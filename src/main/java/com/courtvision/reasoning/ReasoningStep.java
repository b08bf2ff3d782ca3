package com.courtvision.reasoning;

import java.util.Map;

/**
 * One timed stage of a routing decision.
 */
public record ReasoningStep(StepType type, String label, String detail, long durationMs, Map<String, Object> data) {

    public enum StepType {
        GREETING_CHECK,
        QUERY_ROUTING,
        LLM_FALLBACK,
        PLAN_ASSEMBLY,
        ERROR
    }

    public ReasoningStep {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static ReasoningStep of(StepType type, String label, String detail, long durationMs, Map<String, Object> data) {
        return new ReasoningStep(type, label, detail, durationMs, data);
    }
}
