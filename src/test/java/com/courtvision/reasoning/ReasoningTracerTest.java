package com.courtvision.reasoning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.courtvision.reasoning.ReasoningStep.StepType;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ReasoningTracerTest {

    @Nested
    @DisplayName("Trace lifecycle")
    class LifecycleTest {
        @Test
        @DisplayName("Should bind trace to thread and cache it on completion")
        void shouldBindAndCache() {
            ReasoningTracer tracer = new ReasoningTracer(true, false);

            ReasoningTrace trace = tracer.startTrace("Who is LeBron James?");
            assertThat(tracer.getCurrentTrace()).isSameAs(trace);

            ReasoningTrace ended = tracer.endTrace();

            assertThat(ended).isSameAs(trace);
            assertThat(ended.isCompleted()).isTrue();
            assertThat(tracer.getCurrentTrace()).isNull();
            assertThat(tracer.getTrace(trace.getTraceId())).isSameAs(trace);
        }

        @Test
        @DisplayName("Should store a summary instead of the question text")
        void shouldNotStoreQueryText() {
            ReasoningTracer tracer = new ReasoningTracer(true, false);

            ReasoningTrace trace = tracer.startTrace("Who is LeBron James?");

            assertThat(trace.getQuerySummary()).startsWith("[len=20,id=");
            assertThat(trace.toMap().toString()).doesNotContain("LeBron");
            tracer.endTrace();
        }

        @Test
        @DisplayName("Should do nothing when disabled")
        void shouldNoOpWhenDisabled() {
            ReasoningTracer tracer = new ReasoningTracer(false, false);

            assertThat(tracer.startTrace("query")).isNull();
            tracer.addStep(StepType.QUERY_ROUTING, "Heuristic Routing", "detail", 1L);
            assertThat(tracer.endTrace()).isNull();
            assertThat(tracer.cachedTraceCount()).isZero();
        }
    }

    @Nested
    @DisplayName("timed()")
    class TimedTest {
        @Test
        @DisplayName("Should record a step with its data and return the result")
        void shouldRecordStep() {
            ReasoningTracer tracer = new ReasoningTracer(true, true);
            ReasoningTrace trace = tracer.startTrace("query");

            String result = tracer.timed(StepType.QUERY_ROUTING, "Heuristic Routing",
                    () -> ReasoningTracer.TimedResult.of("HYBRID", "Heuristic: HYBRID", Map.of("biographical", true)));

            assertThat(result).isEqualTo("HYBRID");
            assertThat(trace.getSteps()).hasSize(1);
            ReasoningStep step = trace.getSteps().get(0);
            assertThat(step.type()).isEqualTo(StepType.QUERY_ROUTING);
            assertThat(step.detail()).isEqualTo("Heuristic: HYBRID");
            assertThat(step.data()).containsEntry("biographical", true);
            tracer.endTrace();
        }

        @Test
        @DisplayName("Should record an error step and rethrow")
        void shouldRecordFailure() {
            ReasoningTracer tracer = new ReasoningTracer(true, false);
            ReasoningTrace trace = tracer.startTrace("query");

            assertThatThrownBy(() -> tracer.timed(StepType.LLM_FALLBACK, "LLM Routing", () -> {
                throw new IllegalStateException("model unavailable");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(trace.getSteps()).hasSize(1);
            assertThat(trace.getSteps().get(0).type()).isEqualTo(StepType.ERROR);
            assertThat(trace.getSteps().get(0).label()).isEqualTo("LLM Routing (Failed)");
            tracer.endTrace();
        }
    }

    @Test
    @DisplayName("Should evict old traces when the cache is full")
    void shouldBoundCache() {
        ReasoningTracer tracer = new ReasoningTracer(true, false);
        for (int i = 0; i <= ReasoningTracer.MAX_CACHED_TRACES; i++) {
            tracer.startTrace("query " + i);
            tracer.endTrace();
        }

        assertThat(tracer.cachedTraceCount()).isLessThanOrEqualTo(ReasoningTracer.MAX_CACHED_TRACES);
    }
}
