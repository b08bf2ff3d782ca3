package com.courtvision.reasoning;

import com.courtvision.util.LogSanitizer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Thread-bound routing traces. A trace is started and ended on the request thread; completed traces
 * are kept in a bounded cache for later lookup by id.
 */
@Component
public class ReasoningTracer {
    private static final Logger log = LoggerFactory.getLogger(ReasoningTracer.class);
    static final int MAX_CACHED_TRACES = 1000;
    private static final long EVICTION_BATCH = 100L;

    @Value("${courtvision.reasoning.enabled:true}")
    private boolean enabled;
    @Value("${courtvision.reasoning.detailed-traces:false}")
    private boolean detailedTraces;
    private final ThreadLocal<ReasoningTrace> currentTrace = new ThreadLocal<>();
    private final Map<String, ReasoningTrace> traceCache = new ConcurrentHashMap<>();

    public ReasoningTracer() {
        this(true, false);
    }

    public ReasoningTracer(boolean enabled, boolean detailedTraces) {
        this.enabled = enabled;
        this.detailedTraces = detailedTraces;
    }

    public ReasoningTrace startTrace(String query) {
        if (!this.enabled) {
            return null;
        }
        ReasoningTrace trace = new ReasoningTrace(LogSanitizer.querySummary(query));
        this.currentTrace.set(trace);
        log.debug("Started reasoning trace: {}", trace.getTraceId());
        return trace;
    }

    public ReasoningTrace getCurrentTrace() {
        return this.currentTrace.get();
    }

    public void addStep(ReasoningStep.StepType type, String label, String detail, long durationMs) {
        this.addStep(type, label, detail, durationMs, Map.of());
    }

    public void addStep(ReasoningStep.StepType type, String label, String detail, long durationMs, Map<String, Object> data) {
        ReasoningTrace trace = this.currentTrace.get();
        if (trace == null) {
            return;
        }
        trace.addStep(ReasoningStep.of(type, label, detail, durationMs, data));
        if (this.detailedTraces) {
            log.debug("Trace[{}] Step: {} - {} ({}ms)", trace.getTraceId(), type, label, durationMs);
        }
    }

    public void addMetric(String key, Object value) {
        ReasoningTrace trace = this.currentTrace.get();
        if (trace != null) {
            trace.addMetric(key, value);
        }
    }

    public ReasoningTrace endTrace() {
        ReasoningTrace trace = this.currentTrace.get();
        if (trace == null) {
            return null;
        }
        trace.complete();
        this.currentTrace.remove();
        this.cacheTrace(trace);
        log.debug("Completed reasoning trace: {}", trace.getSummary());
        return trace;
    }

    public ReasoningTrace getTrace(String traceId) {
        return this.traceCache.get(traceId);
    }

    /**
     * Runs a stage and records it as one step. A failing stage is recorded as {@link ReasoningStep.StepType#ERROR}
     * and its exception rethrown.
     */
    public <T> T timed(ReasoningStep.StepType type, String label, TimedOperation<T> operation) {
        long startTime = System.currentTimeMillis();
        TimedResult<T> timedResult;
        try {
            timedResult = operation.execute();
        }
        catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            this.addStep(ReasoningStep.StepType.ERROR, label + " (Failed)", LogSanitizer.sanitize(e.getMessage()), duration);
            throw e;
        }
        long duration = System.currentTimeMillis() - startTime;
        Map<String, Object> data = timedResult.data() != null ? timedResult.data() : Map.of();
        this.addStep(type, label, timedResult.detail(), duration, data);
        return timedResult.result();
    }

    private void cacheTrace(ReasoningTrace trace) {
        if (this.traceCache.size() >= MAX_CACHED_TRACES) {
            this.traceCache.keySet().stream().limit(EVICTION_BATCH).toList().forEach(this.traceCache::remove);
        }
        this.traceCache.put(trace.getTraceId(), trace);
    }

    public int cachedTraceCount() {
        return this.traceCache.size();
    }

    @FunctionalInterface
    public interface TimedOperation<T> {
        TimedResult<T> execute();
    }

    public record TimedResult<T>(T result, String detail, Map<String, Object> data) {
        public static <T> TimedResult<T> of(T result, String detail) {
            return new TimedResult<>(result, detail, null);
        }

        public static <T> TimedResult<T> of(T result, String detail, Map<String, Object> data) {
            return new TimedResult<>(result, detail, data);
        }
    }
}
