package com.courtvision.service;

import com.courtvision.model.RetrievalPlan;
import com.courtvision.rag.routing.ClassificationResult;
import com.courtvision.rag.routing.GreetingDetector;
import com.courtvision.rag.routing.QueryClassifier;
import com.courtvision.rag.routing.QueryType;
import com.courtvision.rag.routing.fallback.RoutingFallbackClassifier;
import com.courtvision.reasoning.ReasoningStep.StepType;
import com.courtvision.reasoning.ReasoningTrace;
import com.courtvision.reasoning.ReasoningTracer;
import com.courtvision.reasoning.ReasoningTracer.TimedResult;
import com.courtvision.util.LogSanitizer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Entry point for the answering pipeline: decides whether a question needs retrieval and, if so,
 * which back ends to query and how broadly.
 */
@Service
public class QueryRoutingService {

    private static final Logger log = LoggerFactory.getLogger(QueryRoutingService.class);

    private final GreetingDetector greetingDetector;
    private final QueryClassifier queryClassifier;
    private final ReasoningTracer reasoningTracer;
    @Nullable
    private final RoutingFallbackClassifier fallbackClassifier;

    @Autowired
    public QueryRoutingService(GreetingDetector greetingDetector, QueryClassifier queryClassifier,
            ReasoningTracer reasoningTracer, ObjectProvider<RoutingFallbackClassifier> fallbackClassifier) {
        this(greetingDetector, queryClassifier, reasoningTracer, fallbackClassifier.getIfAvailable());
    }

    QueryRoutingService(GreetingDetector greetingDetector, QueryClassifier queryClassifier,
            ReasoningTracer reasoningTracer, @Nullable RoutingFallbackClassifier fallbackClassifier) {
        this.greetingDetector = greetingDetector;
        this.queryClassifier = queryClassifier;
        this.reasoningTracer = reasoningTracer;
        this.fallbackClassifier = fallbackClassifier;
    }

    public RetrievalPlan plan(String query) {
        ReasoningTrace trace = this.reasoningTracer.startTrace(query);
        try {
            RetrievalPlan plan = this.buildPlan(query);
            this.reasoningTracer.addMetric("decidedBy", plan.decidedBy());
            this.reasoningTracer.addMetric("tools", plan.tools().toString());
            return trace == null ? plan : plan.withTraceId(trace.getTraceId());
        } finally {
            this.reasoningTracer.endTrace();
        }
    }

    /**
     * The recorded routing stages behind an earlier plan, while its trace is still cached.
     */
    public Optional<Map<String, Object>> explain(String traceId) {
        return Optional.ofNullable(this.reasoningTracer.getTrace(traceId)).map(ReasoningTrace::toMap);
    }

    private RetrievalPlan buildPlan(String query) {
        boolean greeting = this.reasoningTracer.timed(StepType.GREETING_CHECK, "Greeting Check", () -> {
            boolean isGreeting = this.greetingDetector.isGreeting(query);
            return TimedResult.of(isGreeting, isGreeting ? "Pure greeting" : "Needs routing");
        });
        if (greeting) {
            log.info("Routing: greeting, retrieval skipped for query {}", LogSanitizer.querySummary(query));
            return RetrievalPlan.greeting();
        }

        ClassificationResult result = this.reasoningTracer.timed(StepType.QUERY_ROUTING, "Heuristic Routing", () -> {
            ClassificationResult classified = this.queryClassifier.classify(query);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("queryType", classified.queryType().name());
            data.put("biographical", classified.biographical());
            data.put("complexityDepth", classified.complexityDepth());
            data.put("styleCategory", classified.styleCategory().name());
            data.put("maxExpansions", classified.maxExpansions());
            return TimedResult.of(classified, "Heuristic: " + classified.queryType(), data);
        });

        if (this.fallbackClassifier == null) {
            return this.assemble(result.queryType(), result, RetrievalPlan.DECIDED_BY_HEURISTIC);
        }

        QueryType override = this.reasoningTracer.timed(StepType.LLM_FALLBACK, "LLM Routing", () -> {
            QueryType verdict = this.fallbackClassifier.classify(query);
            return TimedResult.of(verdict, "LLM: " + verdict,
                    Map.of("heuristicVerdict", result.queryType().name()));
        });
        if (override != result.queryType()) {
            log.info("LLM routing overrode heuristic {} with {} for query {}",
                    result.queryType(), override, LogSanitizer.querySummary(query));
        }
        return this.assemble(override, result, RetrievalPlan.DECIDED_BY_LLM);
    }

    private RetrievalPlan assemble(QueryType queryType, ClassificationResult result, String decidedBy) {
        return this.reasoningTracer.timed(StepType.PLAN_ASSEMBLY, "Plan Assembly", () -> {
            RetrievalPlan plan = RetrievalPlan.of(queryType, result, decidedBy);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("tools", plan.tools().toString());
            data.put("contextualTopK", plan.contextualTopK());
            data.put("maxExpansions", plan.maxExpansions());
            return TimedResult.of(plan, "Plan: " + queryType + " by " + decidedBy, data);
        });
    }
}
