package com.courtvision.model;

import com.courtvision.rag.routing.ClassificationResult;
import com.courtvision.rag.routing.QueryStyleCategory;
import com.courtvision.rag.routing.QueryType;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import org.springframework.lang.Nullable;

/**
 * What the answering pipeline should retrieve for one question.
 *
 * @param queryType      routing verdict; null when retrieval is skipped
 * @param tools          back ends to invoke, empty when retrieval is skipped
 * @param contextualTopK passages to fetch from contextual search, 0 when it is not used
 * @param maxExpansions  paraphrases to generate, 0 when retrieval is skipped
 * @param decidedBy      {@code greeting}, {@code heuristic} or {@code llm-fallback}
 * @param traceId        routing trace to look up with {@code QueryRoutingService.explain}; null when tracing is off
 */
public record RetrievalPlan(
        @Nullable QueryType queryType,
        Set<RetrievalTool> tools,
        int contextualTopK,
        int maxExpansions,
        boolean biographical,
        @Nullable QueryStyleCategory styleCategory,
        String decidedBy,
        @Nullable String traceId) {

    public static final String DECIDED_BY_GREETING = "greeting";
    public static final String DECIDED_BY_HEURISTIC = "heuristic";
    public static final String DECIDED_BY_LLM = "llm-fallback";

    public RetrievalPlan {
        tools = tools.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(RetrievalTool.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(tools));
    }

    public static RetrievalPlan greeting() {
        return new RetrievalPlan(null, EnumSet.noneOf(RetrievalTool.class), 0, 0, false, null, DECIDED_BY_GREETING,
                null);
    }

    /**
     * Plan for a classified question. The verdict may differ from {@code result.queryType()} when a
     * fallback classifier overrode it; metadata always comes from {@code result}.
     */
    public static RetrievalPlan of(QueryType queryType, ClassificationResult result, String decidedBy) {
        EnumSet<RetrievalTool> tools = RetrievalTool.forQueryType(queryType);
        int topK = tools.contains(RetrievalTool.CONTEXTUAL_SEARCH) ? result.complexityDepth() : 0;
        return new RetrievalPlan(queryType, tools, topK, result.maxExpansions(), result.biographical(),
                result.styleCategory(), decidedBy, null);
    }

    public RetrievalPlan withTraceId(@Nullable String traceId) {
        return new RetrievalPlan(this.queryType, this.tools, this.contextualTopK, this.maxExpansions,
                this.biographical, this.styleCategory, this.decidedBy, traceId);
    }

    public boolean skipRetrieval() {
        return this.tools.isEmpty();
    }
}
