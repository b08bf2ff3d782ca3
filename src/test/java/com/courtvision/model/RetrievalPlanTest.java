package com.courtvision.model;

import com.courtvision.rag.routing.ClassificationResult;
import com.courtvision.rag.routing.QueryStyleCategory;
import com.courtvision.rag.routing.QueryType;
import java.util.EnumSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetrievalPlanTest {

    private static final ClassificationResult RESULT =
            new ClassificationResult(QueryType.HYBRID, true, 7, QueryStyleCategory.SIMPLE, 4);

    @Test
    @DisplayName("Tools follow the query type")
    void toolsPerType() {
        assertEquals(EnumSet.of(RetrievalTool.STRUCTURED_LOOKUP), RetrievalTool.forQueryType(QueryType.STATISTICAL));
        assertEquals(EnumSet.of(RetrievalTool.CONTEXTUAL_SEARCH), RetrievalTool.forQueryType(QueryType.CONTEXTUAL));
        assertEquals(EnumSet.allOf(RetrievalTool.class), RetrievalTool.forQueryType(QueryType.HYBRID));
        assertTrue(RetrievalTool.forQueryType(null).isEmpty());
    }

    @Test
    @DisplayName("Top-K is only set when contextual search runs")
    void topKOnlyForContextualSearch() {
        assertEquals(7, RetrievalPlan.of(QueryType.HYBRID, RESULT, RetrievalPlan.DECIDED_BY_HEURISTIC).contextualTopK());
        assertEquals(0, RetrievalPlan.of(QueryType.STATISTICAL, RESULT, RetrievalPlan.DECIDED_BY_LLM).contextualTopK());
    }

    @Test
    @DisplayName("Tools are read-only")
    void toolsReadOnly() {
        RetrievalPlan plan = RetrievalPlan.of(QueryType.HYBRID, RESULT, RetrievalPlan.DECIDED_BY_HEURISTIC);
        assertThrows(UnsupportedOperationException.class, () -> plan.tools().clear());
    }

    @Test
    @DisplayName("Greeting plan skips retrieval")
    void greeting() {
        RetrievalPlan plan = RetrievalPlan.greeting();
        assertTrue(plan.skipRetrieval());
        assertEquals(0, plan.maxExpansions());
        assertNull(plan.traceId());
    }

    @Test
    @DisplayName("Attaching a trace id keeps the rest of the plan")
    void withTraceId() {
        RetrievalPlan plan = RetrievalPlan.of(QueryType.HYBRID, RESULT, RetrievalPlan.DECIDED_BY_HEURISTIC);

        RetrievalPlan traced = plan.withTraceId("a1b2c3d4");

        assertEquals("a1b2c3d4", traced.traceId());
        assertEquals(plan.tools(), traced.tools());
        assertEquals(plan.contextualTopK(), traced.contextualTopK());
        assertEquals(plan.decidedBy(), traced.decidedBy());
    }
}
