package com.courtvision.model;

import com.courtvision.rag.routing.QueryType;
import java.util.EnumSet;

/**
 * Retrieval back ends a plan can invoke.
 */
public enum RetrievalTool {
    /**
     * Structured player and team statistics.
     */
    STRUCTURED_LOOKUP,

    /**
     * Passage search over articles, discussions and the glossary.
     */
    CONTEXTUAL_SEARCH;

    public static EnumSet<RetrievalTool> forQueryType(QueryType queryType) {
        if (queryType == null) {
            return EnumSet.noneOf(RetrievalTool.class);
        }
        return switch (queryType) {
            case STATISTICAL -> EnumSet.of(STRUCTURED_LOOKUP);
            case CONTEXTUAL -> EnumSet.of(CONTEXTUAL_SEARCH);
            case HYBRID -> EnumSet.of(STRUCTURED_LOOKUP, CONTEXTUAL_SEARCH);
        };
    }
}
