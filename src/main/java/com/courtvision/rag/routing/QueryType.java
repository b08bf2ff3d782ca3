package com.courtvision.rag.routing;

import java.util.Locale;

/**
 * Retrieval strategy a question is routed to.
 */
public enum QueryType {
    /**
     * Structured statistical lookup only.
     * Examples: "Top 5 scorers", "Shai's PPG"
     */
    STATISTICAL("sql_only"),

    /**
     * Unstructured contextual search only.
     * Examples: "Why is LeBron considered the GOAT?", "Explain the triangle offense"
     */
    CONTEXTUAL("vector_only"),

    /**
     * Both sources, merged later by the synthesis step.
     * Examples: "Who is Nikola Jokic?", "Compare their stats and explain who's better"
     */
    HYBRID("hybrid");

    private final String wireValue;

    QueryType(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Token used by the generative fallback classifier for this verdict.
     */
    public String getWireValue() {
        return this.wireValue;
    }

    /**
     * Resolves a fallback-classifier token ("sql_only", "vector_only", "hybrid").
     *
     * @throws IllegalArgumentException if the token is not one of the three verdicts
     */
    public static QueryType fromWireValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Routing verdict must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (QueryType type : values()) {
            if (type.wireValue.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown routing verdict: " + value);
    }
}
