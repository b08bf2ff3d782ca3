package com.courtvision.rag.routing;

import java.util.Objects;
import java.util.Set;

/**
 * Routing verdict plus the retrieval tuning derived from the same question.
 *
 * @param queryType       which retrieval tools to invoke
 * @param biographical    whether the question asks about a specific player or team
 * @param complexityDepth number of passages the contextual search should retrieve (3, 5, 7 or 9)
 * @param styleCategory   phrasing style of the question
 * @param maxExpansions   number of paraphrases the expansion step should generate (1 to 5)
 */
public record ClassificationResult(
        QueryType queryType,
        boolean biographical,
        int complexityDepth,
        QueryStyleCategory styleCategory,
        int maxExpansions) {

    public static final Set<Integer> DEPTHS = Set.of(3, 5, 7, 9);
    public static final int MIN_EXPANSIONS = 1;
    public static final int MAX_EXPANSIONS = 5;

    public ClassificationResult {
        Objects.requireNonNull(queryType, "queryType");
        Objects.requireNonNull(styleCategory, "styleCategory");
        if (!DEPTHS.contains(complexityDepth)) {
            throw new IllegalArgumentException("complexityDepth must be one of " + DEPTHS + ": " + complexityDepth);
        }
        if (maxExpansions < MIN_EXPANSIONS || maxExpansions > MAX_EXPANSIONS) {
            throw new IllegalArgumentException("maxExpansions out of range [1,5]: " + maxExpansions);
        }
    }
}
