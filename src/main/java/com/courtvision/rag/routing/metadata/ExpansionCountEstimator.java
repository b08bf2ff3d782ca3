package com.courtvision.rag.routing.metadata;

import com.courtvision.rag.routing.ClassificationResult;
import com.courtvision.rag.routing.QueryStyleCategory;
import com.courtvision.rag.routing.QueryText;

/**
 * Number of paraphrases the expansion step should generate: category base plus a length adjustment,
 * clamped to [1, 5].
 */
public class ExpansionCountEstimator {

    public int estimate(QueryText query, QueryStyleCategory category) {
        int wordCount = query.wordCount();
        int adjustment = 0;
        if (wordCount < 5) {
            adjustment = 1;
        } else if (wordCount > 15) {
            adjustment = -1;
        }
        int value = category.getExpansionBase() + adjustment;
        return Math.max(ClassificationResult.MIN_EXPANSIONS, Math.min(ClassificationResult.MAX_EXPANSIONS, value));
    }
}
