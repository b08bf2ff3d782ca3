package com.courtvision.rag.routing.metadata;

import com.courtvision.rag.routing.QueryText;
import java.util.List;

/**
 * Estimates how many passages the contextual search should retrieve.
 *
 * <p>Depth levels:</p>
 * <ul>
 *   <li>3 - single player or stat lookups</li>
 *   <li>5 - rankings, comparisons, several stats</li>
 *   <li>7 - multi-step analysis</li>
 *   <li>9 - deep analytical or strategic questions</li>
 * </ul>
 */
public class ComplexityDepthEstimator {

    // Each marker counts once when present, however often it occurs.
    static final List<String> MODERATE_MARKERS = List.of(
            "top ", "best ", "compare", "versus", "most", "least",
            "ranking", "average", "leaders", "leaders in");

    static final List<String> COMPLEX_MARKERS = List.of(
            "explain", "analyze", "impact", "effect", "why", "how does",
            "strategy", "style", "strengths", "weakness", "capability",
            "tendency", "pattern", "role", "system", "philosophy",
            "efficient", "effectiveness", "defense", "offense");

    public int estimate(QueryText query) {
        return depthFor(score(query));
    }

    int score(QueryText query) {
        String text = query.normalized();
        int wordCount = query.wordCount();
        int score = 0;

        if (wordCount < 5) {
            score += 1;
        } else if (wordCount > 15) {
            score += 2;
        }
        for (String marker : MODERATE_MARKERS) {
            if (text.contains(marker)) {
                score += 1;
            }
        }
        for (String marker : COMPLEX_MARKERS) {
            if (text.contains(marker)) {
                score += 2;
            }
        }
        if (text.contains(" and ")) {
            score += 1;
        }
        if (text.indexOf(',') >= 0) {
            score += 1;
        }
        return score;
    }

    static int depthFor(int score) {
        if (score <= 1) {
            return 3;
        }
        if (score <= 3) {
            return 5;
        }
        if (score <= 5) {
            return 7;
        }
        return 9;
    }
}
