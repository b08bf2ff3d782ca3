package com.courtvision.rag.routing;

import java.util.ArrayList;
import java.util.List;

/**
 * Sums the weights of the groups that fire on a question. Each group is checked exactly once.
 */
public final class WeightedScorer {

    private WeightedScorer() {
    }

    public static SignalScore score(String normalizedQuery, List<PatternGroup> groups) {
        double total = 0.0;
        List<String> matched = new ArrayList<>();
        for (PatternGroup group : groups) {
            if (group.fires(normalizedQuery)) {
                total += group.weight();
                matched.add(group.name());
            }
        }
        return matched.isEmpty() ? SignalScore.NONE : new SignalScore(total, matched);
    }
}
