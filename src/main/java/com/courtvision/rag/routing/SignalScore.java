package com.courtvision.rag.routing;

import java.util.List;

/**
 * Accumulated weight and fired group names for one signal family.
 */
public record SignalScore(double total, List<String> matchedGroups) {

    public static final SignalScore NONE = new SignalScore(0.0, List.of());

    public SignalScore {
        matchedGroups = List.copyOf(matchedGroups);
    }

    public boolean isPositive() {
        return this.total > 0.0;
    }
}
