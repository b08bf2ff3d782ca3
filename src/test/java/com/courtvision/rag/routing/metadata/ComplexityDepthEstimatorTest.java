package com.courtvision.rag.routing.metadata;

import com.courtvision.rag.routing.QueryText;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityDepthEstimatorTest {

    private final ComplexityDepthEstimator estimator = new ComplexityDepthEstimator();

    private int depth(String query) {
        return estimator.estimate(QueryText.of(query));
    }

    @ParameterizedTest
    @CsvSource({"0,3", "1,3", "2,5", "3,5", "4,7", "5,7", "6,9", "12,9"})
    @DisplayName("Score bands map to depths")
    void scoreBands(int score, int expectedDepth) {
        assertEquals(expectedDepth, ComplexityDepthEstimator.depthFor(score));
    }

    @Test
    @DisplayName("Empty query is a simple lookup")
    void emptyQuery() {
        assertEquals(3, depth(""));
    }

    @Test
    @DisplayName("Single ranking marker stays shallow")
    void singleRanking() {
        assertEquals(3, depth("Who are the top 5 scorers?"));
    }

    @Test
    @DisplayName("Short comparison is moderate")
    void shortComparison() {
        // short +1, compare +1, " and " +1
        assertEquals(5, depth("Compare LeBron and Jordan"));
    }

    @Test
    @DisplayName("Explanation markers deepen retrieval")
    void explanation() {
        // explain +2, why +2
        assertEquals(7, depth("Explain why Curry's shooting changed the game"));
    }

    @Test
    @DisplayName("Strategic analysis is deepest")
    void strategicAnalysis() {
        assertEquals(9, depth("Analyze the impact of the pick and roll on offense and defense strategy"));
    }

    @Test
    @DisplayName("A marker counts once however often it occurs")
    void markerCountsOnce() {
        QueryText once = QueryText.of("compare the two guards tonight please");
        QueryText twice = QueryText.of("compare compare the two guards tonight");
        assertEquals(estimator.score(once), estimator.score(twice));
    }
}
