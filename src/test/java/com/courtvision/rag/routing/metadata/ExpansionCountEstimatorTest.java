package com.courtvision.rag.routing.metadata;

import com.courtvision.rag.routing.QueryStyleCategory;
import com.courtvision.rag.routing.QueryText;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExpansionCountEstimatorTest {

    private static final QueryText SHORT = QueryText.of("top scorers");
    private static final QueryText MEDIUM = QueryText.of("Who are the top 5 scorers this season?");
    private static final QueryText LONG = QueryText.of(
            "Which guards averaged more than twenty points per game while also leading their team in assists during the season");

    private final ExpansionCountEstimator estimator = new ExpansionCountEstimator();

    @Test
    @DisplayName("Medium-length question uses the category base")
    void categoryBase() {
        assertEquals(4, estimator.estimate(MEDIUM, QueryStyleCategory.SIMPLE));
        assertEquals(2, estimator.estimate(MEDIUM, QueryStyleCategory.COMPLEX));
        assertEquals(1, estimator.estimate(MEDIUM, QueryStyleCategory.NOISY));
    }

    @Test
    @DisplayName("Short questions get one more expansion")
    void shortQuestion() {
        assertEquals(5, estimator.estimate(SHORT, QueryStyleCategory.SIMPLE));
        assertEquals(2, estimator.estimate(SHORT, QueryStyleCategory.NOISY));
    }

    @Test
    @DisplayName("Long questions get one fewer expansion")
    void longQuestion() {
        assertEquals(1, estimator.estimate(LONG, QueryStyleCategory.COMPLEX));
        assertEquals(3, estimator.estimate(LONG, QueryStyleCategory.SIMPLE));
    }

    @Test
    @DisplayName("Result is clamped to [1, 5]")
    void clamped() {
        assertEquals(5, estimator.estimate(SHORT, QueryStyleCategory.CONVERSATIONAL));
        assertEquals(1, estimator.estimate(LONG, QueryStyleCategory.NOISY));
    }
}
