package com.courtvision.rag.routing.evaluation;

import com.courtvision.rag.routing.QueryClassifier.FamilyScores;
import com.courtvision.rag.routing.QueryType;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of replaying a labelled corpus through the classifier.
 *
 * @param confusion expected type to actual type to count
 */
public record RoutingEvaluationReport(
        int total,
        int correct,
        Map<QueryType, Map<QueryType, Integer>> confusion,
        List<Misroute> misrouted) {

    /**
     * @param scores family scores of the question, for finding the group that pulled it the wrong way
     */
    public record Misroute(String query, QueryType expected, QueryType actual, FamilyScores scores) {
    }

    public RoutingEvaluationReport {
        Map<QueryType, Map<QueryType, Integer>> copy = new EnumMap<>(QueryType.class);
        confusion.forEach((expected, row) -> copy.put(expected, Map.copyOf(row)));
        confusion = Map.copyOf(copy);
        misrouted = List.copyOf(misrouted);
    }

    /**
     * Fraction routed correctly; 0 for an empty corpus.
     */
    public double accuracy() {
        return this.total == 0 ? 0.0 : (double) this.correct / this.total;
    }

    public int count(QueryType expected, QueryType actual) {
        Map<QueryType, Integer> row = this.confusion.get(expected);
        return row == null ? 0 : row.getOrDefault(actual, 0);
    }
}
