package com.courtvision.rag.routing.fallback;

import com.courtvision.rag.routing.QueryType;

/**
 * Alternative source of the routing verdict, consulted instead of the heuristic ladder when enabled.
 * Implementations never throw; they fall back to {@link QueryType#STATISTICAL}.
 */
public interface RoutingFallbackClassifier {

    QueryType classify(String query);
}
