package com.courtvision.rag.routing;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One semantic check of the pre-filter chain: when the predicate holds, {@code verdict} is final.
 */
public record PreFilterRule(String name, Predicate<QueryText> predicate, QueryType verdict) {

    public PreFilterRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(verdict, "verdict");
    }

    public boolean applies(QueryText query) {
        return this.predicate.test(query);
    }
}
