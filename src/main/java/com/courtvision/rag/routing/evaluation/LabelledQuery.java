package com.courtvision.rag.routing.evaluation;

import com.courtvision.rag.routing.QueryType;
import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A question with its expected route, as stored in a labelled corpus.
 *
 * @param expected wire token of the expected route ({@code sql_only}, {@code vector_only}, {@code hybrid})
 */
public record LabelledQuery(String query, String expected) {

    @JsonIgnore
    public QueryType expectedType() {
        return QueryType.fromWireValue(this.expected);
    }
}
