package org.finos.legend.querybuild.request;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A nested request compiled against another table and joined as a derived
 * table.
 *
 * @param field    Alias of the derived table
 * @param table    Source table of the nested request
 * @param filter   The nested request
 * @param joinCond ON condition linking the derived table to the parent
 */
public record SubQuery(
        @JsonProperty("field") String field,
        @JsonProperty("table") String table,
        @JsonProperty("filter") FilterRequest filter,
        @JsonProperty("join_cond") String joinCond) {

    public SubQuery {
        Objects.requireNonNull(field, "Sub-query alias cannot be null");
        Objects.requireNonNull(table, "Sub-query table cannot be null");
        Objects.requireNonNull(joinCond, "Sub-query join condition cannot be null");
        if (filter == null) {
            filter = FilterRequest.empty();
        }
    }
}
