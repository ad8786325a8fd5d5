package org.finos.legend.querybuild.request;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * An aggregate projection over one field.
 *
 * Without an alias the result column is named after the field's column, so
 * {@code AVG} over {@code age} is read back as {@code age}.
 *
 * @param field      The logical field name
 * @param op         The aggregate operation
 * @param noCase     Aggregate the lower-cased value
 * @param alias      Output column name, or null for the column name
 * @param addSelects Extra raw select items; always rejected when non-empty
 */
public record Aggregation(
        @JsonProperty("field") String field,
        @JsonProperty("op") AggregationOp op,
        @JsonProperty("nocase") boolean noCase,
        @JsonProperty("alias") String alias,
        @JsonProperty("add_selects") List<String> addSelects) {

    public Aggregation {
        if (op == null) {
            op = AggregationOp.UNKNOWN;
        }
        addSelects = addSelects == null ? List.of() : List.copyOf(addSelects);
    }

    public static Aggregation of(String field, AggregationOp op) {
        return new Aggregation(field, op, false, null, List.of());
    }

    public static Aggregation of(String field, AggregationOp op, String alias) {
        return new Aggregation(field, op, false, alias, List.of());
    }

    public Aggregation ignoringCase() {
        return new Aggregation(field, op, true, alias, addSelects);
    }

    public boolean hasAlias() {
        return alias != null && !alias.isEmpty();
    }
}
