package org.finos.legend.querybuild.request;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A declarative predicate on one field.
 *
 * {@code IN}, {@code NOT_IN} and {@code BETWEEN} take their operands as one
 * comma-joined string ({@code "active,pending"}, {@code "18,65"}), so an
 * operand that itself contains a comma cannot be expressed.
 *
 * @param field  The logical field name
 * @param op     The operator; EQ when absent
 * @param value  The string-encoded operand(s); empty when absent
 * @param noCase Compare case-insensitively
 */
public record Filter(
        @JsonProperty("field") String field,
        @JsonProperty("op") Operator op,
        @JsonProperty("value") String value,
        @JsonProperty("nocase") boolean noCase) {

    public Filter {
        if (op == null) {
            op = Operator.EQ;
        }
        if (value == null) {
            value = "";
        }
    }

    public static Filter of(String field, Operator op, String value) {
        return new Filter(field, op, value, false);
    }

    public static Filter of(String field, Operator op) {
        return new Filter(field, op, "", false);
    }

    public static Filter ignoringCase(String field, Operator op, String value) {
        return new Filter(field, op, value, true);
    }
}
