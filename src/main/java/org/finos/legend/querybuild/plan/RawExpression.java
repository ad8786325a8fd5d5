package org.finos.legend.querybuild.plan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * SQL text supplied by a scope or by a declared join, emitted verbatim.
 *
 * The text may contain {@code ?} placeholders, one per entry in
 * {@code parameters}. Nothing in the text is validated or quoted: whoever
 * registers the scope is responsible for keeping it safe.
 *
 * @param sql        The SQL fragment
 * @param parameters Values bound to the placeholders, in order
 */
public record RawExpression(
        String sql,
        List<Object> parameters) implements Expression {

    public RawExpression {
        Objects.requireNonNull(sql, "SQL cannot be null");
        Objects.requireNonNull(parameters, "Parameters cannot be null");

        if (sql.isBlank()) {
            throw new IllegalArgumentException("SQL fragment cannot be blank");
        }

        // Bound values may be null
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public static RawExpression of(String sql, Object... parameters) {
        return new RawExpression(sql, parameters == null ? List.of() : Arrays.asList(parameters));
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitRaw(this);
    }

    @Override
    public String toString() {
        return parameters.isEmpty() ? sql : sql + " " + parameters;
    }
}
