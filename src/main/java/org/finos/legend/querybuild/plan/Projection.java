package org.finos.legend.querybuild.plan;

import java.util.Objects;

/**
 * One item of the SELECT list.
 *
 * @param expression The projected expression
 * @param alias      The output column name, or null to leave it unaliased
 */
public record Projection(Expression expression, String alias) {

    public Projection {
        Objects.requireNonNull(expression, "Expression cannot be null");
        if (alias != null && alias.isBlank()) {
            throw new IllegalArgumentException("Alias cannot be blank");
        }
    }

    public static Projection of(Expression expression) {
        return new Projection(expression, null);
    }

    public static Projection as(Expression expression, String alias) {
        return new Projection(expression, alias);
    }

    public boolean hasAlias() {
        return alias != null;
    }
}
