package org.finos.legend.querybuild.plan;

import java.util.Objects;

/**
 * One item of the ORDER BY list.
 *
 * @param expression The sort key
 * @param direction  The direction, or null when the key already carries one
 *                   (raw scope text such as {@code "status ASC, name DESC"})
 */
public record SortItem(Expression expression, SortDirection direction) {

    /**
     * Sort direction for ORDER BY.
     */
    public enum SortDirection {
        ASC, DESC
    }

    public SortItem {
        Objects.requireNonNull(expression, "Expression cannot be null");
    }

    public static SortItem asc(Expression expression) {
        return new SortItem(expression, SortDirection.ASC);
    }

    public static SortItem desc(Expression expression) {
        return new SortItem(expression, SortDirection.DESC);
    }

    public static SortItem raw(RawExpression expression) {
        return new SortItem(expression, null);
    }
}
