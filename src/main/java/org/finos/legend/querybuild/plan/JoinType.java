package org.finos.legend.querybuild.plan;

import java.util.Locale;
import java.util.Optional;

/**
 * Join kinds a request may declare.
 */
public enum JoinType {
    INNER("INNER JOIN"),
    LEFT("LEFT JOIN"),
    RIGHT("RIGHT JOIN");

    private final String sql;

    JoinType(String sql) {
        this.sql = sql;
    }

    public String toSql() {
        return sql;
    }

    /**
     * Parses a request join type ("left", "INNER", ...), ignoring case.
     */
    public static Optional<JoinType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
