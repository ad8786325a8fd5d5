package org.finos.legend.querybuild.transpiler;

/**
 * SQL dialect implementation for SQLite.
 * SQLite uses double quotes for identifiers.
 */
public final class SQLiteDialect implements SQLDialect {

    public static final SQLiteDialect INSTANCE = new SQLiteDialect();

    private SQLiteDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "SQLite";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        // Escape any existing double quotes by doubling them
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String formatLimitOffset(Integer limit, Integer offset) {
        // SQLite only accepts OFFSET after a LIMIT; -1 means unbounded
        if (limit == null && offset != null) {
            return " LIMIT -1 OFFSET " + offset;
        }
        return SQLDialect.super.formatLimitOffset(limit, offset);
    }
}
