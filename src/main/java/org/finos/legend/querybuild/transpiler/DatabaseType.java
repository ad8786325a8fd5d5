package org.finos.legend.querybuild.transpiler;

/**
 * Database engines with a shipped dialect.
 */
public enum DatabaseType {
    SQLITE,
    DUCKDB;

    /**
     * Maps the database type to its SQL dialect.
     */
    public SQLDialect dialect() {
        return switch (this) {
            case SQLITE -> SQLiteDialect.INSTANCE;
            case DUCKDB -> DuckDBDialect.INSTANCE;
        };
    }
}
