package org.finos.legend.querybuild.transpiler;

/**
 * SQL dialect implementation for DuckDB.
 * DuckDB uses double quotes for identifiers and has no REGEXP operator.
 */
public final class DuckDBDialect implements SQLDialect {

    public static final DuckDBDialect INSTANCE = new DuckDBDialect();

    private DuckDBDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "DuckDB";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String formatRegexp(String operand, String pattern, boolean negated) {
        String match = "regexp_matches(" + operand + ", " + pattern + ")";
        return negated ? "NOT " + match : match;
    }
}
