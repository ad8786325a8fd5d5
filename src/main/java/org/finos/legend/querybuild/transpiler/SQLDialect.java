package org.finos.legend.querybuild.transpiler;

/**
 * Interface defining SQL dialect-specific behavior.
 * Implementations handle differences between database engines.
 */
public interface SQLDialect {

    /**
     * @return The dialect name (e.g., "DuckDB", "SQLite")
     */
    String name();

    /**
     * Quote an identifier (table name, column name, alias).
     *
     * @param identifier The identifier to quote
     * @return The quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Render a regular-expression match of an operand against a pattern.
     *
     * @param operand The rendered operand
     * @param pattern The rendered pattern (normally a placeholder)
     * @param negated true for a non-match test
     * @return The SQL predicate
     */
    default String formatRegexp(String operand, String pattern, boolean negated) {
        return operand + (negated ? " NOT REGEXP " : " REGEXP ") + pattern;
    }

    /**
     * Render the LIMIT/OFFSET tail of a SELECT.
     *
     * @param limit  The row limit, or null
     * @param offset The row offset, or null
     * @return The clause with a leading space, or an empty string
     */
    default String formatLimitOffset(Integer limit, Integer offset) {
        var sb = new StringBuilder();
        if (limit != null) {
            sb.append(" LIMIT ").append(limit);
        }
        if (offset != null) {
            sb.append(" OFFSET ").append(offset);
        }
        return sb.toString();
    }
}
