package org.finos.legend.querybuild.plan;

import java.util.Objects;

/**
 * Reference to a catalogued column, optionally qualified by its table.
 *
 * Only columns resolved through a field catalog should be wrapped in a
 * ColumnReference; both parts are quoted by the dialect when rendered.
 *
 * @param tableName  The owning table, or empty for an unqualified reference
 * @param columnName The column name
 */
public record ColumnReference(
        String tableName,
        String columnName) implements Expression {

    public ColumnReference {
        Objects.requireNonNull(tableName, "Table name cannot be null (use empty string for unqualified)");
        Objects.requireNonNull(columnName, "Column name cannot be null");

        if (columnName.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be blank");
        }
    }

    public static ColumnReference of(String columnName) {
        return new ColumnReference("", columnName);
    }

    public static ColumnReference qualified(String tableName, String columnName) {
        return new ColumnReference(tableName, columnName);
    }

    public boolean isQualified() {
        return !tableName.isEmpty();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitColumnReference(this);
    }

    @Override
    public String toString() {
        return isQualified() ? tableName + "." + columnName : columnName;
    }
}
