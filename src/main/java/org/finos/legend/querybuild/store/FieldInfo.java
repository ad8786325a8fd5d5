package org.finos.legend.querybuild.store;

import org.finos.legend.querybuild.plan.ColumnReference;

import java.util.Objects;

/**
 * A legal field of an entity: the physical column and the table that owns it.
 *
 * @param columnName The column name
 * @param tableName  The owning table name
 */
public record FieldInfo(String columnName, String tableName) {

    public FieldInfo {
        Objects.requireNonNull(columnName, "Column name cannot be null");
        Objects.requireNonNull(tableName, "Table name cannot be null");
    }

    /**
     * Table-prefixed reference, used wherever the column may be ambiguous
     * under joins (filters, sorts, groups, aggregate arguments).
     */
    public ColumnReference qualified() {
        return ColumnReference.qualified(tableName, columnName);
    }
}
