package org.finos.legend.querybuild.store;

import java.util.Objects;

/**
 * Maps a logical entity field to a physical column.
 *
 * @param propertyName The logical field name callers use in requests (e.g., "createdAt")
 * @param columnName   The relational column name (e.g., "created_at")
 */
public record PropertyMapping(
        String propertyName,
        String columnName) {

    public PropertyMapping {
        Objects.requireNonNull(propertyName, "Property name cannot be null");
        Objects.requireNonNull(columnName, "Column name cannot be null");

        if (propertyName.isBlank()) {
            throw new IllegalArgumentException("Property name cannot be blank");
        }
        if (columnName.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be blank");
        }
    }

    public static PropertyMapping column(String propertyName, String columnName) {
        return new PropertyMapping(propertyName, columnName);
    }

    @Override
    public String toString() {
        return propertyName + " -> " + columnName;
    }
}
