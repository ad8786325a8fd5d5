package org.finos.legend.querybuild.store;

import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Links an entity type to its table with field-to-column mappings.
 *
 * This is the schema metadata a {@link FieldCatalog} is built from. It can be
 * declared explicitly or derived from a Java record class.
 *
 * @param entityName       The entity name, used in diagnostics
 * @param tableName        The physical table the entity is stored in
 * @param propertyMappings Mappings from logical fields to table columns
 */
public record EntityMapping(
        String entityName,
        String tableName,
        List<PropertyMapping> propertyMappings) {

    public EntityMapping {
        Objects.requireNonNull(entityName, "Entity name cannot be null");
        Objects.requireNonNull(tableName, "Table name cannot be null");
        Objects.requireNonNull(propertyMappings, "Property mappings cannot be null");

        if (tableName.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be blank");
        }

        // Ensure immutability
        propertyMappings = List.copyOf(propertyMappings);
    }

    /**
     * Derives a mapping from a record class. Each component becomes a field;
     * its column is taken from {@link ColumnName} or else the snake_case form
     * of the component name.
     *
     * @param recordType The entity record class
     * @param tableName  The table the entity is stored in
     * @return The derived mapping
     * @throws IllegalArgumentException if the type is not a record
     */
    public static EntityMapping fromRecord(Class<? extends Record> recordType, String tableName) {
        if (!recordType.isRecord()) {
            throw new IllegalArgumentException("Type must be a record: " + recordType.getName());
        }
        List<PropertyMapping> mappings = new ArrayList<>();
        for (RecordComponent component : recordType.getRecordComponents()) {
            ColumnName override = component.getAnnotation(ColumnName.class);
            String column = override != null ? override.value() : toSnakeCase(component.getName());
            mappings.add(PropertyMapping.column(component.getName(), column));
        }
        return new EntityMapping(recordType.getSimpleName(), tableName, mappings);
    }

    /**
     * Builds a mapping from a plain field-to-column map.
     */
    public static EntityMapping of(String tableName, Map<String, String> fieldToColumn) {
        List<PropertyMapping> mappings = fieldToColumn.entrySet().stream()
                .map(e -> PropertyMapping.column(e.getKey(), e.getValue()))
                .toList();
        return new EntityMapping(tableName, tableName, mappings);
    }

    /**
     * Gets the column name for a given property name.
     *
     * @param propertyName The logical field name
     * @return Optional containing the column name if mapped
     */
    public Optional<String> getColumnForProperty(String propertyName) {
        return propertyMappings.stream()
                .filter(pm -> pm.propertyName().equals(propertyName))
                .map(PropertyMapping::columnName)
                .findFirst();
    }

    /**
     * @return A map from property names to column names
     */
    public Map<String, String> propertyToColumnMap() {
        return propertyMappings.stream()
                .collect(Collectors.toMap(
                        PropertyMapping::propertyName,
                        PropertyMapping::columnName));
    }

    /**
     * Converts a camelCase name to snake_case ("createdAt" -> "created_at",
     * "ID" -> "id").
     */
    static String toSnakeCase(String name) {
        var sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                boolean previousLower = i > 0 && Character.isLowerCase(name.charAt(i - 1));
                boolean nextLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
                boolean previousUpper = i > 0 && Character.isUpperCase(name.charAt(i - 1));
                if (previousLower || (previousUpper && nextLower)) {
                    sb.append('_');
                }
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        sb.append("Mapping ").append(entityName)
                .append(" -> ").append(tableName).append(" {\n");
        for (PropertyMapping pm : propertyMappings) {
            sb.append("    ").append(pm).append("\n");
        }
        sb.append("}");
        return sb.toString();
    }
}
