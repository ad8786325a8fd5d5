package org.finos.legend.querybuild.store;

import org.finos.legend.querybuild.compiler.FieldValidationException;
import org.finos.legend.querybuild.transpiler.SQLDialect;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The allow-list of field names for one entity type.
 *
 * Built once from an {@link EntityMapping} and immutable afterwards, so it can
 * be read concurrently without synchronization. Field names match exactly and
 * case-sensitively: "Status" and "status" are different fields.
 */
public final class FieldCatalog {

    private final String tableName;
    private final Map<String, FieldInfo> fields;

    private FieldCatalog(String tableName, Map<String, FieldInfo> fields) {
        this.tableName = tableName;
        this.fields = Map.copyOf(fields);
    }

    /**
     * Builds the catalog for a mapped entity.
     */
    public static FieldCatalog fromMapping(EntityMapping mapping) {
        Objects.requireNonNull(mapping, "Mapping cannot be null");
        Map<String, FieldInfo> fields = new LinkedHashMap<>();
        for (PropertyMapping pm : mapping.propertyMappings()) {
            fields.put(pm.propertyName(), new FieldInfo(pm.columnName(), mapping.tableName()));
        }
        return new FieldCatalog(mapping.tableName(), fields);
    }

    /**
     * Builds the catalog for a record class stored in {@code tableName}.
     *
     * @see EntityMapping#fromRecord(Class, String)
     */
    public static FieldCatalog fromRecord(Class<? extends Record> recordType, String tableName) {
        return fromMapping(EntityMapping.fromRecord(recordType, tableName));
    }

    /**
     * Builds the catalog from an explicit field-to-column map.
     */
    public static FieldCatalog of(String tableName, Map<String, String> fieldToColumn) {
        return fromMapping(EntityMapping.of(tableName, fieldToColumn));
    }

    /**
     * Looks up a field.
     *
     * @param fieldName The logical field name
     * @return Optional containing the field if it is legal for this entity
     */
    public Optional<FieldInfo> resolve(String fieldName) {
        if (fieldName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(fields.get(fieldName));
    }

    /**
     * @param fieldName The logical field name
     * @return The field
     * @throws FieldValidationException if the field is not in the catalog
     */
    public FieldInfo require(String fieldName) {
        return resolve(fieldName).orElseThrow(() -> new FieldValidationException(fieldName));
    }

    /**
     * Renders the qualified, dialect-quoted reference for a field,
     * e.g. {@code "users"."age"}.
     */
    public Optional<String> qualifiedReference(String fieldName, SQLDialect dialect) {
        return resolve(fieldName).map(info -> dialect.quoteIdentifier(info.tableName())
                + "." + dialect.quoteIdentifier(info.columnName()));
    }

    /**
     * Renders the unqualified, dialect-quoted reference for a field,
     * e.g. {@code "age"}.
     */
    public Optional<String> unqualifiedReference(String fieldName, SQLDialect dialect) {
        return resolve(fieldName).map(info -> dialect.quoteIdentifier(info.columnName()));
    }

    /**
     * Returns a catalog with the same fields, owned by another table.
     * Used to compile sub-queries against a different source table.
     */
    public FieldCatalog withTable(String otherTable) {
        Objects.requireNonNull(otherTable, "Table name cannot be null");
        Map<String, FieldInfo> rebound = new LinkedHashMap<>();
        fields.forEach((name, info) -> rebound.put(name, new FieldInfo(info.columnName(), otherTable)));
        return new FieldCatalog(otherTable, rebound);
    }

    public String tableName() {
        return tableName;
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public boolean contains(String fieldName) {
        return fieldName != null && fields.containsKey(fieldName);
    }

    @Override
    public String toString() {
        return "FieldCatalog(" + tableName + ", " + fields.keySet() + ")";
    }
}
