package org.finos.legend.querybuild.execution;

import org.finos.legend.querybuild.store.EntityMapping;

import java.lang.reflect.Constructor;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds Java record instances from JDBC ResultSet rows.
 *
 * A column feeds a record component when its label equals the component name
 * or the component's column name ({@code @ColumnName}, else snake_case), so
 * {@code created_at} fills {@code createdAt}. Labels match ignoring case.
 * Components with no matching column get null, or zero for primitives.
 *
 * @param <T> The record type to build
 */
public class RecordResultBuilder<T extends Record> {

    private final Class<T> recordType;
    private final RecordComponent[] components;
    private final String[] columnNames;
    private final Constructor<T> constructor;

    /**
     * Creates a builder for the specified record type.
     *
     * @param recordType The record class
     * @throws IllegalArgumentException If the type is not a record
     */
    public RecordResultBuilder(Class<T> recordType) {
        if (!recordType.isRecord()) {
            throw new IllegalArgumentException("Type must be a record: " + recordType.getName());
        }
        this.recordType = recordType;
        this.components = recordType.getRecordComponents();

        EntityMapping mapping = EntityMapping.fromRecord(recordType, recordType.getSimpleName());
        this.columnNames = new String[components.length];
        Class<?>[] componentTypes = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            componentTypes[i] = components[i].getType();
            columnNames[i] = mapping.getColumnForProperty(components[i].getName())
                    .orElse(components[i].getName());
        }

        try {
            this.constructor = recordType.getDeclaredConstructor(componentTypes);
            this.constructor.setAccessible(true);
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("Cannot find canonical constructor for " + recordType.getName(), e);
        }
    }

    /**
     * Builds a list of record instances from a ResultSet.
     *
     * @param rs The ResultSet to read from
     * @return List of record instances, empty when there are no rows
     * @throws SQLException If database access fails
     */
    public List<T> buildAll(ResultSet rs) throws SQLException {
        List<T> results = new ArrayList<>();
        Map<String, Integer> columnMap = buildColumnMap(rs.getMetaData());

        while (rs.next()) {
            results.add(buildOne(rs, columnMap));
        }

        return results;
    }

    /**
     * Builds the first row of a ResultSet, or null if it has none.
     */
    public T buildFirst(ResultSet rs) throws SQLException {
        Map<String, Integer> columnMap = buildColumnMap(rs.getMetaData());
        return rs.next() ? buildOne(rs, columnMap) : null;
    }

    private T buildOne(ResultSet rs, Map<String, Integer> columnMap) throws SQLException {
        Object[] args = new Object[components.length];

        for (int i = 0; i < components.length; i++) {
            Class<?> type = components[i].getType();
            Integer columnIndex = columnMap.get(components[i].getName());
            if (columnIndex == null) {
                columnIndex = columnMap.get(columnNames[i]);
            }

            Object value = columnIndex == null ? null : getValue(rs, columnIndex, type);
            args[i] = value == null ? getDefaultValue(type) : value;
        }

        try {
            return constructor.newInstance(args);
        } catch (ReflectiveOperationException | IllegalArgumentException e) {
            throw new SQLException("Failed to construct record: " + recordType.getName(), e);
        }
    }

    /**
     * Gets a value from the ResultSet, converting to the target type.
     */
    private Object getValue(ResultSet rs, int columnIndex, Class<?> targetType) throws SQLException {
        if (targetType == String.class) {
            return rs.getString(columnIndex);
        } else if (targetType == Integer.class || targetType == int.class) {
            int value = rs.getInt(columnIndex);
            return rs.wasNull() ? null : value;
        } else if (targetType == Long.class || targetType == long.class) {
            long value = rs.getLong(columnIndex);
            return rs.wasNull() ? null : value;
        } else if (targetType == Double.class || targetType == double.class) {
            double value = rs.getDouble(columnIndex);
            return rs.wasNull() ? null : value;
        } else if (targetType == Float.class || targetType == float.class) {
            float value = rs.getFloat(columnIndex);
            return rs.wasNull() ? null : value;
        } else if (targetType == Boolean.class || targetType == boolean.class) {
            boolean value = rs.getBoolean(columnIndex);
            return rs.wasNull() ? null : value;
        } else if (targetType == BigDecimal.class) {
            return rs.getBigDecimal(columnIndex);
        } else if (targetType == java.time.LocalDate.class) {
            java.sql.Date date = rs.getDate(columnIndex);
            return date != null ? date.toLocalDate() : null;
        } else if (targetType == java.time.LocalDateTime.class) {
            java.sql.Timestamp ts = rs.getTimestamp(columnIndex);
            return ts != null ? ts.toLocalDateTime() : null;
        } else {
            return rs.getObject(columnIndex);
        }
    }

    /**
     * Gets the default value for a type (null for references, 0 for primitives).
     */
    private Object getDefaultValue(Class<?> type) {
        if (type.isPrimitive()) {
            if (type == int.class)
                return 0;
            if (type == long.class)
                return 0L;
            if (type == double.class)
                return 0.0;
            if (type == boolean.class)
                return false;
            if (type == float.class)
                return 0.0f;
            if (type == short.class)
                return (short) 0;
            if (type == byte.class)
                return (byte) 0;
            if (type == char.class)
                return '\0';
        }
        return null;
    }

    /**
     * Maps column labels to 1-based indices; the first column wins on
     * duplicate labels.
     */
    private Map<String, Integer> buildColumnMap(ResultSetMetaData meta) throws SQLException {
        Map<String, Integer> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        int columnCount = meta.getColumnCount();

        for (int i = 1; i <= columnCount; i++) {
            map.putIfAbsent(meta.getColumnLabel(i), i);
        }

        return map;
    }
}
