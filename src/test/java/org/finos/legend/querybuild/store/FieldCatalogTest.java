package org.finos.legend.querybuild.store;

import org.finos.legend.querybuild.compiler.FieldValidationException;
import org.finos.legend.querybuild.transpiler.SQLiteDialect;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FieldCatalog")
class FieldCatalogTest {

    record Account(long id, String displayName, @ColumnName("mail") String email, int loginCount) {
    }

    @Test
    @DisplayName("Record components become fields with snake_case columns")
    void testFromRecord() {
        // GIVEN: A catalog derived from a record
        FieldCatalog catalog = FieldCatalog.fromRecord(Account.class, "accounts");

        // THEN: Every component is a field, owned by the table
        assertEquals("accounts", catalog.tableName());
        assertEquals(4, catalog.fieldNames().size());
        assertEquals("display_name", catalog.require("displayName").columnName());
        assertEquals("login_count", catalog.require("loginCount").columnName());
        assertEquals("accounts", catalog.require("id").tableName());
    }

    @Test
    @DisplayName("@ColumnName overrides the derived column")
    void testColumnNameOverride() {
        FieldCatalog catalog = FieldCatalog.fromRecord(Account.class, "accounts");

        assertEquals("mail", catalog.require("email").columnName());
    }

    @Test
    @DisplayName("Field names match exactly and case-sensitively")
    void testCaseSensitiveResolve() {
        FieldCatalog catalog = FieldCatalog.of("users", Map.of("status", "status"));

        assertTrue(catalog.resolve("status").isPresent());
        assertTrue(catalog.resolve("Status").isEmpty());
        assertTrue(catalog.resolve("status ").isEmpty());
        assertTrue(catalog.resolve(null).isEmpty());
        assertFalse(catalog.contains("STATUS"));
    }

    @Test
    @DisplayName("require() reports the invalid field name")
    void testRequireUnknownField() {
        FieldCatalog catalog = FieldCatalog.of("users", Map.of("status", "status"));

        FieldValidationException e = assertThrows(FieldValidationException.class,
                () -> catalog.require("password"));
        assertEquals("invalid field name: password", e.getMessage());
        assertEquals("password", e.getFieldName());
    }

    @Test
    @DisplayName("Qualified and unqualified references are dialect-quoted")
    void testReferences() {
        FieldCatalog catalog = FieldCatalog.of("users", Map.of("createdAt", "created_at"));

        assertEquals("\"users\".\"created_at\"",
                catalog.qualifiedReference("createdAt", SQLiteDialect.INSTANCE).orElseThrow());
        assertEquals("\"created_at\"",
                catalog.unqualifiedReference("createdAt", SQLiteDialect.INSTANCE).orElseThrow());
        assertTrue(catalog.qualifiedReference("missing", SQLiteDialect.INSTANCE).isEmpty());
    }

    @Test
    @DisplayName("withTable() rebinds the same fields to another table")
    void testWithTable() {
        FieldCatalog catalog = FieldCatalog.of("users", Map.of("status", "status", "age", "age"));

        FieldCatalog archived = catalog.withTable("archived_users");

        assertEquals("archived_users", archived.tableName());
        assertEquals(catalog.fieldNames(), archived.fieldNames());
        assertEquals("archived_users", archived.require("age").tableName());
        assertEquals("users", catalog.require("age").tableName());
    }

    @Test
    @DisplayName("EntityMapping snake_case conversion")
    void testSnakeCase() {
        assertEquals("created_at", EntityMapping.toSnakeCase("createdAt"));
        assertEquals("id", EntityMapping.toSnakeCase("ID"));
        assertEquals("user_id", EntityMapping.toSnakeCase("userID"));
        assertEquals("http_status", EntityMapping.toSnakeCase("HTTPStatus"));
        assertEquals("name", EntityMapping.toSnakeCase("name"));
    }

    @Test
    @DisplayName("EntityMapping built from a map exposes its columns")
    void testEntityMappingFromMap() {
        EntityMapping mapping = EntityMapping.of("users", Map.of("firstName", "first_name"));

        assertEquals("first_name", mapping.getColumnForProperty("firstName").orElseThrow());
        assertTrue(mapping.getColumnForProperty("lastName").isEmpty());
        assertEquals(Map.of("firstName", "first_name"), mapping.propertyToColumnMap());
    }
}
