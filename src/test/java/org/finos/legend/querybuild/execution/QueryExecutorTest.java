package org.finos.legend.querybuild.execution;

import org.finos.legend.querybuild.compiler.FieldValidationException;
import org.finos.legend.querybuild.compiler.QueryCompilationException;
import org.finos.legend.querybuild.compiler.UnsupportedFeatureException;
import org.finos.legend.querybuild.plan.QueryPlan;
import org.finos.legend.querybuild.store.ColumnName;
import org.finos.legend.querybuild.transpiler.SQLiteDialect;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("QueryExecutor")
class QueryExecutorTest {

    record Item(long id, String itemName, Double price, boolean active) {
    }

    record Labelled(@ColumnName("label") String name, int qty) {
    }

    @Nested
    @DisplayName("Refusing plans with errors")
    class Refusal {

        @Test
        @DisplayName("No statement is prepared for a plan with errors")
        void testRefusesBeforeTouchingConnection() {
            // GIVEN: A plan carrying two deferred errors
            Connection connection = mock(Connection.class);
            QueryExecutor executor = new QueryExecutor(connection);
            QueryPlan plan = new QueryPlan(SQLiteDialect.INSTANCE, "items")
                    .addError(new FieldValidationException("colour"))
                    .addError(new UnsupportedFeatureException("having conditions must be implemented via a scope"));

            // WHEN: Any execution is attempted
            QueryCompilationException e = assertThrows(QueryCompilationException.class,
                    () -> executor.findAll(plan, Item.class));
            assertThrows(QueryCompilationException.class, () -> executor.findOne(plan, Item.class));
            assertThrows(QueryCompilationException.class, () -> executor.count(plan));

            // THEN: Every error is surfaced and the connection was never used
            assertEquals(2, e.errors().size());
            assertTrue(e.getMessage().contains("invalid field name: colour"));
            assertTrue(e.getMessage().startsWith("2 errors: "));
            verifyNoInteractions(connection);
        }
    }

    @Nested
    @DisplayName("Against SQLite")
    class Execution {

        private Connection connection;
        private QueryExecutor executor;

        @BeforeEach
        void setUp() throws SQLException {
            connection = DriverManager.getConnection("jdbc:sqlite::memory:");
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("CREATE TABLE items (id INTEGER PRIMARY KEY, item_name TEXT, price REAL, active INTEGER)");
                stmt.execute("INSERT INTO items VALUES (1, 'bolt', 0.25, 1), (2, 'nut', NULL, 0), (3, 'gear', 4.5, 1)");
            }
            executor = new QueryExecutor(connection);
        }

        @AfterEach
        void tearDown() throws SQLException {
            if (connection != null && !connection.isClosed()) {
                connection.close();
            }
        }

        private QueryPlan items() {
            return new QueryPlan(SQLiteDialect.INSTANCE, "items");
        }

        @Test
        @DisplayName("snake_case columns map to camelCase components")
        void testFindAllMapsRecords() throws SQLException {
            List<Item> rows = executor.findAll(items().order("id ASC"), Item.class);

            assertEquals(3, rows.size());
            assertEquals(new Item(1, "bolt", 0.25, true), rows.get(0));
            assertNull(rows.get(1).price());
            assertFalse(rows.get(1).active());
        }

        @Test
        @DisplayName("Zero rows is an empty list")
        void testFindAllEmpty() throws SQLException {
            assertTrue(executor.findAll(items().where("price > ?", 100), Item.class).isEmpty());
        }

        @Test
        @DisplayName("findOne returns the first row")
        void testFindOne() throws SQLException {
            Item item = executor.findOne(items().where("item_name = ?", "gear"), Item.class);

            assertEquals(3, item.id());
        }

        @Test
        @DisplayName("findOne with no match is not found")
        void testFindOneNotFound() {
            RecordNotFoundException e = assertThrows(RecordNotFoundException.class,
                    () -> executor.findOne(items().where("item_name = ?", "spring"), Item.class));

            assertEquals("record not found in items", e.getMessage());
        }

        @Test
        @DisplayName("Aliases and @ColumnName select the column")
        void testAliasMapping() throws SQLException {
            List<Labelled> rows = executor.findAll(
                    items().select("item_name AS label, id * 10 AS qty").order("id"), Labelled.class);

            assertEquals(new Labelled("bolt", 10), rows.get(0));
        }

        @Test
        @DisplayName("count ignores paging")
        void testCount() throws SQLException {
            assertEquals(2, executor.count(items().where("active = ?", 1).limit(1).offset(1)));
        }

        @Test
        @DisplayName("Backend errors propagate unchanged")
        void testBackendError() {
            assertThrows(SQLException.class,
                    () -> executor.findAll(new QueryPlan(SQLiteDialect.INSTANCE, "no_such_table"), Item.class));
        }
    }
}
