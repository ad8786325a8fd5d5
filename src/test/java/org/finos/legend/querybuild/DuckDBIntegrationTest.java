package org.finos.legend.querybuild;

import org.finos.legend.querybuild.request.Aggregation;
import org.finos.legend.querybuild.request.AggregationOp;
import org.finos.legend.querybuild.request.Filter;
import org.finos.legend.querybuild.request.FilterRequest;
import org.finos.legend.querybuild.request.Group;
import org.finos.legend.querybuild.request.Operator;
import org.finos.legend.querybuild.request.Sort;
import org.finos.legend.querybuild.scope.Scope;
import org.finos.legend.querybuild.scope.ScopeType;
import org.finos.legend.querybuild.transpiler.DatabaseType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using DuckDB as the execution engine.
 */
@DisplayName("DuckDB Integration Tests")
class DuckDBIntegrationTest extends AbstractDatabaseTest {

    record StatusGroup(String status, long count) {
    }

    @Override
    protected DatabaseType getDatabaseType() {
        return DatabaseType.DUCKDB;
    }

    @Override
    protected String getJdbcUrl() {
        return "jdbc:duckdb:";
    }

    private List<String> findNames(FilterRequest request) throws SQLException {
        return users.findAll(request).stream().map(TestUser::name).toList();
    }

    @Test
    @DisplayName("Equality and case-insensitive equality")
    void testEquality() throws SQLException {
        assertEquals(List.of("John Doe", "Bob Johnson"), findNames(FilterRequest.builder()
                .filter("status", Operator.EQ, "active")
                .sort(Sort.asc("id"))
                .build()));
        assertEquals(List.of("Jane Smith"), findNames(FilterRequest.builder()
                .filter(Filter.ignoringCase("status", Operator.EQ, "INACTIVE"))
                .build()));
    }

    @Test
    @DisplayName("IN and pattern operators")
    void testInAndPatterns() throws SQLException {
        assertEquals(List.of("Jane Smith"), findNames(FilterRequest.builder()
                .filter("status", Operator.NOT_IN, "active")
                .build()));
        assertEquals(List.of("John Doe", "Bob Johnson"), findNames(FilterRequest.builder()
                .filter("name", Operator.CONTAINS, "oh")
                .sort(Sort.asc("id"))
                .build()));
    }

    @Test
    @DisplayName("REGEXP renders as regexp_matches")
    void testRegexp() throws SQLException {
        assertEquals(List.of("Jane Smith"), findNames(FilterRequest.builder()
                .filter("email", Operator.REGEXP, "^ja")
                .build()));
        assertEquals(List.of("John Doe", "Bob Johnson"), findNames(FilterRequest.builder()
                .filter("email", Operator.NOT_REGEXP, "^ja")
                .sort(Sort.asc("id"))
                .build()));
    }

    @Test
    @DisplayName("Pagination counts before paging")
    void testPagination() throws SQLException {
        FilterRequest request = FilterRequest.builder()
                .sort(Sort.desc("name"))
                .page(2, 2)
                .build();

        assertEquals(List.of("Bob Johnson"), findNames(request));
        assertEquals(3, request.pagination().total());
    }

    @Test
    @DisplayName("Grouped count by status")
    void testGroupByStatus() throws SQLException {
        List<StatusGroup> groups = users.findAll(FilterRequest.builder()
                .group(Group.by("status"))
                .aggregation(Aggregation.of("id", AggregationOp.COUNT, "count"))
                .sort(Sort.asc("status"))
                .build(), StatusGroup.class);

        assertEquals(List.of(new StatusGroup("active", 2), new StatusGroup("inactive", 1)), groups);
    }

    @Test
    @DisplayName("Filter scope with arguments")
    void testFilterScope() throws SQLException {
        users.registerScope(ScopeType.FILTER, "withStatus",
                Scope.withArguments((plan, args) -> plan.where("status = ?", args.get(0))));

        assertEquals(1, users.count(FilterRequest.builder().customFilter("withStatus", "inactive").build()));
    }
}
