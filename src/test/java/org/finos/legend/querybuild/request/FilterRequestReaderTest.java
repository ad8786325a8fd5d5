package org.finos.legend.querybuild.request;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FilterRequestReader")
class FilterRequestReaderTest {

    private final FilterRequestReader reader = new FilterRequestReader();

    @Test
    @DisplayName("Reads every clause of a full request")
    void testReadFullRequest() throws Exception {
        // GIVEN: A request using the snake_case wire names
        String json = """
                {
                  "filters": [
                    {"field": "status", "op": "EQ", "value": "ACTIVE", "nocase": true},
                    {"field": "age", "op": 8, "value": "18,65"}
                  ],
                  "custom_fields": [{"name": "info", "scope": "userInfo"}],
                  "custom_filter": {"scope": "olderThan", "values": [30]},
                  "sorts": [{"field": "age", "desc": true}, {"scope": "recent"}],
                  "aggrs": [{"field": "age", "op": "AVG", "alias": "average_age"}, {"field": "id", "op": 1}],
                  "page": {"page": 2, "page_size": 25},
                  "groups": [{"field": "status"}, {"scope": "statusWithCount"}],
                  "joins": [{"type": "left", "table": "orders", "condition": "orders.user_id = users.id"}],
                  "sub_query": {
                    "field": "arch",
                    "table": "archived_users",
                    "filter": {"filters": [{"field": "status", "value": "active"}]},
                    "join_cond": "arch.email = users.email"
                  },
                  "distinct": true
                }
                """;

        // WHEN: We read it
        FilterRequest request = reader.read(json);

        // THEN: Every clause is populated
        assertEquals(2, request.filters().size());
        Filter first = request.filters().get(0);
        assertEquals("status", first.field());
        assertSame(Operator.EQ, first.op());
        assertEquals("ACTIVE", first.value());
        assertTrue(first.noCase());
        assertSame(Operator.BETWEEN, request.filters().get(1).op());

        assertEquals("userInfo", request.customFields().get(0).scope());
        assertEquals("olderThan", request.customFilter().scope());
        assertEquals(List.of(30), request.customFilter().values());

        assertTrue(request.sorts().get(0).desc());
        assertEquals("recent", request.sorts().get(1).scope());

        assertEquals("average_age", request.aggregations().get(0).alias());
        assertSame(AggregationOp.AVG, request.aggregations().get(0).op());
        assertSame(AggregationOp.COUNT, request.aggregations().get(1).op());

        assertEquals(2, request.pagination().page());
        assertEquals(25, request.pagination().pageSize());
        assertEquals(25L, request.pagination().offset());

        assertEquals("statusWithCount", request.groups().get(1).scope());
        assertEquals("left", request.joins().get(0).type());

        SubQuery sub = request.subQuery();
        assertEquals("archived_users", sub.table());
        assertEquals("arch.email = users.email", sub.joinCond());
        assertSame(Operator.EQ, sub.filter().filters().get(0).op());

        assertTrue(request.distinct());
    }

    @Test
    @DisplayName("Missing clauses read as empty")
    void testReadEmpty() throws Exception {
        FilterRequest request = reader.read("{}");

        assertTrue(request.filters().isEmpty());
        assertTrue(request.sorts().isEmpty());
        assertTrue(request.aggregations().isEmpty());
        assertNull(request.pagination());
        assertNull(request.subQuery());
        assertFalse(request.hasCustomFilter());
        assertFalse(request.distinct());
    }

    @Test
    @DisplayName("Unknown operators and properties do not fail the read")
    void testLenientRead() throws Exception {
        FilterRequest request = reader.read("""
                {"filters": [{"field": "age", "op": "APPROX", "value": "1"}, {"field": "age", "op": 99}],
                 "aggrs": [{"field": "age", "op": "MEDIAN"}],
                 "trace_id": "abc"}
                """);

        assertSame(Operator.UNKNOWN, request.filters().get(0).op());
        assertSame(Operator.UNKNOWN, request.filters().get(1).op());
        assertSame(AggregationOp.UNKNOWN, request.aggregations().get(0).op());
    }

    @Test
    @DisplayName("Written requests carry the pagination total")
    void testWriteTotal() throws Exception {
        FilterRequest request = FilterRequest.builder()
                .filter("status", Operator.EQ, "active")
                .page(1, 2)
                .build();
        request.pagination().setTotal(3);

        String json = reader.write(request);

        assertTrue(json.contains("\"total\":3"), json);
        assertTrue(json.contains("\"page_size\":2"), json);
        FilterRequest reread = reader.read(json);
        assertEquals(3, reread.pagination().total());
        assertSame(Operator.EQ, reread.filters().get(0).op());
    }
}
