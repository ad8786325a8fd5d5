package org.finos.legend.querybuild.request;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Operator labels and codes")
class OperatorTest {

    @ParameterizedTest(name = "{0} is labelled {1}")
    @CsvSource({
            "0, EQ",
            "1, NE",
            "2, GT",
            "6, LIKE",
            "7, IN",
            "10, IS_NULL",
            "12, STARTS_WITH",
            "20, ARRAY_CONTAINED",
            "999, UNKNOWN",
            "-1, UNKNOWN",
            "21, UNKNOWN",
    })
    void testLabelOf(int code, String label) {
        assertEquals(label, Operator.labelOf(code));
    }

    @Test
    @DisplayName("Codes follow declaration order starting at EQ")
    void testCodesAreStable() {
        Operator[] values = Operator.values();
        for (int i = 0; i < values.length - 1; i++) {
            assertEquals(i, values[i].code(), values[i].name());
            assertSame(values[i], Operator.fromCode(i));
        }
        assertSame(Operator.UNKNOWN, Operator.fromCode(Operator.UNKNOWN.code()));
    }

    @Test
    @DisplayName("Names resolve ignoring case, unknown names are UNKNOWN")
    void testFromName() {
        assertSame(Operator.NOT_IN, Operator.fromName("not_in"));
        assertSame(Operator.UNKNOWN, Operator.fromName("APPROX"));
        assertSame(Operator.UNKNOWN, Operator.fromName(null));
        assertEquals("GE", Operator.GE.toString());
    }

    @Test
    @DisplayName("Aggregation codes start at COUNT = 1")
    void testAggregationCodes() {
        assertSame(AggregationOp.COUNT, AggregationOp.fromCode(1));
        assertSame(AggregationOp.MIN, AggregationOp.fromCode(5));
        assertSame(AggregationOp.UNKNOWN, AggregationOp.fromCode(0));
        assertSame(AggregationOp.UNKNOWN, AggregationOp.fromCode(42));
        assertSame(AggregationOp.AVG, AggregationOp.fromName("avg"));
    }
}
