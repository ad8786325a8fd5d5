package org.finos.legend.querybuild.request;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Filter comparison operators.
 *
 * Each operator has a stable integer code (its position in the wire
 * protocol, starting with {@code EQ = 0}) and a stable label used in
 * diagnostics. Codes outside the table map to {@link #UNKNOWN}, whose label
 * is {@code "UNKNOWN"}.
 */
@JsonDeserialize(using = Operator.Reader.class)
public enum Operator {
    EQ(0),
    NE(1),
    GT(2),
    GE(3),
    LT(4),
    LE(5),
    LIKE(6),
    IN(7),
    BETWEEN(8),
    NOT_IN(9),
    IS_NULL(10),
    NOT_NULL(11),
    STARTS_WITH(12),
    ENDS_WITH(13),
    CONTAINS(14),
    NOT_LIKE(15),
    REGEXP(16),
    NOT_REGEXP(17),
    OVERLAP(18),
    ARRAY_CONTAINS(19),
    ARRAY_CONTAINED(20),
    UNKNOWN(-1);

    private final int code;

    Operator(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @return The diagnostic label, e.g. "NOT_IN"
     */
    public String label() {
        return name();
    }

    /**
     * Maps a wire code to its operator, or {@link #UNKNOWN}.
     */
    public static Operator fromCode(int code) {
        for (Operator op : values()) {
            if (op.code == code && op != UNKNOWN) {
                return op;
            }
        }
        return UNKNOWN;
    }

    /**
     * Maps an operator name to its operator, or {@link #UNKNOWN}.
     */
    public static Operator fromName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        for (Operator op : values()) {
            if (op.name().equalsIgnoreCase(name.trim())) {
                return op;
            }
        }
        return UNKNOWN;
    }

    /**
     * Diagnostic label for a raw wire code; never throws.
     */
    public static String labelOf(int code) {
        return fromCode(code).label();
    }

    @Override
    public String toString() {
        return label();
    }

    /**
     * Accepts an operator as its name ({@code "GT"}) or its code ({@code 2}).
     */
    static final class Reader extends StdDeserializer<Operator> {

        Reader() {
            super(Operator.class);
        }

        @Override
        public Operator deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonToken token = p.currentToken();
            if (token == JsonToken.VALUE_NUMBER_INT) {
                return fromCode(p.getIntValue());
            }
            if (token == JsonToken.VALUE_STRING) {
                return fromName(p.getText());
            }
            ctxt.handleUnexpectedToken(Operator.class, p);
            return UNKNOWN;
        }

        @Override
        public Operator getNullValue(DeserializationContext ctxt) {
            return EQ;
        }
    }
}
