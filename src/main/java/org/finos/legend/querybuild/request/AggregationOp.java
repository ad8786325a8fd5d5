package org.finos.legend.querybuild.request;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Aggregate operations. Wire codes start at 1; 0 and anything unrecognised
 * is {@link #UNKNOWN}.
 */
@JsonDeserialize(using = AggregationOp.Reader.class)
public enum AggregationOp {
    UNKNOWN(0),
    COUNT(1),
    SUM(2),
    AVG(3),
    MAX(4),
    MIN(5);

    private final int code;

    AggregationOp(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static AggregationOp fromCode(int code) {
        for (AggregationOp op : values()) {
            if (op.code == code) {
                return op;
            }
        }
        return UNKNOWN;
    }

    public static AggregationOp fromName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        for (AggregationOp op : values()) {
            if (op.name().equalsIgnoreCase(name.trim())) {
                return op;
            }
        }
        return UNKNOWN;
    }

    static final class Reader extends StdDeserializer<AggregationOp> {

        Reader() {
            super(AggregationOp.class);
        }

        @Override
        public AggregationOp deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonToken token = p.currentToken();
            if (token == JsonToken.VALUE_NUMBER_INT) {
                return fromCode(p.getIntValue());
            }
            if (token == JsonToken.VALUE_STRING) {
                return fromName(p.getText());
            }
            ctxt.handleUnexpectedToken(AggregationOp.class, p);
            return UNKNOWN;
        }
    }
}
