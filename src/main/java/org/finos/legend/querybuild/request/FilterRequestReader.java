package org.finos.legend.querybuild.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads and writes {@link FilterRequest} documents in their JSON wire form.
 *
 * Properties the model does not know are ignored. Operators may be given by
 * name or by code; unrecognised operators read as {@code UNKNOWN} and are
 * reported when the request is compiled.
 */
public final class FilterRequestReader {

    private final ObjectMapper objectMapper;

    public FilterRequestReader() {
        this(new ObjectMapper());
    }

    public FilterRequestReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public FilterRequest read(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, FilterRequest.class);
    }

    public FilterRequest read(InputStream in) throws IOException {
        return objectMapper.readValue(in, FilterRequest.class);
    }

    /**
     * Writes a request, including any pagination total, back to JSON.
     */
    public String write(FilterRequest request) throws JsonProcessingException {
        return objectMapper.writeValueAsString(request);
    }
}
