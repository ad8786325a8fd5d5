package org.finos.legend.querybuild.request;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A reference to a registered filter scope, with arguments passed to it.
 *
 * @param scope  Name of the filter scope
 * @param values Arguments handed to the scope
 */
public record CustomFilter(
        @JsonProperty("scope") String scope,
        @JsonProperty("values") List<Object> values) {

    public CustomFilter {
        values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static CustomFilter scope(String scopeName, Object... values) {
        return new CustomFilter(scopeName, Arrays.asList(values));
    }
}
