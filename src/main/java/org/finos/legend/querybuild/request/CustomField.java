package org.finos.legend.querybuild.request;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A reference to a registered select scope.
 *
 * @param name  Label of the field in the request (informational)
 * @param scope Name of the select scope
 */
public record CustomField(
        @JsonProperty("name") String name,
        @JsonProperty("scope") String scope) {

    public static CustomField scope(String scopeName) {
        return new CustomField(null, scopeName);
    }
}
