package org.finos.legend.querybuild.request;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Grouping on a field, or a reference to a registered group scope.
 *
 * Raw {@code having} text is rejected at compile time; HAVING conditions
 * belong in a group scope.
 *
 * @param field  The logical field name (ignored when the scope resolves)
 * @param having Raw HAVING text; always rejected when non-empty
 * @param scope  Name of a group scope, or null
 */
public record Group(
        @JsonProperty("field") String field,
        @JsonProperty("having") String having,
        @JsonProperty("scope") String scope) {

    public static Group by(String field) {
        return new Group(field, null, null);
    }

    public static Group scope(String scopeName) {
        return new Group(null, null, scopeName);
    }

    public boolean hasScope() {
        return scope != null && !scope.isEmpty();
    }

    public boolean hasHaving() {
        return having != null && !having.isEmpty();
    }
}
