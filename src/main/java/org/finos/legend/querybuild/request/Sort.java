package org.finos.legend.querybuild.request;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ordering on a field, or a reference to a registered sort scope.
 *
 * @param field  The logical field name (ignored when the scope resolves)
 * @param desc   Sort descending
 * @param noCase Sort on the lower-cased value
 * @param scope  Name of a sort scope, or null
 */
public record Sort(
        @JsonProperty("field") String field,
        @JsonProperty("desc") boolean desc,
        @JsonProperty("nocase") boolean noCase,
        @JsonProperty("scope") String scope) {

    public static Sort asc(String field) {
        return new Sort(field, false, false, null);
    }

    public static Sort desc(String field) {
        return new Sort(field, true, false, null);
    }

    public static Sort scope(String scopeName) {
        return new Sort(null, false, false, scopeName);
    }

    public boolean hasScope() {
        return scope != null && !scope.isEmpty();
    }
}
