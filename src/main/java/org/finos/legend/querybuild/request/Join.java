package org.finos.legend.querybuild.request;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A join against another table, or a reference to a registered join scope.
 *
 * A non-empty {@code type} always wins; the scope is used only when the type
 * is empty. Table and condition are emitted as given.
 *
 * @param type      LEFT, RIGHT or INNER (any case), or empty
 * @param table     The table to join
 * @param condition The ON condition
 * @param scope     Name of a join scope, or null
 */
public record Join(
        @JsonProperty("type") String type,
        @JsonProperty("table") String table,
        @JsonProperty("condition") String condition,
        @JsonProperty("scope") String scope) {

    public static Join left(String table, String condition) {
        return new Join("LEFT", table, condition, null);
    }

    public static Join inner(String table, String condition) {
        return new Join("INNER", table, condition, null);
    }

    public static Join right(String table, String condition) {
        return new Join("RIGHT", table, condition, null);
    }

    public static Join scope(String scopeName) {
        return new Join(null, null, null, scopeName);
    }

    public boolean hasType() {
        return type != null && !type.isEmpty();
    }

    public boolean hasScope() {
        return scope != null && !scope.isEmpty();
    }
}
