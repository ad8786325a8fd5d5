package org.finos.legend.querybuild.scope;

/**
 * Categories of named scopes. A name registered in one category is invisible
 * to every other.
 */
public enum ScopeType {
    FILTER,
    SORT,
    GROUP,
    SELECT,
    JOIN
}
