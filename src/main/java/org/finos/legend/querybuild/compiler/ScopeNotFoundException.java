package org.finos.legend.querybuild.compiler;

import org.finos.legend.querybuild.scope.ScopeType;

import java.util.Locale;

/**
 * A request referenced a scope name that is not registered for its category.
 */
public class ScopeNotFoundException extends QueryBuildException {

    private final ScopeType scopeType;
    private final String scopeName;

    public ScopeNotFoundException(ScopeType scopeType, String scopeName) {
        super(scopeType.name().toLowerCase(Locale.ROOT) + " scope not found: " + scopeName);
        this.scopeType = scopeType;
        this.scopeName = scopeName;
    }

    public ScopeType getScopeType() {
        return scopeType;
    }

    public String getScopeName() {
        return scopeName;
    }
}
