package org.finos.legend.querybuild.scope;

import org.finos.legend.querybuild.plan.QueryPlan;

import java.util.List;
import java.util.Objects;

/**
 * A named transform from one query plan state to the next.
 *
 * Scopes are the escape hatch for SQL the declarative request cannot express
 * safely. A scope is not limited to the clause of the category it is
 * registered under: a group scope may set both GROUP BY and the projection,
 * for example. Any SQL text a scope adds is emitted verbatim, so the code
 * registering it is responsible for its safety.
 */
@FunctionalInterface
public interface Scope {

    /**
     * Applies this scope to a plan.
     *
     * @param plan The plan built so far
     * @return The plan to continue with (normally the same instance)
     */
    QueryPlan apply(QueryPlan plan);

    /**
     * Applies this scope with caller-supplied arguments, such as the values
     * of a custom filter. Scopes that take no arguments ignore them.
     */
    default QueryPlan apply(QueryPlan plan, List<Object> arguments) {
        return apply(plan);
    }

    /**
     * Creates a scope that receives the request's arguments.
     *
     * <pre>{@code
     * Scope olderThan = Scope.withArguments((plan, args) -> plan.where("age > ?", args.get(0)));
     * }</pre>
     */
    static Scope withArguments(ParameterizedScope scope) {
        Objects.requireNonNull(scope, "Scope cannot be null");
        return new Scope() {
            @Override
            public QueryPlan apply(QueryPlan plan) {
                return scope.apply(plan, List.of());
            }

            @Override
            public QueryPlan apply(QueryPlan plan, List<Object> arguments) {
                return scope.apply(plan, arguments == null ? List.of() : arguments);
            }
        };
    }

    /**
     * A scope body that takes arguments.
     */
    @FunctionalInterface
    interface ParameterizedScope {
        QueryPlan apply(QueryPlan plan, List<Object> arguments);
    }
}
