package org.finos.legend.querybuild.compiler;

/**
 * Base class for failures found while turning a request into a query plan.
 *
 * Most of these are not thrown during compilation: they are recorded on the
 * plan and surfaced together when the plan is executed.
 */
public class QueryBuildException extends RuntimeException {

    public QueryBuildException(String message) {
        super(message);
    }

    public QueryBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
