package org.finos.legend.querybuild.compiler;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a plan that recorded errors is about to be executed. Carries
 * every error, in the order the compiler found them.
 */
public class QueryCompilationException extends QueryBuildException {

    private final List<QueryBuildException> errors;

    public QueryCompilationException(List<QueryBuildException> errors) {
        super(format(errors));
        this.errors = List.copyOf(errors);
        errors.forEach(this::addSuppressed);
    }

    public List<QueryBuildException> errors() {
        return errors;
    }

    private static String format(List<QueryBuildException> errors) {
        if (errors.size() == 1) {
            return errors.get(0).getMessage();
        }
        return errors.size() + " errors: " + errors.stream()
                .map(Throwable::getMessage)
                .collect(Collectors.joining("; "));
    }
}
