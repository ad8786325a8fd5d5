package org.finos.legend.querybuild.plan;

import java.util.Objects;

/**
 * A single-argument scalar SQL function call, e.g. {@code LOWER(col)}.
 *
 * @param functionName The SQL function name
 * @param argument     The function argument
 */
public record SqlFunctionCall(
        String functionName,
        Expression argument) implements Expression {

    public SqlFunctionCall {
        Objects.requireNonNull(functionName, "Function name cannot be null");
        Objects.requireNonNull(argument, "Argument cannot be null");
    }

    /**
     * Factory for {@code LOWER(argument)}.
     */
    public static SqlFunctionCall lower(Expression argument) {
        return new SqlFunctionCall("LOWER", argument);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public String toString() {
        return functionName + "(" + argument + ")";
    }
}
