package org.finos.legend.querybuild.plan;

import java.util.Objects;

/**
 * Represents an aggregate function call (COUNT, SUM, AVG, MIN, MAX).
 *
 * @param function The aggregate function
 * @param argument The expression to aggregate
 */
public record AggregateExpression(
        AggregateFunction function,
        Expression argument) implements Expression {

    public enum AggregateFunction {
        COUNT("COUNT"),
        SUM("SUM"),
        AVG("AVG"),
        MIN("MIN"),
        MAX("MAX");

        private final String sql;

        AggregateFunction(String sql) {
            this.sql = sql;
        }

        public String sql() {
            return sql;
        }
    }

    public AggregateExpression {
        Objects.requireNonNull(function, "Function cannot be null");
        Objects.requireNonNull(argument, "Argument cannot be null");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitAggregate(this);
    }

    @Override
    public String toString() {
        return function.sql() + "(" + argument + ")";
    }
}
