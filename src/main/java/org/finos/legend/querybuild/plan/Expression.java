package org.finos.legend.querybuild.plan;

/**
 * Base interface for SQL expressions held by a {@link QueryPlan}.
 *
 * Expressions never carry values inline: every value is a {@link Parameter}
 * or a parameter of a {@link RawExpression}, and is bound at execution time.
 */
public sealed interface Expression
        permits ColumnReference, Parameter, SqlFunctionCall, AggregateExpression,
        ComparisonExpression, InExpression, BetweenExpression, RawExpression {

    /**
     * Accept a visitor for traversing the expression tree.
     */
    <T> T accept(ExpressionVisitor<T> visitor);
}
