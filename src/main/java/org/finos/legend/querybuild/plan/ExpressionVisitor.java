package org.finos.legend.querybuild.plan;

/**
 * Visitor interface for traversing Expression trees.
 *
 * @param <T> The return type of the visitor methods
 */
public interface ExpressionVisitor<T> {

    T visitColumnReference(ColumnReference columnRef);

    T visitParameter(Parameter parameter);

    T visitFunctionCall(SqlFunctionCall functionCall);

    T visitAggregate(AggregateExpression aggregate);

    T visitComparison(ComparisonExpression comparison);

    T visitIn(InExpression in);

    T visitBetween(BetweenExpression between);

    /**
     * Visit caller-supplied SQL text. Its identifiers are not validated.
     */
    T visitRaw(RawExpression raw);
}
