package org.finos.legend.querybuild.transpiler;

import org.finos.legend.querybuild.plan.AggregateExpression;
import org.finos.legend.querybuild.plan.BetweenExpression;
import org.finos.legend.querybuild.plan.ColumnReference;
import org.finos.legend.querybuild.plan.ComparisonExpression;
import org.finos.legend.querybuild.plan.Expression;
import org.finos.legend.querybuild.plan.ExpressionVisitor;
import org.finos.legend.querybuild.plan.InExpression;
import org.finos.legend.querybuild.plan.Parameter;
import org.finos.legend.querybuild.plan.Projection;
import org.finos.legend.querybuild.plan.QueryPlan;
import org.finos.legend.querybuild.plan.RawExpression;
import org.finos.legend.querybuild.plan.SortItem;
import org.finos.legend.querybuild.plan.SqlFunctionCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Transpiles a {@link QueryPlan} into a parameterized SQL statement.
 *
 * Clauses are always emitted in the same order (SELECT, FROM, JOIN, WHERE,
 * GROUP BY, HAVING, ORDER BY, LIMIT/OFFSET) and parameters are collected in
 * the order their placeholders appear, so the same plan always renders to
 * the same text. Sub-queries rely on this when their SQL is embedded into a
 * parent statement.
 */
public final class SQLGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SQLGenerator.class);

    private final SQLDialect dialect;

    public SQLGenerator(SQLDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
    }

    /**
     * Generates the SELECT statement for a plan.
     *
     * @param plan The plan to render
     * @return The SQL text and its bound parameters
     */
    public SqlStatement generate(QueryPlan plan) {
        var renderer = new Renderer();
        var sb = new StringBuilder();

        appendSelectBody(sb, plan, renderer);

        if (!plan.orderings().isEmpty()) {
            sb.append(" ORDER BY ");
            sb.append(plan.orderings().stream()
                    .map(item -> formatSortItem(item, renderer))
                    .collect(Collectors.joining(", ")));
        }

        sb.append(dialect.formatLimitOffset(plan.limit(), plan.offset()));

        SqlStatement statement = new SqlStatement(sb.toString(), renderer.parameters);
        logger.debug("Generated {} SQL: {}", dialect.name(), statement);
        return statement;
    }

    /**
     * Generates a statement counting the rows the plan would return, ignoring
     * its ORDER BY, LIMIT and OFFSET.
     *
     * Plain filtered scans are counted directly; grouped, distinct or
     * aggregated plans are wrapped so the count reflects result rows rather
     * than base-table rows.
     *
     * @param plan The plan to count
     * @return The COUNT statement and its bound parameters
     */
    public SqlStatement generateCount(QueryPlan plan) {
        var renderer = new Renderer();
        var sb = new StringBuilder();

        if (needsDerivedCount(plan)) {
            sb.append("SELECT COUNT(*) FROM (");
            appendSelectBody(sb, plan, renderer);
            sb.append(") AS count_src");
        } else {
            sb.append("SELECT COUNT(*)");
            appendFromWhere(sb, plan, renderer);
        }

        SqlStatement statement = new SqlStatement(sb.toString(), renderer.parameters);
        logger.debug("Generated {} count SQL: {}", dialect.name(), statement);
        return statement;
    }

    /**
     * Renders a single expression, appending its bound values to
     * {@code parameters}.
     */
    public String generateExpression(Expression expression, List<Object> parameters) {
        var renderer = new Renderer();
        String sql = expression.accept(renderer);
        parameters.addAll(renderer.parameters);
        return sql;
    }

    // ==================== Clause rendering ====================

    private void appendSelectBody(StringBuilder sb, QueryPlan plan, Renderer renderer) {
        sb.append("SELECT ");
        if (plan.isDistinct()) {
            sb.append("DISTINCT ");
        }
        if (plan.projections().isEmpty()) {
            sb.append("*");
        } else {
            sb.append(plan.projections().stream()
                    .map(p -> formatProjection(p, renderer))
                    .collect(Collectors.joining(", ")));
        }

        appendFromWhere(sb, plan, renderer);

        if (!plan.groupings().isEmpty()) {
            sb.append(" GROUP BY ");
            sb.append(plan.groupings().stream()
                    .map(g -> g.accept(renderer))
                    .collect(Collectors.joining(", ")));
        }

        if (!plan.havings().isEmpty()) {
            sb.append(" HAVING ");
            sb.append(joinConditions(plan.havings(), renderer));
        }
    }

    private void appendFromWhere(StringBuilder sb, QueryPlan plan, Renderer renderer) {
        sb.append(" FROM ");
        sb.append(dialect.quoteIdentifier(plan.table()));

        for (RawExpression join : plan.joins()) {
            sb.append(" ");
            sb.append(join.accept(renderer));
        }

        if (!plan.conditions().isEmpty()) {
            sb.append(" WHERE ");
            sb.append(joinConditions(plan.conditions(), renderer));
        }
    }

    private String joinConditions(List<Expression> conditions, Renderer renderer) {
        if (conditions.size() == 1) {
            return conditions.get(0).accept(renderer);
        }
        // Raw text may contain OR, so each operand is parenthesized
        return conditions.stream()
                .map(c -> c instanceof RawExpression ? "(" + c.accept(renderer) + ")" : c.accept(renderer))
                .collect(Collectors.joining(" AND "));
    }

    private String formatProjection(Projection projection, Renderer renderer) {
        String expr = projection.expression().accept(renderer);
        if (!projection.hasAlias()) {
            return expr;
        }
        return expr + " AS " + dialect.quoteIdentifier(projection.alias());
    }

    private String formatSortItem(SortItem item, Renderer renderer) {
        String expr = item.expression().accept(renderer);
        if (item.direction() == null) {
            return expr;
        }
        return expr + " " + item.direction().name();
    }

    private boolean needsDerivedCount(QueryPlan plan) {
        if (plan.isDistinct() || !plan.groupings().isEmpty() || !plan.havings().isEmpty()) {
            return true;
        }
        return plan.projections().stream()
                .anyMatch(p -> p.expression() instanceof AggregateExpression);
    }

    // ==================== Expression rendering ====================

    /**
     * Renders expressions for one statement, collecting bound values in
     * placeholder order.
     */
    private final class Renderer implements ExpressionVisitor<String> {

        private final List<Object> parameters = new ArrayList<>();

        @Override
        public String visitColumnReference(ColumnReference columnRef) {
            if (!columnRef.isQualified()) {
                return dialect.quoteIdentifier(columnRef.columnName());
            }
            return dialect.quoteIdentifier(columnRef.tableName())
                    + "." + dialect.quoteIdentifier(columnRef.columnName());
        }

        @Override
        public String visitParameter(Parameter parameter) {
            parameters.add(parameter.value());
            return "?";
        }

        @Override
        public String visitFunctionCall(SqlFunctionCall functionCall) {
            return functionCall.functionName() + "(" + functionCall.argument().accept(this) + ")";
        }

        @Override
        public String visitAggregate(AggregateExpression aggregate) {
            return aggregate.function().sql() + "(" + aggregate.argument().accept(this) + ")";
        }

        @Override
        public String visitComparison(ComparisonExpression comparison) {
            String left = comparison.left().accept(this);
            ComparisonExpression.ComparisonOperator op = comparison.operator();

            if (op.isUnary()) {
                return left + " " + op.toSql();
            }

            String right = comparison.right().accept(this);
            if (op == ComparisonExpression.ComparisonOperator.REGEXP) {
                return dialect.formatRegexp(left, right, false);
            }
            if (op == ComparisonExpression.ComparisonOperator.NOT_REGEXP) {
                return dialect.formatRegexp(left, right, true);
            }
            return left + " " + op.toSql() + " " + right;
        }

        @Override
        public String visitIn(InExpression in) {
            String operand = in.operand().accept(this);
            String values = in.values().stream()
                    .map(v -> v.accept(this))
                    .collect(Collectors.joining(", ", "(", ")"));
            return operand + (in.negated() ? " NOT IN " : " IN ") + values;
        }

        @Override
        public String visitBetween(BetweenExpression between) {
            return between.operand().accept(this)
                    + " BETWEEN " + between.lower().accept(this)
                    + " AND " + between.upper().accept(this);
        }

        @Override
        public String visitRaw(RawExpression raw) {
            parameters.addAll(raw.parameters());
            return raw.sql();
        }
    }
}
