package org.finos.legend.querybuild.plan;

import org.finos.legend.querybuild.compiler.QueryBuildException;
import org.finos.legend.querybuild.transpiler.SQLDialect;
import org.finos.legend.querybuild.transpiler.SQLGenerator;
import org.finos.legend.querybuild.transpiler.SqlStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The accumulated, not-yet-executed state of a compiled request.
 *
 * A plan is a single SELECT against one base table. The compiler folds request
 * clauses into it in a fixed order, and scopes receive it to add or replace
 * clauses with their own SQL text. Clause-level validation failures are kept
 * as deferred errors: a plan with errors must not be executed.
 *
 * Plans are single-owner and not thread-safe. Mutators return {@code this}
 * so scopes can chain them:
 *
 * <pre>{@code
 * registry.register(ScopeType.GROUP, "statusWithCount",
 *         plan -> plan.group("status").select("status, COUNT(*) AS count"));
 * }</pre>
 */
public final class QueryPlan {

    private final SQLDialect dialect;
    private final String table;

    private boolean distinct;
    private final List<Projection> projections = new ArrayList<>();
    private final List<RawExpression> joins = new ArrayList<>();
    private final List<Expression> conditions = new ArrayList<>();
    private final List<Expression> groupings = new ArrayList<>();
    private final List<Expression> havings = new ArrayList<>();
    private final List<SortItem> orderings = new ArrayList<>();
    private Integer limit;
    private Integer offset;

    private final List<QueryBuildException> errors = new ArrayList<>();

    public QueryPlan(SQLDialect dialect, String table) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
        this.table = Objects.requireNonNull(table, "Table cannot be null");

        if (table.isBlank()) {
            throw new IllegalArgumentException("Table cannot be blank");
        }
    }

    // ==================== Projection ====================

    /**
     * Replaces the projection with raw SQL text, e.g. {@code "name, email"}.
     */
    public QueryPlan select(String sql, Object... parameters) {
        projections.clear();
        projections.add(Projection.of(RawExpression.of(sql, parameters)));
        return this;
    }

    /**
     * Replaces the projection with the given items.
     */
    public QueryPlan select(List<Projection> items) {
        projections.clear();
        projections.addAll(items);
        return this;
    }

    /**
     * Appends an item to the projection.
     */
    public QueryPlan addProjection(Projection projection) {
        projections.add(Objects.requireNonNull(projection, "Projection cannot be null"));
        return this;
    }

    public QueryPlan distinct() {
        return distinct(true);
    }

    public QueryPlan distinct(boolean distinct) {
        this.distinct = distinct;
        return this;
    }

    // ==================== Joins ====================

    /**
     * Appends a join clause given as SQL text, e.g.
     * {@code "LEFT JOIN orders ON orders.user_id = users.id"}.
     */
    public QueryPlan join(String sql, Object... parameters) {
        return join(RawExpression.of(sql, parameters));
    }

    public QueryPlan join(RawExpression clause) {
        joins.add(Objects.requireNonNull(clause, "Join clause cannot be null"));
        return this;
    }

    // ==================== Filtering ====================

    /**
     * Appends a WHERE condition given as SQL text with {@code ?} placeholders.
     * Conditions are combined with AND.
     */
    public QueryPlan where(String sql, Object... parameters) {
        return where(RawExpression.of(sql, parameters));
    }

    public QueryPlan where(Expression condition) {
        conditions.add(Objects.requireNonNull(condition, "Condition cannot be null"));
        return this;
    }

    // ==================== Grouping ====================

    public QueryPlan group(String sql) {
        return group(RawExpression.of(sql));
    }

    public QueryPlan group(Expression key) {
        groupings.add(Objects.requireNonNull(key, "Group key cannot be null"));
        return this;
    }

    public QueryPlan having(String sql, Object... parameters) {
        havings.add(RawExpression.of(sql, parameters));
        return this;
    }

    // ==================== Ordering and paging ====================

    /**
     * Appends ORDER BY text that already carries its directions,
     * e.g. {@code "status ASC, name DESC"}.
     */
    public QueryPlan order(String sql) {
        return order(SortItem.raw(RawExpression.of(sql)));
    }

    public QueryPlan order(SortItem item) {
        orderings.add(Objects.requireNonNull(item, "Sort item cannot be null"));
        return this;
    }

    public QueryPlan limit(int limit) {
        this.limit = limit;
        return this;
    }

    public QueryPlan offset(int offset) {
        this.offset = offset;
        return this;
    }

    // ==================== Errors ====================

    /**
     * Records a deferred error. The clause that produced it must not be
     * applied; compilation continues so further errors can be reported.
     */
    public QueryPlan addError(QueryBuildException error) {
        errors.add(Objects.requireNonNull(error, "Error cannot be null"));
        return this;
    }

    public List<QueryBuildException> errors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    // ==================== Accessors ====================

    public SQLDialect dialect() {
        return dialect;
    }

    public String table() {
        return table;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public List<Projection> projections() {
        return Collections.unmodifiableList(projections);
    }

    public List<RawExpression> joins() {
        return Collections.unmodifiableList(joins);
    }

    public List<Expression> conditions() {
        return Collections.unmodifiableList(conditions);
    }

    public List<Expression> groupings() {
        return Collections.unmodifiableList(groupings);
    }

    public List<Expression> havings() {
        return Collections.unmodifiableList(havings);
    }

    public List<SortItem> orderings() {
        return Collections.unmodifiableList(orderings);
    }

    /**
     * @return The row limit, or null if unbounded
     */
    public Integer limit() {
        return limit;
    }

    /**
     * @return The row offset, or null if none
     */
    public Integer offset() {
        return offset;
    }

    /**
     * Renders this plan with its own dialect.
     */
    public SqlStatement toStatement() {
        return new SQLGenerator(dialect).generate(this);
    }

    @Override
    public String toString() {
        return "QueryPlan(" + toStatement().sql() + ", errors=" + errors.size() + ")";
    }
}
