package org.finos.legend.querybuild.compiler;

import org.finos.legend.querybuild.plan.AggregateExpression;
import org.finos.legend.querybuild.plan.AggregateExpression.AggregateFunction;
import org.finos.legend.querybuild.plan.ColumnReference;
import org.finos.legend.querybuild.plan.Expression;
import org.finos.legend.querybuild.plan.JoinType;
import org.finos.legend.querybuild.plan.Projection;
import org.finos.legend.querybuild.plan.QueryPlan;
import org.finos.legend.querybuild.plan.RawExpression;
import org.finos.legend.querybuild.plan.SortItem;
import org.finos.legend.querybuild.plan.SqlFunctionCall;
import org.finos.legend.querybuild.request.Aggregation;
import org.finos.legend.querybuild.request.AggregationOp;
import org.finos.legend.querybuild.request.CustomField;
import org.finos.legend.querybuild.request.CustomFilter;
import org.finos.legend.querybuild.request.Filter;
import org.finos.legend.querybuild.request.FilterRequest;
import org.finos.legend.querybuild.request.Group;
import org.finos.legend.querybuild.request.Join;
import org.finos.legend.querybuild.request.Pagination;
import org.finos.legend.querybuild.request.Sort;
import org.finos.legend.querybuild.request.SubQuery;
import org.finos.legend.querybuild.scope.Scope;
import org.finos.legend.querybuild.scope.ScopeRegistry;
import org.finos.legend.querybuild.scope.ScopeType;
import org.finos.legend.querybuild.store.FieldCatalog;
import org.finos.legend.querybuild.store.FieldInfo;
import org.finos.legend.querybuild.transpiler.SQLDialect;
import org.finos.legend.querybuild.transpiler.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiles a {@link FilterRequest} into a {@link QueryPlan} for one entity.
 *
 * Clauses are applied in a fixed order:
 * <ol>
 *   <li>custom fields (select scopes)</li>
 *   <li>distinct</li>
 *   <li>joins</li>
 *   <li>sub-query, as a derived-table join</li>
 *   <li>filters</li>
 *   <li>custom filter (filter scope)</li>
 *   <li>groups</li>
 *   <li>sorts</li>
 *   <li>aggregations</li>
 *   <li>pagination</li>
 * </ol>
 *
 * A clause that fails validation is skipped and its error recorded on the
 * plan, so one compile reports every problem in the request. Only field names
 * found in the {@link FieldCatalog} are ever written into the SQL text as
 * identifiers; every operand is a bound parameter.
 *
 * Pagination runs a count through the {@link RowCounter} before applying
 * LIMIT/OFFSET, and writes it to {@link Pagination#setTotal(long)}. No count is
 * run for a plan that already has errors. Counts for a paginated sub-query are
 * held back until the whole request has compiled, and run only if it compiled
 * cleanly.
 *
 * A compiler is safe to share between threads; each call to
 * {@link #compile(FilterRequest)} works on its own plan.
 */
public final class RequestCompiler {

    private static final Logger logger = LoggerFactory.getLogger(RequestCompiler.class);

    private final FieldCatalog catalog;
    private final ScopeRegistry registry;
    private final SQLDialect dialect;
    private final RowCounter rowCounter;
    private final OperatorTranslator translator = new OperatorTranslator();

    public RequestCompiler(FieldCatalog catalog, ScopeRegistry registry, SQLDialect dialect, RowCounter rowCounter) {
        this.catalog = Objects.requireNonNull(catalog, "Catalog cannot be null");
        this.registry = Objects.requireNonNull(registry, "Scope registry cannot be null");
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
        this.rowCounter = Objects.requireNonNull(rowCounter, "Row counter cannot be null");
    }

    /**
     * Compiles a request.
     *
     * @param request The request to compile
     * @return The plan, possibly carrying deferred errors
     * @throws SQLException if the pagination count fails
     */
    public QueryPlan compile(FilterRequest request) throws SQLException {
        List<PendingCount> nestedCounts = new ArrayList<>();
        QueryPlan plan = compile(request, nestedCounts, false);

        if (!plan.hasErrors()) {
            for (PendingCount pending : nestedCounts) {
                pending.pagination().setTotal(rowCounter.count(pending.plan()));
            }
        }
        return plan;
    }

    private QueryPlan compile(FilterRequest request, List<PendingCount> nestedCounts, boolean nested)
            throws SQLException {
        Objects.requireNonNull(request, "Request cannot be null");
        QueryPlan plan = new QueryPlan(dialect, catalog.tableName());

        plan = applyCustomFields(plan, request.customFields());
        if (request.distinct()) {
            plan.distinct();
        }
        plan = applyJoins(plan, request.joins());
        plan = applySubQuery(plan, request.subQuery(), nestedCounts);
        applyFilters(plan, request.filters());
        plan = applyCustomFilter(plan, request);

        List<FieldInfo> groupColumns = new ArrayList<>();
        plan = applyGroups(plan, request.groups(), groupColumns);
        plan = applySorts(plan, request.sorts());
        applyAggregations(plan, request.aggregations(), groupColumns);
        applyPagination(plan, request.pagination(), nested ? nestedCounts : null);

        if (plan.hasErrors()) {
            logger.debug("Compiled request for {} with {} error(s)", catalog.tableName(), plan.errors().size());
        }
        return plan;
    }

    public FieldCatalog catalog() {
        return catalog;
    }

    public SQLDialect dialect() {
        return dialect;
    }

    // ==================== Stages ====================

    private QueryPlan applyCustomFields(QueryPlan plan, List<CustomField> customFields) {
        for (CustomField field : customFields) {
            Optional<Scope> scope = findScope(plan, ScopeType.SELECT, field.scope());
            if (scope.isPresent()) {
                plan = scope.get().apply(plan);
            }
        }
        return plan;
    }

    private QueryPlan applyJoins(QueryPlan plan, List<Join> joins) {
        for (Join join : joins) {
            if (join.hasType()) {
                Optional<JoinType> type = JoinType.fromName(join.type());
                if (type.isEmpty()) {
                    recordError(plan, new UnsupportedFeatureException("unsupported join type: " + join.type()));
                } else if (isBlank(join.table()) || isBlank(join.condition())) {
                    recordError(plan, new UnsupportedFeatureException(
                            type.get().toSql() + " requires a table and a condition"));
                } else {
                    plan.join(type.get().toSql() + " " + join.table() + " ON " + join.condition());
                }
            } else if (join.hasScope()) {
                Optional<Scope> scope = findScope(plan, ScopeType.JOIN, join.scope());
                if (scope.isPresent()) {
                    plan = scope.get().apply(plan);
                }
            } else {
                recordError(plan, new UnsupportedFeatureException("join requires a type or a scope"));
            }
        }
        return plan;
    }

    private QueryPlan applySubQuery(QueryPlan plan, SubQuery subQuery, List<PendingCount> nestedCounts)
            throws SQLException {
        if (subQuery == null) {
            return plan;
        }

        RequestCompiler subCompiler = new RequestCompiler(
                catalog.withTable(subQuery.table()), registry, dialect, rowCounter);
        QueryPlan subPlan = subCompiler.compile(subQuery.filter(), nestedCounts, true);
        if (subPlan.hasErrors()) {
            subPlan.errors().forEach(error -> recordError(plan, error));
            return plan;
        }

        SqlStatement statement = subPlan.toStatement();
        String clause = "JOIN (" + statement.sql() + ") AS "
                + dialect.quoteIdentifier(subQuery.field()) + " ON " + subQuery.joinCond();
        return plan.join(new RawExpression(clause, statement.parameters()));
    }

    private void applyFilters(QueryPlan plan, List<Filter> filters) {
        for (Filter filter : filters) {
            Optional<FieldInfo> field = resolveField(plan, filter.field());
            if (field.isEmpty()) {
                continue;
            }
            try {
                translator.translate(field.get().qualified(), filter.op(), filter.value(), filter.noCase())
                        .ifPresent(plan::where);
            } catch (UnsupportedFeatureException e) {
                recordError(plan, e);
            }
        }
    }

    private QueryPlan applyCustomFilter(QueryPlan plan, FilterRequest request) {
        if (!request.hasCustomFilter()) {
            return plan;
        }
        CustomFilter customFilter = request.customFilter();
        Optional<Scope> scope = findScope(plan, ScopeType.FILTER, customFilter.scope());
        return scope.isPresent() ? scope.get().apply(plan, customFilter.values()) : plan;
    }

    private QueryPlan applyGroups(QueryPlan plan, List<Group> groups, List<FieldInfo> groupColumns) {
        for (Group group : groups) {
            if (group.hasScope()) {
                Optional<Scope> scope = findScope(plan, ScopeType.GROUP, group.scope());
                if (scope.isPresent()) {
                    plan = scope.get().apply(plan);
                }
                continue;
            }

            Optional<FieldInfo> field = resolveField(plan, group.field());
            if (field.isEmpty()) {
                continue;
            }
            if (group.hasHaving()) {
                recordError(plan, new UnsupportedFeatureException("having conditions must be implemented via a scope"));
                continue;
            }
            plan.group(field.get().qualified());
            groupColumns.add(field.get());
        }
        return plan;
    }

    private QueryPlan applySorts(QueryPlan plan, List<Sort> sorts) {
        for (Sort sort : sorts) {
            if (sort.hasScope()) {
                Optional<Scope> scope = findScope(plan, ScopeType.SORT, sort.scope());
                if (scope.isPresent()) {
                    plan = scope.get().apply(plan);
                }
                continue;
            }

            Optional<FieldInfo> field = resolveField(plan, sort.field());
            if (field.isEmpty()) {
                continue;
            }
            Expression key = sort.noCase()
                    ? SqlFunctionCall.lower(field.get().qualified())
                    : field.get().qualified();
            plan.order(sort.desc() ? SortItem.desc(key) : SortItem.asc(key));
        }
        return plan;
    }

    private void applyAggregations(QueryPlan plan, List<Aggregation> aggregations, List<FieldInfo> groupColumns) {
        if (aggregations.isEmpty()) {
            return;
        }

        List<Projection> aggregates = new ArrayList<>();
        for (Aggregation aggregation : aggregations) {
            Optional<FieldInfo> field = resolveField(plan, aggregation.field());
            if (field.isEmpty()) {
                continue;
            }
            if (!aggregation.addSelects().isEmpty()) {
                recordError(plan, new UnsupportedFeatureException("additional selects must be implemented via a scope"));
                continue;
            }
            Optional<AggregateFunction> function = toAggregateFunction(aggregation.op());
            if (function.isEmpty()) {
                recordError(plan, new UnsupportedFeatureException("unsupported aggregation: " + aggregation.op()));
                continue;
            }

            Expression argument = aggregation.noCase()
                    ? SqlFunctionCall.lower(field.get().qualified())
                    : field.get().qualified();
            String alias = aggregation.hasAlias() ? aggregation.alias() : field.get().columnName();
            aggregates.add(Projection.as(new AggregateExpression(function.get(), argument), alias));
        }

        if (aggregates.isEmpty()) {
            return;
        }

        // Grouped results stay addressable by their group keys
        List<Projection> projections = new ArrayList<>();
        for (FieldInfo groupColumn : groupColumns) {
            ColumnReference key = groupColumn.qualified();
            projections.add(Projection.as(key, groupColumn.columnName()));
        }
        projections.addAll(aggregates);
        plan.select(projections);
    }

    /**
     * Applies LIMIT/OFFSET. With {@code deferredCounts} null the total is
     * counted here; otherwise the count is queued for the enclosing compile.
     */
    private void applyPagination(QueryPlan plan, Pagination pagination, List<PendingCount> deferredCounts)
            throws SQLException {
        if (pagination == null) {
            return;
        }
        if (pagination.page() < 1 || pagination.pageSize() < 1) {
            recordError(plan, new QueryBuildException("invalid pagination: page=" + pagination.page()
                    + ", page_size=" + pagination.pageSize()));
            return;
        }
        long offset = pagination.offset();
        if (offset > Integer.MAX_VALUE) {
            recordError(plan, new QueryBuildException("invalid pagination: offset out of range for page="
                    + pagination.page() + ", page_size=" + pagination.pageSize()));
            return;
        }

        if (plan.hasErrors()) {
            logger.debug("Skipping pagination count for {}: plan has errors", catalog.tableName());
        } else if (deferredCounts != null) {
            deferredCounts.add(new PendingCount(plan, pagination));
        } else {
            long total = rowCounter.count(plan);
            pagination.setTotal(total);
        }
        plan.offset((int) offset).limit(pagination.pageSize());
    }

    // ==================== Helpers ====================

    /**
     * A sub-query total still to be counted. The counter ignores LIMIT/OFFSET,
     * so the already paged plan can be counted.
     */
    private record PendingCount(QueryPlan plan, Pagination pagination) {
    }

    private Optional<FieldInfo> resolveField(QueryPlan plan, String fieldName) {
        Optional<FieldInfo> field = catalog.resolve(fieldName);
        if (field.isEmpty()) {
            recordError(plan, new FieldValidationException(fieldName));
        }
        return field;
    }

    private Optional<Scope> findScope(QueryPlan plan, ScopeType type, String name) {
        Optional<Scope> scope = isBlank(name) ? Optional.empty() : registry.lookup(type, name);
        if (scope.isEmpty()) {
            recordError(plan, new ScopeNotFoundException(type, name));
        }
        return scope;
    }

    private static Optional<AggregateFunction> toAggregateFunction(AggregationOp op) {
        return switch (op) {
            case COUNT -> Optional.of(AggregateFunction.COUNT);
            case SUM -> Optional.of(AggregateFunction.SUM);
            case AVG -> Optional.of(AggregateFunction.AVG);
            case MAX -> Optional.of(AggregateFunction.MAX);
            case MIN -> Optional.of(AggregateFunction.MIN);
            case UNKNOWN -> Optional.empty();
        };
    }

    private static void recordError(QueryPlan plan, QueryBuildException error) {
        logger.debug("Deferred compile error: {}", error.getMessage());
        plan.addError(error);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
