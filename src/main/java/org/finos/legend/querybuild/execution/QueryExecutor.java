package org.finos.legend.querybuild.execution;

import org.finos.legend.querybuild.compiler.QueryCompilationException;
import org.finos.legend.querybuild.compiler.RowCounter;
import org.finos.legend.querybuild.plan.QueryPlan;
import org.finos.legend.querybuild.transpiler.SQLGenerator;
import org.finos.legend.querybuild.transpiler.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Objects;

/**
 * Runs compiled plans over a JDBC connection.
 *
 * The connection is owned by the caller and never closed here. A plan that
 * recorded compile errors is refused with a {@link QueryCompilationException}
 * before any statement is prepared. Backend failures surface as the driver's
 * {@link SQLException}, unwrapped.
 */
public class QueryExecutor implements RowCounter {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final Connection connection;

    public QueryExecutor(Connection connection) {
        this.connection = Objects.requireNonNull(connection, "Connection cannot be null");
    }

    /**
     * Executes a plan and maps every row.
     *
     * @param plan       The compiled plan
     * @param resultType The record type each row maps to
     * @return All rows; empty if none matched
     * @throws SQLException If execution fails
     */
    public <T extends Record> List<T> findAll(QueryPlan plan, Class<T> resultType) throws SQLException {
        SqlStatement statement = prepare(plan, false);
        RecordResultBuilder<T> builder = new RecordResultBuilder<>(resultType);

        try (PreparedStatement ps = connection.prepareStatement(statement.sql())) {
            bind(ps, statement.parameters());
            try (ResultSet rs = ps.executeQuery()) {
                List<T> rows = builder.buildAll(rs);
                logger.debug("Fetched {} row(s) from {}", rows.size(), plan.table());
                return rows;
            }
        }
    }

    /**
     * Executes a plan and maps its first row.
     *
     * @throws RecordNotFoundException If no row matched
     * @throws SQLException            If execution fails
     */
    public <T extends Record> T findOne(QueryPlan plan, Class<T> resultType) throws SQLException {
        SqlStatement statement = prepare(plan, false);
        RecordResultBuilder<T> builder = new RecordResultBuilder<>(resultType);

        try (PreparedStatement ps = connection.prepareStatement(statement.sql())) {
            bind(ps, statement.parameters());
            try (ResultSet rs = ps.executeQuery()) {
                T row = builder.buildFirst(rs);
                if (row == null) {
                    throw new RecordNotFoundException("record not found in " + plan.table());
                }
                return row;
            }
        }
    }

    /**
     * Counts the rows the plan selects, ignoring ordering and paging.
     */
    @Override
    public long count(QueryPlan plan) throws SQLException {
        SqlStatement statement = prepare(plan, true);

        try (PreparedStatement ps = connection.prepareStatement(statement.sql())) {
            bind(ps, statement.parameters());
            try (ResultSet rs = ps.executeQuery()) {
                long total = rs.next() ? rs.getLong(1) : 0L;
                logger.debug("Counted {} row(s) in {}", total, plan.table());
                return total;
            }
        }
    }

    private SqlStatement prepare(QueryPlan plan, boolean count) {
        Objects.requireNonNull(plan, "Plan cannot be null");
        if (plan.hasErrors()) {
            throw new QueryCompilationException(plan.errors());
        }
        SQLGenerator generator = new SQLGenerator(plan.dialect());
        return count ? generator.generateCount(plan) : generator.generate(plan);
    }

    private static void bind(PreparedStatement ps, List<Object> parameters) throws SQLException {
        for (int i = 0; i < parameters.size(); i++) {
            Object value = parameters.get(i);
            if (value == null) {
                ps.setNull(i + 1, Types.NULL);
            } else {
                ps.setObject(i + 1, value);
            }
        }
    }
}
