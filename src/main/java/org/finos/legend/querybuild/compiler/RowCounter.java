package org.finos.legend.querybuild.compiler;

import org.finos.legend.querybuild.plan.QueryPlan;

import java.sql.SQLException;

/**
 * Counts the rows a plan would return, ignoring its ordering and paging.
 * The compiler uses it to fill in pagination totals.
 */
@FunctionalInterface
public interface RowCounter {

    long count(QueryPlan plan) throws SQLException;
}
