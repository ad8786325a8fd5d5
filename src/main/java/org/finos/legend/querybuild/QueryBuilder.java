package org.finos.legend.querybuild;

import org.finos.legend.querybuild.compiler.RequestCompiler;
import org.finos.legend.querybuild.execution.QueryExecutor;
import org.finos.legend.querybuild.plan.QueryPlan;
import org.finos.legend.querybuild.request.FilterRequest;
import org.finos.legend.querybuild.scope.Scope;
import org.finos.legend.querybuild.scope.ScopeRegistry;
import org.finos.legend.querybuild.scope.ScopeType;
import org.finos.legend.querybuild.store.FieldCatalog;
import org.finos.legend.querybuild.transpiler.DatabaseType;
import org.finos.legend.querybuild.transpiler.SQLDialect;
import org.finos.legend.querybuild.transpiler.SqlStatement;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for querying one entity type with declarative requests.
 *
 * <pre>{@code
 * QueryBuilder<User> users = QueryBuilder.builder(User.class)
 *         .connection(connection)
 *         .databaseType(DatabaseType.SQLITE)
 *         .table("users")
 *         .build();
 *
 * users.registerScope(ScopeType.FILTER, "adults", plan -> plan.where("age >= ?", 18));
 *
 * List<User> page = users.findAll(FilterRequest.builder()
 *         .customFilter("adults")
 *         .sort(Sort.asc("name"))
 *         .page(1, 20)
 *         .build());
 * }</pre>
 *
 * The field catalog is derived from the record type unless one is supplied.
 * Each builder owns its scope registry, so two builders never see each
 * other's scopes unless they are given the same registry.
 *
 * @param <T> The entity record type
 */
public final class QueryBuilder<T extends Record> {

    private final Class<T> entityType;
    private final ScopeRegistry registry;
    private final QueryExecutor executor;
    private final RequestCompiler compiler;

    private QueryBuilder(Builder<T> builder) {
        this.entityType = builder.entityType;
        this.registry = builder.registry != null ? builder.registry : new ScopeRegistry();
        this.executor = new QueryExecutor(Objects.requireNonNull(builder.connection, "Connection is required"));

        FieldCatalog catalog = builder.catalog;
        if (catalog == null) {
            Objects.requireNonNull(builder.table, "Table or catalog is required");
            catalog = FieldCatalog.fromRecord(entityType, builder.table);
        }
        SQLDialect dialect = builder.dialect != null ? builder.dialect : builder.databaseType.dialect();
        this.compiler = new RequestCompiler(catalog, registry, dialect, executor);
    }

    public static <T extends Record> Builder<T> builder(Class<T> entityType) {
        return new Builder<>(entityType);
    }

    /**
     * Registers a scope under a category and name, replacing any previous one.
     */
    public QueryBuilder<T> registerScope(ScopeType type, String name, Scope scope) {
        registry.register(type, name, scope);
        return this;
    }

    /**
     * Compiles a request without executing it. When the request is paginated
     * the total is still counted.
     */
    public QueryPlan build(FilterRequest request) throws SQLException {
        return compiler.compile(request);
    }

    public List<T> findAll(FilterRequest request) throws SQLException {
        return findAll(request, entityType);
    }

    /**
     * Runs a request and maps rows to another record type, typically for
     * grouped or aggregated results.
     */
    public <R extends Record> List<R> findAll(FilterRequest request, Class<R> resultType) throws SQLException {
        return executor.findAll(compiler.compile(request), resultType);
    }

    public T findOne(FilterRequest request) throws SQLException {
        return findOne(request, entityType);
    }

    public <R extends Record> R findOne(FilterRequest request, Class<R> resultType) throws SQLException {
        return executor.findOne(compiler.compile(request), resultType);
    }

    public long count(FilterRequest request) throws SQLException {
        return executor.count(compiler.compile(request));
    }

    /**
     * Renders the SELECT a request compiles to, for inspection. Errors are
     * not checked.
     */
    public SqlStatement sql(FilterRequest request) throws SQLException {
        return build(request).toStatement();
    }

    public String tableName() {
        return compiler.catalog().tableName();
    }

    public ScopeRegistry scopes() {
        return registry;
    }

    public static class Builder<T extends Record> {
        private final Class<T> entityType;
        private Connection connection;
        private DatabaseType databaseType = DatabaseType.SQLITE;
        private SQLDialect dialect;
        private String table;
        private FieldCatalog catalog;
        private ScopeRegistry registry;

        private Builder(Class<T> entityType) {
            this.entityType = Objects.requireNonNull(entityType, "Entity type cannot be null");
        }

        public Builder<T> connection(Connection connection) {
            this.connection = connection;
            return this;
        }

        public Builder<T> databaseType(DatabaseType databaseType) {
            this.databaseType = Objects.requireNonNull(databaseType, "Database type cannot be null");
            return this;
        }

        /**
         * Uses a dialect directly, overriding {@link #databaseType(DatabaseType)}.
         */
        public Builder<T> dialect(SQLDialect dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder<T> table(String table) {
            this.table = table;
            return this;
        }

        /**
         * Uses an explicit catalog instead of deriving one from the record.
         */
        public Builder<T> catalog(FieldCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder<T> scopes(ScopeRegistry registry) {
            this.registry = registry;
            return this;
        }

        public QueryBuilder<T> build() {
            return new QueryBuilder<>(this);
        }
    }
}
