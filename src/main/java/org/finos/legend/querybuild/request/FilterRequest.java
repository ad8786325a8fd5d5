package org.finos.legend.querybuild.request;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A declarative query over one entity: what to filter, sort, group and
 * aggregate, which scopes to apply, and which page to return.
 *
 * Every list is non-null. Only {@link Pagination#total()} is written back
 * during compilation; everything else is read-only input.
 *
 * <pre>{@code
 * FilterRequest request = FilterRequest.builder()
 *         .filter(Filter.of("status", Operator.EQ, "active"))
 *         .sort(Sort.desc("age"))
 *         .page(1, 20)
 *         .build();
 * }</pre>
 */
public record FilterRequest(
        @JsonProperty("filters") List<Filter> filters,
        @JsonProperty("custom_fields") List<CustomField> customFields,
        @JsonProperty("custom_filter") CustomFilter customFilter,
        @JsonProperty("sorts") List<Sort> sorts,
        @JsonProperty("aggrs") List<Aggregation> aggregations,
        @JsonProperty("page") Pagination pagination,
        @JsonProperty("groups") List<Group> groups,
        @JsonProperty("joins") List<Join> joins,
        @JsonProperty("sub_query") SubQuery subQuery,
        @JsonProperty("distinct") boolean distinct) {

    public FilterRequest {
        filters = filters == null ? List.of() : List.copyOf(filters);
        customFields = customFields == null ? List.of() : List.copyOf(customFields);
        sorts = sorts == null ? List.of() : List.copyOf(sorts);
        aggregations = aggregations == null ? List.of() : List.copyOf(aggregations);
        groups = groups == null ? List.of() : List.copyOf(groups);
        joins = joins == null ? List.of() : List.copyOf(joins);
    }

    /**
     * A request that selects every row.
     */
    public static FilterRequest empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasCustomFilter() {
        return customFilter != null && customFilter.scope() != null && !customFilter.scope().isEmpty();
    }

    public static class Builder {
        private final List<Filter> filters = new ArrayList<>();
        private final List<CustomField> customFields = new ArrayList<>();
        private CustomFilter customFilter;
        private final List<Sort> sorts = new ArrayList<>();
        private final List<Aggregation> aggregations = new ArrayList<>();
        private Pagination pagination;
        private final List<Group> groups = new ArrayList<>();
        private final List<Join> joins = new ArrayList<>();
        private SubQuery subQuery;
        private boolean distinct;

        public Builder filter(Filter filter) {
            filters.add(filter);
            return this;
        }

        public Builder filter(String field, Operator op, String value) {
            return filter(Filter.of(field, op, value));
        }

        public Builder customField(CustomField field) {
            customFields.add(field);
            return this;
        }

        public Builder customField(String scope) {
            return customField(CustomField.scope(scope));
        }

        public Builder customFilter(CustomFilter filter) {
            this.customFilter = filter;
            return this;
        }

        public Builder customFilter(String scope, Object... values) {
            return customFilter(CustomFilter.scope(scope, values));
        }

        public Builder sort(Sort sort) {
            sorts.add(sort);
            return this;
        }

        public Builder aggregation(Aggregation aggregation) {
            aggregations.add(aggregation);
            return this;
        }

        public Builder page(Pagination pagination) {
            this.pagination = pagination;
            return this;
        }

        public Builder page(int page, int pageSize) {
            return page(Pagination.of(page, pageSize));
        }

        public Builder group(Group group) {
            groups.add(group);
            return this;
        }

        public Builder join(Join join) {
            joins.add(join);
            return this;
        }

        public Builder subQuery(SubQuery subQuery) {
            this.subQuery = subQuery;
            return this;
        }

        public Builder distinct(boolean distinct) {
            this.distinct = distinct;
            return this;
        }

        public FilterRequest build() {
            return new FilterRequest(filters, customFields, customFilter, sorts, aggregations,
                    pagination, groups, joins, subQuery, distinct);
        }
    }
}
