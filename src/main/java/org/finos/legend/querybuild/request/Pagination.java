package org.finos.legend.querybuild.request;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Page selection. {@code total} is an output: the compiler writes the
 * unpaginated row count into it.
 */
public final class Pagination {

    @JsonProperty("page")
    private int page;

    @JsonProperty("page_size")
    private int pageSize;

    @JsonProperty("total")
    private long total;

    public Pagination() {
    }

    public Pagination(int page, int pageSize) {
        this.page = page;
        this.pageSize = pageSize;
    }

    public static Pagination of(int page, int pageSize) {
        return new Pagination(page, pageSize);
    }

    /**
     * @return The 1-based page number
     */
    public int page() {
        return page;
    }

    public int pageSize() {
        return pageSize;
    }

    /**
     * @return Row count before paging, populated during compilation
     */
    public long total() {
        return total;
    }

    public void setTotal(long total) {
        this.total = total;
    }

    /**
     * @return Rows skipped before this page, computed without int overflow
     */
    public long offset() {
        return (long) (page - 1) * pageSize;
    }

    @Override
    public String toString() {
        return "Pagination(page=" + page + ", pageSize=" + pageSize + ", total=" + total + ")";
    }
}
