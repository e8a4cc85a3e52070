package com.jsonloom.service.core.queries.expressions;

/**
 * One-based page number and optional page size; a null size means unpaged.
 */
public record PaginationExpression(int pageNumber, Integer pageSize) implements QueryExpression {

    public PaginationExpression {
        if (pageNumber < 1) {
            throw new IllegalArgumentException("Page number must be positive");
        }
        if (pageSize != null && pageSize < 1) {
            throw new IllegalArgumentException("Page size must be positive");
        }
    }

    /** Number of resources before this page; computed in {@code long} so large page numbers do not wrap. */
    public long getOffset() {
        return pageSize == null ? 0 : (long) (pageNumber - 1) * pageSize;
    }

    @Override
    public String toString() {
        return pageSize == null ? "page " + pageNumber : "page " + pageNumber + " (size " + pageSize + ")";
    }
}
