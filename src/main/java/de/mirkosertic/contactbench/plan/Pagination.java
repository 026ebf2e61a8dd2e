package de.mirkosertic.contactbench.plan;

/**
 * Window of rows to return. A limit of {@link #UNLIMITED} returns every matching row and skips
 * the count query.
 */
public record Pagination(long offset, int limit) {

    public static final int UNLIMITED = 0;

    public Pagination {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
    }

    public static Pagination ofPage(final int page, final int pageSize) {
        return new Pagination((long) (page - 1) * pageSize, pageSize);
    }

    public static Pagination unpaginated() {
        return new Pagination(0, UNLIMITED);
    }

    public boolean isPaginated() {
        return limit != UNLIMITED;
    }

    /**
     * One-based page number the offset falls into.
     */
    public long page() {
        return isPaginated() ? offset / limit + 1 : 1;
    }

    /**
     * Number of pages needed for {@code totalCount} rows, at least one.
     */
    public long pageCount(final long totalCount) {
        if (!isPaginated() || totalCount <= 0) {
            return 1;
        }
        return (totalCount + limit - 1) / limit;
    }
}
