package de.mirkosertic.contactbench.api;

import de.mirkosertic.contactbench.execution.ExecutionMetrics;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Transport-neutral answer to a live list query.
 *
 * @param statusCode HTTP-style status: 200, 400, 404, 499, 500 or 504
 * @param detail     human readable reason for a non-200 status
 * @param field      offending parameter of a 400 response
 * @param results    rows of the requested page
 * @param count      total number of matching rows
 * @param page       one-based page number, zero for unpaginated responses
 * @param pageSize   rows per page, zero for unpaginated responses
 * @param hasNext    whether rows follow the returned page
 * @param metrics    execution metrics, absent if the query never reached the executor
 */
public record QueryResponse(
        int statusCode,
        @Nullable String detail,
        @Nullable String field,
        List<Map<String, Object>> results,
        long count,
        long page,
        int pageSize,
        boolean hasNext,
        @Nullable ExecutionMetrics metrics
) {

    public QueryResponse {
        results = List.copyOf(results);
    }

    static QueryResponse error(final int statusCode, final String detail, final @Nullable String field,
                               final @Nullable ExecutionMetrics metrics) {
        return new QueryResponse(statusCode, detail, field, List.of(), 0, 0, 0, false, metrics);
    }

    public boolean isSuccess() {
        return statusCode == ContactQueryService.OK;
    }
}
