package de.mirkosertic.contactbench.api;

import de.mirkosertic.contactbench.execution.CancellableQueryExecutor;
import de.mirkosertic.contactbench.execution.CancellationToken;
import de.mirkosertic.contactbench.execution.ExecutionOutcome;
import de.mirkosertic.contactbench.plan.Pagination;
import de.mirkosertic.contactbench.plan.QueryParameters;
import de.mirkosertic.contactbench.plan.QueryPlan;
import de.mirkosertic.contactbench.plan.QueryPlanBuilder;
import de.mirkosertic.contactbench.schema.EntityType;
import de.mirkosertic.contactbench.schema.InvalidQueryException;
import de.mirkosertic.contactbench.store.StoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Boundary for live list queries. Turns raw request parameters into a plan, runs it under a
 * cancellation token and maps the outcome to a status code.
 * <p>
 * A non-empty {@code _cancel} parameter cancels the request's token before execution, so the
 * request ends with 499 without touching the store.
 */
public class ContactQueryService {

    private static final Logger logger = LoggerFactory.getLogger(ContactQueryService.class);

    public static final int OK = 200;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int CLIENT_CLOSED_REQUEST = 499;
    public static final int INTERNAL_SERVER_ERROR = 500;
    public static final int GATEWAY_TIMEOUT = 504;

    private final QueryPlanBuilder planBuilder;
    private final CancellableQueryExecutor executor;
    private final Duration requestTimeout;

    public ContactQueryService(final QueryPlanBuilder planBuilder, final CancellableQueryExecutor executor,
                               final Duration requestTimeout) {
        this.planBuilder = planBuilder;
        this.executor = executor;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Runs a query under a token that expires after the configured request timeout.
     */
    public QueryResponse query(final String entity, final Map<String, String> params) {
        try (CancellationToken token = CancellationToken.withTimeout(requestTimeout)) {
            return query(entity, params, token);
        }
    }

    /**
     * Runs a query under a token owned by the caller, for example one cancelled when the client
     * disconnects.
     */
    public QueryResponse query(final String entity, final Map<String, String> params, final CancellationToken token) {
        final EntityType type;
        try {
            type = EntityType.fromName(entity);
        } catch (final IllegalArgumentException e) {
            return QueryResponse.error(NOT_FOUND, "Not found: " + entity, null, null);
        }

        final String cancel = params.get(QueryParameters.CANCEL);
        if (cancel != null && !cancel.isEmpty()) {
            token.cancel();
        }

        final QueryPlan plan;
        try {
            plan = planBuilder.build(type, params);
        } catch (final InvalidQueryException e) {
            if (token.isCancelled()) {
                return QueryResponse.error(CLIENT_CLOSED_REQUEST, "Request cancelled", null, null);
            }
            logger.debug("Rejected {} query: {}", type.parameterName(), e.getMessage());
            return QueryResponse.error(BAD_REQUEST, e.getMessage(), e.getField(), null);
        }

        final ExecutionOutcome<StoreResult> outcome = executor.execute(plan, token);
        return switch (outcome.status()) {
            case SUCCESS -> success(plan, outcome);
            case CANCELLED -> QueryResponse.error(CLIENT_CLOSED_REQUEST, "Request cancelled", null, outcome.metrics());
            case TIMED_OUT -> QueryResponse.error(GATEWAY_TIMEOUT, outcome.describe(), null, outcome.metrics());
            case EXECUTION_FAILED -> {
                logger.error("Query on {} failed", type.parameterName(), outcome.failure());
                yield QueryResponse.error(INTERNAL_SERVER_ERROR, outcome.describe(), null, outcome.metrics());
            }
        };
    }

    private static QueryResponse success(final QueryPlan plan, final ExecutionOutcome<StoreResult> outcome) {
        final StoreResult result = outcome.value();
        final Pagination pagination = plan.pagination();
        final boolean hasNext = pagination.isPaginated() && pagination.offset() + result.size() < result.totalCount();
        return new QueryResponse(OK, null, null, result.rows(), result.totalCount(),
                pagination.isPaginated() ? pagination.page() : 0, pagination.limit(), hasNext, outcome.metrics());
    }
}
