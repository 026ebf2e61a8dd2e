package de.mirkosertic.contactbench.execution;

import de.mirkosertic.contactbench.plan.QueryPlan;
import de.mirkosertic.contactbench.store.ContactStore;
import de.mirkosertic.contactbench.store.StoreException;
import de.mirkosertic.contactbench.store.StoreQuery;
import de.mirkosertic.contactbench.store.StoreResult;
import de.mirkosertic.contactbench.store.StoreTimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.ToIntFunction;

/**
 * Executes query plans against a {@link ContactStore} under a {@link CancellationToken}.
 * <p>
 * The store call runs on a worker thread while the caller waits in slices of at most one poll
 * interval, checking the token between slices. A cancelled token aborts the store query and ends
 * the execution as {@link ExecutionStatus#CANCELLED}; a passed deadline ends it as
 * {@link ExecutionStatus#TIMED_OUT}. Failures are returned as outcomes and never thrown.
 * <p>
 * All state of an execution lives on the calling thread's stack, so one executor serves any
 * number of concurrent callers.
 */
public class CancellableQueryExecutor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CancellableQueryExecutor.class);

    @FunctionalInterface
    private interface Preparer<T> {
        StoreQuery<T> prepare(QueryPlan plan, Duration statementTimeout) throws StoreException;
    }

    private final ContactStore store;
    private final ExecutionSettings settings;
    private final ThreadPoolExecutor workers;

    public CancellableQueryExecutor(final ContactStore store, final ExecutionSettings settings) {
        this.store = store;
        this.settings = settings;

        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "query-worker-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        this.workers = new ThreadPoolExecutor(
                settings.workerThreads(),
                settings.workerThreads(),
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                threadFactory
        );

        logger.info("CancellableQueryExecutor initialized for store '{}' with {} workers, poll interval {}ms",
                store.name(), settings.workerThreads(), settings.pollInterval().toMillis());
    }

    /**
     * Fetches the rows selected by the plan.
     */
    public ExecutionOutcome<StoreResult> execute(final QueryPlan plan, final CancellationToken token) {
        return run(plan, token, store::prepareFetch, StoreResult::size);
    }

    /**
     * Counts the rows matching the plan's filters and search. Count executions report a result
     * count of zero.
     */
    public ExecutionOutcome<Long> count(final QueryPlan plan, final CancellationToken token) {
        return run(plan, token, store::prepareCount, value -> 0);
    }

    private <T> ExecutionOutcome<T> run(final QueryPlan plan, final CancellationToken token,
                                        final Preparer<T> preparer, final ToIntFunction<T> rowCounter) {
        final long startNanos = System.nanoTime();

        if (token.isCancelled()) {
            logger.debug("Token for {} query already cancelled, skipping store", plan.entity().parameterName());
            return ExecutionOutcome.terminated(metrics(startNanos, 0, 0, ExecutionStatus.CANCELLED), null);
        }
        if (token.isExpired()) {
            logger.debug("Deadline for {} query already passed, skipping store", plan.entity().parameterName());
            return ExecutionOutcome.terminated(metrics(startNanos, 0, 0, ExecutionStatus.TIMED_OUT), null);
        }

        final StoreQuery<T> query;
        try {
            query = preparer.prepare(plan, statementTimeoutFor(token));
        } catch (final StoreException e) {
            logger.warn("Preparing {} query failed: {}", plan.entity().parameterName(), e.getMessage());
            return ExecutionOutcome.terminated(metrics(startNanos, 0, 0, ExecutionStatus.EXECUTION_FAILED), e);
        }

        try {
            return await(query, workers.submit(query::execute), token, startNanos, rowCounter);
        } finally {
            query.close();
        }
    }

    private <T> ExecutionOutcome<T> await(final StoreQuery<T> query, final Future<T> future,
                                          final CancellationToken token, final long startNanos,
                                          final ToIntFunction<T> rowCounter) {
        final long pollNanos = settings.pollInterval().toNanos();
        while (true) {
            if (token.isCancelled()) {
                stop(query, future);
                logger.debug("Query cancelled after {}ms", elapsedMs(startNanos));
                return ExecutionOutcome.terminated(
                        metrics(startNanos, query.statementCount(), 0, ExecutionStatus.CANCELLED), null);
            }
            if (token.isExpired()) {
                stop(query, future);
                logger.info("Query exceeded its deadline after {}ms", elapsedMs(startNanos));
                return ExecutionOutcome.terminated(
                        metrics(startNanos, query.statementCount(), 0, ExecutionStatus.TIMED_OUT), null);
            }

            final long waitNanos = Math.max(1, Math.min(pollNanos, token.remainingNanos()));
            try {
                final T value = future.get(waitNanos, TimeUnit.NANOSECONDS);
                if (token.isCancelled()) {
                    // Result arrived after cancellation was requested, discard it
                    return ExecutionOutcome.terminated(
                            metrics(startNanos, query.statementCount(), 0, ExecutionStatus.CANCELLED), null);
                }
                return ExecutionOutcome.success(value,
                        metrics(startNanos, query.statementCount(), rowCounter.applyAsInt(value), ExecutionStatus.SUCCESS));
            } catch (final TimeoutException e) {
                logger.trace("Query still running after {}ms", elapsedMs(startNanos));
            } catch (final CancellationException e) {
                return ExecutionOutcome.terminated(
                        metrics(startNanos, query.statementCount(), 0, ExecutionStatus.CANCELLED), null);
            } catch (final ExecutionException e) {
                return failed(query, token, startNanos, e.getCause());
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                stop(query, future);
                logger.debug("Caller interrupted while waiting for query");
                return ExecutionOutcome.terminated(
                        metrics(startNanos, query.statementCount(), 0, ExecutionStatus.CANCELLED), e);
            }
        }
    }

    private <T> ExecutionOutcome<T> failed(final StoreQuery<T> query, final CancellationToken token,
                                           final long startNanos, final @Nullable Throwable cause) {
        if (token.isCancelled()) {
            return ExecutionOutcome.terminated(
                    metrics(startNanos, query.statementCount(), 0, ExecutionStatus.CANCELLED), cause);
        }
        if (cause instanceof StoreTimeoutException) {
            logger.info("Store statement timeout fired after {}ms", elapsedMs(startNanos));
            return ExecutionOutcome.terminated(
                    metrics(startNanos, query.statementCount(), 0, ExecutionStatus.TIMED_OUT), cause);
        }
        logger.warn("Query execution failed after {}ms", elapsedMs(startNanos), cause);
        return ExecutionOutcome.terminated(
                metrics(startNanos, query.statementCount(), 0, ExecutionStatus.EXECUTION_FAILED), cause);
    }

    private static void stop(final StoreQuery<?> query, final Future<?> future) {
        query.abort();
        future.cancel(true);
    }

    Duration statementTimeoutFor(final CancellationToken token) {
        final Duration configured = settings.statementTimeout();
        if (!settings.propagateStatementTimeout() || !token.hasDeadline()) {
            return configured;
        }
        final Duration remaining = token.remaining();
        if (configured.isZero() || configured.isNegative()) {
            return remaining;
        }
        return remaining.compareTo(configured) < 0 ? remaining : configured;
    }

    private static ExecutionMetrics metrics(final long startNanos, final int statements, final int rows,
                                            final ExecutionStatus status) {
        return new ExecutionMetrics(elapsedMs(startNanos), statements, rows, status);
    }

    private static double elapsedMs(final long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    /**
     * Stops the worker pool. Running store calls are interrupted.
     */
    @Override
    public void close() {
        logger.info("Shutting down CancellableQueryExecutor");
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Query workers did not terminate in time, forcing shutdown");
                workers.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for query workers to terminate", e);
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
