package de.mirkosertic.contactbench.store;

import de.mirkosertic.contactbench.plan.QueryPlan;

import java.time.Duration;

/**
 * Backing store of the contacts data. Implementations translate a {@link QueryPlan} into their
 * native query language and enforce {@code statementTimeout} natively; a zero or negative
 * timeout means no limit.
 */
public interface ContactStore extends AutoCloseable {

    /**
     * Prepares retrieval of the plan's rows. Paginated plans also report the total matching count.
     */
    StoreQuery<StoreResult> prepareFetch(QueryPlan plan, Duration statementTimeout) throws StoreException;

    /**
     * Prepares a count of all rows matching the plan's filters and search, ignoring its pagination.
     */
    StoreQuery<Long> prepareCount(QueryPlan plan, Duration statementTimeout) throws StoreException;

    /**
     * Short name used in logs and reports.
     */
    String name();

    @Override
    void close() throws StoreException;
}
