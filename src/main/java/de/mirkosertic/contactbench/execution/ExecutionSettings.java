package de.mirkosertic.contactbench.execution;

import java.time.Duration;

/**
 * Executor tuning.
 *
 * @param statementTimeout          upper bound passed to the store when the token has no deadline
 * @param pollInterval              granularity at which the waiting caller notices cancellation
 * @param propagateStatementTimeout whether the token's remaining time is passed on as the store's
 *                                  statement timeout
 * @param workerThreads             size of the worker pool
 */
public record ExecutionSettings(
        Duration statementTimeout,
        Duration pollInterval,
        boolean propagateStatementTimeout,
        int workerThreads
) {

    public static final ExecutionSettings DEFAULTS =
            new ExecutionSettings(Duration.ofSeconds(30), Duration.ofMillis(25), true, 4);

    public ExecutionSettings {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
    }
}
