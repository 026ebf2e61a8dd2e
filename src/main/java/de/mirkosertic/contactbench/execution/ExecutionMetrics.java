package de.mirkosertic.contactbench.execution;

/**
 * Measurements of a single execution.
 *
 * @param durationMs     wall-clock time from start to the terminal state
 * @param statementCount data statements the store issued
 * @param resultCount    rows returned, zero unless successful
 * @param status         the terminal state
 */
public record ExecutionMetrics(double durationMs, int statementCount, int resultCount, ExecutionStatus status) {
}
