package de.mirkosertic.contactbench.execution;

import org.jspecify.annotations.Nullable;

/**
 * Result of an execution. {@code value} is only present on success, {@code failure} only on
 * {@link ExecutionStatus#EXECUTION_FAILED} and {@link ExecutionStatus#TIMED_OUT} when the store
 * reported the timeout.
 *
 * @param <T> the value type
 */
public record ExecutionOutcome<T>(
        ExecutionStatus status,
        @Nullable T value,
        ExecutionMetrics metrics,
        @Nullable Throwable failure
) {

    public static <T> ExecutionOutcome<T> success(final T value, final ExecutionMetrics metrics) {
        return new ExecutionOutcome<>(ExecutionStatus.SUCCESS, value, metrics, null);
    }

    public static <T> ExecutionOutcome<T> terminated(final ExecutionMetrics metrics, final @Nullable Throwable failure) {
        return new ExecutionOutcome<>(metrics.status(), null, metrics, failure);
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }

    /**
     * Human readable reason for a non-success outcome.
     */
    public String describe() {
        return switch (status) {
            case SUCCESS -> "ok";
            case CANCELLED -> "Query cancelled";
            case TIMED_OUT -> "Query timed out after " + Math.round(metrics.durationMs()) + "ms";
            case EXECUTION_FAILED -> "Query failed: " + (failure != null ? failure.getMessage() : "unknown error");
        };
    }
}
