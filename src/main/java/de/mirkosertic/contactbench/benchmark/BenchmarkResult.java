package de.mirkosertic.contactbench.benchmark;

import de.mirkosertic.contactbench.execution.ExecutionMetrics;
import de.mirkosertic.contactbench.execution.ExecutionStatus;
import de.mirkosertic.contactbench.plan.QueryPlan;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Outcome of one benchmark run.
 *
 * @param scenario  scenario name
 * @param runIndex  zero-based index of the run within its scenario
 * @param variant   page variant, null for scenarios without variants
 * @param page      fetched page, zero for unpaginated runs or when the page could not be resolved
 * @param plan      executed plan, null if none could be built
 * @param metrics   execution metrics
 * @param timestamp completion time
 * @param error     reason for a non-success run
 */
public record BenchmarkResult(
        String scenario,
        int runIndex,
        @Nullable PageVariant variant,
        long page,
        @Nullable QueryPlan plan,
        ExecutionMetrics metrics,
        Instant timestamp,
        @Nullable String error
) {

    public ExecutionStatus status() {
        return metrics.status();
    }

    public boolean isSuccess() {
        return metrics.status() == ExecutionStatus.SUCCESS;
    }
}
