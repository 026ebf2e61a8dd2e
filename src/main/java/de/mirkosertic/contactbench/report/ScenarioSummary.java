package de.mirkosertic.contactbench.report;

import de.mirkosertic.contactbench.execution.ExecutionStatus;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Per-scenario aggregate. Timing figures cover successful runs only and are absent when no run
 * succeeded.
 *
 * @param scenario     scenario name
 * @param totalRuns    all recorded runs
 * @param runsByStatus run count per terminal status, every status present
 * @param stats        statistics over successful runs, or null
 */
public record ScenarioSummary(
        String scenario,
        int totalRuns,
        Map<ExecutionStatus, Integer> runsByStatus,
        @Nullable Stats stats
) {

    /**
     * @param meanMs          arithmetic mean duration
     * @param medianMs        median duration; mean of the two middle values for an even count
     * @param p95Ms           95th percentile duration, nearest-rank method
     * @param minMs           fastest run
     * @param maxMs           slowest run
     * @param meanQueryCount  mean statements per run
     * @param meanResultCount mean rows per run
     */
    public record Stats(
            double meanMs,
            double medianMs,
            double p95Ms,
            double minMs,
            double maxMs,
            double meanQueryCount,
            double meanResultCount
    ) {
    }

    public ScenarioSummary {
        runsByStatus = Map.copyOf(runsByStatus);
    }

    public int successfulRuns() {
        return runsByStatus.getOrDefault(ExecutionStatus.SUCCESS, 0);
    }
}
