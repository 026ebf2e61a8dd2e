package de.mirkosertic.contactbench.report;

import de.mirkosertic.contactbench.benchmark.BenchmarkResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Numeric series handed to chart rendering, keyed by scenario in report order. Only successful
 * runs contribute values.
 */
public record ChartSeries(
        List<String> scenarios,
        Map<String, List<Double>> durationMs,
        Map<String, List<Integer>> queryCount,
        Map<String, Double> meanDurationMs
) {

    public static ChartSeries from(final BenchmarkReport report) {
        final Map<String, List<Double>> durations = new LinkedHashMap<>();
        final Map<String, List<Integer>> queries = new LinkedHashMap<>();
        for (final ScenarioSummary summary : report.summaries()) {
            durations.put(summary.scenario(), new ArrayList<>());
            queries.put(summary.scenario(), new ArrayList<>());
        }
        for (final BenchmarkResult result : report.results()) {
            if (result.isSuccess()) {
                durations.get(result.scenario()).add(result.metrics().durationMs());
                queries.get(result.scenario()).add(result.metrics().statementCount());
            }
        }

        final Map<String, Double> means = new LinkedHashMap<>();
        for (final ScenarioSummary summary : report.summaries()) {
            if (summary.stats() != null) {
                means.put(summary.scenario(), summary.stats().meanMs());
            }
        }
        return new ChartSeries(List.copyOf(durations.keySet()), durations, queries, means);
    }
}
