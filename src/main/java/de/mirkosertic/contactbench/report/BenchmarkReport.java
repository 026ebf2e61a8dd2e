package de.mirkosertic.contactbench.report;

import de.mirkosertic.contactbench.benchmark.BenchmarkResult;

import java.time.Instant;
import java.util.List;

/**
 * Finalized outcome of a benchmark session. Summaries follow the order in which scenarios first
 * appeared in the results.
 */
public record BenchmarkReport(Instant generatedAt, List<BenchmarkResult> results, List<ScenarioSummary> summaries) {

    public BenchmarkReport {
        results = List.copyOf(results);
        summaries = List.copyOf(summaries);
    }
}
