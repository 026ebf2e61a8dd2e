package de.mirkosertic.contactbench.report;

import de.mirkosertic.contactbench.benchmark.BenchmarkListener;
import de.mirkosertic.contactbench.benchmark.BenchmarkResult;
import de.mirkosertic.contactbench.execution.ExecutionStatus;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds benchmark results into a {@link BenchmarkReport}. Results are recorded one at a time;
 * {@link #finish()} may be called once.
 */
public class ReportAggregator implements BenchmarkListener {

    private final Clock clock;
    private final Map<String, List<BenchmarkResult>> byScenario = new LinkedHashMap<>();
    private final List<BenchmarkResult> results = new ArrayList<>();
    private boolean finished;

    public ReportAggregator() {
        this(Clock.systemUTC());
    }

    public ReportAggregator(final Clock clock) {
        this.clock = clock;
    }

    public void record(final BenchmarkResult result) {
        if (finished) {
            throw new IllegalStateException("Report already finished");
        }
        results.add(result);
        byScenario.computeIfAbsent(result.scenario(), name -> new ArrayList<>()).add(result);
    }

    @Override
    public void runCompleted(final BenchmarkResult result) {
        record(result);
    }

    public BenchmarkReport finish() {
        if (finished) {
            throw new IllegalStateException("Report already finished");
        }
        finished = true;
        final List<ScenarioSummary> summaries = new ArrayList<>();
        byScenario.forEach((scenario, runs) -> summaries.add(summarize(scenario, runs)));
        return new BenchmarkReport(clock.instant(), results, summaries);
    }

    static ScenarioSummary summarize(final String scenario, final List<BenchmarkResult> runs) {
        final Map<ExecutionStatus, Integer> byStatus = new EnumMap<>(ExecutionStatus.class);
        for (final ExecutionStatus status : ExecutionStatus.values()) {
            byStatus.put(status, 0);
        }
        for (final BenchmarkResult run : runs) {
            byStatus.merge(run.status(), 1, Integer::sum);
        }

        final List<BenchmarkResult> successful = runs.stream().filter(BenchmarkResult::isSuccess).toList();
        if (successful.isEmpty()) {
            return new ScenarioSummary(scenario, runs.size(), byStatus, null);
        }

        final double[] durations = successful.stream().mapToDouble(run -> run.metrics().durationMs()).toArray();
        final double[] queries = successful.stream().mapToDouble(run -> run.metrics().statementCount()).toArray();
        final double[] rows = successful.stream().mapToDouble(run -> run.metrics().resultCount()).toArray();

        final ScenarioSummary.Stats stats = new ScenarioSummary.Stats(
                Statistics.mean(durations),
                Statistics.median(durations),
                Statistics.percentile(durations, 95),
                Statistics.min(durations),
                Statistics.max(durations),
                Statistics.mean(queries),
                Statistics.mean(rows));
        return new ScenarioSummary(scenario, runs.size(), byStatus, stats);
    }
}
