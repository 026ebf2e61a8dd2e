package de.mirkosertic.contactbench.report;

import de.mirkosertic.contactbench.execution.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders the per-scenario summary as a fixed-width table and logs it.
 */
public class ReportPrinter {

    private static final Logger logger = LoggerFactory.getLogger(ReportPrinter.class);

    private static final String HEADER_FORMAT = "%-36s %6s %6s %10s %10s %10s %10s %10s %8s %10s";
    private static final String ROW_FORMAT = "%-36s %6d %6d %10.2f %10.2f %10.2f %10.2f %10.2f %8.2f %10.1f";

    public void print(final BenchmarkReport report) {
        for (final String line : render(report)) {
            logger.info(line);
        }
    }

    List<String> render(final BenchmarkReport report) {
        final List<String> lines = new ArrayList<>();
        final String header = String.format(Locale.ROOT, HEADER_FORMAT,
                "scenario", "runs", "ok", "mean ms", "median ms", "p95 ms", "min ms", "max ms", "queries", "results");
        lines.add("=".repeat(header.length()));
        lines.add("BENCHMARK SUMMARY (" + report.generatedAt() + ")");
        lines.add("=".repeat(header.length()));
        lines.add(header);
        lines.add("-".repeat(header.length()));
        for (final ScenarioSummary summary : report.summaries()) {
            final ScenarioSummary.Stats stats = summary.stats();
            if (stats == null) {
                lines.add(String.format(Locale.ROOT, "%-36s %6d %6d   no successful runs (%s)", summary.scenario(),
                        summary.totalRuns(), 0, failures(summary)));
                continue;
            }
            lines.add(String.format(Locale.ROOT, ROW_FORMAT, summary.scenario(), summary.totalRuns(),
                    summary.successfulRuns(), stats.meanMs(), stats.medianMs(), stats.p95Ms(), stats.minMs(),
                    stats.maxMs(), stats.meanQueryCount(), stats.meanResultCount()));
            if (summary.successfulRuns() < summary.totalRuns()) {
                lines.add("    " + failures(summary));
            }
        }
        lines.add("=".repeat(header.length()));
        return lines;
    }

    private static String failures(final ScenarioSummary summary) {
        final List<String> parts = new ArrayList<>();
        for (final ExecutionStatus status : ExecutionStatus.values()) {
            final int count = summary.runsByStatus().getOrDefault(status, 0);
            if (status != ExecutionStatus.SUCCESS && count > 0) {
                parts.add(status.name().toLowerCase(Locale.ROOT) + "=" + count);
            }
        }
        return String.join(", ", parts);
    }
}
