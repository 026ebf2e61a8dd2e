package de.mirkosertic.contactbench.report;

import de.mirkosertic.contactbench.benchmark.BenchmarkResult;
import de.mirkosertic.contactbench.benchmark.PageVariant;
import de.mirkosertic.contactbench.execution.ExecutionMetrics;
import de.mirkosertic.contactbench.execution.ExecutionStatus;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

final class ReportFixtures {

    static final Instant GENERATED_AT = Instant.parse("2024-03-05T14:07:09Z");

    private ReportFixtures() {
    }

    static BenchmarkResult success(final String scenario, final int runIndex, final double durationMs) {
        return new BenchmarkResult(scenario, runIndex, null, 1, null,
                new ExecutionMetrics(durationMs, 2, 50, ExecutionStatus.SUCCESS), GENERATED_AT, null);
    }

    static BenchmarkResult page(final String scenario, final int runIndex, final PageVariant variant, final long page,
                                final double durationMs) {
        return new BenchmarkResult(scenario, runIndex, variant, page, null,
                new ExecutionMetrics(durationMs, 2, 1000, ExecutionStatus.SUCCESS), GENERATED_AT, null);
    }

    static BenchmarkResult failure(final String scenario, final int runIndex, final ExecutionStatus status,
                                   final @Nullable String error) {
        return new BenchmarkResult(scenario, runIndex, null, 1, null, new ExecutionMetrics(3.0, 1, 0, status),
                GENERATED_AT, error);
    }
}
