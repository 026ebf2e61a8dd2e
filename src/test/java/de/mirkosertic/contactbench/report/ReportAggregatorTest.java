package de.mirkosertic.contactbench.report;

import de.mirkosertic.contactbench.execution.ExecutionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static de.mirkosertic.contactbench.report.ReportFixtures.GENERATED_AT;
import static de.mirkosertic.contactbench.report.ReportFixtures.failure;
import static de.mirkosertic.contactbench.report.ReportFixtures.success;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ReportAggregator Tests")
class ReportAggregatorTest {

    private final ReportAggregator aggregator = new ReportAggregator(Clock.fixed(GENERATED_AT, ZoneOffset.UTC));

    @Test
    @DisplayName("Should compute statistics over successful runs")
    void shouldComputeStatistics() {
        // Given
        final double[] durations = {10, 20, 30, 40, 50};
        for (int i = 0; i < durations.length; i++) {
            aggregator.record(success("filter_by_name", i, durations[i]));
        }

        // When
        final BenchmarkReport report = aggregator.finish();

        // Then
        assertThat(report.generatedAt()).isEqualTo(GENERATED_AT);
        assertThat(report.results()).hasSize(5);
        final ScenarioSummary summary = report.summaries().get(0);
        assertThat(summary.totalRuns()).isEqualTo(5);
        assertThat(summary.successfulRuns()).isEqualTo(5);
        assertThat(summary.stats()).isEqualTo(new ScenarioSummary.Stats(30, 30, 50, 10, 50, 2, 50));
    }

    @Test
    @DisplayName("Should count every status and exclude failures from timings")
    void shouldCountStatuses() {
        aggregator.record(success("s", 0, 10));
        aggregator.record(failure("s", 1, ExecutionStatus.TIMED_OUT, "deadline"));
        aggregator.record(failure("s", 2, ExecutionStatus.CANCELLED, null));
        aggregator.record(success("s", 3, 30));

        final ScenarioSummary summary = aggregator.finish().summaries().get(0);

        assertThat(summary.runsByStatus())
                .containsEntry(ExecutionStatus.SUCCESS, 2)
                .containsEntry(ExecutionStatus.TIMED_OUT, 1)
                .containsEntry(ExecutionStatus.CANCELLED, 1)
                .containsEntry(ExecutionStatus.EXECUTION_FAILED, 0);
        assertThat(summary.stats()).isNotNull();
        assertThat(summary.stats().meanMs()).isEqualTo(20.0);
        assertThat(summary.stats().medianMs()).isEqualTo(20.0);
    }

    @Test
    @DisplayName("Should omit statistics when no run succeeded")
    void shouldOmitStatsWithoutSuccess() {
        final ScenarioSummary summary = ReportAggregator.summarize("broken",
                List.of(failure("broken", 0, ExecutionStatus.EXECUTION_FAILED, "Invalid query: x")));

        assertThat(summary.totalRuns()).isEqualTo(1);
        assertThat(summary.successfulRuns()).isZero();
        assertThat(summary.stats()).isNull();
    }

    @Test
    @DisplayName("Should keep scenarios in order of first appearance")
    void shouldKeepScenarioOrder() {
        aggregator.runCompleted(success("b", 0, 1));
        aggregator.runCompleted(success("a", 0, 1));
        aggregator.runCompleted(success("b", 1, 1));

        assertThat(aggregator.finish().summaries()).extracting(ScenarioSummary::scenario).containsExactly("b", "a");
    }

    @Test
    @DisplayName("Should refuse use after finish")
    void shouldFinishOnce() {
        aggregator.finish();

        assertThatThrownBy(aggregator::finish).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> aggregator.record(success("s", 0, 1))).isInstanceOf(IllegalStateException.class);
    }
}
