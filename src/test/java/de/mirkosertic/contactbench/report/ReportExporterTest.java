package de.mirkosertic.contactbench.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.contactbench.benchmark.PageVariant;
import de.mirkosertic.contactbench.execution.ExecutionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

import static de.mirkosertic.contactbench.report.ReportFixtures.GENERATED_AT;
import static de.mirkosertic.contactbench.report.ReportFixtures.failure;
import static de.mirkosertic.contactbench.report.ReportFixtures.page;
import static de.mirkosertic.contactbench.report.ReportFixtures.success;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReportExporter Tests")
class ReportExporterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private BenchmarkReport report;

    @BeforeEach
    void setUp() {
        final ReportAggregator aggregator = new ReportAggregator(Clock.fixed(GENERATED_AT, ZoneOffset.UTC));
        aggregator.record(success("filter_by_name", 0, 12.5));
        aggregator.record(failure("filter_by_name", 1, ExecutionStatus.TIMED_OUT, "Timed out after 60000ms"));
        aggregator.record(page("pagination_selected_pages", 0, PageVariant.FIRST, 1, 4));
        aggregator.record(page("pagination_selected_pages", 1, PageVariant.LAST, 10, 8));
        aggregator.record(page("pagination_selected_pages", 2, PageVariant.RANDOM, 3, 6));
        report = aggregator.finish();
    }

    @Test
    @DisplayName("Should name files after the report timestamp")
    void shouldNameFiles() throws Exception {
        final ExportedFiles files = new ReportExporter(tempDir.resolve("out")).export(report, true);

        assertThat(files.json()).hasFileName("benchmark_results_20240305_140709.json").exists();
        assertThat(files.csv()).hasFileName("benchmark_results_20240305_140709.csv").exists();
        assertThat(files.chartSeries()).hasFileName("chart_series_20240305_140709.json").exists();
        assertThat(files.paginationReports()).singleElement()
                .satisfies(path -> assertThat(path)
                        .hasFileName("pagination_report_pagination_selected_pages_20240305_140709.json"));
    }

    @Test
    @DisplayName("Should write summaries and runs as snake_case JSON")
    void shouldWriteJson() throws Exception {
        final ExportedFiles files = new ReportExporter(tempDir).export(report, false);

        final JsonNode root = objectMapper.readTree(files.json().toFile());
        assertThat(root.get("generated_at").asText()).isEqualTo("2024-03-05T14:07:09Z");

        final JsonNode summary = root.get("summaries").get(0);
        assertThat(summary.get("scenario").asText()).isEqualTo("filter_by_name");
        assertThat(summary.get("total_runs").asInt()).isEqualTo(2);
        assertThat(summary.get("runs_by_status").get("TIMED_OUT").asInt()).isEqualTo(1);
        assertThat(summary.get("mean_ms").asDouble()).isEqualTo(12.5);

        final JsonNode failedRun = root.get("runs").get(1);
        assertThat(failedRun.get("status").asText()).isEqualTo("TIMED_OUT");
        assertThat(failedRun.get("error").asText()).isEqualTo("Timed out after 60000ms");
        assertThat(root.get("runs").get(0).has("error")).isFalse();
        assertThat(root.get("runs").size()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should write one CSV line per run")
    void shouldWriteCsv() throws Exception {
        final ExportedFiles files = new ReportExporter(tempDir).export(report, false);

        final List<String> lines = Files.readAllLines(files.csv(), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(6);
        assertThat(lines.get(0)).isEqualTo(String.join(",", ReportExporter.CSV_COLUMNS));
        assertThat(lines.get(1)).startsWith("filter_by_name,0,SUCCESS,12.5,2,50,1,");
        assertThat(lines.get(2)).startsWith("filter_by_name,1,TIMED_OUT,");
    }

    @Test
    @DisplayName("Should skip the chart series when disabled")
    void shouldSkipChartSeries() throws Exception {
        final ExportedFiles files = new ReportExporter(tempDir).export(report, false);

        assertThat(files.chartSeries()).isNull();
        try (Stream<Path> listing = Files.list(tempDir)) {
            assertThat(listing.map(path -> path.getFileName().toString()))
                    .noneMatch(name -> name.startsWith("chart_series_"));
        }
    }

    @Test
    @DisplayName("Should list the tested pages in the pagination report")
    void shouldWritePaginationReport() throws Exception {
        final ExportedFiles files = new ReportExporter(tempDir).export(report, false);

        final JsonNode root = objectMapper.readTree(files.paginationReports().get(0).toFile());
        assertThat(root.get("scenario").asText()).isEqualTo("pagination_selected_pages");
        assertThat(root.get("pages_tested").toString()).isEqualTo("[1,3,10]");
        assertThat(root.get("pages").size()).isEqualTo(3);
        assertThat(root.get("pages").get(1).get("variant").asText()).isEqualTo("LAST");
        assertThat(root.get("summary").get("max_ms").asDouble()).isEqualTo(8.0);
    }

    @Test
    @DisplayName("Should write chart series for successful runs")
    void shouldWriteChartSeries() throws Exception {
        final ExportedFiles files = new ReportExporter(tempDir).export(report, true);

        final JsonNode root = objectMapper.readTree(files.chartSeries().toFile());
        assertThat(root.get("scenarios").toString()).isEqualTo("[\"filter_by_name\",\"pagination_selected_pages\"]");
        assertThat(root.get("duration_ms").get("filter_by_name").size()).isEqualTo(1);
        assertThat(root.get("mean_duration_ms").get("pagination_selected_pages").asDouble()).isEqualTo(6.0);
    }
}
