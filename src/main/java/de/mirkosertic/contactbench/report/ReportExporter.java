package de.mirkosertic.contactbench.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import de.mirkosertic.contactbench.benchmark.BenchmarkResult;
import de.mirkosertic.contactbench.execution.ExecutionStatus;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes a {@link BenchmarkReport} to disk.
 * <ul>
 *   <li>{@code benchmark_results_<timestamp>.json}: summaries and every run</li>
 *   <li>{@code benchmark_results_<timestamp>.csv}: one line per run</li>
 *   <li>{@code chart_series_<timestamp>.json}: numeric series for chart rendering</li>
 *   <li>{@code pagination_report_<scenario>_<timestamp>.json}: per-page figures of scenarios that visit page variants</li>
 * </ul>
 */
public class ReportExporter {

    private static final Logger logger = LoggerFactory.getLogger(ReportExporter.class);

    static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss", Locale.ROOT).withZone(ZoneOffset.UTC);

    static final List<String> CSV_COLUMNS = List.of(
            "scenario", "run_index", "status", "duration_ms", "query_count", "result_count", "page", "timestamp");

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    @JsonPropertyOrder({"scenario", "run_index", "status", "duration_ms", "query_count", "result_count", "page",
            "variant", "timestamp", "error"})
    record RunRecord(
            String scenario,
            @JsonProperty("run_index") int runIndex,
            String status,
            @JsonProperty("duration_ms") double durationMs,
            @JsonProperty("query_count") int queryCount,
            @JsonProperty("result_count") int resultCount,
            long page,
            @Nullable String variant,
            String timestamp,
            @Nullable String error
    ) {

        static RunRecord of(final BenchmarkResult result) {
            return new RunRecord(result.scenario(), result.runIndex(), result.status().name(),
                    result.metrics().durationMs(), result.metrics().statementCount(), result.metrics().resultCount(),
                    result.page(), result.variant() != null ? result.variant().name() : null,
                    result.timestamp().toString(), result.error());
        }
    }

    @JsonPropertyOrder({"scenario", "total_runs", "runs_by_status", "mean_ms", "median_ms", "p95_ms", "min_ms",
            "max_ms", "mean_query_count", "mean_result_count"})
    record SummaryRecord(
            String scenario,
            @JsonProperty("total_runs") int totalRuns,
            @JsonProperty("runs_by_status") Map<String, Integer> runsByStatus,
            @JsonProperty("mean_ms") @Nullable Double meanMs,
            @JsonProperty("median_ms") @Nullable Double medianMs,
            @JsonProperty("p95_ms") @Nullable Double p95Ms,
            @JsonProperty("min_ms") @Nullable Double minMs,
            @JsonProperty("max_ms") @Nullable Double maxMs,
            @JsonProperty("mean_query_count") @Nullable Double meanQueryCount,
            @JsonProperty("mean_result_count") @Nullable Double meanResultCount
    ) {

        static SummaryRecord of(final ScenarioSummary summary) {
            final Map<String, Integer> byStatus = new LinkedHashMap<>();
            for (final ExecutionStatus status : ExecutionStatus.values()) {
                byStatus.put(status.name(), summary.runsByStatus().getOrDefault(status, 0));
            }
            final ScenarioSummary.Stats stats = summary.stats();
            if (stats == null) {
                return new SummaryRecord(summary.scenario(), summary.totalRuns(), byStatus,
                        null, null, null, null, null, null, null);
            }
            return new SummaryRecord(summary.scenario(), summary.totalRuns(), byStatus, stats.meanMs(),
                    stats.medianMs(), stats.p95Ms(), stats.minMs(), stats.maxMs(), stats.meanQueryCount(),
                    stats.meanResultCount());
        }
    }

    @JsonPropertyOrder({"generated_at", "summaries", "runs"})
    record ResultsDocument(
            @JsonProperty("generated_at") String generatedAt,
            List<SummaryRecord> summaries,
            List<RunRecord> runs
    ) {
    }

    @JsonPropertyOrder({"generated_at", "scenarios", "duration_ms", "query_count", "mean_duration_ms"})
    record ChartDocument(
            @JsonProperty("generated_at") String generatedAt,
            List<String> scenarios,
            @JsonProperty("duration_ms") Map<String, List<Double>> durationMs,
            @JsonProperty("query_count") Map<String, List<Integer>> queryCount,
            @JsonProperty("mean_duration_ms") Map<String, Double> meanDurationMs
    ) {
    }

    @JsonPropertyOrder({"generated_at", "scenario", "pages_tested", "summary", "pages"})
    record PaginationDocument(
            @JsonProperty("generated_at") String generatedAt,
            String scenario,
            @JsonProperty("pages_tested") List<Long> pagesTested,
            SummaryRecord summary,
            List<RunRecord> pages
    ) {
    }

    private final Path outputDirectory;

    public ReportExporter(final Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public ExportedFiles export(final BenchmarkReport report, final boolean includeChartSeries) throws IOException {
        Files.createDirectories(outputDirectory);
        final String timestamp = FILE_TIMESTAMP.format(report.generatedAt());
        final String generatedAt = report.generatedAt().toString();

        final List<RunRecord> runs = report.results().stream().map(RunRecord::of).toList();

        final Path json = outputDirectory.resolve("benchmark_results_" + timestamp + ".json");
        OBJECT_MAPPER.writeValue(json.toFile(), new ResultsDocument(generatedAt,
                report.summaries().stream().map(SummaryRecord::of).toList(), runs));
        logger.info("JSON results saved to: {}", json);

        final Path csv = outputDirectory.resolve("benchmark_results_" + timestamp + ".csv");
        writeCsv(csv, runs);
        logger.info("CSV results saved to: {}", csv);

        Path chartSeries = null;
        if (includeChartSeries) {
            final ChartSeries series = ChartSeries.from(report);
            chartSeries = outputDirectory.resolve("chart_series_" + timestamp + ".json");
            OBJECT_MAPPER.writeValue(chartSeries.toFile(), new ChartDocument(generatedAt, series.scenarios(),
                    series.durationMs(), series.queryCount(), series.meanDurationMs()));
            logger.info("Chart series saved to: {}", chartSeries);
        }

        final List<Path> paginationReports = new ArrayList<>();
        for (final ScenarioSummary summary : report.summaries()) {
            final List<RunRecord> pages = runs.stream()
                    .filter(run -> run.scenario().equals(summary.scenario()) && run.variant() != null)
                    .toList();
            if (pages.isEmpty()) {
                continue;
            }
            final Path path = outputDirectory.resolve("pagination_report_" + summary.scenario() + "_" + timestamp + ".json");
            final List<Long> pagesTested = pages.stream().map(RunRecord::page).distinct().sorted().toList();
            OBJECT_MAPPER.writeValue(path.toFile(), new PaginationDocument(generatedAt, summary.scenario(), pagesTested,
                    SummaryRecord.of(summary), pages));
            paginationReports.add(path);
            logger.info("Pagination report saved to: {}", path);
        }

        return new ExportedFiles(json, csv, chartSeries, paginationReports);
    }

    private static void writeCsv(final Path csv, final List<RunRecord> runs) throws IOException {
        final CsvSchema.Builder schema = CsvSchema.builder();
        CSV_COLUMNS.forEach(schema::addColumn);
        try (Writer writer = Files.newBufferedWriter(csv, StandardCharsets.UTF_8);
             SequenceWriter rows = CSV_MAPPER.writer(schema.build().withHeader()).writeValues(writer)) {
            for (final RunRecord run : runs) {
                rows.write(Arrays.asList(run.scenario(), run.runIndex(), run.status(), run.durationMs(),
                        run.queryCount(), run.resultCount(), run.page(), run.timestamp()));
            }
        }
    }
}
