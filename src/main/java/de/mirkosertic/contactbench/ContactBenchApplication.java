package de.mirkosertic.contactbench;

import de.mirkosertic.contactbench.benchmark.BenchmarkHarness;
import de.mirkosertic.contactbench.benchmark.BenchmarkListener;
import de.mirkosertic.contactbench.benchmark.BenchmarkScenario;
import de.mirkosertic.contactbench.benchmark.LoggingBenchmarkListener;
import de.mirkosertic.contactbench.benchmark.ScenarioCatalogueLoader;
import de.mirkosertic.contactbench.config.ApplicationConfig;
import de.mirkosertic.contactbench.config.BuildInfo;
import de.mirkosertic.contactbench.config.LoggingConfigurator;
import de.mirkosertic.contactbench.execution.CancellableQueryExecutor;
import de.mirkosertic.contactbench.plan.QueryPlanBuilder;
import de.mirkosertic.contactbench.report.BenchmarkReport;
import de.mirkosertic.contactbench.report.ExportedFiles;
import de.mirkosertic.contactbench.report.ReportAggregator;
import de.mirkosertic.contactbench.report.ReportExporter;
import de.mirkosertic.contactbench.report.ReportPrinter;
import de.mirkosertic.contactbench.schema.ContactSchemaRegistry;
import de.mirkosertic.contactbench.store.lucene.LuceneContactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Main entry point of the contact query bench.
 * Opens the Lucene contact index, runs the scenario catalogue and exports the report.
 * <p>
 * Usage: {@code ContactBenchApplication [--no-charts] [--no-export] [--scenarios <file>] [--repetitions <n>]}
 */
public class ContactBenchApplication {

    private static final Logger logger = LoggerFactory.getLogger(ContactBenchApplication.class);

    private final ApplicationConfig config;
    private LuceneContactStore store;
    private CancellableQueryExecutor executor;

    public ContactBenchApplication(final ApplicationConfig config) {
        this.config = config;
    }

    /**
     * Open the store and start the executor.
     */
    public void init() throws IOException {
        logger.info("Initializing contact query bench {} (built {})", BuildInfo.getVersion(), BuildInfo.getBuildTimestamp());

        store = LuceneContactStore.open(Paths.get(config.getIndexPath()), ContactSchemaRegistry.INSTANCE);
        if (store.documentCount() == 0) {
            logger.warn("Index at {} is empty, all scenarios will return zero rows", config.getIndexPath());
        } else {
            logger.info("Opened index at {} with {} documents", config.getIndexPath(), store.documentCount());
        }

        executor = new CancellableQueryExecutor(store, config.executionSettings());
    }

    /**
     * Run the configured catalogue and return the aggregated report.
     */
    public BenchmarkReport run() throws IOException {
        final ScenarioCatalogueLoader loader = new ScenarioCatalogueLoader(config.getRandomPages());
        final List<BenchmarkScenario> scenarios = config.getScenariosFile() != null
                ? loader.load(Paths.get(config.getScenariosFile()))
                : loader.loadDefault();

        final QueryPlanBuilder planBuilder = new QueryPlanBuilder(ContactSchemaRegistry.INSTANCE,
                config.getDefaultPageSize(), config.getMaxPageSize());
        final BenchmarkHarness harness = new BenchmarkHarness(executor, planBuilder, config.harnessSettings());

        final ReportAggregator aggregator = new ReportAggregator();
        harness.run(scenarios, BenchmarkListener.compose(new LoggingBenchmarkListener(), aggregator));

        final BenchmarkReport report = aggregator.finish();
        new ReportPrinter().print(report);

        if (config.isExportEnabled()) {
            final ExportedFiles files = new ReportExporter(Path.of(config.getOutputDirectory()))
                    .export(report, config.isChartsEnabled());
            logger.info("Results written to {} and {}", files.json(), files.csv());
            if (files.chartSeries() != null) {
                logger.info("Chart series written to {}", files.chartSeries());
            }
        } else {
            logger.info("Export disabled, results were not written");
        }
        return report;
    }

    /**
     * Release executor and store. Safe to call more than once.
     */
    public synchronized void shutdown() {
        logger.info("Shutting down contact query bench...");

        // Reverse order of initialization
        if (executor != null) {
            executor.close();
            executor = null;
        }

        try {
            if (store != null) {
                store.close();
                store = null;
            }
        } catch (final Exception e) {
            logger.error("Error closing contact store", e);
        }

        logger.info("Contact query bench shutdown complete");
    }

    /**
     * Applies command line flags on top of the loaded configuration.
     *
     * @throws IllegalArgumentException on unknown flags or missing values
     */
    static void applyArguments(final ApplicationConfig config, final String[] args) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--no-charts" -> config.setChartsEnabled(false);
                case "--no-export" -> config.setExportEnabled(false);
                case "--scenarios" -> config.setScenariosFile(requireValue(args, ++i, "--scenarios"));
                case "--repetitions" -> {
                    final String value = requireValue(args, ++i, "--repetitions");
                    try {
                        final int repetitions = Integer.parseInt(value);
                        if (repetitions < 1) {
                            throw new IllegalArgumentException("--repetitions must be at least 1, got " + repetitions);
                        }
                        config.setRepetitions(repetitions);
                    } catch (final NumberFormatException e) {
                        throw new IllegalArgumentException("--repetitions expects a number, got '" + value + "'", e);
                    }
                }
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]
                        + ". Usage: [--no-charts] [--no-export] [--scenarios <file>] [--repetitions <n>]");
            }
        }
    }

    private static String requireValue(final String[] args, final int index, final String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException(flag + " expects a value");
        }
        return args[index];
    }

    public static void main(final String[] args) {
        try {
            // Configure logging first, before any other code that might log
            final boolean quietMode = "quiet".equalsIgnoreCase(System.getProperty("profile"));
            LoggingConfigurator.configure(quietMode);

            final ApplicationConfig config = ApplicationConfig.load();
            applyArguments(config, args);

            final ContactBenchApplication app = new ContactBenchApplication(config);
            Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "shutdown-hook"));
            try {
                app.init();
                app.run();
            } finally {
                app.shutdown();
            }

            logger.info("Contact query bench finished.");

        } catch (final Exception e) {
            // In quiet mode the console has no appender, so report to stderr
            System.err.println("Failed to run contact query bench: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
