package de.mirkosertic.contactbench.config;

import de.mirkosertic.contactbench.benchmark.HarnessSettings;
import de.mirkosertic.contactbench.execution.ExecutionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Settings of the contact query bench, read once at startup.
 * <p>
 * Later sources override earlier ones: application.yaml on the classpath, the user file
 * ~/.contactbench/config.yaml, then the {@code CONTACTBENCH_*} environment variables and the
 * {@code contactbench.index.path} system property. String values may reference
 * {@code ${VAR:default}}.
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_INDEX_PATH = "CONTACTBENCH_INDEX_PATH";
    private static final String ENV_OUTPUT_DIR = "CONTACTBENCH_OUTPUT_DIR";
    private static final String PROP_INDEX_PATH = "contactbench.index.path";
    private static final String PROP_PROFILE = "profile";

    private static final Pattern VARIABLE = Pattern.compile("\\$\\{([^:}]+)(?::([^}]*))?}");
    private static final String CONFIG_DIR = ".contactbench";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Store settings
    private String indexPath;

    // Query settings
    private int defaultPageSize = 50;
    private int maxPageSize = 1000;
    private long statementTimeoutMs = 30000;
    private long pollIntervalMs = 25;
    private boolean propagateStatementTimeout = true;
    private int workerThreads = 4;

    // Benchmark settings
    private int repetitions = 0;
    private long runDeadlineMs = 60000;
    private long randomSeed = 42;
    private int randomPages = 10;
    private String outputDirectory = "benchmark_results";
    private boolean exportEnabled = true;
    private boolean chartsEnabled = true;
    private String scenariosFile;

    // Profile settings
    private boolean quietMode = false;

    ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        return load(getUserConfigPath());
    }

    /**
     * Load configuration using {@code userConfigPath} in place of the file in the user's home.
     */
    public static ApplicationConfig load(final Path userConfigPath) {
        final ApplicationConfig config = new ApplicationConfig();

        try (InputStream defaults = ApplicationConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (defaults != null) {
                config.applyYaml(defaults, "classpath:" + DEFAULT_CONFIG_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to read {} from classpath", DEFAULT_CONFIG_FILE, e);
        }

        if (Files.isRegularFile(userConfigPath)) {
            try (InputStream user = Files.newInputStream(userConfigPath)) {
                config.applyYaml(user, userConfigPath.toString());
            } catch (final IOException e) {
                logger.warn("Failed to read user config {}", userConfigPath, e);
            }
        }

        // Environment and system properties win over both files
        config.applyEnvironmentOverrides();
        config.quietMode = "quiet".equalsIgnoreCase(System.getProperty(PROP_PROFILE, "default"));

        logger.info("Configuration loaded: indexPath={}, statementTimeoutMs={}, outputDirectory={}, quietMode={}",
                config.indexPath, config.statementTimeoutMs, config.outputDirectory, config.quietMode);

        return config;
    }

    private void applyYaml(final InputStream input, final String source) {
        final Object document = new Yaml().load(input);
        if (document instanceof Map<?, ?> map) {
            @SuppressWarnings("unchecked")
            final Map<String, Object> config = (Map<String, Object>) map;
            applyYamlConfig(config);
            logger.debug("Applied configuration from {}", source);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("contactbench");
        if (root == null) {
            return;
        }

        final Map<String, Object> storeConfig = (Map<String, Object>) root.get("store");
        if (storeConfig != null) {
            final Object path = storeConfig.get("index-path");
            if (path != null) {
                this.indexPath = resolveVariables(path.toString());
            }
        }

        final Map<String, Object> queryConfig = (Map<String, Object>) root.get("query");
        if (queryConfig != null) {
            applyQueryConfig(queryConfig);
        }

        final Map<String, Object> benchmarkConfig = (Map<String, Object>) root.get("benchmark");
        if (benchmarkConfig != null) {
            applyBenchmarkConfig(benchmarkConfig);
        }
    }

    private void applyQueryConfig(final Map<String, Object> queryConfig) {
        if (queryConfig.containsKey("default-page-size")) {
            this.defaultPageSize = ((Number) queryConfig.get("default-page-size")).intValue();
        }
        if (queryConfig.containsKey("max-page-size")) {
            this.maxPageSize = ((Number) queryConfig.get("max-page-size")).intValue();
        }
        if (queryConfig.containsKey("statement-timeout-ms")) {
            this.statementTimeoutMs = ((Number) queryConfig.get("statement-timeout-ms")).longValue();
        }
        if (queryConfig.containsKey("poll-interval-ms")) {
            this.pollIntervalMs = ((Number) queryConfig.get("poll-interval-ms")).longValue();
        }
        if (queryConfig.containsKey("propagate-statement-timeout")) {
            this.propagateStatementTimeout = (Boolean) queryConfig.get("propagate-statement-timeout");
        }
        if (queryConfig.containsKey("worker-threads")) {
            this.workerThreads = ((Number) queryConfig.get("worker-threads")).intValue();
        }
    }

    private void applyBenchmarkConfig(final Map<String, Object> benchmarkConfig) {
        if (benchmarkConfig.containsKey("repetitions")) {
            this.repetitions = ((Number) benchmarkConfig.get("repetitions")).intValue();
        }
        if (benchmarkConfig.containsKey("run-deadline-ms")) {
            this.runDeadlineMs = ((Number) benchmarkConfig.get("run-deadline-ms")).longValue();
        }
        if (benchmarkConfig.containsKey("random-seed")) {
            this.randomSeed = ((Number) benchmarkConfig.get("random-seed")).longValue();
        }
        if (benchmarkConfig.containsKey("random-pages")) {
            this.randomPages = ((Number) benchmarkConfig.get("random-pages")).intValue();
        }
        if (benchmarkConfig.containsKey("output-directory")) {
            this.outputDirectory = resolveVariables(benchmarkConfig.get("output-directory").toString());
        }
        if (benchmarkConfig.containsKey("export-enabled")) {
            this.exportEnabled = (Boolean) benchmarkConfig.get("export-enabled");
        }
        if (benchmarkConfig.containsKey("charts-enabled")) {
            this.chartsEnabled = (Boolean) benchmarkConfig.get("charts-enabled");
        }
        final Object scenarios = benchmarkConfig.get("scenarios-file");
        if (scenarios != null && !scenarios.toString().isBlank()) {
            this.scenariosFile = resolveVariables(scenarios.toString());
        }
    }

    private void applyEnvironmentOverrides() {
        indexPath = firstNonBlank(System.getProperty(PROP_INDEX_PATH), System.getenv(ENV_INDEX_PATH), indexPath,
                getConfigDirectory().resolve("index").toString());
        outputDirectory = firstNonBlank(System.getenv(ENV_OUTPUT_DIR), outputDirectory, "benchmark_results");
    }

    private static String firstNonBlank(final String... candidates) {
        for (final String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate.trim();
            }
        }
        return null;
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }
        final Matcher matcher = VARIABLE.matcher(value);
        final StringBuilder resolved = new StringBuilder();
        while (matcher.find()) {
            final String name = matcher.group(1);
            final String fallback = matcher.group(2) != null ? matcher.group(2) : "";
            final String fromEnvironment = System.getenv(name);
            final String replacement = fromEnvironment != null && !fromEnvironment.isEmpty()
                    ? fromEnvironment
                    : System.getProperty(name, fallback);
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(resolveVariables(replacement)));
        }
        matcher.appendTail(resolved);
        return resolved.toString();
    }

    public static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    /**
     * Executor settings derived from the query section.
     */
    public ExecutionSettings executionSettings() {
        return new ExecutionSettings(Duration.ofMillis(statementTimeoutMs), Duration.ofMillis(pollIntervalMs),
                propagateStatementTimeout, workerThreads);
    }

    /**
     * Harness settings derived from the benchmark section.
     */
    public HarnessSettings harnessSettings() {
        return new HarnessSettings(repetitions, Duration.ofMillis(runDeadlineMs), randomSeed, randomPages);
    }

    // Getters
    public String getIndexPath() {
        return indexPath;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public long getStatementTimeoutMs() {
        return statementTimeoutMs;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public boolean isPropagateStatementTimeout() {
        return propagateStatementTimeout;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public int getRepetitions() {
        return repetitions;
    }

    public void setRepetitions(final int repetitions) {
        this.repetitions = repetitions;
    }

    public long getRunDeadlineMs() {
        return runDeadlineMs;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public int getRandomPages() {
        return randomPages;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    public boolean isExportEnabled() {
        return exportEnabled;
    }

    public void setExportEnabled(final boolean exportEnabled) {
        this.exportEnabled = exportEnabled;
    }

    public boolean isChartsEnabled() {
        return chartsEnabled;
    }

    public void setChartsEnabled(final boolean chartsEnabled) {
        this.chartsEnabled = chartsEnabled;
    }

    public String getScenariosFile() {
        return scenariosFile;
    }

    public void setScenariosFile(final String scenariosFile) {
        this.scenariosFile = scenariosFile;
    }

    public boolean isQuietMode() {
        return quietMode;
    }
}
