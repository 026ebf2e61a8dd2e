package de.mirkosertic.contactbench.benchmark;

import de.mirkosertic.contactbench.execution.CancellableQueryExecutor;
import de.mirkosertic.contactbench.execution.CancellationToken;
import de.mirkosertic.contactbench.execution.ExecutionMetrics;
import de.mirkosertic.contactbench.execution.ExecutionOutcome;
import de.mirkosertic.contactbench.execution.ExecutionStatus;
import de.mirkosertic.contactbench.plan.QueryParameters;
import de.mirkosertic.contactbench.plan.QueryPlan;
import de.mirkosertic.contactbench.plan.QueryPlanBuilder;
import de.mirkosertic.contactbench.schema.InvalidQueryException;
import de.mirkosertic.contactbench.store.StoreResult;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Runs a scenario catalogue sequentially and in a deterministic order.
 * <p>
 * Every run builds a fresh plan from the scenario template and executes it under its own
 * cancellation token. Failed, cancelled or timed out runs are recorded and the catalogue
 * continues; nothing is retried.
 */
public class BenchmarkHarness {

    private static final Logger logger = LoggerFactory.getLogger(BenchmarkHarness.class);

    private final CancellableQueryExecutor executor;
    private final QueryPlanBuilder planBuilder;
    private final HarnessSettings settings;

    public BenchmarkHarness(final CancellableQueryExecutor executor, final QueryPlanBuilder planBuilder,
                            final HarnessSettings settings) {
        this.executor = executor;
        this.planBuilder = planBuilder;
        this.settings = settings;
    }

    public List<BenchmarkResult> run(final List<BenchmarkScenario> scenarios, final BenchmarkListener listener) {
        final Random random = new Random(settings.randomSeed());
        final List<BenchmarkResult> results = new ArrayList<>();
        final long start = System.currentTimeMillis();

        for (final BenchmarkScenario scenario : scenarios) {
            final int plannedRuns = scenario.plannedRuns(settings.repetitionOverride());
            logger.info("Running scenario '{}' ({} runs)", scenario.name(), plannedRuns);
            listener.scenarioStarted(scenario, plannedRuns);

            final Recorder recorder = new Recorder(results, listener);
            if (scenario.pageVariants().isEmpty()) {
                runPlain(scenario, recorder);
            } else {
                runVariants(scenario, random, recorder);
            }

            listener.scenarioFinished(scenario);
        }

        logger.info("Benchmark finished: {} scenarios, {} runs in {}ms", scenarios.size(), results.size(),
                System.currentTimeMillis() - start);
        return results;
    }

    /**
     * Collects the runs of one scenario and forwards each to the listener as it completes.
     */
    private static final class Recorder {

        private final List<BenchmarkResult> sink;
        private final BenchmarkListener listener;
        private int runs;

        Recorder(final List<BenchmarkResult> sink, final BenchmarkListener listener) {
            this.sink = sink;
            this.listener = listener;
        }

        int nextIndex() {
            return runs;
        }

        void add(final BenchmarkResult result) {
            runs++;
            sink.add(result);
            listener.runCompleted(result);
        }
    }

    private void runPlain(final BenchmarkScenario scenario, final Recorder recorder) {
        final int repetitions = scenario.effectiveRepetitions(settings.repetitionOverride());
        for (int repetition = 0; repetition < repetitions; repetition++) {
            recorder.add(runOnce(scenario, recorder.nextIndex(), null, null));
        }
    }

    private void runVariants(final BenchmarkScenario scenario, final Random random, final Recorder recorder) {
        final int repetitions = scenario.effectiveRepetitions(settings.repetitionOverride());
        final QueryPlan countPlan;
        try {
            countPlan = buildPlan(scenario, null);
        } catch (final InvalidQueryException e) {
            logger.warn("Scenario '{}' has an invalid template: {}", scenario.name(), e.getMessage());
            for (int repetition = 0; repetition < repetitions; repetition++) {
                for (final PageVariant variant : scenario.pageVariants()) {
                    recorder.add(invalid(scenario, recorder.nextIndex(), variant, e));
                }
            }
            return;
        }

        final ExecutionOutcome<Long> count;
        try (CancellationToken token = CancellationToken.withTimeout(settings.runDeadline())) {
            count = executor.count(countPlan, token);
        }

        if (!count.isSuccess() || count.value() == null) {
            final String error = "Page count failed: " + count.describe();
            logger.warn("Scenario '{}': {}", scenario.name(), error);
            for (int repetition = 0; repetition < repetitions; repetition++) {
                for (final PageVariant variant : scenario.pageVariants()) {
                    recorder.add(new BenchmarkResult(scenario.name(), recorder.nextIndex(), variant, 0, countPlan,
                            count.metrics(), Instant.now(), error));
                }
            }
            return;
        }

        final long lastPage = countPlan.pagination().pageCount(count.value());
        logger.debug("Scenario '{}': {} rows on {} pages", scenario.name(), count.value(), lastPage);
        for (int repetition = 0; repetition < repetitions; repetition++) {
            for (final PageVariant variant : scenario.pageVariants()) {
                recorder.add(runOnce(scenario, recorder.nextIndex(), variant, variant.resolve(lastPage, random)));
            }
        }
    }

    private BenchmarkResult runOnce(final BenchmarkScenario scenario, final int runIndex,
                                    final @Nullable PageVariant variant, final @Nullable Long page) {
        final QueryPlan plan;
        try {
            plan = buildPlan(scenario, page);
        } catch (final InvalidQueryException e) {
            logger.warn("Scenario '{}' run {} has an invalid plan: {}", scenario.name(), runIndex, e.getMessage());
            return invalid(scenario, runIndex, variant, e);
        }

        final ExecutionOutcome<StoreResult> outcome;
        try (CancellationToken token = CancellationToken.withTimeout(settings.runDeadline())) {
            outcome = executor.execute(plan, token);
        }

        final long fetchedPage = plan.pagination().isPaginated() ? plan.pagination().page() : 0;
        return new BenchmarkResult(scenario.name(), runIndex, variant, fetchedPage, plan, outcome.metrics(),
                Instant.now(), outcome.isSuccess() ? null : outcome.describe());
    }

    private QueryPlan buildPlan(final BenchmarkScenario scenario, final @Nullable Long page)
            throws InvalidQueryException {
        final Map<String, String> params = new LinkedHashMap<>(scenario.params());
        if (page != null) {
            params.put(QueryParameters.PAGE, Long.toString(page));
        }
        return scenario.paginated()
                ? planBuilder.build(scenario.entity(), params)
                : planBuilder.buildUnpaginated(scenario.entity(), params);
    }

    private static BenchmarkResult invalid(final BenchmarkScenario scenario, final int runIndex,
                                           final @Nullable PageVariant variant, final InvalidQueryException e) {
        return new BenchmarkResult(scenario.name(), runIndex, variant, 0, null,
                new ExecutionMetrics(0, 0, 0, ExecutionStatus.EXECUTION_FAILED), Instant.now(),
                "Invalid query: " + e.getMessage());
    }
}
