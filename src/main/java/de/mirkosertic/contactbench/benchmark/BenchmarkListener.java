package de.mirkosertic.contactbench.benchmark;

import java.util.List;

/**
 * Receives harness progress. Called on the harness thread.
 */
public interface BenchmarkListener {

    default void scenarioStarted(final BenchmarkScenario scenario, final int plannedRuns) {
    }

    void runCompleted(BenchmarkResult result);

    default void scenarioFinished(final BenchmarkScenario scenario) {
    }

    static BenchmarkListener compose(final BenchmarkListener... listeners) {
        final List<BenchmarkListener> all = List.of(listeners);
        return new BenchmarkListener() {
            @Override
            public void scenarioStarted(final BenchmarkScenario scenario, final int plannedRuns) {
                all.forEach(listener -> listener.scenarioStarted(scenario, plannedRuns));
            }

            @Override
            public void runCompleted(final BenchmarkResult result) {
                all.forEach(listener -> listener.runCompleted(result));
            }

            @Override
            public void scenarioFinished(final BenchmarkScenario scenario) {
                all.forEach(listener -> listener.scenarioFinished(scenario));
            }
        };
    }
}
