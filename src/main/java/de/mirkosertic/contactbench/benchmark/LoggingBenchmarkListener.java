package de.mirkosertic.contactbench.benchmark;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs each completed run.
 */
public class LoggingBenchmarkListener implements BenchmarkListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingBenchmarkListener.class);

    @Override
    public void runCompleted(final BenchmarkResult result) {
        if (result.isSuccess()) {
            logger.info("{} #{}{}: {} ms, {} queries, {} results", result.scenario(), result.runIndex(),
                    result.page() > 0 ? " page " + result.page() : "",
                    String.format("%.2f", result.metrics().durationMs()),
                    result.metrics().statementCount(), result.metrics().resultCount());
        } else {
            logger.warn("{} #{}{}: {} after {} ms: {}", result.scenario(), result.runIndex(),
                    result.page() > 0 ? " page " + result.page() : "", result.status(),
                    String.format("%.2f", result.metrics().durationMs()), result.error());
        }
    }
}
