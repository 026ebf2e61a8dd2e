package de.mirkosertic.contactbench.benchmark;

import java.time.Duration;

/**
 * Harness tuning.
 *
 * @param repetitionOverride  if positive, replaces every scenario's own repetition count
 * @param runDeadline         deadline of each run's cancellation token
 * @param randomSeed          seed of the generator resolving {@link PageVariant#RANDOM}
 * @param defaultRandomPages  random pages added to scenarios that list variants without a count
 */
public record HarnessSettings(int repetitionOverride, Duration runDeadline, long randomSeed, int defaultRandomPages) {

    public static final HarnessSettings DEFAULTS = new HarnessSettings(0, Duration.ofSeconds(60), 42L, 10);

    public HarnessSettings {
        if (runDeadline.isNegative() || runDeadline.isZero()) {
            throw new IllegalArgumentException("runDeadline must be positive");
        }
    }

    public HarnessSettings withRepetitionOverride(final int repetitions) {
        return new HarnessSettings(repetitions, runDeadline, randomSeed, defaultRandomPages);
    }
}
