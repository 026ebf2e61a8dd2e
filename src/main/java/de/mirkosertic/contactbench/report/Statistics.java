package de.mirkosertic.contactbench.report;

import java.util.Arrays;

/**
 * Descriptive statistics over unsorted samples. All methods require at least one value.
 */
final class Statistics {

    private Statistics() {
    }

    static double mean(final double[] values) {
        requireValues(values);
        double sum = 0;
        for (final double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    static double median(final double[] values) {
        final double[] sorted = sorted(values);
        final int middle = sorted.length / 2;
        if (sorted.length % 2 == 0) {
            return (sorted[middle - 1] + sorted[middle]) / 2.0;
        }
        return sorted[middle];
    }

    /**
     * Nearest-rank percentile: the smallest value with at least {@code percentile} percent of the
     * samples at or below it.
     */
    static double percentile(final double[] values, final int percentile) {
        final double[] sorted = sorted(values);
        final int index = (int) Math.ceil(percentile / 100.0 * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(index, sorted.length - 1))];
    }

    static double min(final double[] values) {
        return sorted(values)[0];
    }

    static double max(final double[] values) {
        final double[] sorted = sorted(values);
        return sorted[sorted.length - 1];
    }

    private static double[] sorted(final double[] values) {
        requireValues(values);
        final double[] copy = Arrays.copyOf(values, values.length);
        Arrays.sort(copy);
        return copy;
    }

    private static void requireValues(final double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("At least one value is required");
        }
    }
}
