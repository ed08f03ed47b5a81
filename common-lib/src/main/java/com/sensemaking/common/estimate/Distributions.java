package com.sensemaking.common.estimate;

import java.util.Arrays;
import java.util.Collection;

/**
 * Descriptive statistics over small samples of doubles.
 *
 * <p>Pure static utility with no state and no logging.
 */
public final class Distributions {

    private Distributions() {}

    /** Arithmetic mean; 0.0 for an empty sample. */
    public static double mean(Collection<Double> values) {
        if (values == null || values.isEmpty()) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.size();
    }

    /**
     * Sample standard deviation with an (n − 1) denominator.
     * Returns 0.0 for fewer than two values.
     */
    public static double sampleStandardDeviation(Collection<Double> values) {
        if (values == null || values.size() <= 1) return 0.0;
        double mean = mean(values);
        double squared = 0.0;
        for (double v : values) {
            squared += (v - mean) * (v - mean);
        }
        return Math.sqrt(squared / (values.size() - 1));
    }

    /**
     * Linear-interpolated percentile over index {@code q · (n − 1)} of the sorted sample.
     *
     * @param values   sample, need not be sorted
     * @param quantile in [0, 1], e.g. 0.75 for the 75th percentile
     * @return the percentile, or {@code NaN} for an empty sample
     */
    public static double percentile(Collection<Double> values, double quantile) {
        if (quantile < 0.0 || quantile > 1.0) {
            throw new IllegalArgumentException("Quantile must be in [0, 1]: " + quantile);
        }
        if (values == null || values.isEmpty()) return Double.NaN;

        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);

        double position = quantile * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        if (lower == upper) return sorted[lower];
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    /** max − min of the sample; 0.0 when empty. */
    public static double spread(Collection<Double> values) {
        if (values == null || values.isEmpty()) return 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return max - min;
    }
}
