package com.z254.sentinel.detection;

import com.z254.sentinel.domain.model.MetricSample;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Descriptive statistics over ordered metric samples.
 */
public final class SeriesStatistics {

    private SeriesStatistics() {
    }

    public static double mean(List<MetricSample> samples) {
        return samples.stream()
                .mapToDouble(MetricSample::value)
                .average()
                .orElse(0.0);
    }

    /**
     * Population standard deviation.
     */
    public static double standardDeviation(List<MetricSample> samples) {
        if (samples.isEmpty()) {
            return 0.0;
        }
        double mean = mean(samples);
        double variance = samples.stream()
                .mapToDouble(s -> Math.pow(s.value() - mean, 2))
                .sum() / samples.size();
        return Math.sqrt(variance);
    }

    /**
     * Relative change per sample: {@code (last - first) / (first * n)}.
     * <p>
     * Fewer than two samples yield 0. A zero first value yields an empty result since the
     * relative change is undefined.
     */
    public static OptionalDouble trend(List<MetricSample> samples) {
        if (samples.size() < 2) {
            return OptionalDouble.of(0.0);
        }
        double first = samples.get(0).value();
        double last = samples.get(samples.size() - 1).value();
        if (first == 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((last - first) / (first * samples.size()));
    }

    /**
     * Per-bucket seasonal indices: the average of the samples at positions {@code i mod period},
     * divided by the overall mean. Empty buckets get an index of 1.
     *
     * @return the indices, or {@code null} when the series has no samples or a zero mean
     */
    public static double[] seasonalIndices(List<MetricSample> samples, int period) {
        if (samples.isEmpty()) {
            return null;
        }
        double overallMean = mean(samples);
        if (overallMean == 0.0) {
            return null;
        }

        double[] sums = new double[period];
        int[] counts = new int[period];
        for (int i = 0; i < samples.size(); i++) {
            int bucket = i % period;
            sums[bucket] += samples.get(i).value();
            counts[bucket]++;
        }

        double[] indices = new double[period];
        for (int bucket = 0; bucket < period; bucket++) {
            indices[bucket] = counts[bucket] > 0
                    ? (sums[bucket] / counts[bucket]) / overallMean
                    : 1.0;
        }
        return indices;
    }

    public static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
