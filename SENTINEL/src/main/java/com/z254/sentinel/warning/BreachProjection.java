package com.z254.sentinel.warning;

import com.z254.sentinel.detection.SeriesStatistics;
import com.z254.sentinel.domain.model.MetricSample;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Linear projection of a metric and the estimated time until it crosses a threshold.
 */
public final class BreachProjection {

    private BreachProjection() {
    }

    /**
     * Project the last sample {@code horizonMinutes} ahead along the series trend:
     * {@code current * (1 + trend * horizonMinutes / 60)}.
     *
     * @return the projected value, or empty when the trend is undefined
     */
    public static OptionalDouble projectValue(List<MetricSample> samples, long horizonMinutes) {
        if (samples.isEmpty()) {
            return OptionalDouble.empty();
        }
        OptionalDouble trend = SeriesStatistics.trend(samples);
        if (trend.isEmpty()) {
            return OptionalDouble.empty();
        }
        double current = samples.get(samples.size() - 1).value();
        return OptionalDouble.of(current * (1 + trend.getAsDouble() * (horizonMinutes / 60.0)));
    }

    /**
     * Minutes until {@code threshold} is reached when moving linearly from {@code current} to
     * {@code projected} over {@code horizonMinutes}.
     *
     * @return positive infinity when the projection does not grow, 0 when already at or above
     *         the threshold
     */
    public static double timeToBreach(double current, double projected, double threshold, long horizonMinutes) {
        if (projected <= current || horizonMinutes <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        if (current >= threshold) {
            return 0.0;
        }
        double ratePerMinute = (projected - current) / horizonMinutes;
        return (threshold - current) / ratePerMinute;
    }
}
