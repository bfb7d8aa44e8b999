package com.z254.sentinel.client;

import com.z254.sentinel.domain.model.MetricSample;
import com.z254.sentinel.domain.model.TimeRange;
import reactor.core.publisher.Flux;

/**
 * Source of aggregated metric samples.
 * <p>
 * Implementations emit samples in ascending timestamp order at one sample per hour. An empty
 * flux means "no data"; an error signal is reserved for genuine I/O failures and is reported
 * as {@link MetricGatewayException}.
 */
public interface MetricGateway {

    /**
     * Fetch the samples of a metric within a time range.
     *
     * @param metric metric name
     * @param range  half-open query interval
     * @return ordered samples, possibly fewer than the range could hold
     */
    Flux<MetricSample> getRecentSamples(String metric, TimeRange range);
}
