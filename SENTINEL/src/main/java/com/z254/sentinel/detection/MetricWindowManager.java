package com.z254.sentinel.detection;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.sentinel.client.MetricGateway;
import com.z254.sentinel.client.MetricGatewayException;
import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.MetricSample;
import com.z254.sentinel.domain.model.TimeRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;

/**
 * Fetches the recent and baseline sample windows of a metric from the gateway.
 * <p>
 * Every gateway call is bounded by the configured timeout. Baseline windows are cached per
 * metric and hour, since the gateway aggregates samples hourly and a baseline shifted by a
 * few minutes covers the same buckets.
 */
@Slf4j
@Component
public class MetricWindowManager {

    private final MetricGateway metricGateway;
    private final SentinelProperties sentinelProperties;
    private final Cache<String, List<MetricSample>> baselineCache;

    public MetricWindowManager(MetricGateway metricGateway, SentinelProperties sentinelProperties) {
        this.metricGateway = metricGateway;
        this.sentinelProperties = sentinelProperties;

        SentinelProperties.BaselineCache cacheConfig = sentinelProperties.getBaselineCache();
        this.baselineCache = Caffeine.newBuilder()
                .maximumSize(cacheConfig.getMaxEntries())
                .expireAfterWrite(cacheConfig.getTtl())
                .build();
    }

    /**
     * Load both windows for a detection pass.
     * <p>
     * The baseline is only fetched when the recent window already holds the minimum number of
     * samples; otherwise it is returned empty.
     *
     * @throws MetricGatewayException if a gateway call fails or times out
     */
    public MetricWindows loadWindows(String metric, TimeRange recentRange) {
        TimeRange baselineRange = recentRange.preceding();
        List<MetricSample> recent = fetchSamples(metric, recentRange);

        if (recent.size() < sentinelProperties.getDetection().getMinRecentSamples()) {
            return new MetricWindows(metric, recentRange, baselineRange, recent, List.of());
        }

        List<MetricSample> baseline = fetchBaseline(metric, baselineRange);
        return new MetricWindows(metric, recentRange, baselineRange, recent, baseline);
    }

    /**
     * Fetch samples of a metric, ordered by timestamp.
     *
     * @throws MetricGatewayException if the gateway call fails or times out
     */
    public List<MetricSample> fetchSamples(String metric, TimeRange range) {
        Duration timeout = sentinelProperties.getGateway().getTimeout();

        List<MetricSample> samples = Flux.defer(() -> metricGateway.getRecentSamples(metric, range))
                .timeout(timeout)
                .onErrorMap(error -> !(error instanceof MetricGatewayException),
                        error -> new MetricGatewayException(metric,
                                "Failed to fetch samples for " + metric + " in " + range, error))
                .collectList()
                .block();

        if (samples == null) {
            return List.of();
        }
        return samples.stream()
                .sorted(Comparator.comparing(MetricSample::timestamp))
                .toList();
    }

    /**
     * Drop cached baselines, e.g. after the gateway data was corrected.
     */
    public void invalidateBaselines() {
        baselineCache.invalidateAll();
    }

    long cachedBaselineCount() {
        return baselineCache.estimatedSize();
    }

    private List<MetricSample> fetchBaseline(String metric, TimeRange baselineRange) {
        if (!sentinelProperties.getBaselineCache().isEnabled()) {
            return fetchSamples(metric, baselineRange);
        }

        String key = baselineKey(metric, baselineRange);
        List<MetricSample> cached = baselineCache.getIfPresent(key);
        if (cached != null) {
            log.debug("Baseline cache hit: metric={}, key={}", metric, key);
            return cached;
        }

        List<MetricSample> baseline = fetchSamples(metric, baselineRange);
        baselineCache.put(key, baseline);
        return baseline;
    }

    private String baselineKey(String metric, TimeRange range) {
        return metric + ":" + range.start().truncatedTo(ChronoUnit.HOURS)
                + ":" + range.end().truncatedTo(ChronoUnit.HOURS);
    }
}
