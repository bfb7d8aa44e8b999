package com.z254.sentinel.client;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.MetricSample;
import com.z254.sentinel.domain.model.TimeRange;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.netty.channel.ChannelOption;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.netty.http.client.HttpClient;

import java.time.Instant;
import java.util.Objects;

/**
 * Metric gateway backed by the metric aggregation service REST API.
 */
@Slf4j
@Component
public class HttpMetricGateway implements MetricGateway {

    private final WebClient webClient;
    private final SentinelProperties sentinelProperties;

    public HttpMetricGateway(WebClient.Builder webClientBuilder,
                             SentinelProperties sentinelProperties) {
        this.sentinelProperties = sentinelProperties;
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) sentinelProperties.getGateway().getConnectTimeout().toMillis());
        this.webClient = webClientBuilder
                .baseUrl(sentinelProperties.getGateway().getUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Override
    @CircuitBreaker(name = "metric-gateway", fallbackMethod = "getRecentSamplesFallback")
    @Retry(name = "metric-gateway")
    public Flux<MetricSample> getRecentSamples(String metric, TimeRange range) {
        SentinelProperties.Gateway gateway = sentinelProperties.getGateway();

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/metrics/{metric}/samples")
                        .queryParam("start", range.start().toString())
                        .queryParam("end", range.end().toString())
                        .queryParam("granularity", gateway.getGranularity())
                        .queryParam("aggregation", gateway.getAggregation())
                        .build(metric))
                .retrieve()
                .bodyToFlux(SampleResponse.class)
                .filter(response -> response.getTimestamp() != null && response.getValue() != null)
                .map(response -> new MetricSample(response.getTimestamp(), response.getValue()))
                .doOnError(error -> log.warn("Metric gateway call failed: metric={}, error={}",
                        metric, error.getMessage()));
    }

    /**
     * Fallback when the circuit is open or the call failed.
     */
    public Flux<MetricSample> getRecentSamplesFallback(String metric, TimeRange range, Throwable throwable) {
        if (throwable instanceof MetricGatewayException) {
            return Flux.error(throwable);
        }
        String reason = Objects.toString(throwable.getMessage(), throwable.getClass().getSimpleName());
        return Flux.error(new MetricGatewayException(metric,
                "Metric gateway unavailable for " + metric + ": " + reason, throwable));
    }

    /**
     * Wire format of one sample.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SampleResponse {
        private Instant timestamp;
        private Double value;
    }
}
