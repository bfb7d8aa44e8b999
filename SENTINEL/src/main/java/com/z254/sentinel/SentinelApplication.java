package com.z254.sentinel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * SENTINEL - Anomaly Detection and Early-Warning Engine.
 *
 * <p>SENTINEL provides:
 * <ul>
 *   <li>Retrospective anomaly detection - statistical outliers, seasonal deviations, trend changes</li>
 *   <li>Early warnings - projected threshold, trend, capacity and cost breaches</li>
 *   <li>Detection rule registry - rule metadata with trigger and false-positive statistics</li>
 * </ul>
 *
 * <p>SENTINEL consumes time-series samples from the metric aggregation service and exposes
 * its findings through the REST API under {@code /api/v1}.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class SentinelApplication {

    public static void main(String[] args) {
        SpringApplication.run(SentinelApplication.class, args);
    }
}
