package com.z254.sentinel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for SENTINEL service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Anomaly detection windows, thresholds and retention</li>
 *     <li>Early-warning checks, horizons and budgets</li>
 *     <li>Metric gateway client settings</li>
 *     <li>Baseline caching and rule seeding</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "sentinel")
public class SentinelProperties {

    private final Detection detection = new Detection();
    private final Warning warning = new Warning();
    private final Gateway gateway = new Gateway();
    private final BaselineCache baselineCache = new BaselineCache();
    private final Rules rules = new Rules();
    private final Scheduler scheduler = new Scheduler();

    /**
     * Anomaly detection configuration.
     */
    @Data
    public static class Detection {
        /** Metrics inspected by the detection loop */
        private List<String> metrics = new ArrayList<>(List.of(
                "document_generation", "ai_usage", "user_activity", "system_performance", "cost_analysis"));

        /** Detection loop interval */
        private Duration interval = Duration.ofMinutes(15);

        /** Delay before the first detection pass */
        private Duration initialDelay = Duration.ofMinutes(1);

        /** Recent window used when no time range is given */
        private Duration defaultLookback = Duration.ofDays(7);

        @Positive
        private int minRecentSamples = 10;

        @Positive
        private int minBaselineSamples = 20;

        /** Number of baseline standard deviations that makes a sample an outlier */
        private double sigmaThreshold = 3.0;

        private double spikeMultiplier = 2.0;
        private double dropMultiplier = 0.5;

        /** Points used for the local trend around an outlier */
        @Positive
        private int localTrendPoints = 3;

        private double localTrendThreshold = 0.1;

        /** Samples each window needs before the overall trends are compared */
        @Positive
        private int minTrendSamples = 10;

        private double trendChangeThreshold = 0.1;
        private double highTrendChangeThreshold = 0.2;

        /** Buckets per seasonal cycle (24 = hour of day) */
        @Positive
        private int seasonalPeriod = 24;

        private double seasonalDeviationThreshold = 0.5;

        /** Maximum anomalies retained */
        @Positive
        private int retentionCapacity = 1000;

        /** Width of the time bucket in the deduplication key */
        private Duration dedupBucket = Duration.ofHours(1);
    }

    /**
     * Early-warning configuration.
     */
    @Data
    public static class Warning {
        /** Warning loop interval */
        private Duration interval = Duration.ofMinutes(5);

        /** Delay before the first warning pass */
        private Duration initialDelay = Duration.ofSeconds(30);

        /** Recent window used when no time range is given */
        private Duration defaultLookback = Duration.ofDays(1);

        @Positive
        private int retentionCapacity = 500;

        private final Threshold threshold = new Threshold();
        private final Trend trend = new Trend();
        private final Capacity capacity = new Capacity();
        private final Cost cost = new Cost();

        @Data
        public static class Threshold {
            private List<String> metrics = new ArrayList<>(List.of(
                    "compute", "storage", "bandwidth", "ai_tokens", "api_calls"));
            private Map<String, Double> limits = new HashMap<>(Map.of(
                    "compute", 0.8,
                    "storage", 0.9,
                    "bandwidth", 0.7,
                    "ai_tokens", 0.85,
                    "api_calls", 0.75));
            private double defaultLimit = 0.8;
            /** Fraction of the limit at which a metric is considered near it */
            private double proximityRatio = 0.9;
            private long horizonMinutes = 60;
            /** Warn only when the breach is projected within this many minutes */
            private double breachWindowMinutes = 120;
            private double criticalBreachMinutes = 30;
            private double confidence = 0.85;
        }

        @Data
        public static class Trend {
            private List<String> metrics = new ArrayList<>(List.of(
                    "document_generation", "ai_usage", "user_activity", "cost_analysis"));
            @Positive
            private int minSamples = 10;
            private double growthThreshold = 0.2;
            private double criticalGrowth = 0.5;
            private long horizonMinutes = 1440;
            /** Projection target as a multiple of the current value */
            private double targetMultiplier = 2.0;
            private double confidence = 0.75;
        }

        @Data
        public static class Capacity {
            private List<String> metrics = new ArrayList<>(List.of("compute", "storage", "bandwidth"));
            private double utilizationThreshold = 0.8;
            private double criticalUtilization = 0.9;
            private double limit = 1.0;
            private long horizonMinutes = 60;
            private double confidence = 0.8;
        }

        @Data
        public static class Cost {
            @NotBlank
            private String metric = "cost_analysis";
            @Positive
            private double dailyBudget = 1000;
            private double warnRatio = 0.8;
            private double criticalRatio = 0.9;
            private long horizonMinutes = 1440;
            private double confidence = 0.85;
        }
    }

    /**
     * Metric gateway client configuration.
     */
    @Data
    public static class Gateway {
        @NotBlank
        private String url = "http://localhost:8090";

        /** Upper bound on a single gateway call */
        private Duration timeout = Duration.ofSeconds(10);

        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotBlank
        private String granularity = "hour";

        @NotBlank
        private String aggregation = "average";
    }

    /**
     * Baseline window cache configuration.
     */
    @Data
    public static class BaselineCache {
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(1);
        @Positive
        private int maxEntries = 500;
    }

    /**
     * Detection rule registry configuration.
     */
    @Data
    public static class Rules {
        /** Seed the built-in rules at startup */
        private boolean seedDefaults = true;
    }

    /**
     * Background loop configuration.
     */
    @Data
    public static class Scheduler {
        private boolean enabled = true;
    }
}
