package com.z254.sentinel.client;

/**
 * Failure or timeout while fetching samples from the metric gateway.
 */
public class MetricGatewayException extends RuntimeException {

    private final String metric;

    public MetricGatewayException(String metric, String message) {
        super(message);
        this.metric = metric;
    }

    public MetricGatewayException(String metric, String message, Throwable cause) {
        super(message, cause);
        this.metric = metric;
    }

    public String getMetric() {
        return metric;
    }
}
