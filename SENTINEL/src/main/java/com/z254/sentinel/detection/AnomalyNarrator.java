package com.z254.sentinel.detection;

import com.z254.sentinel.domain.model.AnomalyDetection.AnomalyType;
import com.z254.sentinel.domain.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes the human-readable description and recommendations of an anomaly.
 */
@Component
public class AnomalyNarrator {

    public String describe(String metric, AnomalyType type, double expected, double actual) {
        return switch (type) {
            case SPIKE -> String.format("%s experienced a %d%% increase above normal levels",
                    metric, percentChange(expected, actual));
            case DROP -> String.format("%s dropped %d%% below normal levels",
                    metric, percentChange(expected, actual));
            case TREND_CHANGE -> metric + " shows an unexpected trend change";
            case SEASONAL_DEVIATION -> metric + " deviated from expected seasonal pattern";
            default -> metric + " deviated significantly from expected pattern";
        };
    }

    public List<String> recommend(AnomalyType type, Severity severity) {
        List<String> recommendations = new ArrayList<>();

        if (severity.isAtLeast(Severity.HIGH)) {
            recommendations.add("Investigate immediately and implement corrective measures");
        }

        switch (type) {
            case SPIKE -> {
                recommendations.add("Check for increased demand or system issues");
                recommendations.add("Consider scaling resources if trend continues");
            }
            case DROP -> {
                recommendations.add("Verify system health and user activity");
                recommendations.add("Check for potential service disruptions");
            }
            case TREND_CHANGE -> {
                recommendations.add("Analyze underlying causes of trend change");
                recommendations.add("Update forecasting models if needed");
            }
            case SEASONAL_DEVIATION -> recommendations.add("Review seasonal patterns and update baselines");
            default -> {
                // no type-specific advice
            }
        }
        return recommendations;
    }

    private long percentChange(double expected, double actual) {
        if (expected == 0.0) {
            return 0;
        }
        return Math.round(Math.abs(actual - expected) / Math.abs(expected) * 100);
    }
}
