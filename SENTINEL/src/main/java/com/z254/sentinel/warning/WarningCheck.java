package com.z254.sentinel.warning;

import com.z254.sentinel.domain.model.EarlyWarning;
import com.z254.sentinel.domain.model.MetricSample;

import java.util.List;
import java.util.Optional;

/**
 * One kind of early-warning check, evaluated per metric on its recent samples.
 */
public interface WarningCheck {

    EarlyWarning.WarningType type();

    /**
     * Metrics this check inspects on every pass.
     */
    List<String> metrics();

    /**
     * Evaluate the check against the recent samples of one metric, oldest first and never empty.
     *
     * @return the warning to raise, or empty when the check does not trigger
     */
    Optional<EarlyWarning> evaluate(String metric, List<MetricSample> samples);
}
