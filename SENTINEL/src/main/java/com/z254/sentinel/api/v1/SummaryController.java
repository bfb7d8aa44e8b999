package com.z254.sentinel.api.v1;

import com.z254.sentinel.domain.service.AnomalyDetectionService;
import com.z254.sentinel.domain.service.AnomalyDetectionService.EngineSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/summary")
@Tag(name = "Summary", description = "Overview of active anomalies and warnings")
public class SummaryController {

    private final AnomalyDetectionService detectionService;

    public SummaryController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @GetMapping
    @Operation(summary = "Get summary",
            description = "Active counts by severity and the ten most recent active anomalies and warnings")
    public Mono<EngineSummary> getSummary() {
        return Mono.fromCallable(detectionService::getSummary);
    }
}
