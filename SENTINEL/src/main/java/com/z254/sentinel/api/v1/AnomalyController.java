package com.z254.sentinel.api.v1;

import com.z254.sentinel.api.dto.AcknowledgeRequest;
import com.z254.sentinel.api.dto.AnomalyListResponse;
import com.z254.sentinel.api.dto.DetectAnomaliesRequest;
import com.z254.sentinel.api.dto.ResolveRequest;
import com.z254.sentinel.domain.model.AnomalyDetection;
import com.z254.sentinel.domain.model.TimeRange;
import com.z254.sentinel.domain.service.AnomalyDetectionService;
import com.z254.sentinel.domain.service.AnomalyDetectionService.AnomalyFilter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Locale;

/**
 * REST API controller for anomalies.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Anomaly detection and lifecycle")
public class AnomalyController {

    static final int MAX_LIMIT = 1000;

    private final AnomalyDetectionService detectionService;

    public AnomalyController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @GetMapping
    @Operation(summary = "List anomalies",
            description = "List active anomalies, newest first; a status filter also returns closed ones")
    public Mono<ResponseEntity<AnomalyListResponse>> listAnomalies(
            @Parameter(description = "Filter by metric")
            @RequestParam(required = false) String metric,
            @Parameter(description = "Filter by status (new, investigating, resolved, false_positive)")
            @RequestParam(required = false) String status,
            @Parameter(description = "Maximum number of anomalies")
            @RequestParam(defaultValue = "50") int limit) {

        return Mono.fromCallable(() -> {
            AnomalyDetection.AnomalyStatus statusFilter = status != null
                    ? AnomalyDetection.AnomalyStatus.valueOf(status.toUpperCase(Locale.ROOT))
                    : null;
            List<AnomalyDetection> anomalies = detectionService.findAnomalies(
                    new AnomalyFilter(metric, statusFilter, statusFilter == null, clampLimit(limit)));

            return ResponseEntity.ok(AnomalyListResponse.builder()
                    .anomalies(anomalies)
                    .total(anomalies.size())
                    .build());
        });
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get anomaly", description = "Get anomaly details by ID")
    public Mono<ResponseEntity<AnomalyDetection>> getAnomaly(
            @Parameter(description = "Anomaly ID") @PathVariable String id) {

        return Mono.justOrEmpty(detectionService.getAnomaly(id))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/detect")
    @Operation(summary = "Detect anomalies", description = "Run a detection pass for one metric")
    public Mono<ResponseEntity<AnomalyListResponse>> detectAnomalies(
            @Valid @RequestBody DetectAnomaliesRequest request) {

        TimeRange range = request.toTimeRange();
        log.info("Detection requested: metric={}, range={}", request.getMetric(), range);

        return Mono.fromCallable(() -> detectionService.detectAnomalies(request.getMetric(), range))
                .subscribeOn(Schedulers.boundedElastic())
                .map(anomalies -> ResponseEntity.ok(AnomalyListResponse.builder()
                        .anomalies(anomalies)
                        .total(anomalies.size())
                        .build()));
    }

    @PostMapping("/{id}/acknowledge")
    @Operation(summary = "Acknowledge anomaly", description = "Start investigating an anomaly")
    public Mono<ResponseEntity<AnomalyDetection>> acknowledgeAnomaly(
            @Parameter(description = "Anomaly ID") @PathVariable String id,
            @Valid @RequestBody AcknowledgeRequest request) {

        return Mono.fromCallable(() -> detectionService.acknowledgeAnomaly(id, request.getUserId()))
                .map(applied -> transitionResult(id, applied));
    }

    @PostMapping("/{id}/resolve")
    @Operation(summary = "Resolve anomaly",
            description = "Close an anomaly; the resolution false_positive marks it as a false positive")
    public Mono<ResponseEntity<AnomalyDetection>> resolveAnomaly(
            @Parameter(description = "Anomaly ID") @PathVariable String id,
            @Valid @RequestBody ResolveRequest request) {

        return Mono.fromCallable(() -> detectionService.resolveAnomaly(id, request.getResolution()))
                .map(applied -> transitionResult(id, applied));
    }

    /**
     * 200 with the updated anomaly, 409 with the unchanged one when its status does not allow
     * the transition, 404 when it is unknown.
     */
    private ResponseEntity<AnomalyDetection> transitionResult(String id, boolean applied) {
        return detectionService.getAnomaly(id)
                .map(anomaly -> applied
                        ? ResponseEntity.ok(anomaly)
                        : ResponseEntity.status(HttpStatus.CONFLICT).body(anomaly))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    static int clampLimit(int limit) {
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }
}
