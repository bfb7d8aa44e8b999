package com.z254.sentinel.api.v1;

import com.z254.sentinel.api.dto.AcknowledgeRequest;
import com.z254.sentinel.api.dto.TimeRangeRequest;
import com.z254.sentinel.api.dto.WarningListResponse;
import com.z254.sentinel.domain.model.EarlyWarning;
import com.z254.sentinel.domain.model.Severity;
import com.z254.sentinel.domain.model.TimeRange;
import com.z254.sentinel.domain.service.AnomalyDetectionService;
import com.z254.sentinel.domain.service.AnomalyDetectionService.WarningFilter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * REST API controller for early warnings.
 */
@RestController
@RequestMapping("/api/v1/warnings")
@Tag(name = "Warnings", description = "Early warnings and lifecycle")
public class EarlyWarningController {

    private final AnomalyDetectionService detectionService;

    public EarlyWarningController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @GetMapping
    @Operation(summary = "List warnings", description = "List active early warnings, newest first")
    public Mono<ResponseEntity<WarningListResponse>> listWarnings(
            @Parameter(description = "Filter by type (threshold_breach, trend_alert, capacity_warning, cost_alert)")
            @RequestParam(required = false) String type,
            @Parameter(description = "Filter by severity (low, medium, high, critical)")
            @RequestParam(required = false) String severity,
            @Parameter(description = "Maximum number of warnings")
            @RequestParam(defaultValue = "50") int limit) {

        return Mono.fromCallable(() -> {
            EarlyWarning.WarningType typeFilter = type != null
                    ? EarlyWarning.WarningType.valueOf(type.toUpperCase(Locale.ROOT))
                    : null;
            Severity severityFilter = severity != null
                    ? Severity.valueOf(severity.toUpperCase(Locale.ROOT))
                    : null;
            List<EarlyWarning> warnings = detectionService.findWarnings(
                    new WarningFilter(typeFilter, severityFilter, true, AnomalyController.clampLimit(limit)));

            return ResponseEntity.ok(WarningListResponse.builder()
                    .warnings(warnings)
                    .total(warnings.size())
                    .build());
        });
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get warning", description = "Get early warning details by ID")
    public Mono<ResponseEntity<EarlyWarning>> getWarning(
            @Parameter(description = "Warning ID") @PathVariable String id) {

        return Mono.justOrEmpty(detectionService.getWarning(id))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/generate")
    @Operation(summary = "Generate warnings", description = "Run a warning pass over all checks")
    public Mono<ResponseEntity<WarningListResponse>> generateWarnings(
            @RequestBody(required = false) TimeRangeRequest request) {

        TimeRange range = request != null ? request.toTimeRange() : null;

        return Mono.fromCallable(() -> detectionService.generateEarlyWarnings(range))
                .subscribeOn(Schedulers.boundedElastic())
                .map(warnings -> ResponseEntity.ok(WarningListResponse.builder()
                        .warnings(warnings)
                        .total(warnings.size())
                        .build()));
    }

    @PostMapping("/{id}/acknowledge")
    @Operation(summary = "Acknowledge warning", description = "Acknowledge an early warning")
    public Mono<ResponseEntity<EarlyWarning>> acknowledgeWarning(
            @Parameter(description = "Warning ID") @PathVariable String id,
            @Valid @RequestBody AcknowledgeRequest request) {

        return transition(id, warningId -> detectionService.acknowledgeWarning(warningId, request.getUserId()));
    }

    @PostMapping("/{id}/resolve")
    @Operation(summary = "Resolve warning", description = "Mark an early warning as resolved")
    public Mono<ResponseEntity<EarlyWarning>> resolveWarning(
            @Parameter(description = "Warning ID") @PathVariable String id) {

        return transition(id, detectionService::resolveWarning);
    }

    @PostMapping("/{id}/dismiss")
    @Operation(summary = "Dismiss warning", description = "Dismiss an early warning")
    public Mono<ResponseEntity<EarlyWarning>> dismissWarning(
            @Parameter(description = "Warning ID") @PathVariable String id) {

        return transition(id, detectionService::dismissWarning);
    }

    private Mono<ResponseEntity<EarlyWarning>> transition(String id, Predicate<String> action) {
        return Mono.fromCallable(() -> action.test(id))
                .map(applied -> detectionService.getWarning(id)
                        .map(warning -> applied
                                ? ResponseEntity.ok(warning)
                                : ResponseEntity.status(HttpStatus.CONFLICT).body(warning))
                        .orElseGet(() -> ResponseEntity.notFound().build()));
    }
}
