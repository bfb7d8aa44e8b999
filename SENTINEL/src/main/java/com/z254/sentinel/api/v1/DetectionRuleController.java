package com.z254.sentinel.api.v1;

import com.z254.sentinel.api.dto.CreateRuleRequest;
import com.z254.sentinel.api.dto.RuleCreatedResponse;
import com.z254.sentinel.domain.model.DetectionRule;
import com.z254.sentinel.domain.model.RulePerformance;
import com.z254.sentinel.domain.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST API controller for detection rules.
 */
@RestController
@RequestMapping("/api/v1/rules")
@Tag(name = "Rules", description = "Detection rule management")
public class DetectionRuleController {

    private final AnomalyDetectionService detectionService;

    public DetectionRuleController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @GetMapping
    @Operation(summary = "List rules", description = "List all detection rules")
    public Mono<List<DetectionRule>> listRules() {
        return Mono.fromCallable(detectionService::listRules);
    }

    @PostMapping
    @Operation(summary = "Create rule", description = "Register a detection rule")
    public Mono<ResponseEntity<RuleCreatedResponse>> createRule(@Valid @RequestBody CreateRuleRequest request) {
        return Mono.fromCallable(() -> detectionService.createDetectionRule(request.toSpec()))
                .map(ruleId -> ResponseEntity.status(HttpStatus.CREATED).body(new RuleCreatedResponse(ruleId)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get rule", description = "Get a detection rule by ID")
    public Mono<ResponseEntity<DetectionRule>> getRule(
            @Parameter(description = "Rule ID") @PathVariable String id) {

        return Mono.justOrEmpty(detectionService.getRule(id))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/performance")
    @Operation(summary = "Get rule performance",
            description = "Trigger count, false positive rate and last trigger time of a rule")
    public Mono<ResponseEntity<RulePerformance>> getRulePerformance(
            @Parameter(description = "Rule ID") @PathVariable String id) {

        return Mono.fromCallable(() -> detectionService.getRulePerformance(id))
                .map(ResponseEntity::of);
    }

    @PostMapping("/{id}/enable")
    @Operation(summary = "Enable rule")
    public Mono<ResponseEntity<DetectionRule>> enableRule(
            @Parameter(description = "Rule ID") @PathVariable String id) {

        return Mono.fromCallable(() -> detectionService.setRuleEnabled(id, true))
                .map(ResponseEntity::of);
    }

    @PostMapping("/{id}/disable")
    @Operation(summary = "Disable rule")
    public Mono<ResponseEntity<DetectionRule>> disableRule(
            @Parameter(description = "Rule ID") @PathVariable String id) {

        return Mono.fromCallable(() -> detectionService.setRuleEnabled(id, false))
                .map(ResponseEntity::of);
    }
}
