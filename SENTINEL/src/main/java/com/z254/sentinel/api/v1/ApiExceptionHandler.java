package com.z254.sentinel.api.v1;

import com.z254.sentinel.api.dto.ErrorResponse;
import com.z254.sentinel.rules.RuleValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.time.Instant;
import java.util.List;

/**
 * Maps rejected requests to 400 responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(RuleValidationException.class)
    public ResponseEntity<ErrorResponse> handleRuleValidation(RuleValidationException e) {
        log.info("Rejected rule: {}", e.getMessage());
        return badRequest("Invalid rule", e.getMessage(), List.of());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleBinding(WebExchangeBindException e) {
        List<String> details = e.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        return badRequest("Invalid request", "Request validation failed", details);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return badRequest("Invalid request", e.getMessage(), List.of());
    }

    private ResponseEntity<ErrorResponse> badRequest(String error, String message, List<String> details) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .error(error)
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .build());
    }
}
