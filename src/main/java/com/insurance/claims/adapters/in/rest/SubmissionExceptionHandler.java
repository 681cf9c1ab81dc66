package com.insurance.claims.adapters.in.rest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.insurance.claims.domain.exception.ClaimValidationException;
import com.insurance.claims.domain.exception.ConcurrentSubmissionException;
import com.insurance.claims.domain.valueobject.ValidationFailureReason;

/**
 * Maps synchronous submission refusals to HTTP responses.
 */
@RestControllerAdvice(assignableTypes = ClaimSubmissionController.class)
public class SubmissionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(SubmissionExceptionHandler.class);

    @ExceptionHandler(ClaimValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ClaimValidationException e) {
        HttpStatus status = e.getReason() == ValidationFailureReason.RATE_LIMITED
                ? HttpStatus.TOO_MANY_REQUESTS
                : HttpStatus.BAD_REQUEST;
        log.info("action=submission_refused reason={} field={}", e.getReason(), e.getField());
        return ResponseEntity.status(status).body(Map.of(
                "status", "refused",
                "reason", e.getReason().name(),
                "field", e.getField(),
                "message", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException e) {
        List<Map<String, String>> errors = e.getBindingResult().getFieldErrors().stream()
                .map(error -> {
                    Map<String, String> item = new LinkedHashMap<>();
                    item.put("field", error.getField());
                    item.put("message", String.valueOf(error.getDefaultMessage()));
                    return item;
                })
                .collect(Collectors.toList());
        log.info("action=submission_invalid_body fields={}",
                errors.stream().map(item -> item.get("field")).collect(Collectors.joining(",")));
        return ResponseEntity.badRequest().body(Map.of(
                "status", "invalid",
                "errors", errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.info("action=submission_unreadable_body error={}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(Map.of(
                "status", "invalid",
                "message", "Malformed claim submission body"));
    }

    @ExceptionHandler(ConcurrentSubmissionException.class)
    public ResponseEntity<Map<String, Object>> handleConcurrent(ConcurrentSubmissionException e) {
        log.info("action=submission_conflict actorId={}", e.getActorId());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                "status", "conflict",
                "actorId", e.getActorId(),
                "message", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        log.info("action=submission_bad_request error={}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of(
                "status", "error",
                "message", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("action=submission_unexpected_error error={}", e.getMessage(), e);
        return ResponseEntity.internalServerError().body(Map.of(
                "status", "error",
                "message", "Unable to process claim submission"));
    }
}
