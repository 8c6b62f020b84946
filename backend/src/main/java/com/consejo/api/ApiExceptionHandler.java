/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.api;

import com.consejo.application.models.NoCandidatesException;
import com.consejo.application.modes.UnknownExecutionModeException;
import com.consejo.application.ratelimit.QuotaExceededException;
import com.consejo.application.routing.CircuitOpenException;
import com.consejo.application.routing.NoRoutableCandidateException;
import com.consejo.config.RateLimitFilter;
import com.consejo.config.RequestIdFilter;
import com.consejo.infrastructure.provider.ProviderException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex) {
        return respond(ex.getStatus(), ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<ApiErrorResponse> handleCircuitOpen(CircuitOpenException ex) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "CIRCUIT_OPEN", ex.getMessage());
    }

    @ExceptionHandler(NoCandidatesException.class)
    public ResponseEntity<ApiErrorResponse> handleNoCandidates(NoCandidatesException ex) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "NO_CANDIDATES", ex.getMessage());
    }

    @ExceptionHandler(NoRoutableCandidateException.class)
    public ResponseEntity<ApiErrorResponse> handleNoRoutable(NoRoutableCandidateException ex) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "NO_ROUTABLE_CANDIDATE", ex.getMessage());
    }

    @ExceptionHandler(UnknownExecutionModeException.class)
    public ResponseEntity<ApiErrorResponse> handleUnknownMode(UnknownExecutionModeException ex) {
        return respond(HttpStatus.BAD_REQUEST, "UNKNOWN_EXECUTION_MODE", ex.getMessage());
    }

    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<ApiErrorResponse> handleQuota(QuotaExceededException ex) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()));
        headers.set(RateLimitFilter.LIMIT_HEADER, String.valueOf(ex.getDecision().limit()));
        headers.set(RateLimitFilter.REMAINING_HEADER, "0");
        headers.set(RateLimitFilter.RESET_HEADER, String.valueOf(ex.getDecision().resetAt()));
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .headers(headers)
                .body(body(HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMIT_EXCEEDED",
                        "Rate limit exceeded. Try again in " + ex.getRetryAfterSeconds() + " seconds"));
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<ApiErrorResponse> handleProvider(ProviderException ex) {
        HttpStatus status = ex.getType().isTimeout() ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY;
        log.warn("Provider failure requestId={} provider={} type={}", currentRequestId(), ex.getProvider(), ex.getType());
        return respond(status, "PROVIDER_" + ex.getType().name(), ex.getSafeMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Invalid request");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleAny(Exception ex) {
        log.error("Unhandled exception requestId={}", currentRequestId(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", "Unexpected error");
    }

    private ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(body(status, code, message));
    }

    private ApiErrorResponse body(HttpStatus status, String code, String message) {
        return new ApiErrorResponse(status.name(), code, message, currentRequestId());
    }

    private String currentRequestId() {
        String rid = MDC.get(RequestIdFilter.MDC_KEY);
        return (rid == null || rid.isBlank()) ? "" : rid;
    }
}
