/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.api.admin;

import com.consejo.api.ApiException;
import com.consejo.application.ratelimit.RateLimitUsage;
import com.consejo.application.ratelimit.RateLimiter;
import com.consejo.application.routing.CircuitBreaker;
import com.consejo.application.routing.CircuitStats;
import com.consejo.config.CallerIdentity;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Operator views over breaker and quota state. Only callers with the admin role may use it.
 */
@RestController
@RequestMapping("/api/admin")
public class AdminProviderController {
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;

    public AdminProviderController(CircuitBreaker circuitBreaker, RateLimiter rateLimiter) {
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter = rateLimiter;
    }

    @GetMapping("/circuits")
    public List<CircuitStats> circuits(HttpServletRequest request) {
        requireAdmin(request);
        return circuitBreaker.getAllStats();
    }

    @GetMapping("/circuits/{provider}")
    public CircuitStats circuit(@PathVariable("provider") String provider, HttpServletRequest request) {
        requireAdmin(request);
        return circuitBreaker.getStats(provider);
    }

    @PostMapping("/circuits/{provider}/reset")
    public CircuitStats resetCircuit(@PathVariable("provider") String provider, HttpServletRequest request) {
        requireAdmin(request);
        circuitBreaker.reset(provider);
        return circuitBreaker.getStats(provider);
    }

    @GetMapping("/rate-limits/{identifier}")
    public RateLimitUsage usage(
            @PathVariable("identifier") String identifier,
            @RequestParam(value = "demo", defaultValue = "false") boolean demo,
            HttpServletRequest request
    ) {
        requireAdmin(request);
        return rateLimiter.getCurrentUsage(identifier, demo);
    }

    @DeleteMapping("/rate-limits/{identifier}")
    public ResponseEntity<Void> resetUsage(
            @PathVariable("identifier") String identifier,
            @RequestParam(value = "demo", defaultValue = "false") boolean demo,
            HttpServletRequest request
    ) {
        requireAdmin(request);
        rateLimiter.resetLimit(identifier, demo);
        return ResponseEntity.noContent().build();
    }

    private static void requireAdmin(HttpServletRequest request) {
        CallerIdentity caller = CallerIdentity.resolve(request);
        if (caller.demo()) {
            throw new ApiException(HttpStatus.UNAUTHORIZED, "Missing X-User-Id");
        }
        if (!caller.admin()) {
            throw new ApiException(HttpStatus.FORBIDDEN, "Admin role required");
        }
    }
}
