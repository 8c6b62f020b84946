/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.config;

import com.consejo.api.ApiErrorResponse;
import com.consejo.application.ratelimit.RateLimitDecision;
import com.consejo.application.ratelimit.RateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class RateLimitFilter extends OncePerRequestFilter {
    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RESET_HEADER = "X-RateLimit-Reset";
    public static final String RETRY_AFTER_HEADER = "Retry-After";

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean enabled;
    private final List<String> paths;

    public RateLimitFilter(RateLimiter rateLimiter, ObjectMapper objectMapper, Clock clock, AppProperties properties) {
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.enabled = properties.rateLimit().enabled();
        this.paths = properties.rateLimit().paths();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!enabled) return true;
        String path = request.getRequestURI();
        if (path == null) return true;
        return paths.stream().noneMatch(path::startsWith);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        CallerIdentity caller = CallerIdentity.resolve(request);
        RateLimitDecision decision = rateLimiter.checkLimit(caller.identifier(), caller.demo(), caller.admin());

        response.setHeader(LIMIT_HEADER, String.valueOf(decision.limit()));
        response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
        response.setHeader(RESET_HEADER, String.valueOf(decision.resetAt()));

        if (!decision.allowed()) {
            long retryAfter = decision.retryAfterSeconds(clock.instant().getEpochSecond());
            log.info("Rate limit rejected identifier={} demo={} path={}", caller.identifier(), caller.demo(), request.getRequestURI());
            response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
            response.setHeader(RETRY_AFTER_HEADER, String.valueOf(retryAfter));
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
            String requestId = MDC.get(RequestIdFilter.MDC_KEY);
            ApiErrorResponse payload = new ApiErrorResponse(
                    HttpStatus.TOO_MANY_REQUESTS.name(),
                    "RATE_LIMIT_EXCEEDED",
                    "Rate limit exceeded. Try again in " + retryAfter + " seconds",
                    requestId == null ? "" : requestId
            );
            objectMapper.writeValue(response.getWriter(), payload);
            return;
        }

        filterChain.doFilter(request, response);
    }
}
