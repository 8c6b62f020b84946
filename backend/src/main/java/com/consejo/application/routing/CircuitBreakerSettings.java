/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.routing;

import com.consejo.config.AppProperties;

import java.time.Duration;

public record CircuitBreakerSettings(
        int failureThreshold,
        Duration baseTimeout,
        int successThreshold,
        Duration maxTimeout
) {
    public CircuitBreakerSettings {
        failureThreshold = Math.max(1, failureThreshold);
        successThreshold = Math.max(1, successThreshold);
        baseTimeout = (baseTimeout == null || baseTimeout.isNegative()) ? Duration.ofSeconds(60) : baseTimeout;
        maxTimeout = (maxTimeout == null || maxTimeout.compareTo(baseTimeout) < 0) ? baseTimeout : maxTimeout;
    }

    public static CircuitBreakerSettings defaults() {
        return new CircuitBreakerSettings(5, Duration.ofSeconds(60), 2, Duration.ofSeconds(300));
    }

    public static CircuitBreakerSettings from(AppProperties.Breaker breaker) {
        if (breaker == null) return defaults();
        return new CircuitBreakerSettings(
                breaker.failureThreshold(),
                breaker.timeout(),
                breaker.successThreshold(),
                breaker.maxTimeout()
        );
    }
}
