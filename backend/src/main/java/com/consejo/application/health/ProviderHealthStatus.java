/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.health;

import com.consejo.domain.model.HealthState;

import java.time.Instant;

public record ProviderHealthStatus(
        HealthState status,
        Instant lastCheck,
        Double responseTimeMs,
        String errorMessage
) {
    public static ProviderHealthStatus down(Instant at, String errorMessage) {
        return new ProviderHealthStatus(HealthState.DOWN, at, null, errorMessage);
    }

    public ProviderHealthStatus withStatus(HealthState newStatus, String newErrorMessage) {
        return new ProviderHealthStatus(newStatus, lastCheck, responseTimeMs, newErrorMessage);
    }
}
