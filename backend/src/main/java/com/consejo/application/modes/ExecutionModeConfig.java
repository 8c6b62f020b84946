/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.modes;

import com.consejo.domain.model.ExecutionMode;
import com.consejo.domain.model.FallbackStrategy;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * @param costLimit USD ceiling for one request; {@code null} means no ceiling
 */
public record ExecutionModeConfig(
        ExecutionMode mode,
        int maxParallelExecutions,
        Duration timeout,
        int maxRetries,
        boolean enableArbitration,
        boolean enableSynthesis,
        double accuracyRequirement,
        BigDecimal costLimit,
        List<String> preferredModels,
        FallbackStrategy fallbackStrategy
) {
    public ExecutionModeConfig {
        if (mode == null) throw new IllegalArgumentException("mode is required");
        if (maxParallelExecutions < 1) throw new IllegalArgumentException("maxParallelExecutions must be >= 1 for " + mode.key());
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0 for " + mode.key());
        if (accuracyRequirement < 0 || accuracyRequirement > 1) {
            throw new IllegalArgumentException("accuracyRequirement out of [0,1] for " + mode.key());
        }
        if (costLimit != null && costLimit.signum() < 0) {
            throw new IllegalArgumentException("costLimit must not be negative for " + mode.key());
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive for " + mode.key());
        }
        preferredModels = preferredModels == null ? List.of() : List.copyOf(preferredModels);
        fallbackStrategy = fallbackStrategy == null ? FallbackStrategy.AUTOMATIC : fallbackStrategy;
    }

    public boolean hasCostLimit() {
        return costLimit != null;
    }
}
