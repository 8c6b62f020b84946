/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.routing;

import com.consejo.domain.model.CircuitState;

import java.time.Duration;
import java.time.Instant;

public record CircuitStats(
        String provider,
        CircuitState state,
        int failureCount,
        int successCount,
        Duration timeout,
        Instant lastFailureAt,
        Instant openedAt
) {}
