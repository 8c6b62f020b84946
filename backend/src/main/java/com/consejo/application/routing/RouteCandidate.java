/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.routing;

import com.consejo.domain.model.HealthState;

/**
 * @param estimatedCost {@code null} when the request carried no usage estimate
 * @param lastKnownHealth {@code null} when the provider has not been probed recently
 */
public record RouteCandidate(
        String modelId,
        String provider,
        String remoteModelName,
        Double estimatedCost,
        HealthState lastKnownHealth
) {
    int healthPenalty() {
        return lastKnownHealth == null ? 0 : lastKnownHealth.routingPenalty();
    }
}
