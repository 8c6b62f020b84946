/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.routing;

import com.consejo.domain.model.ExecutionMode;
import com.consejo.domain.model.TaskCapability;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public record RoutePlan(
        TaskCapability capability,
        ExecutionMode mode,
        List<RouteCandidate> candidates,
        List<SkippedCandidate> skipped,
        int maxParallelExecutions,
        Duration timeout,
        int maxRetries,
        boolean arbitrationEnabled
) {
    public RoutePlan {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    public RouteCandidate primary() {
        return candidates.get(0);
    }

    /**
     * Distinct providers in candidate order.
     */
    public List<String> providerOrder() {
        List<String> providers = new ArrayList<>();
        for (RouteCandidate candidate : candidates) {
            if (!providers.contains(candidate.provider())) {
                providers.add(candidate.provider());
            }
        }
        return providers;
    }
}
