/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.models;

import com.consejo.domain.model.TaskCapability;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public record ModelRecord(
        String id,
        String provider,
        String remoteModelName,
        Set<TaskCapability> capabilities,
        double costPerInputUnit,
        double costPerOutputUnit,
        Duration averageLatency,
        int maxContext,
        double reliabilityScore,
        boolean localOnly
) {
    public ModelRecord {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("model id is required");
        if (provider == null || provider.isBlank()) throw new IllegalArgumentException("provider is required for " + id);
        if (capabilities == null || capabilities.isEmpty()) {
            throw new IllegalArgumentException("model " + id + " declares no capabilities");
        }
        if (reliabilityScore < 0 || reliabilityScore > 1) {
            throw new IllegalArgumentException("reliabilityScore out of [0,1] for " + id);
        }
        if (costPerInputUnit < 0 || costPerOutputUnit < 0) {
            throw new IllegalArgumentException("negative cost for " + id);
        }
        capabilities = Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
        averageLatency = averageLatency == null ? Duration.ZERO : averageLatency;
    }

    public boolean supports(TaskCapability capability) {
        return capabilities.contains(capability);
    }

    public double unitCost() {
        return costPerInputUnit + costPerOutputUnit;
    }

    public double estimateCost(long inputUnits, long outputUnits) {
        return costPerInputUnit * Math.max(0, inputUnits) + costPerOutputUnit * Math.max(0, outputUnits);
    }
}
