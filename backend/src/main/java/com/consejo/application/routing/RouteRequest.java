/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.routing;

import com.consejo.domain.model.ExecutionMode;
import com.consejo.domain.model.TaskCapability;

/**
 * @param expectedInputUnits  optional; with {@code expectedOutputUnits} it drives cost-limit skipping
 * @param expectedOutputUnits optional
 */
public record RouteRequest(
        TaskCapability capability,
        ExecutionMode mode,
        Long expectedInputUnits,
        Long expectedOutputUnits
) {
    public RouteRequest {
        if (capability == null) throw new IllegalArgumentException("capability is required");
        mode = mode == null ? ExecutionMode.BALANCED : mode;
    }

    public static RouteRequest of(TaskCapability capability, ExecutionMode mode) {
        return new RouteRequest(capability, mode, null, null);
    }

    public boolean hasUsageEstimate() {
        return expectedInputUnits != null || expectedOutputUnits != null;
    }

    public long inputUnits() {
        return expectedInputUnits == null ? 0L : expectedInputUnits;
    }

    public long outputUnits() {
        return expectedOutputUnits == null ? 0L : expectedOutputUnits;
    }
}
