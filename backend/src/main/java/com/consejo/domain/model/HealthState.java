/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HealthState {
    HEALTHY,
    DEGRADED,
    DOWN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static HealthState fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("health state is blank");
        }
        return HealthState.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Lower is better; used to push degraded providers behind healthy ones.
     */
    public int routingPenalty() {
        return switch (this) {
            case HEALTHY -> 0;
            case DEGRADED -> 1;
            case DOWN -> 2;
        };
    }
}
