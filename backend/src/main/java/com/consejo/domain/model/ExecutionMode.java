/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum ExecutionMode {
    FAST("fast"),
    BALANCED("balanced"),
    BEST_QUALITY("best_quality");

    private final String key;

    ExecutionMode(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public static Optional<ExecutionMode> fromKey(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().replace('-', '_').toLowerCase(Locale.ROOT);
        for (ExecutionMode mode : values()) {
            if (mode.key.equals(normalized)) return Optional.of(mode);
        }
        return Optional.empty();
    }
}
