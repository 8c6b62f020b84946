/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.domain.model;

import java.util.Locale;

public enum TaskCapability {
    REASONING,
    RESEARCH,
    CODE_GENERATION,
    CREATIVE_OUTPUT,
    FACT_CHECKING,
    DEBUGGING,
    VERIFICATION,
    IMAGE_GENERATION;

    public static TaskCapability parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("capability is required");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return TaskCapability.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown capability: " + value);
        }
    }
}
