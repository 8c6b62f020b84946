/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    /**
     * Nombre en minúsculas usado en las respuestas de observabilidad ("closed", "open", "half_open").
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
