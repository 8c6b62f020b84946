/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.routing;

/**
 * The provider was not contacted: its breaker is open.
 */
public class CircuitOpenException extends RuntimeException {
    private final String provider;

    public CircuitOpenException(String provider) {
        super("Circuit breaker is open for provider: " + provider);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
