/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.routing;

import com.consejo.application.health.ProviderHealthStatus;

import java.util.Optional;

/**
 * Last known health of a provider, without probing it.
 */
public interface ProviderHealthReader {
    Optional<ProviderHealthStatus> cachedStatus(String provider);
}
