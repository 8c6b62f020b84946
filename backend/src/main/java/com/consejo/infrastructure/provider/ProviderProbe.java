/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.infrastructure.provider;

import java.time.Duration;

/**
 * Liveness transport for a provider. Returns the HTTP status code of the probe request, or throws
 * {@link ProviderException} when no status could be obtained within {@code timeout}.
 */
public interface ProviderProbe {
    int probe(String provider, String healthUrl, String apiKey, Duration timeout);
}
