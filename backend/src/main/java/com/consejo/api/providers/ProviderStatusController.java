/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.api.providers;

import com.consejo.application.health.ProviderHealthChecker;
import com.consejo.application.health.ProviderHealthStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/providers")
public class ProviderStatusController {
    private final ProviderHealthChecker healthChecker;

    public ProviderStatusController(ProviderHealthChecker healthChecker) {
        this.healthChecker = healthChecker;
    }

    @GetMapping("/health")
    public Map<String, ProviderHealthStatus> health() {
        return healthChecker.checkAllProviders();
    }

    @GetMapping("/{provider}/health")
    public ProviderHealthStatus providerHealth(@PathVariable("provider") String provider) {
        return healthChecker.checkProviderHealth(provider);
    }
}
