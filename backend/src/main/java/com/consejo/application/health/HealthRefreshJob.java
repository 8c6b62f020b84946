/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.health;

import com.consejo.domain.model.HealthState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Keeps the health cache warm so routing has a recent verdict without probing inline.
 */
@Component
@ConditionalOnProperty(prefix = "app.health", name = "scheduled-refresh", havingValue = "true")
public class HealthRefreshJob {
    private static final Logger log = LoggerFactory.getLogger(HealthRefreshJob.class);

    private final ProviderHealthChecker healthChecker;

    public HealthRefreshJob(ProviderHealthChecker healthChecker) {
        this.healthChecker = healthChecker;
    }

    @Scheduled(fixedDelayString = "${app.health.refresh-interval:PT60S}", initialDelayString = "PT5S")
    public void refresh() {
        Map<String, ProviderHealthStatus> statuses = healthChecker.checkAllProviders();
        statuses.forEach((provider, status) -> {
            if (status.status() != HealthState.HEALTHY) {
                log.warn("Provider not healthy provider={} status={} error={}",
                        provider, status.status().wireName(), status.errorMessage());
            }
        });
        log.debug("Health refresh done providers={}", statuses.size());
    }
}
