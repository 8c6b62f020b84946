/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
        Providers providers,
        Breaker circuitBreaker,
        RateLimit rateLimit,
        Health health,
        Store store
) {
    public AppProperties {
        providers = providers == null ? new Providers(Map.of()) : providers;
        circuitBreaker = circuitBreaker == null ? Breaker.defaults() : circuitBreaker;
        rateLimit = rateLimit == null ? RateLimit.defaults() : rateLimit;
        health = health == null ? Health.defaults() : health;
        store = store == null ? new Store("memory") : store;
    }

    public record Providers(Map<String, Endpoint> endpoints) {
        public Providers {
            endpoints = endpoints == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(endpoints));
        }

        public record Endpoint(String healthUrl, String apiKey, boolean local) {}
    }

    public record Breaker(
            int failureThreshold,
            Duration timeout,
            int successThreshold,
            Duration maxTimeout
    ) {
        public static Breaker defaults() {
            return new Breaker(5, Duration.ofSeconds(60), 2, Duration.ofSeconds(300));
        }
    }

    public record RateLimit(
            boolean enabled,
            int windowSeconds,
            int authenticatedLimit,
            int demoLimit,
            int adminLimit,
            List<String> paths
    ) {
        public RateLimit {
            paths = paths == null ? List.of("/api/routing/plan") : List.copyOf(paths);
        }

        public static RateLimit defaults() {
            return new RateLimit(true, 3600, 100, 3, 1000, null);
        }
    }

    public record Health(
            Duration probeTimeout,
            Duration cacheTtl,
            int poolSize,
            Duration refreshInterval,
            boolean scheduledRefresh
    ) {
        public Health {
            probeTimeout = probeTimeout == null ? Duration.ofSeconds(5) : probeTimeout;
            cacheTtl = cacheTtl == null ? Duration.ofSeconds(60) : cacheTtl;
            refreshInterval = refreshInterval == null ? Duration.ofSeconds(60) : refreshInterval;
        }

        public static Health defaults() {
            return new Health(null, null, 4, null, false);
        }
    }

    public record Store(String backend) {}
}
