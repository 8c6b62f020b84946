/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.health;

import com.consejo.application.routing.CircuitBreaker;
import com.consejo.application.routing.ProviderHealthReader;
import com.consejo.config.AppProperties;
import com.consejo.config.DeploymentMode;
import com.consejo.domain.model.CircuitState;
import com.consejo.domain.model.HealthState;
import com.consejo.infrastructure.provider.ProviderException;
import com.consejo.infrastructure.provider.ProviderProbe;
import com.consejo.infrastructure.store.SharedStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Probes provider liveness endpoints, folds in circuit breaker state and caches the verdict in the
 * shared store.
 */
@Service
public class ProviderHealthChecker implements ProviderHealthReader {
    private static final Logger log = LoggerFactory.getLogger(ProviderHealthChecker.class);
    private static final String CACHE_PREFIX = "provider:health:";
    private static final Duration AGGREGATE_MARGIN = Duration.ofSeconds(2);

    private final SharedStore store;
    private final ProviderProbe probe;
    private final CircuitBreaker circuitBreaker;
    private final DeploymentMode deploymentMode;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ExecutorService executor;
    private final Map<String, AppProperties.Providers.Endpoint> endpoints;
    private final AppProperties.Health health;

    public ProviderHealthChecker(
            SharedStore store,
            ProviderProbe probe,
            CircuitBreaker circuitBreaker,
            DeploymentMode deploymentMode,
            ObjectMapper objectMapper,
            Clock clock,
            @Qualifier("healthProbeExecutor") ExecutorService executor,
            AppProperties properties
    ) {
        this.store = store;
        this.probe = probe;
        this.circuitBreaker = circuitBreaker;
        this.deploymentMode = deploymentMode;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.executor = executor;
        this.endpoints = properties.providers().endpoints();
        this.health = properties.health();
    }

    public ProviderHealthStatus checkProviderHealth(String provider) {
        Optional<ProviderHealthStatus> cached = cachedStatus(provider);
        if (cached.isPresent()) {
            return cached.get();
        }

        AppProperties.Providers.Endpoint endpoint = endpoints.get(provider);
        if (endpoint == null) {
            return ProviderHealthStatus.down(clock.instant(), "Unknown provider: " + provider);
        }

        ProviderHealthStatus folded = foldCircuitState(provider, probe(provider, endpoint));
        writeCache(provider, folded);
        return folded;
    }

    /**
     * Checks every provider enabled for the current deployment mode concurrently. One provider failing
     * or overrunning only degrades its own entry.
     */
    public Map<String, ProviderHealthStatus> checkAllProviders() {
        List<String> providers = enabledProviders();
        Map<String, CompletableFuture<ProviderHealthStatus>> futures = new LinkedHashMap<>();
        for (String provider : providers) {
            futures.put(provider, submit(provider));
        }

        long deadline = System.nanoTime() + health.probeTimeout().plus(AGGREGATE_MARGIN).toNanos();
        Map<String, ProviderHealthStatus> results = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<ProviderHealthStatus>> entry : futures.entrySet()) {
            results.put(entry.getKey(), await(entry.getKey(), entry.getValue(), deadline));
        }
        return results;
    }

    @Override
    public Optional<ProviderHealthStatus> cachedStatus(String provider) {
        try {
            Optional<String> raw = store.get(cacheKey(provider));
            if (raw.isEmpty()) return Optional.empty();
            return Optional.of(objectMapper.readValue(raw.get(), ProviderHealthStatus.class));
        } catch (Exception e) {
            log.warn("Error reading health cache for provider={}: {}", provider, e.getMessage());
            return Optional.empty();
        }
    }

    public List<String> enabledProviders() {
        List<String> enabled = new ArrayList<>();
        for (Map.Entry<String, AppProperties.Providers.Endpoint> entry : endpoints.entrySet()) {
            if (deploymentMode.allowsModel(entry.getValue().local())) {
                enabled.add(entry.getKey());
            }
        }
        return enabled;
    }

    ProviderHealthStatus probe(String provider, AppProperties.Providers.Endpoint endpoint) {
        long started = System.nanoTime();
        try {
            int code = probe.probe(provider, endpoint.healthUrl(), endpoint.apiKey(), health.probeTimeout());
            return classify(code, elapsedMs(started));
        } catch (ProviderException e) {
            String message = e.getType().isTimeout() ? "Request timeout" : e.getSafeMessage();
            log.warn("Health probe failed provider={} type={} message={}", provider, e.getType(), message);
            return new ProviderHealthStatus(HealthState.DOWN, clock.instant(), elapsedMs(started), message);
        } catch (RuntimeException e) {
            log.error("Error checking health for provider={}", provider, e);
            return new ProviderHealthStatus(HealthState.DOWN, clock.instant(), elapsedMs(started), String.valueOf(e.getMessage()));
        }
    }

    ProviderHealthStatus classify(int statusCode, double responseTimeMs) {
        if (statusCode >= 200 && statusCode < 300) {
            return new ProviderHealthStatus(HealthState.HEALTHY, clock.instant(), responseTimeMs, null);
        }
        // Reachable but refusing us (auth, quota, redirects): degraded rather than down.
        HealthState state = (statusCode >= 300 && statusCode < 500) ? HealthState.DEGRADED : HealthState.DOWN;
        return new ProviderHealthStatus(state, clock.instant(), responseTimeMs, "HTTP " + statusCode);
    }

    ProviderHealthStatus foldCircuitState(String provider, ProviderHealthStatus probed) {
        CircuitState circuitState = circuitBreaker.getState(provider);
        if (circuitState == CircuitState.OPEN) {
            String message = probed.errorMessage() == null ? "Circuit breaker open" : probed.errorMessage();
            return probed.withStatus(HealthState.DOWN, message);
        }
        if (circuitState == CircuitState.HALF_OPEN && probed.status() == HealthState.HEALTHY) {
            return probed.withStatus(HealthState.DEGRADED, probed.errorMessage());
        }
        return probed;
    }

    private CompletableFuture<ProviderHealthStatus> submit(String provider) {
        try {
            return CompletableFuture.supplyAsync(() -> checkProviderHealth(provider), executor);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private ProviderHealthStatus await(String provider, CompletableFuture<ProviderHealthStatus> future, long deadline) {
        long remaining = Math.max(0L, deadline - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Error checking health for provider={}", provider, cause);
            return ProviderHealthStatus.down(clock.instant(), String.valueOf(cause.getMessage()));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Health check overran deadline provider={}", provider);
            return ProviderHealthStatus.down(clock.instant(), "Health check timed out");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProviderHealthStatus.down(clock.instant(), "Health check interrupted");
        }
    }

    private void writeCache(String provider, ProviderHealthStatus status) {
        try {
            store.set(cacheKey(provider), objectMapper.writeValueAsString(status), health.cacheTtl());
        } catch (Exception e) {
            log.warn("Error caching health status for provider={}: {}", provider, e.getMessage());
        }
    }

    private static String cacheKey(String provider) {
        return CACHE_PREFIX + provider;
    }

    private static double elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000.0;
    }
}
