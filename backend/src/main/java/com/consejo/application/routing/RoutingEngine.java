/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.routing;

import com.consejo.application.health.ProviderHealthStatus;
import com.consejo.application.models.ModelRecord;
import com.consejo.application.modes.ExecutionModeConfig;
import com.consejo.application.modes.ExecutionModePolicy;
import com.consejo.config.DeploymentMode;
import com.consejo.domain.model.HealthState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a capability and execution mode into an ordered plan of models to try.
 *
 * <p>The mode's ranked candidates are filtered by deployment mode, cost limit and breaker availability,
 * then stably reordered so that providers last seen degraded or down sink to the end.
 */
@Service
public class RoutingEngine {
    private static final Logger log = LoggerFactory.getLogger(RoutingEngine.class);

    private final ExecutionModePolicy modePolicy;
    private final CircuitBreaker circuitBreaker;
    private final ProviderHealthReader providerHealthReader;
    private final DeploymentMode deploymentMode;

    public RoutingEngine(
            ExecutionModePolicy modePolicy,
            CircuitBreaker circuitBreaker,
            ProviderHealthReader providerHealthReader,
            DeploymentMode deploymentMode
    ) {
        this.modePolicy = modePolicy;
        this.circuitBreaker = circuitBreaker;
        this.providerHealthReader = providerHealthReader;
        this.deploymentMode = deploymentMode;
    }

    /**
     * @throws com.consejo.application.models.NoCandidatesException when no model supports the capability
     * @throws NoRoutableCandidateException when every supporting model was skipped
     */
    public RoutePlan plan(RouteRequest request) {
        ExecutionModeConfig cfg = modePolicy.config(request.mode());
        List<ModelRecord> ranked = modePolicy.rankedCandidates(request.mode(), request.capability());

        List<RouteCandidate> candidates = new ArrayList<>();
        List<SkippedCandidate> skipped = new ArrayList<>();
        Map<String, Optional<HealthState>> healthByProvider = new HashMap<>();

        for (ModelRecord model : ranked) {
            Optional<SkipReason> reason = skipReason(model, request, cfg);
            if (reason.isPresent()) {
                skipped.add(new SkippedCandidate(model.id(), model.provider(), reason.get()));
                continue;
            }
            HealthState health = healthByProvider
                    .computeIfAbsent(model.provider(), this::lastKnownHealth)
                    .orElse(null);
            Double estimatedCost = request.hasUsageEstimate()
                    ? model.estimateCost(request.inputUnits(), request.outputUnits())
                    : null;
            candidates.add(new RouteCandidate(model.id(), model.provider(), model.remoteModelName(), estimatedCost, health));
        }

        if (candidates.isEmpty()) {
            log.warn("No routable candidate capability={} mode={} skipped={}",
                    request.capability(), request.mode().key(), skipped.size());
            throw new NoRoutableCandidateException(request.capability(), request.mode(), skipped);
        }

        // List.sort is stable: rank order is kept within each health tier.
        candidates.sort(Comparator.comparingInt(RouteCandidate::healthPenalty));

        log.debug("Route planned capability={} mode={} primary={} candidates={} skipped={}",
                request.capability(), request.mode().key(), candidates.get(0).modelId(), candidates.size(), skipped.size());

        return new RoutePlan(
                request.capability(),
                request.mode(),
                candidates,
                skipped,
                cfg.maxParallelExecutions(),
                cfg.timeout(),
                cfg.maxRetries(),
                cfg.enableArbitration()
        );
    }

    /**
     * Next provider in the plan, after {@code failedProvider}, whose breaker still admits calls.
     */
    public Optional<String> fallbackFor(RoutePlan plan, String failedProvider) {
        return circuitBreaker.getFallbackProvider(failedProvider, plan.providerOrder());
    }

    private Optional<SkipReason> skipReason(ModelRecord model, RouteRequest request, ExecutionModeConfig cfg) {
        if (!deploymentMode.allowsModel(model.localOnly())) {
            return Optional.of(SkipReason.DEPLOYMENT_MODE);
        }
        if (cfg.hasCostLimit() && request.hasUsageEstimate()) {
            BigDecimal estimate = BigDecimal.valueOf(model.estimateCost(request.inputUnits(), request.outputUnits()));
            if (estimate.compareTo(cfg.costLimit()) > 0) {
                return Optional.of(SkipReason.COST_LIMIT);
            }
        }
        if (!circuitBreaker.isAvailable(model.provider())) {
            return Optional.of(SkipReason.CIRCUIT_OPEN);
        }
        return Optional.empty();
    }

    private Optional<HealthState> lastKnownHealth(String provider) {
        return providerHealthReader.cachedStatus(provider).map(ProviderHealthStatus::status);
    }
}
