/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.routing;

import com.consejo.application.health.ProviderHealthStatus;
import com.consejo.application.models.ModelRegistry;
import com.consejo.application.models.NoCandidatesException;
import com.consejo.application.modes.ExecutionModePolicy;
import com.consejo.config.DeploymentMode;
import com.consejo.domain.model.ExecutionMode;
import com.consejo.domain.model.HealthState;
import com.consejo.domain.model.TaskCapability;
import com.consejo.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoutingEngineTest {
    private final Map<String, HealthState> health = new HashMap<>();
    private final ProviderHealthReader healthReader = provider -> Optional.ofNullable(health.get(provider))
            .map(state -> new ProviderHealthStatus(state, Instant.EPOCH, 10.0, null));

    private MutableClock clock;
    private CircuitBreaker circuitBreaker;
    private ExecutionModePolicy policy;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(1_700_000_000L);
        circuitBreaker = new CircuitBreaker(
                new CircuitBreakerSettings(1, Duration.ofSeconds(60), 1, Duration.ofSeconds(300)), clock);
        policy = new ExecutionModePolicy(new ModelRegistry());
    }

    @Test
    void cloudModeSkipsLocalModels() {
        RoutePlan plan = engine(DeploymentMode.Kind.CLOUD).plan(RouteRequest.of(TaskCapability.REASONING, ExecutionMode.FAST));

        assertEquals(List.of(
                "groq-mixtral-8x7b",
                "huggingface-mistral-7b",
                "together-mixtral-8x7b",
                "groq-llama3-70b",
                "openrouter-claude-3-sonnet",
                "openrouter-gpt4-turbo"
        ), modelIds(plan));
        assertEquals(2, plan.skipped().size());
        assertTrue(plan.skipped().stream().allMatch(s -> s.reason() == SkipReason.DEPLOYMENT_MODE));
        assertEquals(3, plan.maxParallelExecutions());
        assertEquals(Duration.ofSeconds(30), plan.timeout());
        assertEquals(false, plan.arbitrationEnabled());
        assertNull(plan.primary().estimatedCost());
    }

    @Test
    void localModeKeepsOnlyOllama() {
        RoutePlan plan = engine(DeploymentMode.Kind.LOCAL).plan(RouteRequest.of(TaskCapability.CODE_GENERATION, ExecutionMode.BALANCED));

        assertEquals(List.of("ollama"), plan.providerOrder());
        assertEquals(List.of("ollama-mistral", "ollama-codellama"), modelIds(plan));
    }

    @Test
    void costLimitSkipsExpensiveModels() {
        RouteRequest request = new RouteRequest(TaskCapability.REASONING, ExecutionMode.FAST, 100_000L, 100_000L);

        RoutePlan plan = engine(DeploymentMode.Kind.CLOUD).plan(request);

        List<String> costSkipped = plan.skipped().stream()
                .filter(s -> s.reason() == SkipReason.COST_LIMIT)
                .map(SkippedCandidate::modelId)
                .toList();
        assertEquals(List.of("openrouter-claude-3-sonnet", "openrouter-gpt4-turbo"), costSkipped);
        assertEquals(0.138, plan.candidates().stream()
                .filter(c -> c.modelId().equals("groq-llama3-70b"))
                .findFirst().orElseThrow().estimatedCost(), 1e-9);
    }

    @Test
    void bestQualityHasNoCostCeiling() {
        RouteRequest request = new RouteRequest(TaskCapability.REASONING, ExecutionMode.BEST_QUALITY, 1_000_000L, 1_000_000L);

        RoutePlan plan = engine(DeploymentMode.Kind.CLOUD).plan(request);

        assertEquals("openrouter-claude-3-sonnet", plan.primary().modelId());
        assertTrue(plan.skipped().stream().noneMatch(s -> s.reason() == SkipReason.COST_LIMIT));
    }

    @Test
    void openCircuitSkipsProvider() {
        circuitBreaker.recordFailure("groq");

        RoutePlan plan = engine(DeploymentMode.Kind.CLOUD).plan(RouteRequest.of(TaskCapability.REASONING, ExecutionMode.FAST));

        assertEquals("huggingface-mistral-7b", plan.primary().modelId());
        assertTrue(plan.candidates().stream().noneMatch(c -> c.provider().equals("groq")));
        assertEquals(2, plan.skipped().stream().filter(s -> s.reason() == SkipReason.CIRCUIT_OPEN).count());
    }

    @Test
    void unhealthyProvidersSinkStably() {
        health.put("groq", HealthState.DOWN);
        health.put("together", HealthState.DEGRADED);
        health.put("huggingface", HealthState.HEALTHY);

        RoutePlan plan = engine(DeploymentMode.Kind.CLOUD).plan(RouteRequest.of(TaskCapability.REASONING, ExecutionMode.FAST));

        assertEquals(List.of(
                "huggingface-mistral-7b",
                "openrouter-claude-3-sonnet",
                "openrouter-gpt4-turbo",
                "together-mixtral-8x7b",
                "groq-mixtral-8x7b",
                "groq-llama3-70b"
        ), modelIds(plan));
        assertEquals(HealthState.DOWN, plan.candidates().get(5).lastKnownHealth());
        assertNull(plan.candidates().get(1).lastKnownHealth());
    }

    @Test
    void everyCandidateSkippedIsTypedError() {
        NoRoutableCandidateException ex = assertThrows(NoRoutableCandidateException.class,
                () -> engine(DeploymentMode.Kind.LOCAL).plan(RouteRequest.of(TaskCapability.FACT_CHECKING, ExecutionMode.BALANCED)));

        assertEquals(1, ex.getSkipped().size());
        assertEquals(SkipReason.DEPLOYMENT_MODE, ex.getSkipped().get(0).reason());
    }

    @Test
    void unsupportedCapabilityPropagates() {
        assertThrows(NoCandidatesException.class,
                () -> engine(DeploymentMode.Kind.HYBRID).plan(RouteRequest.of(TaskCapability.VERIFICATION, ExecutionMode.FAST)));
    }

    @Test
    void fallbackWalksPlanProvidersPastOpenCircuits() {
        RoutingEngine engine = engine(DeploymentMode.Kind.CLOUD);
        RoutePlan plan = engine.plan(RouteRequest.of(TaskCapability.REASONING, ExecutionMode.FAST));
        assertEquals(List.of("groq", "huggingface", "together", "openrouter"), plan.providerOrder());

        assertEquals(Optional.of("huggingface"), engine.fallbackFor(plan, "groq"));

        circuitBreaker.recordFailure("huggingface");
        assertEquals(Optional.of("together"), engine.fallbackFor(plan, "groq"));
    }

    @Test
    void missingModeDefaultsToBalanced() {
        RoutePlan plan = engine(DeploymentMode.Kind.HYBRID).plan(new RouteRequest(TaskCapability.REASONING, null, null, null));

        assertEquals(ExecutionMode.BALANCED, plan.mode());
        assertEquals("groq-llama3-70b", plan.primary().modelId());
    }

    private RoutingEngine engine(DeploymentMode.Kind kind) {
        return new RoutingEngine(policy, circuitBreaker, healthReader, new DeploymentMode(kind));
    }

    private static List<String> modelIds(RoutePlan plan) {
        return plan.candidates().stream().map(RouteCandidate::modelId).toList();
    }
}
