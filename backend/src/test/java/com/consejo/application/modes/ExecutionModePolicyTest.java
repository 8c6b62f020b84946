/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.modes;

import com.consejo.application.models.ModelRecord;
import com.consejo.application.models.ModelRegistry;
import com.consejo.application.models.NoCandidatesException;
import com.consejo.domain.model.ExecutionMode;
import com.consejo.domain.model.FallbackStrategy;
import com.consejo.domain.model.TaskCapability;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionModePolicyTest {
    private final ModelRegistry registry = new ModelRegistry();
    private final ExecutionModePolicy policy = new ExecutionModePolicy(registry);

    @Test
    void presetsScaleFromFastToBestQuality() {
        assertEquals(3, policy.maxParallelExecutions(ExecutionMode.FAST));
        assertEquals(5, policy.maxParallelExecutions(ExecutionMode.BALANCED));
        assertEquals(8, policy.maxParallelExecutions(ExecutionMode.BEST_QUALITY));

        assertFalse(policy.arbitrationEnabled(ExecutionMode.FAST));
        assertTrue(policy.arbitrationEnabled(ExecutionMode.BEST_QUALITY));

        assertEquals(Optional.of(new BigDecimal("1.00")), policy.costLimit(ExecutionMode.FAST));
        assertEquals(Optional.empty(), policy.costLimit(ExecutionMode.BEST_QUALITY));
        assertEquals(Duration.ofSeconds(120), policy.timeout(ExecutionMode.BEST_QUALITY));
        assertEquals(1, policy.maxRetries(ExecutionMode.FAST));
        assertEquals(0.95, policy.accuracyRequirement(ExecutionMode.BEST_QUALITY), 1e-9);
    }

    @Test
    void resolvesModesByWireName() {
        assertEquals(ExecutionMode.BEST_QUALITY, policy.resolve("best_quality"));
        assertEquals(ExecutionMode.FAST, policy.config("fast").mode());
        assertEquals(3, policy.all().size());
    }

    @Test
    void unknownModeIsTypedError() {
        UnknownExecutionModeException ex = assertThrows(UnknownExecutionModeException.class, () -> policy.resolve("turbo"));
        assertEquals("turbo", ex.getRequestedMode());
        assertThrows(UnknownExecutionModeException.class, () -> policy.config((ExecutionMode) null));
    }

    @Test
    void fastPrefersCheapModelsThenOrdersRestByCost() {
        List<String> ranked = ids(policy.rankedCandidates(ExecutionMode.FAST, TaskCapability.REASONING));

        assertEquals(List.of(
                "groq-mixtral-8x7b",
                "huggingface-mistral-7b",
                "together-mixtral-8x7b",
                "ollama-llama2",
                "ollama-mistral",
                "groq-llama3-70b",
                "openrouter-claude-3-sonnet",
                "openrouter-gpt4-turbo"
        ), ranked);
    }

    @Test
    void bestQualityOrdersRestByReliability() {
        List<String> ranked = ids(policy.rankedCandidates(ExecutionMode.BEST_QUALITY, TaskCapability.REASONING));

        assertEquals(List.of(
                "openrouter-claude-3-sonnet",
                "openrouter-gpt4-turbo",
                "groq-llama3-70b",
                "groq-mixtral-8x7b",
                "together-mixtral-8x7b",
                "ollama-mistral",
                "huggingface-mistral-7b",
                "ollama-llama2"
        ), ranked);
    }

    @Test
    void balancedBlendsReliabilityCostAndSpeed() {
        List<String> ranked = ids(policy.rankedCandidates(ExecutionMode.BALANCED, TaskCapability.REASONING));

        assertEquals(List.of(
                "groq-llama3-70b",
                "together-mixtral-8x7b",
                "groq-mixtral-8x7b",
                "ollama-mistral",
                "openrouter-claude-3-sonnet",
                "huggingface-mistral-7b",
                "ollama-llama2",
                "openrouter-gpt4-turbo"
        ), ranked);
    }

    @Test
    void preferredModelsLackingCapabilityAreLeftOut() {
        List<String> ranked = ids(policy.rankedCandidates(ExecutionMode.FAST, TaskCapability.FACT_CHECKING));
        assertEquals(List.of("openrouter-claude-3-sonnet"), ranked);
    }

    @Test
    void capabilityWithoutModelsThrows() {
        assertThrows(NoCandidatesException.class,
                () -> policy.rankedCandidates(ExecutionMode.BALANCED, TaskCapability.IMAGE_GENERATION));
    }

    @Test
    void rejectsFastCostLimitNotBelowOthers() {
        ExecutionModeConfig pricyFast = withCostLimit(ExecutionModePresets.fast(), new BigDecimal("5.00"));
        assertThrows(IllegalStateException.class, () -> new ExecutionModePolicy(
                registry,
                List.of(pricyFast, ExecutionModePresets.balanced(), ExecutionModePresets.bestQuality()),
                RankWeights.defaults()
        ));
    }

    @Test
    void rejectsMissingOrDuplicatePresets() {
        assertThrows(IllegalStateException.class, () -> new ExecutionModePolicy(
                registry, List.of(ExecutionModePresets.fast(), ExecutionModePresets.balanced()), RankWeights.defaults()));
        assertThrows(IllegalStateException.class, () -> new ExecutionModePolicy(
                registry,
                List.of(ExecutionModePresets.fast(), ExecutionModePresets.fast(), ExecutionModePresets.balanced(), ExecutionModePresets.bestQuality()),
                RankWeights.defaults()));
    }

    @Test
    void rejectsPreferredModelMissingFromRegistry() {
        ExecutionModeConfig fast = ExecutionModePresets.fast();
        ExecutionModeConfig broken = new ExecutionModeConfig(fast.mode(), fast.maxParallelExecutions(), fast.timeout(),
                fast.maxRetries(), fast.enableArbitration(), fast.enableSynthesis(), fast.accuracyRequirement(),
                fast.costLimit(), List.of("no-such-model"), FallbackStrategy.CHEAPEST);

        assertThrows(IllegalStateException.class, () -> new ExecutionModePolicy(
                registry,
                List.of(broken, ExecutionModePresets.balanced(), ExecutionModePresets.bestQuality()),
                RankWeights.defaults()
        ));
    }

    @Test
    void rejectsInvalidPresetValues() {
        assertThrows(IllegalArgumentException.class, () -> new ExecutionModeConfig(ExecutionMode.FAST, 0,
                Duration.ofSeconds(30), 1, false, true, 0.7, null, List.of(), FallbackStrategy.CHEAPEST));
        assertThrows(IllegalArgumentException.class, () -> new ExecutionModeConfig(ExecutionMode.FAST, 1,
                Duration.ofSeconds(30), 1, false, true, 1.5, null, List.of(), FallbackStrategy.CHEAPEST));
    }

    private static ExecutionModeConfig withCostLimit(ExecutionModeConfig c, BigDecimal limit) {
        return new ExecutionModeConfig(c.mode(), c.maxParallelExecutions(), c.timeout(), c.maxRetries(),
                c.enableArbitration(), c.enableSynthesis(), c.accuracyRequirement(), limit, c.preferredModels(),
                c.fallbackStrategy());
    }

    private static List<String> ids(List<ModelRecord> models) {
        return models.stream().map(ModelRecord::id).toList();
    }
}
