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
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static lookup from execution mode to its preset, plus the ranked candidate list a mode yields for a
 * capability. Presets are validated once, at construction.
 */
@Component
public class ExecutionModePolicy {
    private final Map<ExecutionMode, ExecutionModeConfig> configs;
    private final ModelRegistry modelRegistry;
    private final RankWeights rankWeights;

    @Autowired
    public ExecutionModePolicy(ModelRegistry modelRegistry) {
        this(modelRegistry, ExecutionModePresets.defaults(), RankWeights.defaults());
    }

    public ExecutionModePolicy(ModelRegistry modelRegistry, List<ExecutionModeConfig> presets, RankWeights rankWeights) {
        this.modelRegistry = modelRegistry;
        this.rankWeights = rankWeights == null ? RankWeights.defaults() : rankWeights;
        EnumMap<ExecutionMode, ExecutionModeConfig> byMode = new EnumMap<>(ExecutionMode.class);
        for (ExecutionModeConfig preset : presets) {
            if (byMode.putIfAbsent(preset.mode(), preset) != null) {
                throw new IllegalStateException("Duplicate preset for mode=" + preset.mode().key());
            }
        }
        for (ExecutionMode mode : ExecutionMode.values()) {
            if (!byMode.containsKey(mode)) {
                throw new IllegalStateException("Missing preset for mode=" + mode.key());
            }
        }
        validateOrdering(byMode);
        validatePreferredModels(byMode, modelRegistry);
        this.configs = Collections.unmodifiableMap(byMode);
    }

    public ExecutionModeConfig config(ExecutionMode mode) {
        if (mode == null) throw new UnknownExecutionModeException(null);
        return configs.get(mode);
    }

    public ExecutionModeConfig config(String modeName) {
        return config(resolve(modeName));
    }

    public ExecutionMode resolve(String modeName) {
        return ExecutionMode.fromKey(modeName).orElseThrow(() -> new UnknownExecutionModeException(modeName));
    }

    public List<ExecutionModeConfig> all() {
        return List.copyOf(configs.values());
    }

    public List<String> preferredModels(ExecutionMode mode) {
        return config(mode).preferredModels();
    }

    public Optional<BigDecimal> costLimit(ExecutionMode mode) {
        return Optional.ofNullable(config(mode).costLimit());
    }

    public boolean arbitrationEnabled(ExecutionMode mode) {
        return config(mode).enableArbitration();
    }

    public int maxParallelExecutions(ExecutionMode mode) {
        return config(mode).maxParallelExecutions();
    }

    public double accuracyRequirement(ExecutionMode mode) {
        return config(mode).accuracyRequirement();
    }

    public Duration timeout(ExecutionMode mode) {
        return config(mode).timeout();
    }

    public int maxRetries(ExecutionMode mode) {
        return config(mode).maxRetries();
    }

    /**
     * Preferred models supporting {@code capability} in preferred order, then the remaining supporting
     * models ordered by the mode's fallback strategy.
     *
     * @throws NoCandidatesException when no registered model supports the capability
     */
    public List<ModelRecord> rankedCandidates(ExecutionMode mode, TaskCapability capability) {
        ExecutionModeConfig cfg = config(mode);
        List<ModelRecord> supporting = modelRegistry.recordsForCapability(capability);
        if (supporting.isEmpty()) {
            throw new NoCandidatesException(capability);
        }

        Set<String> seen = new LinkedHashSet<>();
        List<ModelRecord> ranked = new ArrayList<>();
        for (String preferred : cfg.preferredModels()) {
            modelRegistry.find(preferred)
                    .filter(m -> m.supports(capability))
                    .filter(m -> seen.add(m.id()))
                    .ifPresent(ranked::add);
        }

        List<ModelRecord> rest = supporting.stream().filter(m -> !seen.contains(m.id())).toList();
        ranked.addAll(orderByStrategy(rest, supporting, cfg.fallbackStrategy()));
        return List.copyOf(ranked);
    }

    List<ModelRecord> orderByStrategy(List<ModelRecord> models, List<ModelRecord> population, FallbackStrategy strategy) {
        List<ModelRecord> sorted = new ArrayList<>(models);
        switch (strategy) {
            case CHEAPEST -> sorted.sort(Comparator.comparingDouble(ModelRecord::unitCost));
            case HIGHEST_QUALITY -> sorted.sort(Comparator.comparingDouble(ModelRecord::reliabilityScore).reversed());
            case AUTOMATIC -> {
                Map<String, Double> scores = automaticScores(population);
                sorted.sort(Comparator.comparingDouble((ModelRecord m) -> scores.get(m.id())).reversed());
            }
        }
        return sorted;
    }

    // Higher is better. Cheapness and speed are min-max normalized within the population.
    private Map<String, Double> automaticScores(List<ModelRecord> population) {
        double minCost = population.stream().mapToDouble(ModelRecord::unitCost).min().orElse(0);
        double maxCost = population.stream().mapToDouble(ModelRecord::unitCost).max().orElse(0);
        double minLatency = population.stream().mapToDouble(m -> m.averageLatency().toMillis()).min().orElse(0);
        double maxLatency = population.stream().mapToDouble(m -> m.averageLatency().toMillis()).max().orElse(0);

        Map<String, Double> scores = new HashMap<>();
        for (ModelRecord m : population) {
            double cheapness = 1.0 - normalize(m.unitCost(), minCost, maxCost);
            double speed = 1.0 - normalize(m.averageLatency().toMillis(), minLatency, maxLatency);
            double score = rankWeights.reliability() * m.reliabilityScore()
                    + rankWeights.cheapness() * cheapness
                    + rankWeights.speed() * speed;
            scores.put(m.id(), score);
        }
        return scores;
    }

    private static double normalize(double value, double min, double max) {
        if (max - min <= 0) return 0;
        return (value - min) / (max - min);
    }

    private static void validateOrdering(Map<ExecutionMode, ExecutionModeConfig> byMode) {
        ExecutionModeConfig fast = byMode.get(ExecutionMode.FAST);
        ExecutionModeConfig balanced = byMode.get(ExecutionMode.BALANCED);
        ExecutionModeConfig best = byMode.get(ExecutionMode.BEST_QUALITY);

        if (!(fast.maxParallelExecutions() <= balanced.maxParallelExecutions()
                && balanced.maxParallelExecutions() <= best.maxParallelExecutions())) {
            throw new IllegalStateException("maxParallelExecutions must satisfy fast <= balanced <= best_quality");
        }
        if (!(fast.accuracyRequirement() <= balanced.accuracyRequirement()
                && balanced.accuracyRequirement() <= best.accuracyRequirement())) {
            throw new IllegalStateException("accuracyRequirement must satisfy fast <= balanced <= best_quality");
        }
        if (fast.hasCostLimit()) {
            for (ExecutionModeConfig other : List.of(balanced, best)) {
                if (other.hasCostLimit() && fast.costLimit().compareTo(other.costLimit()) >= 0) {
                    throw new IllegalStateException("fast cost limit must be strictly below " + other.mode().key());
                }
            }
        }
        if (balanced.hasCostLimit() && best.hasCostLimit() && balanced.costLimit().compareTo(best.costLimit()) > 0) {
            throw new IllegalStateException("balanced cost limit must not exceed best_quality");
        }
    }

    private static void validatePreferredModels(Map<ExecutionMode, ExecutionModeConfig> byMode, ModelRegistry registry) {
        for (ExecutionModeConfig cfg : byMode.values()) {
            for (String modelId : cfg.preferredModels()) {
                if (!registry.contains(modelId)) {
                    throw new IllegalStateException("Preset " + cfg.mode().key() + " prefers unknown model " + modelId);
                }
            }
        }
    }
}
