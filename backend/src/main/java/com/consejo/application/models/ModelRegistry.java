/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.models;

import com.consejo.domain.model.TaskCapability;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only catalog of callable models, in catalog order.
 */
@Component
public class ModelRegistry {
    private final Map<String, ModelRecord> models;

    public ModelRegistry() {
        this(ModelCatalog.defaults());
    }

    public ModelRegistry(List<ModelRecord> records) {
        Map<String, ModelRecord> byId = new LinkedHashMap<>();
        for (ModelRecord record : records == null ? List.<ModelRecord>of() : records) {
            if (record == null) {
                throw new IllegalStateException("Model catalog contains null");
            }
            ModelRecord existing = byId.putIfAbsent(record.id(), record);
            if (existing != null) {
                throw new IllegalStateException("Duplicate model id=" + record.id());
            }
        }
        this.models = Collections.unmodifiableMap(byId);
    }

    public List<ModelRecord> all() {
        return List.copyOf(models.values());
    }

    public Optional<ModelRecord> find(String modelId) {
        if (modelId == null) return Optional.empty();
        return Optional.ofNullable(models.get(modelId));
    }

    public ModelRecord get(String modelId) {
        return find(modelId).orElseThrow(() -> new IllegalArgumentException("Unknown model: " + modelId));
    }

    public boolean contains(String modelId) {
        return modelId != null && models.containsKey(modelId);
    }

    public List<String> modelsForCapability(TaskCapability capability) {
        return recordsForCapability(capability).stream().map(ModelRecord::id).toList();
    }

    public List<ModelRecord> recordsForCapability(TaskCapability capability) {
        return models.values().stream()
                .filter(m -> m.supports(capability))
                .toList();
    }

    public String cheapestForCapability(TaskCapability capability) {
        return pick(capability, Comparator.comparingDouble(ModelRecord::unitCost));
    }

    public String fastestForCapability(TaskCapability capability) {
        return pick(capability, Comparator.comparing(ModelRecord::averageLatency));
    }

    public String bestQualityForCapability(TaskCapability capability) {
        return pick(capability, Comparator.comparingDouble(ModelRecord::reliabilityScore).reversed());
    }

    public List<String> cloudModels() {
        return models.values().stream().filter(m -> !m.localOnly()).map(ModelRecord::id).toList();
    }

    public List<String> localModels() {
        return models.values().stream().filter(ModelRecord::localOnly).map(ModelRecord::id).toList();
    }

    public boolean isLocal(String modelId) {
        return find(modelId).map(ModelRecord::localOnly).orElse(false);
    }

    public double estimateCost(String modelId, long inputUnits, long outputUnits) {
        return get(modelId).estimateCost(inputUnits, outputUnits);
    }

    // First minimum in catalog order wins ties.
    private String pick(TaskCapability capability, Comparator<ModelRecord> order) {
        ModelRecord best = null;
        for (ModelRecord candidate : recordsForCapability(capability)) {
            if (best == null || order.compare(candidate, best) < 0) {
                best = candidate;
            }
        }
        if (best == null) {
            throw new NoCandidatesException(capability);
        }
        return best.id();
    }
}
