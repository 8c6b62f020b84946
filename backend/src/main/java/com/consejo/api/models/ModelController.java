/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.api.models;

import com.consejo.application.models.ModelRecord;
import com.consejo.application.models.ModelRegistry;
import com.consejo.domain.model.TaskCapability;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

@RestController
@RequestMapping("/api/models")
public class ModelController {
    private final ModelRegistry modelRegistry;

    public ModelController(ModelRegistry modelRegistry) {
        this.modelRegistry = modelRegistry;
    }

    /**
     * @param scope {@code all} (default), {@code cloud} or {@code local}
     */
    @GetMapping
    public List<ModelRecord> list(
            @RequestParam(value = "capability", required = false) String capability,
            @RequestParam(value = "scope", required = false, defaultValue = "all") String scope
    ) {
        Stream<ModelRecord> models = capability == null || capability.isBlank()
                ? modelRegistry.all().stream()
                : modelRegistry.recordsForCapability(TaskCapability.parse(capability)).stream();

        return switch (scope.trim().toLowerCase(Locale.ROOT)) {
            case "all" -> models.toList();
            case "cloud" -> models.filter(m -> !m.localOnly()).toList();
            case "local" -> models.filter(ModelRecord::localOnly).toList();
            default -> throw new IllegalArgumentException("Unknown scope: " + scope);
        };
    }
}
