/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decide si se usan proveedores cloud, el Ollama local o ambos.
 */
@Component
public class DeploymentMode {
    public enum Kind {
        CLOUD,
        LOCAL,
        HYBRID
    }

    private static final List<String> CLOUD_PRIORITY = List.of("groq", "together", "openrouter", "huggingface");
    private static final List<String> LOCAL_PRIORITY = List.of("ollama");

    private final Kind kind;

    @Autowired
    public DeploymentMode(Environment env) {
        this(parse(firstNonBlank(env.getProperty("AI_DEPLOYMENT_MODE"), env.getProperty("app.deployment.mode"))));
    }

    public DeploymentMode(Kind kind) {
        this.kind = kind == null ? Kind.CLOUD : kind;
    }

    public Kind kind() {
        return kind;
    }

    public boolean usesCloudProviders() {
        return kind == Kind.CLOUD || kind == Kind.HYBRID;
    }

    public boolean usesLocalProviders() {
        return kind == Kind.LOCAL || kind == Kind.HYBRID;
    }

    public boolean allowsModel(boolean localOnly) {
        return localOnly ? usesLocalProviders() : usesCloudProviders();
    }

    public List<String> providerPriority() {
        return switch (kind) {
            case LOCAL -> LOCAL_PRIORITY;
            case CLOUD -> CLOUD_PRIORITY;
            case HYBRID -> {
                List<String> all = new ArrayList<>(CLOUD_PRIORITY);
                all.addAll(LOCAL_PRIORITY);
                yield List.copyOf(all);
            }
        };
    }

    // Unknown values fall back to cloud.
    static Kind parse(String value) {
        if (value == null || value.isBlank()) return Kind.CLOUD;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "local" -> Kind.LOCAL;
            case "hybrid" -> Kind.HYBRID;
            default -> Kind.CLOUD;
        };
    }

    private static String firstNonBlank(String primary, String fallback) {
        if (primary != null && !primary.isBlank()) return primary.trim();
        if (fallback != null && !fallback.isBlank()) return fallback.trim();
        return "";
    }
}
