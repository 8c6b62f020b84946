/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.modes;

import com.consejo.domain.model.ExecutionMode;
import com.consejo.domain.model.FallbackStrategy;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

public final class ExecutionModePresets {
    private ExecutionModePresets() {
    }

    public static List<ExecutionModeConfig> defaults() {
        return List.of(fast(), balanced(), bestQuality());
    }

    // Few parallel calls, cheap models, no arbitration.
    static ExecutionModeConfig fast() {
        return new ExecutionModeConfig(
                ExecutionMode.FAST,
                3,
                Duration.ofSeconds(30),
                1,
                false,
                true,
                0.7,
                new BigDecimal("1.00"),
                List.of("groq-mixtral-8x7b", "huggingface-mistral-7b", "together-mixtral-8x7b"),
                FallbackStrategy.CHEAPEST
        );
    }

    static ExecutionModeConfig balanced() {
        return new ExecutionModeConfig(
                ExecutionMode.BALANCED,
                5,
                Duration.ofSeconds(60),
                3,
                true,
                true,
                0.8,
                new BigDecimal("5.00"),
                List.of("groq-llama3-70b", "together-mixtral-8x7b", "groq-mixtral-8x7b", "together-llama2-70b"),
                FallbackStrategy.AUTOMATIC
        );
    }

    static ExecutionModeConfig bestQuality() {
        return new ExecutionModeConfig(
                ExecutionMode.BEST_QUALITY,
                8,
                Duration.ofSeconds(120),
                5,
                true,
                true,
                0.95,
                null,
                List.of("openrouter-claude-3-sonnet", "openrouter-gpt4-turbo", "groq-llama3-70b", "together-llama2-70b"),
                FallbackStrategy.HIGHEST_QUALITY
        );
    }
}
