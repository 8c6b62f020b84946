/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.models;

import com.consejo.domain.model.TaskCapability;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;

import static com.consejo.domain.model.TaskCapability.CODE_GENERATION;
import static com.consejo.domain.model.TaskCapability.CREATIVE_OUTPUT;
import static com.consejo.domain.model.TaskCapability.DEBUGGING;
import static com.consejo.domain.model.TaskCapability.FACT_CHECKING;
import static com.consejo.domain.model.TaskCapability.REASONING;
import static com.consejo.domain.model.TaskCapability.RESEARCH;

/**
 * Catálogo estático de modelos. Costes en USD por token.
 */
public final class ModelCatalog {
    private ModelCatalog() {
    }

    public static List<ModelRecord> defaults() {
        return List.of(
                cloud("groq-llama3-70b", "groq", "llama3-70b-8192",
                        EnumSet.of(REASONING, RESEARCH, CODE_GENERATION),
                        0.00000059, 0.00000079, 500, 8192, 0.95),
                cloud("groq-mixtral-8x7b", "groq", "mixtral-8x7b-32768",
                        EnumSet.of(REASONING, CREATIVE_OUTPUT),
                        0.00000027, 0.00000027, 400, 32768, 0.93),
                cloud("together-mixtral-8x7b", "together", "mistralai/Mixtral-8x7B-Instruct-v0.1",
                        EnumSet.of(REASONING, CODE_GENERATION),
                        0.0000006, 0.0000006, 1200, 32768, 0.92),
                cloud("together-llama2-70b", "together", "meta-llama/Llama-2-70b-chat-hf",
                        EnumSet.of(RESEARCH, CREATIVE_OUTPUT),
                        0.0000009, 0.0000009, 1500, 4096, 0.90),
                cloud("openrouter-claude-3-sonnet", "openrouter", "anthropic/claude-3-sonnet",
                        EnumSet.of(REASONING, RESEARCH, CODE_GENERATION, FACT_CHECKING),
                        0.000003, 0.000015, 2000, 200000, 0.98),
                cloud("openrouter-gpt4-turbo", "openrouter", "openai/gpt-4-turbo",
                        EnumSet.of(REASONING, CODE_GENERATION, DEBUGGING),
                        0.00001, 0.00003, 3000, 128000, 0.97),
                cloud("huggingface-mistral-7b", "huggingface", "mistralai/Mistral-7B-Instruct-v0.2",
                        EnumSet.of(REASONING, CREATIVE_OUTPUT),
                        0.0000002, 0.0000002, 2500, 32768, 0.85),
                local("ollama-llama2", "llama2",
                        EnumSet.of(REASONING, RESEARCH, CREATIVE_OUTPUT),
                        3000, 4096, 0.85),
                local("ollama-mistral", "mistral",
                        EnumSet.of(REASONING, CODE_GENERATION, CREATIVE_OUTPUT),
                        2500, 8192, 0.87),
                local("ollama-codellama", "codellama",
                        EnumSet.of(CODE_GENERATION, DEBUGGING),
                        3500, 4096, 0.83)
        );
    }

    private static ModelRecord cloud(String id, String provider, String remoteName, EnumSet<TaskCapability> caps,
                                     double costIn, double costOut, long latencyMs, int maxContext, double reliability) {
        return new ModelRecord(id, provider, remoteName, caps, costIn, costOut,
                Duration.ofMillis(latencyMs), maxContext, reliability, false);
    }

    // Local models run on our own hardware: no per-token cost.
    private static ModelRecord local(String id, String remoteName, EnumSet<TaskCapability> caps,
                                     long latencyMs, int maxContext, double reliability) {
        return new ModelRecord(id, "ollama", remoteName, caps, 0.0, 0.0,
                Duration.ofMillis(latencyMs), maxContext, reliability, true);
    }
}
