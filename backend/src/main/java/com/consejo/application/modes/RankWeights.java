/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.modes;

/**
 * Weights of the AUTOMATIC fallback ranking. Each term is normalized to [0,1] within the candidate set.
 */
public record RankWeights(
        double reliability,
        double cheapness,
        double speed
) {
    public static RankWeights defaults() {
        return new RankWeights(0.50, 0.25, 0.25);
    }
}
