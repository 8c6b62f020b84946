/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.domain.model;

public enum FallbackStrategy {
    CHEAPEST,
    AUTOMATIC,
    HIGHEST_QUALITY
}
