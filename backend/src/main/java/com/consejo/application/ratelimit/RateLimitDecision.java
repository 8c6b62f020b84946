/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.ratelimit;

/**
 * @param resetAt epoch seconds at which the current window ends
 */
public record RateLimitDecision(
        boolean allowed,
        int limit,
        long remaining,
        long resetAt
) {
    public long retryAfterSeconds(long nowEpochSeconds) {
        return Math.max(0, resetAt - nowEpochSeconds);
    }
}
