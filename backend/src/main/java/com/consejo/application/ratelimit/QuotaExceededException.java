/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.ratelimit;

public class QuotaExceededException extends RuntimeException {
    private final RateLimitDecision decision;
    private final long retryAfterSeconds;

    public QuotaExceededException(RateLimitDecision decision, long retryAfterSeconds) {
        super("Rate limit exceeded");
        this.decision = decision;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public RateLimitDecision getDecision() {
        return decision;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
