/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.ratelimit;

import com.consejo.config.AppProperties;
import com.consejo.infrastructure.store.CounterUpdate;
import com.consejo.infrastructure.store.SharedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Fixed-window quota per caller. Windows are aligned to multiples of {@code windowSeconds} since the
 * epoch, so a caller can spend up to twice its limit across a window boundary.
 */
@Service
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);
    private static final String KEY_PREFIX = "rate_limit:";

    private final SharedStore store;
    private final Clock clock;
    private final AppProperties.RateLimit properties;

    public RateLimiter(SharedStore store, Clock clock, AppProperties properties) {
        this.store = store;
        this.clock = clock;
        this.properties = properties.rateLimit();
    }

    public RateLimitDecision checkLimit(String identifier, boolean demo, boolean admin) {
        int limit = limitFor(CallerTier.of(demo, admin));
        long windowStart = windowStart();
        long resetAt = windowStart + windowSeconds();
        String key = key(identifier, demo, windowStart);

        CounterUpdate update = store.incrementIfBelow(key, limit, Duration.ofSeconds(windowSeconds()));
        if (!update.incremented()) {
            log.debug("Rate limit exceeded identifier={} demo={} admin={} count={}", identifier, demo, admin, update.count());
            return new RateLimitDecision(false, limit, 0, resetAt);
        }
        long remaining = Math.max(0, limit - update.countBefore() - 1);
        return new RateLimitDecision(true, limit, remaining, resetAt);
    }

    /**
     * Same as {@link #checkLimit} but throws when the caller is over quota.
     */
    public RateLimitDecision acquire(String identifier, boolean demo, boolean admin) {
        RateLimitDecision decision = checkLimit(identifier, demo, admin);
        if (!decision.allowed()) {
            throw new QuotaExceededException(decision, decision.retryAfterSeconds(clock.instant().getEpochSecond()));
        }
        return decision;
    }

    public RateLimitUsage getCurrentUsage(String identifier, boolean demo) {
        long windowStart = windowStart();
        long count = store.get(key(identifier, demo, windowStart))
                .map(RateLimiter::parseCount)
                .orElse(0L);
        return new RateLimitUsage(identifier, demo, count, windowStart + windowSeconds());
    }

    /**
     * Drops the caller's counter for the current window. Never throws; store failures are logged.
     */
    public void resetLimit(String identifier, boolean demo) {
        if (identifier == null || identifier.isBlank()) {
            log.warn("Ignoring rate limit reset for blank identifier");
            return;
        }
        try {
            store.delete(key(identifier, demo, windowStart()));
            log.info("Rate limit reset identifier={} demo={}", identifier, demo);
        } catch (RuntimeException e) {
            log.error("Rate limit reset failed identifier={} demo={}", identifier, demo, e);
        }
    }

    public int limitFor(CallerTier tier) {
        return switch (tier) {
            case ADMIN -> properties.adminLimit();
            case AUTHENTICATED -> properties.authenticatedLimit();
            case DEMO -> properties.demoLimit();
        };
    }

    public int windowSeconds() {
        return Math.max(1, properties.windowSeconds());
    }

    long windowStart() {
        long now = clock.instant().getEpochSecond();
        return now - (now % windowSeconds());
    }

    String key(String identifier, boolean demo, long windowStart) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("rate limit identifier is required");
        }
        return demo
                ? KEY_PREFIX + "demo:" + identifier + ":hour:" + windowStart
                : KEY_PREFIX + identifier + ":hour:" + windowStart;
    }

    private static long parseCount(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non numeric rate counter value={}", value);
            return 0L;
        }
    }
}
