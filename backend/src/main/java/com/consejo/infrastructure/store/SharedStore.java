/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.infrastructure.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared counting/caching store keyed by string. Counters and cached values expire on their own.
 */
public interface SharedStore {
    Optional<String> get(String key);

    /**
     * Increments {@code key} only if its current value is below {@code limit}, refreshing the expiry to
     * {@code ttl}. Read, compare, increment and expire happen as a single atomic step.
     */
    CounterUpdate incrementIfBelow(String key, long limit, Duration ttl);

    long incrementWithExpiry(String key, Duration ttl);

    void set(String key, String value, Duration ttl);

    void delete(String key);
}
