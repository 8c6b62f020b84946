/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.infrastructure.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local store for single-node deployments and tests. Expired entries are dropped on access
 * and, every {@code sweepInterval} writes, in one pass over the whole map. Counter keys of a past
 * window are never accessed again.
 */
public class InMemorySharedStore implements SharedStore {
    static final int DEFAULT_SWEEP_INTERVAL = 256;

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong writes = new AtomicLong();
    private final Clock clock;
    private final int sweepInterval;

    public InMemorySharedStore(Clock clock) {
        this(clock, DEFAULT_SWEEP_INTERVAL);
    }

    InMemorySharedStore(Clock clock, int sweepInterval) {
        if (sweepInterval < 1) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
        this.clock = clock;
        this.sweepInterval = sweepInterval;
    }

    @Override
    public Optional<String> get(String key) {
        Instant now = clock.instant();
        Entry entry = entries.get(key);
        if (entry == null) return Optional.empty();
        synchronized (entry) {
            if (entry.isExpired(now)) {
                entry.removed = true;
                entries.remove(key, entry);
                return Optional.empty();
            }
            return Optional.ofNullable(entry.value);
        }
    }

    @Override
    public CounterUpdate incrementIfBelow(String key, long limit, Duration ttl) {
        sweepIfDue();
        while (true) {
            Instant now = clock.instant();
            Entry entry = entries.computeIfAbsent(key, k -> new Entry("0", now.plus(ttl)));
            synchronized (entry) {
                if (entry.removed) continue;
                if (entry.isExpired(now)) {
                    entry.value = "0";
                }
                long current = parse(entry.value);
                if (current >= limit) {
                    return new CounterUpdate(false, current);
                }
                long next = current + 1;
                entry.value = Long.toString(next);
                entry.expiresAt = now.plus(ttl);
                return new CounterUpdate(true, next);
            }
        }
    }

    @Override
    public long incrementWithExpiry(String key, Duration ttl) {
        return incrementIfBelow(key, Long.MAX_VALUE, ttl).count();
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        sweepIfDue();
        Entry fresh = new Entry(value, clock.instant().plus(ttl));
        Entry previous = entries.put(key, fresh);
        markRemoved(previous);
    }

    @Override
    public void delete(String key) {
        markRemoved(entries.remove(key));
    }

    int size() {
        return entries.size();
    }

    /**
     * Drops every expired entry. Returns how many were removed.
     */
    int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, Entry> mapping : entries.entrySet()) {
            Entry entry = mapping.getValue();
            synchronized (entry) {
                if (!entry.removed && entry.isExpired(now) && entries.remove(mapping.getKey(), entry)) {
                    entry.removed = true;
                    removed++;
                }
            }
        }
        return removed;
    }

    private void sweepIfDue() {
        if (writes.incrementAndGet() % sweepInterval == 0) {
            purgeExpired();
        }
    }

    private static void markRemoved(Entry entry) {
        if (entry == null) return;
        synchronized (entry) {
            entry.removed = true;
        }
    }

    private static long parse(String value) {
        if (value == null || value.isBlank()) return 0L;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Stored value is not a counter: " + value, e);
        }
    }

    private static final class Entry {
        private String value;
        private Instant expiresAt;
        private boolean removed;

        private Entry(String value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
