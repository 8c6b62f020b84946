/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.infrastructure.store;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public class RedisSharedStore implements SharedStore {
    // KEYS[1]=counter, ARGV[1]=limit, ARGV[2]=ttl seconds.
    // Returns the new count when incremented, or -(current + 1) when already at the limit.
    private static final String INCREMENT_IF_BELOW = """
            local current = tonumber(redis.call('GET', KEYS[1]) or '0')
            if current >= tonumber(ARGV[1]) then
              return -(current + 1)
            end
            local next = redis.call('INCR', KEYS[1])
            redis.call('EXPIRE', KEYS[1], tonumber(ARGV[2]))
            return next
            """;

    private static final String INCREMENT_WITH_EXPIRY = """
            local next = redis.call('INCR', KEYS[1])
            redis.call('EXPIRE', KEYS[1], tonumber(ARGV[1]))
            return next
            """;

    private static final RedisScript<Long> INCREMENT_IF_BELOW_SCRIPT = new DefaultRedisScript<>(INCREMENT_IF_BELOW, Long.class);
    private static final RedisScript<Long> INCREMENT_WITH_EXPIRY_SCRIPT = new DefaultRedisScript<>(INCREMENT_WITH_EXPIRY, Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisSharedStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public CounterUpdate incrementIfBelow(String key, long limit, Duration ttl) {
        Long reply = redisTemplate.execute(
                INCREMENT_IF_BELOW_SCRIPT,
                List.of(key),
                String.valueOf(limit),
                String.valueOf(ttlSeconds(ttl))
        );
        if (reply == null || reply == 0L) {
            throw new IllegalStateException("Unexpected reply from counter script for key=" + key);
        }
        return reply > 0 ? new CounterUpdate(true, reply) : new CounterUpdate(false, -reply - 1);
    }

    @Override
    public long incrementWithExpiry(String key, Duration ttl) {
        Long next = redisTemplate.execute(INCREMENT_WITH_EXPIRY_SCRIPT, List.of(key), String.valueOf(ttlSeconds(ttl)));
        if (next == null) {
            throw new IllegalStateException("Unexpected reply from increment script for key=" + key);
        }
        return next;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
    }

    private static long ttlSeconds(Duration ttl) {
        return Math.max(1L, ttl == null ? 1L : ttl.toSeconds());
    }
}
