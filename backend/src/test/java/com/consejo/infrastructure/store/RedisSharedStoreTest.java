/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.infrastructure.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisSharedStoreTest {
    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisSharedStore store;

    @BeforeEach
    void setUp() {
        store = new RedisSharedStore(redisTemplate);
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void incrementIfBelowPassesLimitAndTtlToScript() {
        when(redisTemplate.execute(any(RedisScript.class), eq(List.of("rate_limit:u:hour:0")), eq("100"), eq("3600")))
                .thenReturn(7L);

        CounterUpdate update = store.incrementIfBelow("rate_limit:u:hour:0", 100, Duration.ofHours(1));

        assertTrue(update.incremented());
        assertEquals(7, update.count());
        assertEquals(6, update.countBefore());
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void rejectedIncrementReportsCurrentCount() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any()))
                .thenReturn(-4L);

        CounterUpdate update = store.incrementIfBelow("k", 3, Duration.ofSeconds(10));

        assertFalse(update.incremented());
        assertEquals(3, update.count());
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void rejectedIncrementAtZeroLimitReportsZero() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any())).thenReturn(-1L);

        CounterUpdate update = store.incrementIfBelow("k", 0, Duration.ofSeconds(10));

        assertFalse(update.incremented());
        assertEquals(0, update.count());
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void unexpectedScriptReplyFails() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any())).thenReturn(null);

        assertThrows(IllegalStateException.class, () -> store.incrementIfBelow("k", 3, Duration.ofSeconds(10)));
    }

    @Test
    void setWritesValueWithTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        store.set("provider:health:groq", "{}", Duration.ofSeconds(60));

        verify(valueOperations).set("provider:health:groq", "{}", Duration.ofSeconds(60));
    }

    @Test
    void getReadsValue() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("k")).thenReturn("v");

        assertEquals(Optional.of("v"), store.get("k"));
    }
}
