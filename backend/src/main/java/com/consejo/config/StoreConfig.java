/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.config;

import com.consejo.infrastructure.store.InMemorySharedStore;
import com.consejo.infrastructure.store.RedisSharedStore;
import com.consejo.infrastructure.store.SharedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
public class StoreConfig {
    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    /**
     * Redis when {@code app.store.backend=redis} and a template is available, otherwise an in-process
     * store (single instance only).
     */
    @Bean
    public SharedStore sharedStore(AppProperties properties, ObjectProvider<StringRedisTemplate> redisTemplate, Clock clock) {
        if ("redis".equalsIgnoreCase(properties.store().backend())) {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template != null) {
                log.info("Shared store backend=redis");
                return new RedisSharedStore(template);
            }
            log.warn("app.store.backend=redis but no StringRedisTemplate is available; using memory store");
        }
        log.info("Shared store backend=memory");
        return new InMemorySharedStore(clock);
    }
}
