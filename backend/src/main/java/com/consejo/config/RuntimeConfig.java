/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class RuntimeConfig {
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Never smaller than the number of configured providers: a full health sweep runs every probe at once.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService healthProbeExecutor(AppProperties properties) {
        return Executors.newFixedThreadPool(probePoolSize(properties));
    }

    static int probePoolSize(AppProperties properties) {
        int providers = properties.providers().endpoints().size();
        return Math.max(2, Math.max(providers, properties.health().poolSize()));
    }
}
