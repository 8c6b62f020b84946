/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ConsejoRouterApplication {
    public static void main(String[] args) {
        SpringApplication.run(ConsejoRouterApplication.class, args);
    }
}
