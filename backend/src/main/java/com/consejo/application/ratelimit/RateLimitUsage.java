/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.ratelimit;

public record RateLimitUsage(
        String identifier,
        boolean demo,
        long count,
        long resetAt
) {}
