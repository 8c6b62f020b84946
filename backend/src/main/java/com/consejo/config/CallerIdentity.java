/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.config;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Who a request counts against. Authenticated callers arrive with gateway headers; anyone else is a
 * demo caller keyed by client address.
 */
public record CallerIdentity(String identifier, boolean demo, boolean admin) {
    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";
    public static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    public static CallerIdentity resolve(HttpServletRequest request) {
        String userId = request.getHeader(USER_ID_HEADER);
        if (userId != null && !userId.isBlank()) {
            boolean admin = "admin".equalsIgnoreCase(trimToEmpty(request.getHeader(USER_ROLE_HEADER)));
            return new CallerIdentity(userId.trim(), false, admin);
        }
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (forwarded != null && !forwarded.isBlank()) {
            String firstHop = forwarded.split(",")[0].trim();
            if (!firstHop.isEmpty()) {
                return new CallerIdentity(firstHop, true, false);
            }
        }
        String remote = request.getRemoteAddr();
        return new CallerIdentity(remote == null || remote.isBlank() ? "unknown" : remote, true, false);
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
