/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.ratelimit;

public enum CallerTier {
    ADMIN,
    AUTHENTICATED,
    DEMO;

    public static CallerTier of(boolean demo, boolean admin) {
        if (admin) return ADMIN;
        return demo ? DEMO : AUTHENTICATED;
    }
}
