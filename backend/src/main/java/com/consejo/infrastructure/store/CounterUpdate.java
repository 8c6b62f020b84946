/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.infrastructure.store;

/**
 * @param incremented whether the counter was bumped
 * @param count       value after the operation (unchanged value when not incremented)
 */
public record CounterUpdate(boolean incremented, long count) {
    public long countBefore() {
        return incremented ? count - 1 : count;
    }
}
