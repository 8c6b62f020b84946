/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.infrastructure.provider;

/**
 * Why a call to a provider endpoint produced no usable answer.
 */
public enum ProviderErrorType {
    /** No response within the allotted time. */
    TIMEOUT,
    /** Connection refused, DNS failure or no endpoint configured. */
    UNREACHABLE,
    UNKNOWN;

    public boolean isTimeout() {
        return this == TIMEOUT;
    }
}
