/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.infrastructure.provider;

/**
 * Failure talking to a provider. {@link #getSafeMessage()} never carries credentials or response bodies
 * and may be shown to callers.
 */
public class ProviderException extends RuntimeException {
    private final String provider;
    private final ProviderErrorType type;
    private final String safeMessage;

    public ProviderException(String provider, ProviderErrorType type, String safeMessage, Throwable cause) {
        super(provider + ": " + safeMessage, cause);
        this.provider = provider;
        this.type = type;
        this.safeMessage = safeMessage;
    }

    public ProviderException(String provider, ProviderErrorType type, String safeMessage) {
        this(provider, type, safeMessage, null);
    }

    public static ProviderException timeout(String provider, Throwable cause) {
        return new ProviderException(provider, ProviderErrorType.TIMEOUT, "Request timeout", cause);
    }

    public static ProviderException unreachable(String provider, String safeMessage, Throwable cause) {
        return new ProviderException(provider, ProviderErrorType.UNREACHABLE, safeMessage, cause);
    }

    public String getProvider() {
        return provider;
    }

    public ProviderErrorType getType() {
        return type;
    }

    public String getSafeMessage() {
        return safeMessage;
    }
}
