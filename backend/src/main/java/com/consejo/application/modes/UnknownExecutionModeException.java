/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.modes;

public class UnknownExecutionModeException extends RuntimeException {
    private final String requestedMode;

    public UnknownExecutionModeException(String requestedMode) {
        super("Unknown execution mode: " + requestedMode);
        this.requestedMode = requestedMode;
    }

    public String getRequestedMode() {
        return requestedMode;
    }
}
