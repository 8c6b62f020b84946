/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.api;

public record ApiErrorResponse(
        String error,
        String code,
        String message,
        String requestId
) {}
