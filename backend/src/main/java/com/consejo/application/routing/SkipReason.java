/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.routing;

public enum SkipReason {
    DEPLOYMENT_MODE,
    COST_LIMIT,
    CIRCUIT_OPEN
}
