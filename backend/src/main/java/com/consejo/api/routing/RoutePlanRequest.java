/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.api.routing;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record RoutePlanRequest(
        @NotBlank String capability,
        String mode,
        @PositiveOrZero Long expectedInputUnits,
        @PositiveOrZero Long expectedOutputUnits
) {}
