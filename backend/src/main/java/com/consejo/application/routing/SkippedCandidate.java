/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.routing;

public record SkippedCandidate(String modelId, String provider, SkipReason reason) {}
