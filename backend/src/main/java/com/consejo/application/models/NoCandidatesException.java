/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.models;

import com.consejo.domain.model.TaskCapability;

/**
 * No registered model serves the capability. This is a catalog problem, not a transient one.
 */
public class NoCandidatesException extends RuntimeException {
    private final TaskCapability capability;

    public NoCandidatesException(TaskCapability capability) {
        super("No models found for task type: " + capability);
        this.capability = capability;
    }

    public TaskCapability getCapability() {
        return capability;
    }
}
