/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.routing;

import com.consejo.domain.model.ExecutionMode;
import com.consejo.domain.model.TaskCapability;

import java.util.List;

public class NoRoutableCandidateException extends RuntimeException {
    private final TaskCapability capability;
    private final ExecutionMode mode;
    private final List<SkippedCandidate> skipped;

    public NoRoutableCandidateException(TaskCapability capability, ExecutionMode mode, List<SkippedCandidate> skipped) {
        super("No routable model for task type " + capability + " in mode " + mode.key()
                + " (" + skipped.size() + " skipped)");
        this.capability = capability;
        this.mode = mode;
        this.skipped = List.copyOf(skipped);
    }

    public TaskCapability getCapability() {
        return capability;
    }

    public ExecutionMode getMode() {
        return mode;
    }

    public List<SkippedCandidate> getSkipped() {
        return skipped;
    }
}
