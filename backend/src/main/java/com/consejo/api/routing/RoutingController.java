/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.api.routing;

import com.consejo.application.modes.ExecutionModeConfig;
import com.consejo.application.modes.ExecutionModePolicy;
import com.consejo.application.routing.RoutePlan;
import com.consejo.application.routing.RouteRequest;
import com.consejo.application.routing.RoutingEngine;
import com.consejo.domain.model.ExecutionMode;
import com.consejo.domain.model.TaskCapability;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/routing")
public class RoutingController {
    private final RoutingEngine routingEngine;
    private final ExecutionModePolicy modePolicy;

    public RoutingController(RoutingEngine routingEngine, ExecutionModePolicy modePolicy) {
        this.routingEngine = routingEngine;
        this.modePolicy = modePolicy;
    }

    @PostMapping("/plan")
    public RoutePlan plan(@Valid @RequestBody RoutePlanRequest req) {
        TaskCapability capability = TaskCapability.parse(req.capability());
        ExecutionMode mode = req.mode() == null || req.mode().isBlank()
                ? ExecutionMode.BALANCED
                : modePolicy.resolve(req.mode());
        return routingEngine.plan(new RouteRequest(capability, mode, req.expectedInputUnits(), req.expectedOutputUnits()));
    }

    @GetMapping("/modes")
    public List<ExecutionModeConfig> modes() {
        return modePolicy.all();
    }

    @GetMapping("/modes/{mode}")
    public ExecutionModeConfig mode(@PathVariable("mode") String mode) {
        return modePolicy.config(mode);
    }
}
