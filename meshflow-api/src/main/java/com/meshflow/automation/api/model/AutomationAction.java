/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;

public record AutomationAction(
    @JsonProperty("type") ActionType type,
    @JsonProperty("config") Map<String, Object> config
) implements Serializable {

    public AutomationAction {
        Objects.requireNonNull(type, "type");
        config = ConfigMaps.copyOf(config);
    }
}
