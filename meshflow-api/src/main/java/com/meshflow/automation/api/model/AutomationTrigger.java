/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;

/**
 * The single trigger of an automation.
 */
public record AutomationTrigger(
    @JsonProperty("type") TriggerType type,
    @JsonProperty("config") Map<String, Object> config
) implements Serializable {

    public AutomationTrigger {
        Objects.requireNonNull(type, "type");
        config = ConfigMaps.copyOf(config);
    }

    public AutomationTrigger withConfig(Map<String, Object> newConfig) {
        return new AutomationTrigger(type, newConfig);
    }
}
