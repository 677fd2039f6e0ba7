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
 * One predicate of an automation. All conditions of an automation are
 * AND-combined by the rule engine.
 */
public record AutomationCondition(
    @JsonProperty("type") ConditionType type,
    @JsonProperty("config") Map<String, Object> config
) implements Serializable {

    public AutomationCondition {
        Objects.requireNonNull(type, "type");
        config = ConfigMaps.copyOf(config);
    }

    public AutomationCondition withType(ConditionType newType) {
        return new AutomationCondition(newType, config);
    }
}
