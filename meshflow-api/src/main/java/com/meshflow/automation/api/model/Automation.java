/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A compiled automation rule: one trigger, optional AND-combined conditions
 * and one or more actions, executed by the rule engine.
 *
 * <p>An empty condition list means "no conditions" and is left out of the
 * JSON form, matching what the rule engine expects for unconditional rules.
 *
 * <h2>Usage</h2>
 * <pre>
 * Automation automation = Automation.create(
 *     "Visual Flow: Node Online → Notify",
 *     "When: Node Online · Then: Notify",
 *     new AutomationTrigger(TriggerType.NODE_ONLINE, Map.of()),
 *     List.of(new AutomationAction(ActionType.PUSH_NOTIFICATION, Map.of())),
 *     List.of());
 * </pre>
 */
public record Automation(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("enabled") boolean enabled,
    @JsonProperty("trigger") AutomationTrigger trigger,
    @JsonProperty("actions") List<AutomationAction> actions,
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonProperty("conditions") List<AutomationCondition> conditions
) implements Serializable {

    public Automation {
        Objects.requireNonNull(trigger, "trigger");
        if (actions == null || actions.isEmpty()) {
            throw new IllegalArgumentException("Automation '" + name + "' must have at least one action");
        }
        if (id == null || id.isBlank()) {
            id = UUID.randomUUID().toString();
        }
        actions = List.copyOf(actions);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    /**
     * Creates an enabled automation with a freshly generated id.
     */
    public static Automation create(String name,
                                    String description,
                                    AutomationTrigger trigger,
                                    List<AutomationAction> actions,
                                    List<AutomationCondition> conditions) {
        return new Automation(null, name, description, true, trigger, actions, conditions);
    }

    @JsonIgnore
    public boolean hasConditions() {
        return !conditions.isEmpty();
    }
}
