/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Predicates that gate whether a triggered automation runs.
 *
 * <p>Each type has a wire name (used by the rule engine) and an editor node
 * type. The two only differ for {@link #NODE_ONLINE} and {@link #NODE_OFFLINE},
 * whose node types carry a {@code cond_} prefix so they do not collide with
 * the trigger types of the same name.
 */
public enum ConditionType {
    TIME_RANGE("timeRange", "timeRange", "Time Range"),
    DAY_OF_WEEK("dayOfWeek", "dayOfWeek", "Day of Week"),
    BATTERY_ABOVE("batteryAbove", "batteryAbove", "Battery Above"),
    BATTERY_BELOW("batteryBelow", "batteryBelow", "Battery Below"),
    NODE_ONLINE("nodeOnline", "cond_nodeOnline", "Node Is Online"),
    NODE_OFFLINE("nodeOffline", "cond_nodeOffline", "Node Is Offline"),
    WITHIN_GEOFENCE("withinGeofence", "withinGeofence", "Within Geofence"),
    OUTSIDE_GEOFENCE("outsideGeofence", "outsideGeofence", "Outside Geofence");

    private final String wireName;
    private final String nodeType;
    private final String displayName;

    ConditionType(String wireName, String nodeType, String displayName) {
        this.wireName = wireName;
        this.nodeType = nodeType;
        this.displayName = displayName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String nodeType() {
        return nodeType;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Strict lookup by editor node type.
     */
    public static Optional<ConditionType> fromNodeType(String type) {
        for (ConditionType candidate : values()) {
            if (candidate.nodeType.equals(type)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves either an editor node type ({@code cond_nodeOnline}) or a raw
     * wire name ({@code nodeOnline}).
     */
    public static Optional<ConditionType> resolve(String name) {
        Optional<ConditionType> direct = fromNodeType(name);
        if (direct.isPresent()) {
            return direct;
        }
        for (ConditionType candidate : values()) {
            if (candidate.wireName.equals(name)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static ConditionType fromJson(String name) {
        return resolve(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown condition type: " + name));
    }
}
