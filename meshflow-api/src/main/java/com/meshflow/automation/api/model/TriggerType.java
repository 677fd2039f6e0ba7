/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Events that can start an automation. The wire name is shared by the rule
 * engine and by the trigger node type in the flow editor.
 */
public enum TriggerType {
    NODE_ONLINE("nodeOnline", "Node Online"),
    NODE_OFFLINE("nodeOffline", "Node Offline"),
    BATTERY_LOW("batteryLow", "Battery Low"),
    BATTERY_FULL("batteryFull", "Battery Full"),
    MESSAGE_RECEIVED("messageReceived", "Message Received"),
    MESSAGE_CONTAINS("messageContains", "Message Contains"),
    POSITION_CHANGED("positionChanged", "Position Changed"),
    GEOFENCE_ENTER("geofenceEnter", "Geofence Enter"),
    GEOFENCE_EXIT("geofenceExit", "Geofence Exit"),
    NODE_SILENT("nodeSilent", "Node Silent"),
    SCHEDULED("scheduled", "Scheduled"),
    SIGNAL_WEAK("signalWeak", "Signal Weak"),
    CHANNEL_ACTIVITY("channelActivity", "Channel Activity"),
    DETECTION_SENSOR("detectionSensor", "Detection Sensor"),
    MANUAL("manual", "Manual");

    private final String wireName;
    private final String displayName;

    TriggerType(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<TriggerType> fromWireName(String name) {
        for (TriggerType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Display name for a raw trigger type string, falling back to the string
     * itself for types this build does not know.
     */
    public static String displayNameOf(String name) {
        return fromWireName(name).map(TriggerType::displayName).orElse(name);
    }

    @JsonCreator
    public static TriggerType fromJson(String name) {
        return fromWireName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown trigger type: " + name));
    }
}
