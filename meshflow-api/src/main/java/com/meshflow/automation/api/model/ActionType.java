/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * What an automation does when it fires.
 */
public enum ActionType {
    SEND_MESSAGE("sendMessage", "Send Message"),
    PLAY_SOUND("playSound", "Play Sound"),
    VIBRATE("vibrate", "Vibrate"),
    PUSH_NOTIFICATION("pushNotification", "Push Notification"),
    TRIGGER_WEBHOOK("triggerWebhook", "Trigger Webhook"),
    LOG_EVENT("logEvent", "Log Event"),
    UPDATE_WIDGET("updateWidget", "Update Widget"),
    SEND_TO_CHANNEL("sendToChannel", "Send to Channel"),
    TRIGGER_SHORTCUT("triggerShortcut", "Trigger Shortcut"),
    GLYPH_PATTERN("glyphPattern", "Glyph Pattern");

    /** Substituted for action types this build cannot resolve. */
    public static final ActionType FALLBACK = PUSH_NOTIFICATION;

    private final String wireName;
    private final String displayName;

    ActionType(String wireName, String displayName) {
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

    public static Optional<ActionType> fromWireName(String name) {
        for (ActionType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static ActionType fromJson(String name) {
        return fromWireName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown action type: " + name));
    }
}
