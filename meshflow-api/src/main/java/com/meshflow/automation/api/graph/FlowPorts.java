/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.graph;

/**
 * Port type names and config keys shared with the flow editor.
 */
public final class FlowPorts {

    public static final String EVENT_OUT = "event_out";
    public static final String EVENT_IN = "event_in";
    public static final String ACTION_IN = "action_in";

    /** Config key holding a delay gate's duration in seconds. */
    public static final String DELAY_SECONDS = "delaySeconds";

    private static final String INDEXED_INPUT_PREFIX = EVENT_IN + "_";

    private FlowPorts() {
    }

    /**
     * Name of the {@code index}-th dynamic input of an AND or OR gate (0-based).
     */
    public static String indexedInput(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Input index must be >= 0: " + index);
        }
        return INDEXED_INPUT_PREFIX + index;
    }

    public static boolean isIndexedInput(String portType) {
        if (portType == null || !portType.startsWith(INDEXED_INPUT_PREFIX)) {
            return false;
        }
        String suffix = portType.substring(INDEXED_INPUT_PREFIX.length());
        return !suffix.isEmpty() && suffix.chars().allMatch(Character::isDigit);
    }
}
