/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.emit;

/**
 * Short human-readable durations for automation descriptions.
 */
public final class DelayFormat {

    private DelayFormat() {
    }

    /**
     * Formats a delay: {@code 30s}, {@code 5m}, {@code 5m 30s}, {@code 1h},
     * {@code 1h 30m}. Seconds are dropped once the delay reaches an hour.
     */
    public static String format(int seconds) {
        if (seconds < 60) {
            return seconds + "s";
        }
        if (seconds < 3600) {
            int minutes = seconds / 60;
            int remainder = seconds % 60;
            return remainder == 0 ? minutes + "m" : minutes + "m " + remainder + "s";
        }
        int hours = seconds / 3600;
        int minutes = (seconds % 3600) / 60;
        return minutes == 0 ? hours + "h" : hours + "h " + minutes + "m";
    }
}
