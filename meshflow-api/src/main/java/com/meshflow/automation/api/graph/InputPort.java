/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.graph;

import java.util.Objects;

/**
 * Typed input slot of a node, optionally wired to an upstream output.
 *
 * @param type       port type name, e.g. {@code event_in} or {@code event_in_2}
 * @param title      label shown in the editor
 * @param connection upstream reference, null while unwired
 */
public record InputPort(String type, String title, PortRef connection) {

    public InputPort {
        Objects.requireNonNull(type, "type");
        if (title == null) {
            title = type;
        }
    }

    public static InputPort unwired(String type, String title) {
        return new InputPort(type, title, null);
    }

    public boolean isConnected() {
        return connection != null;
    }

    public InputPort connectedTo(PortRef ref) {
        return new InputPort(type, title, ref);
    }
}
