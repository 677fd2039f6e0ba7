/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.graph;

import java.util.Objects;

/**
 * Typed output slot of a node. Outputs hold no references; wiring lives on
 * the consuming {@link InputPort}.
 */
public record OutputPort(String type, String title) {

    public OutputPort {
        Objects.requireNonNull(type, "type");
        if (title == null) {
            title = type;
        }
    }
}
