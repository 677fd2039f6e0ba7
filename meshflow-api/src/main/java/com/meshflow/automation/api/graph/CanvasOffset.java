/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Top-left position of a node on the editor canvas, in logical pixels.
 */
public record CanvasOffset(
    @JsonProperty("x") double x,
    @JsonProperty("y") double y
) {
}
