/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.meshflow.automation.api.model.ConfigMaps;

import java.util.Map;
import java.util.Objects;

/**
 * Node to create when an automation is reopened in the editor.
 *
 * @param type   editor type tag to build the node from
 * @param kind   node kind
 * @param offset canvas position
 * @param config initial configuration, null when the node keeps its defaults
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecompiledNode(
    @JsonProperty("type") String type,
    @JsonProperty("kind") NodeKind kind,
    @JsonProperty("offset") CanvasOffset offset,
    @JsonProperty("config") Map<String, Object> config
) {

    public DecompiledNode {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(offset, "offset");
        config = config == null ? null : ConfigMaps.copyOf(config);
    }
}
