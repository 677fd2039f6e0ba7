/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire between two nodes of a {@link DecompiledGraph}, addressed by their
 * index in the node list.
 */
public record DecompiledConnection(
    @JsonProperty("fromNodeIndex") int fromNodeIndex,
    @JsonProperty("fromOutputType") String fromOutputType,
    @JsonProperty("toNodeIndex") int toNodeIndex,
    @JsonProperty("toInputType") String toInputType
) {
}
