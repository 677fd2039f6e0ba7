/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Editor-ready description of an automation laid out as a graph: the nodes
 * to create and the wires between them. Node ids are assigned by whoever
 * materialises the description.
 */
public record DecompiledGraph(
    @JsonProperty("nodes") List<DecompiledNode> nodes,
    @JsonProperty("connections") List<DecompiledConnection> connections
) {

    public DecompiledGraph {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        connections = connections == null ? List.of() : List.copyOf(connections);
        for (DecompiledConnection connection : connections) {
            checkIndex(connection.fromNodeIndex(), nodes.size());
            checkIndex(connection.toNodeIndex(), nodes.size());
        }
    }

    private static void checkIndex(int index, int size) {
        if (index < 0 || index >= size) {
            throw new IllegalArgumentException("Connection refers to node index " + index
                    + " but the graph has " + size + " nodes");
        }
    }
}
