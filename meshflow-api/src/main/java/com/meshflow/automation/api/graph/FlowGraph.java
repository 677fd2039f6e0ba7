/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, insertion-ordered snapshot of a flow graph as the editor holds it.
 *
 * <p>The graph owns all nodes; input ports only reference upstream nodes by
 * id. A reference to an id that is not in the graph is a broken reference
 * and {@link #upstreamOf(InputPort)} resolves it to empty.
 *
 * <h2>Usage</h2>
 * <pre>
 * FlowGraph graph = FlowGraph.builder()
 *     .add(FlowNodes.trigger("t1", TriggerType.NODE_ONLINE, Map.of()))
 *     .add(FlowNodes.action("a1", "pushNotification", "Notify", Map.of()))
 *     .connect("t1", FlowPorts.EVENT_OUT, "a1", FlowPorts.ACTION_IN)
 *     .build();
 * </pre>
 */
public final class FlowGraph {

    private static final FlowGraph EMPTY = new FlowGraph(Map.of());

    private final Map<String, FlowNode> nodes;

    private FlowGraph(Map<String, FlowNode> nodes) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    public static FlowGraph empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.nodes.putAll(nodes);
        return builder;
    }

    /**
     * Node id to node, in insertion order.
     */
    public Map<String, FlowNode> nodeMap() {
        return nodes;
    }

    public Collection<FlowNode> nodes() {
        return nodes.values();
    }

    public Optional<FlowNode> node(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean contains(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public List<FlowNode> nodesOfKind(NodeKind kind) {
        List<FlowNode> result = new ArrayList<>();
        for (FlowNode node : nodes.values()) {
            if (node.kind() == kind) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * Resolves the node an input port is wired to. Unwired ports and broken
     * references both resolve to empty.
     */
    public Optional<FlowNode> upstreamOf(InputPort input) {
        if (input == null || input.connection() == null) {
            return Optional.empty();
        }
        return node(input.connection().nodeId());
    }

    /**
     * Nodes with at least one input wired to {@code nodeId}.
     */
    public List<FlowNode> consumersOf(String nodeId) {
        List<FlowNode> consumers = new ArrayList<>();
        for (FlowNode node : nodes.values()) {
            for (InputPort input : node.inputs()) {
                if (input.connection() != null && input.connection().nodeId().equals(nodeId)) {
                    consumers.add(node);
                    break;
                }
            }
        }
        return consumers;
    }

    /**
     * Ids of every node that some input in the graph resolves to. Broken
     * references are not included.
     */
    public Set<String> referencedNodeIds() {
        Set<String> referenced = new LinkedHashSet<>();
        for (FlowNode node : nodes.values()) {
            for (InputPort input : node.inputs()) {
                upstreamOf(input).ifPresent(upstream -> referenced.add(upstream.id()));
            }
        }
        return referenced;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FlowGraph)) return false;
        return nodes.equals(((FlowGraph) o).nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return "FlowGraph{nodes=" + nodes.keySet() + "}";
    }

    /**
     * Mutable builder. Node ids are unique; adding a node with an existing id
     * replaces it in place.
     */
    public static final class Builder {
        private final Map<String, FlowNode> nodes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(FlowNode node) {
            Objects.requireNonNull(node, "node");
            nodes.put(node.id(), node);
            return this;
        }

        public Builder remove(String nodeId) {
            nodes.remove(nodeId);
            return this;
        }

        /**
         * Wires output {@code fromOutput} of {@code fromId} into input
         * {@code toInput} of {@code toId}. The source node does not have to be
         * added yet, so graphs with broken references can be built on purpose.
         *
         * @throws IllegalArgumentException if the target node is unknown or has no such input
         */
        public Builder connect(String fromId, String fromOutput, String toId, String toInput) {
            FlowNode target = nodes.get(toId);
            if (target == null) {
                throw new IllegalArgumentException("Unknown target node: " + toId);
            }
            nodes.put(toId, target.withConnection(toInput, new PortRef(fromId, fromOutput)));
            return this;
        }

        /**
         * Wires {@code fromId}'s event output into {@code toId}'s input.
         */
        public Builder connect(String fromId, String toId, String toInput) {
            return connect(fromId, FlowPorts.EVENT_OUT, toId, toInput);
        }

        public FlowGraph build() {
            return new FlowGraph(nodes);
        }
    }
}
