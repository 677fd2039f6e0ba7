/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.graph;

import com.meshflow.automation.api.model.ConfigMaps;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of one editor node.
 *
 * <p>The {@code type} string is the editor's tag ({@code nodeOnline},
 * {@code cond_nodeOnline}, {@code logic_and}, {@code sendMessage}, ...). The
 * {@code kind} decides how the compiler treats the node, so an action whose
 * type the compiler does not recognise is still an action.
 *
 * @param id      opaque node id, unique within a graph
 * @param type    editor type tag
 * @param title   display title
 * @param kind    node kind
 * @param inputs  ordered input ports
 * @param outputs ordered output ports
 * @param config  node configuration, may hold null values
 */
public record FlowNode(
    String id,
    String type,
    String title,
    NodeKind kind,
    List<InputPort> inputs,
    List<OutputPort> outputs,
    Map<String, Object> config
) {

    public FlowNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        if (kind == null) {
            kind = NodeKind.infer(type);
        }
        if (title == null) {
            title = type;
        }
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        config = ConfigMaps.copyOf(config);
    }

    /**
     * The node's configuration, as the editor's {@code getConfig()} exposes it.
     */
    public Map<String, Object> getConfig() {
        return config;
    }

    /**
     * Inputs that are wired to something. AND and OR gates always keep a
     * trailing empty slot, which this view leaves out.
     */
    public List<InputPort> connectedInputs() {
        List<InputPort> connected = new ArrayList<>(inputs.size());
        for (InputPort input : inputs) {
            if (input.isConnected()) {
                connected.add(input);
            }
        }
        return connected;
    }

    public Optional<InputPort> input(String portType) {
        for (InputPort input : inputs) {
            if (input.type().equals(portType)) {
                return Optional.of(input);
            }
        }
        return Optional.empty();
    }

    public boolean hasConnectedInput() {
        for (InputPort input : inputs) {
            if (input.isConnected()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a copy with the given input wired to {@code ref}. Indexed
     * gate inputs that do not exist yet are appended.
     *
     * @throws IllegalArgumentException if the node has no such input
     */
    public FlowNode withConnection(String portType, PortRef ref) {
        List<InputPort> updated = new ArrayList<>(inputs.size() + 1);
        boolean found = false;
        for (InputPort input : inputs) {
            if (input.type().equals(portType)) {
                updated.add(input.connectedTo(ref));
                found = true;
            } else {
                updated.add(input);
            }
        }
        if (!found) {
            boolean listGate = kind == NodeKind.AND_GATE || kind == NodeKind.OR_GATE;
            if (!listGate || !FlowPorts.isIndexedInput(portType)) {
                throw new IllegalArgumentException(
                        "Node '" + id + "' (" + type + ") has no input '" + portType + "'");
            }
            updated.add(new InputPort(portType, "Input", ref));
        }
        return new FlowNode(id, type, title, kind, updated, outputs, config);
    }

    public FlowNode withConfig(Map<String, Object> newConfig) {
        return new FlowNode(id, type, title, kind, inputs, outputs, newConfig);
    }
}
