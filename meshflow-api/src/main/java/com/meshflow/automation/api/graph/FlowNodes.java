/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.graph;

import com.meshflow.automation.api.model.ActionType;
import com.meshflow.automation.api.model.ConditionType;
import com.meshflow.automation.api.model.ConfigMaps;
import com.meshflow.automation.api.model.TriggerType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Factories producing nodes with the same ports the flow editor gives them.
 */
public final class FlowNodes {

    private static final List<OutputPort> EVENT_OUTPUT =
            List.of(new OutputPort(FlowPorts.EVENT_OUT, "Event"));

    private FlowNodes() {
    }

    public static FlowNode trigger(String id, TriggerType type, Map<String, ?> config) {
        return trigger(id, type.wireName(), type.displayName(), config);
    }

    /**
     * Trigger node with a raw type string, which may be one the compiler
     * does not know.
     */
    public static FlowNode trigger(String id, String type, String title, Map<String, ?> config) {
        return new FlowNode(id, type, title, NodeKind.TRIGGER, List.of(), EVENT_OUTPUT, ConfigMaps.copyOf(config));
    }

    public static FlowNode condition(String id, ConditionType type, Map<String, ?> config) {
        return condition(id, type.nodeType(), type.displayName(), config);
    }

    public static FlowNode condition(String id, String type, String title, Map<String, ?> config) {
        return new FlowNode(id, type, title, NodeKind.CONDITION,
                List.of(InputPort.unwired(FlowPorts.EVENT_IN, "Event")),
                List.of(new OutputPort(FlowPorts.EVENT_OUT, "Passed")),
                ConfigMaps.copyOf(config));
    }

    /**
     * AND gate with {@code inputCount} indexed inputs.
     */
    public static FlowNode andGate(String id, int inputCount) {
        return listGate(id, NodeKind.AND_GATE, inputCount, "All Met");
    }

    /**
     * OR gate with {@code inputCount} indexed inputs.
     */
    public static FlowNode orGate(String id, int inputCount) {
        return listGate(id, NodeKind.OR_GATE, inputCount, "Any Met");
    }

    public static FlowNode notGate(String id) {
        return new FlowNode(id, NodeKind.NOT_GATE.gateType(), NodeKind.NOT_GATE.gateLabel(),
                NodeKind.NOT_GATE,
                List.of(InputPort.unwired(FlowPorts.EVENT_IN, "Input")),
                List.of(new OutputPort(FlowPorts.EVENT_OUT, "Inverted")),
                Map.of());
    }

    public static FlowNode delayGate(String id, int delaySeconds) {
        return delayGate(id, Map.of(FlowPorts.DELAY_SECONDS, delaySeconds));
    }

    /**
     * Delay gate with a raw config map, e.g. one without {@code delaySeconds}.
     */
    public static FlowNode delayGate(String id, Map<String, ?> config) {
        return new FlowNode(id, NodeKind.DELAY_GATE.gateType(), NodeKind.DELAY_GATE.gateLabel(),
                NodeKind.DELAY_GATE,
                List.of(InputPort.unwired(FlowPorts.EVENT_IN, "Input")),
                List.of(new OutputPort(FlowPorts.EVENT_OUT, "Delayed")),
                ConfigMaps.copyOf(config));
    }

    public static FlowNode action(String id, ActionType type, Map<String, ?> config) {
        return action(id, type.wireName(), type.displayName(), config);
    }

    public static FlowNode action(String id, String type, String title, Map<String, ?> config) {
        return new FlowNode(id, type, title, NodeKind.ACTION,
                List.of(InputPort.unwired(FlowPorts.ACTION_IN, "Event")),
                List.of(),
                ConfigMaps.copyOf(config));
    }

    /**
     * Node of a kind this compiler does not know, with a single event input.
     */
    public static FlowNode unknown(String id, String type) {
        return new FlowNode(id, type, type, NodeKind.UNKNOWN,
                List.of(InputPort.unwired(FlowPorts.EVENT_IN, "Input")),
                EVENT_OUTPUT,
                Map.of());
    }

    /**
     * Builds a gate node from its kind, used when materialising decompiled graphs.
     */
    public static FlowNode gate(String id, NodeKind kind, int inputCount, Map<String, ?> config) {
        return switch (kind) {
            case AND_GATE -> andGate(id, inputCount);
            case OR_GATE -> orGate(id, inputCount);
            case NOT_GATE -> notGate(id);
            case DELAY_GATE -> delayGate(id, ConfigMaps.copyOf(config));
            default -> throw new IllegalArgumentException("Not a logic gate kind: " + kind);
        };
    }

    private static FlowNode listGate(String id, NodeKind kind, int inputCount, String outputTitle) {
        if (inputCount < 1) {
            throw new IllegalArgumentException(kind.gateLabel() + " gate needs at least one input slot");
        }
        List<InputPort> inputs = new ArrayList<>(inputCount);
        for (int i = 0; i < inputCount; i++) {
            inputs.add(InputPort.unwired(FlowPorts.indexedInput(i), "Input " + (i + 1)));
        }
        return new FlowNode(id, kind.gateType(), kind.gateLabel(), kind, inputs,
                List.of(new OutputPort(FlowPorts.EVENT_OUT, outputTitle)), Map.of());
    }
}
