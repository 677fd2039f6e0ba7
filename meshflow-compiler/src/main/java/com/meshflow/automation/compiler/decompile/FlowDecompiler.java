/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.decompile;

import com.meshflow.automation.api.graph.CanvasOffset;
import com.meshflow.automation.api.graph.DecompiledConnection;
import com.meshflow.automation.api.graph.DecompiledGraph;
import com.meshflow.automation.api.graph.DecompiledNode;
import com.meshflow.automation.api.graph.FlowPorts;
import com.meshflow.automation.api.graph.NodeKind;
import com.meshflow.automation.api.model.Automation;
import com.meshflow.automation.api.model.AutomationAction;
import com.meshflow.automation.api.model.AutomationCondition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lays out an automation as a left-to-right graph:
 * trigger → conditions → AND gate (two or more conditions only) → actions.
 *
 * <p>Every coordinate is a multiple of {@link #GRID}, so reopened graphs
 * land on the editor's grid intersections. Columns are ten grid cells apart.
 * The output depends only on the automation.
 */
public final class FlowDecompiler {

    public static final double GRID = 24.0;

    static final double COLUMN_TRIGGER = 48.0;
    static final double COLUMN_CONDITION = 288.0;
    static final double COLUMN_AND_GATE = 528.0;
    static final double COLUMN_ACTION = 768.0;
    static final double ROW_START = 72.0;
    static final double ROW_SPACING = 144.0;

    public DecompiledGraph decompile(Automation automation) {
        List<DecompiledNode> nodes = new ArrayList<>();
        List<DecompiledConnection> connections = new ArrayList<>();

        nodes.add(new DecompiledNode(
                automation.trigger().type().wireName(),
                NodeKind.TRIGGER,
                new CanvasOffset(COLUMN_TRIGGER, ROW_START),
                nonEmpty(automation.trigger().config())));
        int triggerIndex = 0;

        List<AutomationCondition> conditions = automation.conditions();
        List<Integer> conditionIndices = new ArrayList<>(conditions.size());
        for (int i = 0; i < conditions.size(); i++) {
            AutomationCondition condition = conditions.get(i);
            nodes.add(new DecompiledNode(
                    condition.type().nodeType(),
                    NodeKind.CONDITION,
                    new CanvasOffset(COLUMN_CONDITION, row(i)),
                    nonEmpty(condition.config())));
            int conditionIndex = nodes.size() - 1;
            conditionIndices.add(conditionIndex);
            connections.add(new DecompiledConnection(
                    triggerIndex, FlowPorts.EVENT_OUT, conditionIndex, FlowPorts.EVENT_IN));
        }

        int preActionIndex;
        if (conditionIndices.isEmpty()) {
            preActionIndex = triggerIndex;
        } else if (conditionIndices.size() == 1) {
            preActionIndex = conditionIndices.get(0);
        } else {
            // vertically centred on the condition column
            double andRow = ROW_START + (conditionIndices.size() - 1) * ROW_SPACING / 2;
            nodes.add(new DecompiledNode(
                    NodeKind.AND_GATE.gateType(),
                    NodeKind.AND_GATE,
                    new CanvasOffset(COLUMN_AND_GATE, andRow),
                    null));
            preActionIndex = nodes.size() - 1;
            for (int i = 0; i < conditionIndices.size(); i++) {
                connections.add(new DecompiledConnection(
                        conditionIndices.get(i), FlowPorts.EVENT_OUT, preActionIndex, FlowPorts.indexedInput(i)));
            }
        }

        List<AutomationAction> actions = automation.actions();
        for (int i = 0; i < actions.size(); i++) {
            AutomationAction action = actions.get(i);
            nodes.add(new DecompiledNode(
                    action.type().wireName(),
                    NodeKind.ACTION,
                    new CanvasOffset(COLUMN_ACTION, row(i)),
                    nonEmpty(action.config())));
            connections.add(new DecompiledConnection(
                    preActionIndex, FlowPorts.EVENT_OUT, nodes.size() - 1, FlowPorts.ACTION_IN));
        }

        return new DecompiledGraph(nodes, connections);
    }

    private static double row(int index) {
        return ROW_START + index * ROW_SPACING;
    }

    private static Map<String, Object> nonEmpty(Map<String, Object> config) {
        return config.isEmpty() ? null : config;
    }
}
