/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.validation;

import com.meshflow.automation.api.graph.FlowGraph;
import com.meshflow.automation.api.graph.FlowNode;
import com.meshflow.automation.api.graph.InputPort;
import com.meshflow.automation.api.graph.NodeKind;
import com.meshflow.automation.api.model.FlowDiagnostic;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural pre-check run before a compile. Does not trace paths.
 *
 * <p>Rules:
 * <ul>
 *   <li>at least one trigger node</li>
 *   <li>at least one action node</li>
 *   <li>every action node has an upstream node</li>
 *   <li>a logic gate that some node consumes has at least one upstream node;
 *       a gate nobody consumes is left alone</li>
 * </ul>
 * Inputs pointing at nodes that are not in the graph count as unconnected.
 */
public final class FlowGraphValidator {

    public List<FlowDiagnostic> validate(FlowGraph graph) {
        List<FlowDiagnostic> issues = new ArrayList<>();

        if (graph.nodesOfKind(NodeKind.TRIGGER).isEmpty()) {
            issues.add(FlowDiagnostic.error("Graph has no trigger node. "
                    + "Add a trigger to define when the automation should fire."));
        }

        List<FlowNode> actions = graph.nodesOfKind(NodeKind.ACTION);
        if (actions.isEmpty()) {
            issues.add(FlowDiagnostic.error("Graph has no action node. "
                    + "Add an action to define what happens when the automation fires."));
        }

        for (FlowNode action : actions) {
            if (!hasResolvableInput(graph, action)) {
                issues.add(FlowDiagnostic.error("Action node \"" + action.title()
                        + "\" is not connected to any upstream node.", action.id(), action.type()));
            }
        }

        for (FlowNode node : graph.nodes()) {
            if (!node.kind().isLogicGate() || hasResolvableInput(graph, node)) {
                continue;
            }
            if (!graph.consumersOf(node.id()).isEmpty()) {
                issues.add(FlowDiagnostic.error("Logic gate \"" + node.title()
                        + "\" has no connected inputs but has downstream nodes depending on it.",
                        node.id(), node.type()));
            }
        }

        return issues;
    }

    private static boolean hasResolvableInput(FlowGraph graph, FlowNode node) {
        for (InputPort input : node.connectedInputs()) {
            if (graph.upstreamOf(input).isPresent()) {
                return true;
            }
        }
        return false;
    }
}
