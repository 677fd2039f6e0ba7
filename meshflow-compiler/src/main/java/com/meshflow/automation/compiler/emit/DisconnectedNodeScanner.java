/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.emit;

import com.meshflow.automation.api.graph.FlowGraph;
import com.meshflow.automation.api.graph.FlowNode;
import com.meshflow.automation.compiler.trace.DiagnosticCollector;

import java.util.Set;

/**
 * Warns about condition and gate nodes whose output nobody consumes. They
 * have no effect on the compiled automations, but the user may simply be
 * mid-edit, so this is never an error. Triggers and actions are exempt.
 */
public final class DisconnectedNodeScanner {

    private DisconnectedNodeScanner() {
    }

    /**
     * @return number of warnings added
     */
    public static int scan(FlowGraph graph, DiagnosticCollector diagnostics) {
        Set<String> referenced = graph.referencedNodeIds();
        int found = 0;
        for (FlowNode node : graph.nodes()) {
            if (referenced.contains(node.id())) {
                continue;
            }
            boolean scanned = switch (node.kind()) {
                case CONDITION, AND_GATE, OR_GATE, NOT_GATE, DELAY_GATE -> true;
                case TRIGGER, ACTION, UNKNOWN -> false;
            };
            if (scanned) {
                diagnostics.warning("Node \"" + node.title()
                        + "\" is disconnected and was not included in any compiled automation.", node);
                found++;
            }
        }
        return found;
    }
}
