/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.decompile;

import com.meshflow.automation.api.graph.DecompiledConnection;
import com.meshflow.automation.api.graph.DecompiledGraph;
import com.meshflow.automation.api.graph.DecompiledNode;
import com.meshflow.automation.api.graph.FlowGraph;
import com.meshflow.automation.api.graph.FlowNode;
import com.meshflow.automation.api.graph.FlowNodes;
import com.meshflow.automation.api.model.ActionType;
import com.meshflow.automation.api.model.ConditionType;
import com.meshflow.automation.api.model.TriggerType;

import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Builds an editable {@link FlowGraph} from a {@link DecompiledGraph}.
 *
 * <p>Node ids are {@code decompiled-<index>}. Nodes of an unknown kind are
 * skipped and so are the connections touching them.
 */
public final class DecompiledGraphMaterializer {

    private static final Logger logger = Logger.getLogger(DecompiledGraphMaterializer.class.getName());

    static final String ID_PREFIX = "decompiled-";

    public FlowGraph materialize(DecompiledGraph description) {
        Map<Integer, Integer> inputCounts = new HashMap<>();
        for (DecompiledConnection connection : description.connections()) {
            inputCounts.merge(connection.toNodeIndex(), 1, Integer::sum);
        }

        FlowGraph.Builder builder = FlowGraph.builder();
        Map<Integer, String> createdIds = new HashMap<>();
        for (int i = 0; i < description.nodes().size(); i++) {
            DecompiledNode described = description.nodes().get(i);
            String id = ID_PREFIX + i;
            FlowNode node = create(id, described, inputCounts.getOrDefault(i, 1));
            if (node == null) {
                logger.warning("No node builder for decompiled node type \"" + described.type() + "\", skipping");
                continue;
            }
            builder.add(node);
            createdIds.put(i, id);
        }

        for (DecompiledConnection connection : description.connections()) {
            String from = createdIds.get(connection.fromNodeIndex());
            String to = createdIds.get(connection.toNodeIndex());
            if (from == null || to == null) {
                continue;
            }
            builder.connect(from, connection.fromOutputType(), to, connection.toInputType());
        }
        return builder.build();
    }

    private static FlowNode create(String id, DecompiledNode described, int inputCount) {
        Map<String, Object> config = described.config() == null ? Map.of() : described.config();
        return switch (described.kind()) {
            case TRIGGER -> FlowNodes.trigger(id, described.type(), TriggerType.displayNameOf(described.type()), config);
            case CONDITION -> FlowNodes.condition(id, described.type(),
                    ConditionType.resolve(described.type()).map(ConditionType::displayName).orElse(described.type()),
                    config);
            case AND_GATE, OR_GATE, NOT_GATE, DELAY_GATE -> FlowNodes.gate(id, described.kind(), inputCount, config);
            case ACTION -> FlowNodes.action(id, described.type(),
                    ActionType.fromWireName(described.type()).map(ActionType::displayName).orElse(described.type()),
                    config);
            case UNKNOWN -> null;
        };
    }
}
