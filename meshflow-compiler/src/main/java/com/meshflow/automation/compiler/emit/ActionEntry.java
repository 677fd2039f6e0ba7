/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.emit;

import com.meshflow.automation.api.graph.FlowNode;
import com.meshflow.automation.api.model.ConfigMaps;

import java.util.Map;

/**
 * Action node contributing to a path group.
 *
 * @param nodeId     id of the action node
 * @param actionType editor action type, not necessarily a known one
 * @param title      node title, used in generated names
 * @param config     action configuration
 */
public record ActionEntry(String nodeId, String actionType, String title, Map<String, Object> config) {

    public ActionEntry {
        config = ConfigMaps.copyOf(config);
    }

    public static ActionEntry of(FlowNode actionNode) {
        return new ActionEntry(actionNode.id(), actionNode.type(), actionNode.title(), actionNode.getConfig());
    }
}
