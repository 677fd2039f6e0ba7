/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Links a serialized flow graph to the automations compiled from it, so a
 * stored automation can be reopened in the visual editor.
 *
 * @param graphJson                 serialized graph at the time of compilation
 * @param automationIds             every automation id produced by the graph
 * @param actionNodeToAutomationIds action node id to the automation ids it ended up in;
 *                                  one action maps to several ids when an OR gate forks its path
 * @param flowName                  user-assigned flow name, may be null
 */
public record FlowGraphMetadata(
    @JsonProperty("graphJson") String graphJson,
    @JsonProperty("automationIds") List<String> automationIds,
    @JsonProperty("actionNodeToAutomationId") Map<String, List<String>> actionNodeToAutomationIds,
    @JsonProperty("flowName") String flowName
) implements Serializable {

    public FlowGraphMetadata {
        if (graphJson == null) graphJson = "";
        automationIds = automationIds == null ? List.of() : List.copyOf(automationIds);
        Map<String, List<String>> mapping = new LinkedHashMap<>();
        if (actionNodeToAutomationIds != null) {
            actionNodeToAutomationIds.forEach((nodeId, ids) ->
                    mapping.put(nodeId, ids == null ? List.of() : List.copyOf(ids)));
        }
        actionNodeToAutomationIds = Collections.unmodifiableMap(mapping);
    }

    /**
     * Automation ids the given action node contributed to, empty if none.
     */
    public List<String> automationIdsFor(String actionNodeId) {
        return actionNodeToAutomationIds.getOrDefault(actionNodeId, List.of());
    }
}
