/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.emit;

import com.meshflow.automation.api.graph.FlowNode;
import com.meshflow.automation.compiler.trace.CompiledPath;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buckets (action, path) pairs by {@link PathSignature}.
 *
 * <p>Groups come out in the order their signature was first seen. An action
 * reached twice through structurally equal paths (an OR gate whose branches
 * are identical) contributes to its group once.
 */
public final class PathGrouper {

    private PathGrouper() {
    }

    /**
     * @param pathsPerAction traced paths per action node, in graph order
     * @return one group per distinct signature
     */
    public static List<PathGroup> group(Map<FlowNode, List<CompiledPath>> pathsPerAction) {
        Map<PathSignature, CompiledPath> representatives = new LinkedHashMap<>();
        Map<PathSignature, Map<String, ActionEntry>> members = new LinkedHashMap<>();

        for (Map.Entry<FlowNode, List<CompiledPath>> entry : pathsPerAction.entrySet()) {
            ActionEntry action = ActionEntry.of(entry.getKey());
            for (CompiledPath path : entry.getValue()) {
                PathSignature signature = PathSignature.of(path);
                representatives.putIfAbsent(signature, path);
                members.computeIfAbsent(signature, sig -> new LinkedHashMap<>())
                        .putIfAbsent(action.nodeId(), action);
            }
        }

        List<PathGroup> groups = new ArrayList<>(representatives.size());
        for (Map.Entry<PathSignature, CompiledPath> entry : representatives.entrySet()) {
            groups.add(new PathGroup(entry.getKey(), entry.getValue(),
                    new ArrayList<>(members.get(entry.getKey()).values())));
        }
        return groups;
    }
}
