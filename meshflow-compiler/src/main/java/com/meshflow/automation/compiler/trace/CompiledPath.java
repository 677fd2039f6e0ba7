/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.trace;

import com.meshflow.automation.api.graph.FlowNode;
import com.meshflow.automation.api.model.AutomationCondition;
import com.meshflow.automation.api.model.ConfigMaps;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One route from a trigger to the action being traced.
 *
 * <p>Each condition node prepends its condition to the paths its upstream
 * returned, so a chain {@code trigger → c1 → c2} yields {@code [c2, c1]}. A
 * NOT gate inverts the last entry, which is the condition directly upstream
 * of it when that upstream is a single condition node. An OR gate yields one
 * path per branch; an AND gate folds its branches into combined paths.
 *
 * @param triggerType   editor type of the originating trigger node
 * @param triggerConfig trigger node configuration
 * @param triggerNodeId id of the originating trigger node, null if unknown
 * @param conditions    conditions collected along the path
 * @param delaySeconds  largest delay seen along the path, null when no delay gate was passed
 */
public record CompiledPath(
    String triggerType,
    Map<String, Object> triggerConfig,
    String triggerNodeId,
    List<AutomationCondition> conditions,
    Integer delaySeconds
) {

    public CompiledPath {
        Objects.requireNonNull(triggerType, "triggerType");
        triggerConfig = ConfigMaps.copyOf(triggerConfig);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    /**
     * Seeds a path at a trigger node: its configuration, no conditions, no delay.
     */
    public static CompiledPath fromTrigger(FlowNode trigger) {
        return new CompiledPath(trigger.type(), trigger.getConfig(), trigger.id(), List.of(), null);
    }

    public CompiledPath withConditionsPrepended(List<AutomationCondition> extra) {
        List<AutomationCondition> combined = new ArrayList<>(extra.size() + conditions.size());
        combined.addAll(extra);
        combined.addAll(conditions);
        return new CompiledPath(triggerType, triggerConfig, triggerNodeId, combined, delaySeconds);
    }

    /**
     * Applies a delay, keeping the larger one if the path already carries a delay.
     */
    public CompiledPath withDelay(int seconds) {
        return new CompiledPath(triggerType, triggerConfig, triggerNodeId, conditions,
                maxDelay(delaySeconds, seconds));
    }

    public CompiledPath withLastConditionReplaced(AutomationCondition replacement) {
        if (conditions.isEmpty()) {
            throw new IllegalStateException("Path from trigger '" + triggerType + "' has no condition to replace");
        }
        List<AutomationCondition> updated = new ArrayList<>(conditions);
        updated.set(updated.size() - 1, replacement);
        return new CompiledPath(triggerType, triggerConfig, triggerNodeId, updated, delaySeconds);
    }

    /**
     * Joins this path with a sibling branch of an AND gate: conditions are
     * concatenated, the larger delay wins and this path's trigger is kept.
     */
    public CompiledPath mergedWith(CompiledPath branch) {
        List<AutomationCondition> combined = new ArrayList<>(conditions.size() + branch.conditions.size());
        combined.addAll(conditions);
        combined.addAll(branch.conditions);
        return new CompiledPath(triggerType, triggerConfig, triggerNodeId, combined,
                maxDelay(delaySeconds, branch.delaySeconds));
    }

    public Optional<AutomationCondition> lastCondition() {
        return conditions.isEmpty() ? Optional.empty() : Optional.of(conditions.get(conditions.size() - 1));
    }

    public boolean hasDelay() {
        return delaySeconds != null && delaySeconds > 0;
    }

    private static Integer maxDelay(Integer current, Integer candidate) {
        if (current == null) return candidate;
        if (candidate == null) return current;
        return Math.max(current, candidate);
    }
}
