/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.emit;

import com.meshflow.automation.api.graph.FlowNode;
import com.meshflow.automation.api.graph.FlowNodes;
import com.meshflow.automation.api.model.ActionType;
import com.meshflow.automation.api.model.AutomationCondition;
import com.meshflow.automation.api.model.ConditionType;
import com.meshflow.automation.compiler.trace.CompiledPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PathGrouperTest {

    private static final CompiledPath ONLINE = new CompiledPath("nodeOnline", Map.of(), "t1", List.of(), null);
    private static final CompiledPath ONLINE_LOW_BATTERY = new CompiledPath("nodeOnline", Map.of(), "t1",
            List.of(new AutomationCondition(ConditionType.BATTERY_BELOW, Map.of("batteryThreshold", 20))), null);
    private static final CompiledPath MANUAL = new CompiledPath("manual", Map.of(), "t2", List.of(), null);

    @Test
    @DisplayName("Actions with equal paths should share one group, in first-seen order")
    void shouldGroupEqualPaths() {
        FlowNode vibrate = FlowNodes.action("a1", ActionType.VIBRATE, Map.of());
        FlowNode sound = FlowNodes.action("a2", ActionType.PLAY_SOUND, Map.of());
        FlowNode log = FlowNodes.action("a3", ActionType.LOG_EVENT, Map.of());

        Map<FlowNode, List<CompiledPath>> paths = new LinkedHashMap<>();
        paths.put(vibrate, List.of(ONLINE_LOW_BATTERY));
        paths.put(sound, List.of(MANUAL, ONLINE_LOW_BATTERY));
        paths.put(log, List.of(ONLINE));

        List<PathGroup> groups = PathGrouper.group(paths);

        assertThat(groups).hasSize(3);
        assertThat(groups.get(0).representative()).isEqualTo(ONLINE_LOW_BATTERY);
        assertThat(groups.get(0).actions()).extracting(ActionEntry::nodeId).containsExactly("a1", "a2");
        assertThat(groups.get(1).actions()).extracting(ActionEntry::nodeId).containsExactly("a2");
        assertThat(groups.get(2).actions()).extracting(ActionEntry::nodeId).containsExactly("a3");
    }

    @Test
    @DisplayName("An action reached twice through equal paths should be listed once")
    void shouldNotDuplicateAction() {
        FlowNode vibrate = FlowNodes.action("a1", ActionType.VIBRATE, Map.of());
        CompiledPath sameShape = new CompiledPath("nodeOnline", Map.of(), "t9", List.of(), null);

        List<PathGroup> groups = PathGrouper.group(Map.of(vibrate, List.of(ONLINE, sameShape)));

        assertThat(groups).singleElement().satisfies(group -> {
            assertThat(group.actions()).hasSize(1);
            assertThat(group.representative().triggerNodeId()).isEqualTo("t1");
        });
    }
}
