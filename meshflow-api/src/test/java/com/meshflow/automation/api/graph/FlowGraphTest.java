/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.graph;

import com.meshflow.automation.api.model.ActionType;
import com.meshflow.automation.api.model.ConditionType;
import com.meshflow.automation.api.model.TriggerType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowGraphTest {

    private static FlowGraph triggerConditionAction() {
        return FlowGraph.builder()
                .add(FlowNodes.trigger("t1", TriggerType.NODE_ONLINE, Map.of()))
                .add(FlowNodes.condition("c1", ConditionType.BATTERY_ABOVE, Map.of("batteryThreshold", 50)))
                .add(FlowNodes.action("a1", ActionType.VIBRATE, Map.of()))
                .connect("t1", "c1", FlowPorts.EVENT_IN)
                .connect("c1", "a1", FlowPorts.ACTION_IN)
                .build();
    }

    @Test
    @DisplayName("Should keep nodes in insertion order")
    void shouldKeepInsertionOrder() {
        FlowGraph graph = triggerConditionAction();

        assertThat(graph.nodeMap().keySet()).containsExactly("t1", "c1", "a1");
        assertThat(graph.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should resolve upstream node through an input port")
    void shouldResolveUpstream() {
        FlowGraph graph = triggerConditionAction();
        FlowNode action = graph.node("a1").orElseThrow();

        assertThat(graph.upstreamOf(action.input(FlowPorts.ACTION_IN).orElseThrow()))
                .map(FlowNode::id)
                .contains("c1");
    }

    @Test
    @DisplayName("Should resolve a reference to a missing node to empty")
    void shouldTreatBrokenReferenceAsUnwired() {
        FlowGraph graph = FlowGraph.builder()
                .add(FlowNodes.action("a1", ActionType.VIBRATE, Map.of()))
                .connect("ghost", "a1", FlowPorts.ACTION_IN)
                .build();
        FlowNode action = graph.node("a1").orElseThrow();

        assertThat(action.hasConnectedInput()).isTrue();
        assertThat(graph.upstreamOf(action.inputs().get(0))).isEmpty();
        assertThat(graph.referencedNodeIds()).isEmpty();
    }

    @Test
    @DisplayName("Should list consumers and referenced ids")
    void shouldListConsumers() {
        FlowGraph graph = triggerConditionAction();

        assertThat(graph.consumersOf("t1")).extracting(FlowNode::id).containsExactly("c1");
        assertThat(graph.consumersOf("a1")).isEmpty();
        assertThat(graph.referencedNodeIds()).containsExactly("t1", "c1");
    }

    @Test
    @DisplayName("Should reject connections to unknown targets or inputs")
    void shouldRejectInvalidConnections() {
        FlowGraph.Builder builder = FlowGraph.builder()
                .add(FlowNodes.trigger("t1", TriggerType.MANUAL, Map.of()))
                .add(FlowNodes.notGate("not"));

        assertThatThrownBy(() -> builder.connect("t1", "missing", FlowPorts.EVENT_IN))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown target node");
        assertThatThrownBy(() -> builder.connect("t1", "not", FlowPorts.indexedInput(3)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("has no input");
    }

    @Nested
    @DisplayName("Logic gate inputs")
    class GateInputs {

        @Test
        @DisplayName("Should filter empty slots out of connected inputs")
        void shouldFilterEmptySlots() {
            FlowGraph graph = FlowGraph.builder()
                    .add(FlowNodes.trigger("t1", TriggerType.NODE_ONLINE, Map.of()))
                    .add(FlowNodes.andGate("and", 3))
                    .connect("t1", "and", FlowPorts.indexedInput(1))
                    .build();
            FlowNode gate = graph.node("and").orElseThrow();

            assertThat(gate.inputs()).hasSize(3);
            assertThat(gate.connectedInputs())
                    .extracting(InputPort::type)
                    .containsExactly("event_in_1");
        }

        @Test
        @DisplayName("Should append indexed inputs to list gates on demand")
        void shouldAppendIndexedInputs() {
            FlowGraph graph = FlowGraph.builder()
                    .add(FlowNodes.trigger("t1", TriggerType.NODE_ONLINE, Map.of()))
                    .add(FlowNodes.orGate("or", 1))
                    .connect("t1", "or", FlowPorts.indexedInput(0))
                    .connect("t1", "or", FlowPorts.indexedInput(1))
                    .build();

            assertThat(graph.node("or").orElseThrow().connectedInputs()).hasSize(2);
        }

        @Test
        @DisplayName("Should name gate nodes after their editor type")
        void shouldUseEditorGateTypes() {
            assertThat(FlowNodes.andGate("a", 2).type()).isEqualTo("logic_and");
            assertThat(FlowNodes.orGate("o", 2).type()).isEqualTo("logic_or");
            assertThat(FlowNodes.notGate("n").type()).isEqualTo("logic_not");
            assertThat(FlowNodes.delayGate("d", 60).getConfig()).containsEntry("delaySeconds", 60);
        }
    }

    @Test
    @DisplayName("Should tolerate null values in node configuration")
    void shouldAllowNullConfigValues() {
        Map<String, Object> config = new HashMap<>();
        config.put("nodeNum", null);

        FlowNode trigger = FlowNodes.trigger("t1", TriggerType.NODE_OFFLINE, config);

        assertThat(trigger.getConfig()).containsKey("nodeNum");
        assertThat(trigger.getConfig().get("nodeNum")).isNull();
    }
}
