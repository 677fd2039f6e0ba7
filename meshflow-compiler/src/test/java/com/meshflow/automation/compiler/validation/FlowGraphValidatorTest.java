/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.validation;

import com.meshflow.automation.api.graph.FlowGraph;
import com.meshflow.automation.api.graph.FlowNodes;
import com.meshflow.automation.api.graph.FlowPorts;
import com.meshflow.automation.api.model.ActionType;
import com.meshflow.automation.api.model.ConditionType;
import com.meshflow.automation.api.model.FlowDiagnostic;
import com.meshflow.automation.api.model.TriggerType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FlowGraphValidatorTest {

    private final FlowGraphValidator validator = new FlowGraphValidator();

    @Test
    @DisplayName("A wired trigger-to-action graph should be valid")
    void wiredGraphShouldBeValid() {
        FlowGraph graph = FlowGraph.builder()
                .add(FlowNodes.trigger("t1", TriggerType.BATTERY_LOW, Map.of()))
                .add(FlowNodes.action("a1", ActionType.PUSH_NOTIFICATION, Map.of()))
                .connect("t1", "a1", FlowPorts.ACTION_IN)
                .build();

        assertThat(validator.validate(graph)).isEmpty();
    }

    @Test
    @DisplayName("An empty graph should miss both a trigger and an action")
    void emptyGraphShouldReportBoth() {
        List<FlowDiagnostic> issues = validator.validate(FlowGraph.empty());

        assertThat(issues).extracting(FlowDiagnostic::message).containsExactly(
                "Graph has no trigger node. Add a trigger to define when the automation should fire.",
                "Graph has no action node. Add an action to define what happens when the automation fires.");
        assertThat(issues).allMatch(FlowDiagnostic::isError);
    }

    @Test
    @DisplayName("Unwired and broken action inputs should both be reported")
    void unwiredActionsShouldBeReported() {
        FlowGraph graph = FlowGraph.builder()
                .add(FlowNodes.trigger("t1", TriggerType.MANUAL, Map.of()))
                .add(FlowNodes.action("a1", ActionType.VIBRATE, Map.of()))
                .add(FlowNodes.action("a2", ActionType.LOG_EVENT, Map.of()))
                .connect("deleted", "a2", FlowPorts.ACTION_IN)
                .build();

        assertThat(validator.validate(graph)).extracting(FlowDiagnostic::nodeId).containsExactly("a1", "a2");
    }

    @Test
    @DisplayName("Only gates with consumers should need inputs")
    void onlyConsumedGatesNeedInputs() {
        FlowGraph graph = FlowGraph.builder()
                .add(FlowNodes.trigger("t1", TriggerType.MANUAL, Map.of()))
                .add(FlowNodes.orGate("or", 2))
                .add(FlowNodes.notGate("idle"))
                .add(FlowNodes.condition("c1", ConditionType.DAY_OF_WEEK, Map.of()))
                .add(FlowNodes.action("a1", ActionType.VIBRATE, Map.of()))
                .connect("or", "c1", FlowPorts.EVENT_IN)
                .connect("t1", "a1", FlowPorts.ACTION_IN)
                .build();

        List<FlowDiagnostic> issues = validator.validate(graph);

        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.message()).isEqualTo(
                    "Logic gate \"OR\" has no connected inputs but has downstream nodes depending on it.");
            assertThat(issue.nodeType()).isEqualTo("logic_or");
        });
    }
}
