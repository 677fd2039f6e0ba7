/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.decompile;

import com.meshflow.automation.api.graph.CanvasOffset;
import com.meshflow.automation.api.graph.DecompiledConnection;
import com.meshflow.automation.api.graph.DecompiledGraph;
import com.meshflow.automation.api.graph.DecompiledNode;
import com.meshflow.automation.api.graph.FlowGraph;
import com.meshflow.automation.api.graph.FlowNode;
import com.meshflow.automation.api.graph.NodeKind;
import com.meshflow.automation.api.model.ActionType;
import com.meshflow.automation.api.model.Automation;
import com.meshflow.automation.api.model.AutomationAction;
import com.meshflow.automation.api.model.AutomationCondition;
import com.meshflow.automation.api.model.AutomationTrigger;
import com.meshflow.automation.api.model.ConditionType;
import com.meshflow.automation.api.model.FlowCompilationResult;
import com.meshflow.automation.api.model.TriggerType;
import com.meshflow.automation.compiler.FlowCompiler;
import com.meshflow.automation.compiler.config.CompilerConfig;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DecompiledGraphMaterializerTest {

    private final DecompiledGraphMaterializer materializer = new DecompiledGraphMaterializer();

    @Test
    @DisplayName("Should build editor nodes with display titles and wired ports")
    void shouldBuildNodes() {
        Automation automation = Automation.create("Test", null,
                new AutomationTrigger(TriggerType.GEOFENCE_ENTER, Map.of()),
                List.of(new AutomationAction(ActionType.SEND_TO_CHANNEL, Map.of("channel", 2))),
                List.of(new AutomationCondition(ConditionType.NODE_ONLINE, Map.of()),
                        new AutomationCondition(ConditionType.TIME_RANGE, Map.of())));

        FlowGraph graph = materializer.materialize(new FlowDecompiler().decompile(automation));

        assertThat(graph.nodeMap().keySet()).containsExactly(
                "decompiled-0", "decompiled-1", "decompiled-2", "decompiled-3", "decompiled-4");
        FlowNode condition = graph.node("decompiled-1").orElseThrow();
        assertThat(condition.title()).isEqualTo("Node Is Online");
        assertThat(condition.type()).isEqualTo("cond_nodeOnline");

        FlowNode gate = graph.node("decompiled-3").orElseThrow();
        assertThat(gate.kind()).isEqualTo(NodeKind.AND_GATE);
        assertThat(gate.connectedInputs()).hasSize(2);

        FlowNode action = graph.node("decompiled-4").orElseThrow();
        assertThat(action.title()).isEqualTo("Send to Channel");
        assertThat(action.getConfig()).containsEntry("channel", 2);
        assertThat(graph.upstreamOf(action.inputs().get(0))).contains(gate);
    }

    @Test
    @DisplayName("Should skip nodes of unknown kind and the connections touching them")
    void shouldSkipUnknownNodes() {
        DecompiledGraph description = new DecompiledGraph(
                List.of(new DecompiledNode("manual", NodeKind.TRIGGER, new CanvasOffset(0, 0), null),
                        new DecompiledNode("nodedexQuery", NodeKind.UNKNOWN, new CanvasOffset(0, 0), null),
                        new DecompiledNode("vibrate", NodeKind.ACTION, new CanvasOffset(0, 0), null)),
                List.of(new DecompiledConnection(0, "event_out", 1, "event_in"),
                        new DecompiledConnection(1, "event_out", 2, "action_in")));

        FlowGraph graph = materializer.materialize(description);

        assertThat(graph.nodeMap().keySet()).containsExactly("decompiled-0", "decompiled-2");
        assertThat(graph.node("decompiled-2").orElseThrow().hasConnectedInput()).isFalse();
    }

    @Test
    @DisplayName("Decompiling and recompiling should give back an equivalent automation")
    void recompileShouldRoundTrip() {
        Automation original = Automation.create("Original", null,
                new AutomationTrigger(TriggerType.NODE_ONLINE, Map.of("nodeNum", 5)),
                List.of(new AutomationAction(ActionType.VIBRATE, Map.of()),
                        new AutomationAction(ActionType.SEND_MESSAGE, Map.of("text", "back online"))),
                List.of(new AutomationCondition(ConditionType.BATTERY_ABOVE, Map.of("batteryThreshold", 50)),
                        new AutomationCondition(ConditionType.DAY_OF_WEEK, Map.of("days", List.of(1, 5)))));
        FlowCompiler compiler = new FlowCompiler(OpenTelemetry.noop().getTracer("test"), CompilerConfig.defaults());

        FlowGraph graph = materializer.materialize(compiler.decompile(original));
        FlowCompilationResult result = compiler.compile(graph, "Round trip", null);

        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.automations()).singleElement().satisfies(recompiled -> {
            assertThat(recompiled.trigger()).isEqualTo(original.trigger());
            assertThat(recompiled.conditions()).isEqualTo(original.conditions());
            assertThat(recompiled.actions()).isEqualTo(original.actions());
            assertThat(recompiled.id()).isNotEqualTo(original.id());
        });
    }
}
