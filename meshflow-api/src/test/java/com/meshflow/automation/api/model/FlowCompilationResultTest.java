/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FlowCompilationResultTest {

    private static Automation automation() {
        return Automation.create("n", "d",
                new AutomationTrigger(TriggerType.MANUAL, Map.of()),
                List.of(new AutomationAction(ActionType.VIBRATE, Map.of())),
                List.of());
    }

    @Test
    @DisplayName("Successful result needs automations and no errors")
    void shouldDeriveSuccess() {
        FlowCompilationResult ok = new FlowCompilationResult(List.of(automation()), List.of(), List.of(), null);
        FlowCompilationResult emptyOk = new FlowCompilationResult(List.of(), List.of(), List.of(), null);
        FlowCompilationResult withError = new FlowCompilationResult(List.of(automation()),
                List.of(FlowDiagnostic.error("boom")), List.of(), null);

        assertThat(ok.isSuccess()).isTrue();
        assertThat(ok.isEmpty()).isFalse();
        assertThat(emptyOk.isSuccess()).isFalse();
        assertThat(emptyOk.isEmpty()).isTrue();
        assertThat(withError.isSuccess()).isFalse();
        assertThat(withError.graphMetadata()).isEmpty();
    }

    @Test
    @DisplayName("Should render node attribution in diagnostics")
    void shouldRenderDiagnostic() {
        FlowDiagnostic diagnostic = FlowDiagnostic.warning("Node is disconnected", "n1", "logic_or");

        assertThat(diagnostic.isError()).isFalse();
        assertThat(diagnostic.toString())
                .isEqualTo("WARNING: Node is disconnected (node: n1, type: logic_or)");
        assertThat(FlowDiagnostic.error("No actions").toString()).isEqualTo("ERROR: No actions");
    }

    @Test
    @DisplayName("Metadata maps one action node to several automations")
    void shouldMapActionsToAutomations() {
        FlowGraphMetadata metadata = new FlowGraphMetadata("{}", List.of("r1", "r2"),
                Map.of("a1", List.of("r1", "r2")), null);

        assertThat(metadata.automationIdsFor("a1")).containsExactly("r1", "r2");
        assertThat(metadata.automationIdsFor("a2")).isEmpty();
    }
}
