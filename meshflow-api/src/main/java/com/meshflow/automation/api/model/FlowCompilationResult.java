/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of compiling one flow graph.
 *
 * <p>A compilation always produces a result, even for a malformed graph.
 * Callers should check both {@link #isSuccess()} and {@link #isEmpty()}:
 * a compile without errors can still yield no automations.
 *
 * <h2>Usage</h2>
 * <pre>
 * FlowCompilationResult result = compiler.compile(graph, "Porch light", graphJson);
 * if (result.isSuccess()) {
 *     store.saveAll(result.automations(), result.graphMetadata().orElseThrow());
 * } else {
 *     result.errors().forEach(e -> editor.highlight(e.nodeId(), e.message()));
 * }
 * </pre>
 */
public record FlowCompilationResult(
    @JsonProperty("automations") List<Automation> automations,
    @JsonProperty("errors") List<FlowDiagnostic> errors,
    @JsonProperty("warnings") List<FlowDiagnostic> warnings,
    @JsonProperty("graph_metadata") FlowGraphMetadata metadata
) implements Serializable {

    public FlowCompilationResult {
        automations = automations == null ? List.of() : List.copyOf(automations);
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static FlowCompilationResult failed(List<FlowDiagnostic> errors) {
        return new FlowCompilationResult(List.of(), errors, List.of(), null);
    }

    /**
     * No errors and at least one automation.
     */
    @JsonIgnore
    public boolean isSuccess() {
        return errors.isEmpty() && !automations.isEmpty();
    }

    /**
     * No automations were produced.
     */
    @JsonIgnore
    public boolean isEmpty() {
        return automations.isEmpty();
    }

    @JsonIgnore
    public Optional<FlowGraphMetadata> graphMetadata() {
        return Optional.ofNullable(metadata);
    }
}
