/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.trace;

import com.meshflow.automation.api.graph.FlowNode;
import com.meshflow.automation.api.model.FlowDiagnostic;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates errors and warnings for a single compile call. Not thread-safe;
 * each compile creates its own.
 */
public final class DiagnosticCollector {

    private final List<FlowDiagnostic> errors = new ArrayList<>();
    private final List<FlowDiagnostic> warnings = new ArrayList<>();

    public void error(String message) {
        errors.add(FlowDiagnostic.error(message));
    }

    public void error(String message, FlowNode node) {
        errors.add(FlowDiagnostic.error(message, node.id(), node.type()));
    }

    public void error(String message, String nodeId, String nodeType) {
        errors.add(FlowDiagnostic.error(message, nodeId, nodeType));
    }

    public void warning(String message, FlowNode node) {
        warnings.add(FlowDiagnostic.warning(message, node.id(), node.type()));
    }

    public void warning(String message, String nodeId, String nodeType) {
        warnings.add(FlowDiagnostic.warning(message, nodeId, nodeType));
    }

    public void addAll(List<FlowDiagnostic> diagnostics) {
        for (FlowDiagnostic diagnostic : diagnostics) {
            if (diagnostic.isError()) {
                errors.add(diagnostic);
            } else {
                warnings.add(diagnostic);
            }
        }
    }

    public List<FlowDiagnostic> errors() {
        return List.copyOf(errors);
    }

    public List<FlowDiagnostic> warnings() {
        return List.copyOf(warnings);
    }

    public int errorCount() {
        return errors.size();
    }

    public int warningCount() {
        return warnings.size();
    }
}
