/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api;

import com.meshflow.automation.api.graph.DecompiledGraph;
import com.meshflow.automation.api.graph.FlowGraph;
import com.meshflow.automation.api.model.Automation;
import com.meshflow.automation.api.model.FlowCompilationResult;
import com.meshflow.automation.api.model.FlowDiagnostic;

import io.opentelemetry.api.trace.Tracer;
import java.util.List;

/**
 * Contract for compiling visual flow graphs into automations and back.
 */
public interface IFlowCompiler {

    /**
     * Compiles a flow graph into automations.
     *
     * <p>Never throws on graph content: every structural problem is reported
     * as a {@link FlowDiagnostic} on the result.
     *
     * @param graph     graph snapshot to compile
     * @param flowName  prefix for generated automation names, null for the default
     * @param graphJson serialized graph kept in the round-trip metadata; when null
     *                  no metadata is produced
     * @return compilation result, possibly empty
     */
    FlowCompilationResult compile(FlowGraph graph, String flowName, String graphJson);

    /**
     * Compiles a graph with the default flow name and without round-trip metadata.
     */
    default FlowCompilationResult compile(FlowGraph graph) {
        return compile(graph, null, null);
    }

    /**
     * Runs the structural checks only, without tracing any path.
     *
     * @return validation errors, empty when the graph can be compiled
     */
    List<FlowDiagnostic> validate(FlowGraph graph);

    /**
     * Lays out an existing automation as an editable graph description.
     */
    DecompiledGraph decompile(Automation automation);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
