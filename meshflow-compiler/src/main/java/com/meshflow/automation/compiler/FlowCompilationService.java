/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler;

import com.meshflow.automation.api.IFlowCompiler;
import com.meshflow.automation.api.exceptions.CompilationException;
import com.meshflow.automation.api.graph.FlowGraph;
import com.meshflow.automation.api.model.Automation;
import com.meshflow.automation.api.model.FlowCompilationResult;
import com.meshflow.automation.api.model.FlowDiagnostic;
import com.meshflow.automation.api.model.FlowGraphMetadata;
import com.meshflow.automation.compiler.decompile.DecompiledGraphMaterializer;
import com.meshflow.automation.compiler.io.FlowGraphCodec;

import java.util.List;
import java.util.logging.Logger;

/**
 * Editor-facing entry point: validate before compiling, attach the serialized
 * graph to the result, and load graphs back from automations or saved
 * metadata.
 */
public class FlowCompilationService {

    private static final Logger logger = Logger.getLogger(FlowCompilationService.class.getName());

    private final IFlowCompiler compiler;
    private final FlowGraphCodec codec;
    private final DecompiledGraphMaterializer materializer;

    public FlowCompilationService() {
        this(new FlowCompiler(), new FlowGraphCodec());
    }

    public FlowCompilationService(IFlowCompiler compiler, FlowGraphCodec codec) {
        this.compiler = compiler;
        this.codec = codec;
        this.materializer = new DecompiledGraphMaterializer();
    }

    /**
     * Validates the graph and compiles it only when validation finds no
     * errors. A failed validation returns its errors and no automations.
     */
    public FlowCompilationResult compileChecked(FlowGraph graph, String flowName) {
        List<FlowDiagnostic> issues = compiler.validate(graph);
        if (!issues.isEmpty()) {
            logger.info("Flow '" + flowName + "' failed validation with " + issues.size() + " error(s)");
            return FlowCompilationResult.failed(issues);
        }
        return compiler.compile(graph, flowName, codec.toJson(graph));
    }

    /**
     * Recompiles a graph saved alongside earlier automations, keeping its flow name.
     *
     * @throws CompilationException if the saved graph JSON cannot be parsed
     */
    public FlowCompilationResult recompile(FlowGraphMetadata metadata) {
        return compileChecked(loadFromMetadata(metadata), metadata.flowName());
    }

    /**
     * Rebuilds an editable graph for an automation that has no saved graph.
     */
    public FlowGraph loadFromAutomation(Automation automation) {
        return materializer.materialize(compiler.decompile(automation));
    }

    /**
     * @throws CompilationException if the saved graph JSON cannot be parsed
     */
    public FlowGraph loadFromMetadata(FlowGraphMetadata metadata) {
        return codec.fromJson(metadata.graphJson());
    }
}
