/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler;

import com.meshflow.automation.api.CompilationListener;
import com.meshflow.automation.api.IFlowCompiler;
import com.meshflow.automation.api.graph.DecompiledGraph;
import com.meshflow.automation.api.graph.FlowGraph;
import com.meshflow.automation.api.graph.FlowNode;
import com.meshflow.automation.api.graph.InputPort;
import com.meshflow.automation.api.graph.NodeKind;
import com.meshflow.automation.api.model.Automation;
import com.meshflow.automation.api.model.FlowCompilationResult;
import com.meshflow.automation.api.model.FlowDiagnostic;
import com.meshflow.automation.api.model.FlowGraphMetadata;
import com.meshflow.automation.compiler.config.CompilerConfig;
import com.meshflow.automation.compiler.decompile.FlowDecompiler;
import com.meshflow.automation.compiler.emit.AutomationEmitter;
import com.meshflow.automation.compiler.emit.DisconnectedNodeScanner;
import com.meshflow.automation.compiler.emit.PathGroup;
import com.meshflow.automation.compiler.emit.PathGrouper;
import com.meshflow.automation.compiler.trace.CompiledPath;
import com.meshflow.automation.compiler.trace.DiagnosticCollector;
import com.meshflow.automation.compiler.trace.PathTracer;
import com.meshflow.automation.compiler.validation.FlowGraphValidator;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles visual flow graphs into automations.
 *
 * The compilation runs in three stages:
 * 1. PATH_TRACING: every action node is traced back to the triggers that can
 * reach it, with a fresh visited set per action.
 * 2. PATH_GROUPING: paths are grouped by signature so actions sharing the
 * same trigger, conditions and delay land in one automation, then each group
 * is emitted with a generated name and description.
 * 3. DISCONNECTED_SCAN: conditions and gates that feed nothing are reported.
 *
 * Graph problems never throw; they come back as diagnostics on the result,
 * and an action whose path fails is dropped without affecting the others.
 * An instance holds no per-compile state and may be shared between threads
 * as long as the tracer and listener are not swapped while compiles run.
 */
public class FlowCompiler implements IFlowCompiler {

    private static final Logger logger = Logger.getLogger(FlowCompiler.class.getName());

    public static final String STAGE_PATH_TRACING = "PATH_TRACING";
    public static final String STAGE_PATH_GROUPING = "PATH_GROUPING";
    public static final String STAGE_DISCONNECTED_SCAN = "DISCONNECTED_SCAN";
    static final int TOTAL_STAGES = 3;

    private final CompilerConfig config;
    private final FlowGraphValidator validator = new FlowGraphValidator();
    private final FlowDecompiler decompiler = new FlowDecompiler();
    private Tracer tracer;
    private CompilationListener listener;

    public FlowCompiler() {
        this(OpenTelemetry.noop().getTracer(FlowCompiler.class.getName()), CompilerConfig.loadDefault());
    }

    public FlowCompiler(Tracer tracer) {
        this(tracer, CompilerConfig.loadDefault());
    }

    public FlowCompiler(Tracer tracer, CompilerConfig config) {
        this.tracer = tracer;
        this.config = config;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    public CompilerConfig getConfig() {
        return config;
    }

    @Override
    public FlowCompilationResult compile(FlowGraph graph, String flowName, String graphJson) {
        Span span = tracer.spanBuilder("compile-flow").startSpan();
        String stage = null;
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("nodeCount", graph.size());
            if (flowName != null) {
                span.setAttribute("flowName", flowName);
            }
            long startTime = System.nanoTime();
            DiagnosticCollector diagnostics = new DiagnosticCollector();

            List<FlowNode> actionNodes = graph.nodesOfKind(NodeKind.ACTION);
            span.setAttribute("actionNodeCount", actionNodes.size());
            if (actionNodes.isEmpty()) {
                logger.info("Flow '" + flowName + "' has no action nodes, nothing to compile");
                diagnostics.error("No action nodes found in the graph. "
                        + "Add at least one action node to create an automation.");
                return new FlowCompilationResult(List.of(), diagnostics.errors(), diagnostics.warnings(), null);
            }

            stage = STAGE_PATH_TRACING;
            long stageStart = stageStarted(stage, 1);
            Map<FlowNode, List<CompiledPath>> pathsPerAction = traceActions(graph, actionNodes, diagnostics);
            int pathCount = pathsPerAction.values().stream().mapToInt(List::size).sum();
            stageCompleted(stage, stageStart, Map.of(
                    "actionCount", actionNodes.size(),
                    "tracedActionCount", pathsPerAction.size(),
                    "pathCount", pathCount));

            stage = STAGE_PATH_GROUPING;
            stageStart = stageStarted(stage, 2);
            List<PathGroup> groups = PathGrouper.group(pathsPerAction);
            AutomationEmitter.Emission emission = new AutomationEmitter(config, diagnostics).emit(groups, flowName);
            stageCompleted(stage, stageStart, Map.of(
                    "groupCount", groups.size(),
                    "automationCount", emission.automations().size()));

            stage = STAGE_DISCONNECTED_SCAN;
            stageStart = stageStarted(stage, 3);
            int disconnected = DisconnectedNodeScanner.scan(graph, diagnostics);
            stageCompleted(stage, stageStart, Map.of("disconnectedNodeCount", disconnected));

            FlowGraphMetadata metadata = null;
            if (graphJson != null) {
                List<String> automationIds = new ArrayList<>(emission.automations().size());
                for (Automation automation : emission.automations()) {
                    automationIds.add(automation.id());
                }
                metadata = new FlowGraphMetadata(graphJson, automationIds,
                        emission.actionNodeToAutomationIds(), flowName);
            }

            long compilationTime = System.nanoTime() - startTime;
            span.setAttribute("pathCount", pathCount);
            span.setAttribute("automationCount", emission.automations().size());
            span.setAttribute("errorCount", diagnostics.errorCount());
            span.setAttribute("warningCount", diagnostics.warningCount());
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(compilationTime));

            logger.info(String.format("Compiled flow '%s': %d automations from %d paths, %d errors, %d warnings (%d us)",
                    flowName, emission.automations().size(), pathCount, diagnostics.errorCount(),
                    diagnostics.warningCount(), TimeUnit.NANOSECONDS.toMicros(compilationTime)));

            return new FlowCompilationResult(emission.automations(), diagnostics.errors(),
                    diagnostics.warnings(), metadata);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Flow compilation failed in stage " + stage, e);
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getClass().getSimpleName());
            if (listener != null) {
                listener.onError(stage == null ? "SETUP" : stage, e);
            }
            return FlowCompilationResult.failed(List.of(
                    FlowDiagnostic.error("Internal compiler error: " + e.getMessage())));
        } finally {
            span.end();
        }
    }

    @Override
    public List<FlowDiagnostic> validate(FlowGraph graph) {
        List<FlowDiagnostic> issues = validator.validate(graph);
        if (!issues.isEmpty()) {
            logger.fine("Flow graph validation found " + issues.size() + " issue(s)");
        }
        return issues;
    }

    @Override
    public DecompiledGraph decompile(Automation automation) {
        Span span = tracer.spanBuilder("decompile-automation").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("automationId", automation.id());
            DecompiledGraph graph = decompiler.decompile(automation);
            span.setAttribute("nodeCount", graph.nodes().size());
            return graph;
        } finally {
            span.end();
        }
    }

    private Map<FlowNode, List<CompiledPath>> traceActions(FlowGraph graph,
                                                           List<FlowNode> actionNodes,
                                                           DiagnosticCollector diagnostics) {
        Span span = tracer.spanBuilder("trace-paths").startSpan();
        try (Scope scope = span.makeCurrent()) {
            PathTracer pathTracer = new PathTracer(graph, diagnostics, config);
            Map<FlowNode, List<CompiledPath>> pathsPerAction = new LinkedHashMap<>();

            for (FlowNode action : actionNodes) {
                InputPort input = action.inputs().isEmpty() ? null : action.inputs().get(0);
                if (input == null || !input.isConnected()) {
                    diagnostics.error("Action node \"" + action.title() + "\" has no upstream connection. "
                            + "Connect a trigger or condition to its input.", action);
                    continue;
                }

                Optional<FlowNode> upstream = graph.upstreamOf(input);
                if (upstream.isEmpty()) {
                    diagnostics.error("Action node \"" + action.title()
                            + "\" has a broken upstream reference.", action);
                    continue;
                }

                List<CompiledPath> paths = pathTracer.tracePaths(upstream.get(), new HashSet<>());
                if (paths.isEmpty()) {
                    diagnostics.error("Action node \"" + action.title()
                            + "\" has no valid path to a trigger node.", action);
                    continue;
                }
                pathsPerAction.put(action, paths);
            }

            span.setAttribute("tracedActionCount", pathsPerAction.size());
            return pathsPerAction;
        } finally {
            span.end();
        }
    }

    private long stageStarted(String stage, int stageNumber) {
        logger.fine("Stage " + stageNumber + "/" + TOTAL_STAGES + ": " + stage);
        if (listener != null) {
            listener.onStageStart(stage, stageNumber, TOTAL_STAGES);
        }
        return System.nanoTime();
    }

    private void stageCompleted(String stage, long startNanos, Map<String, Object> metrics) {
        if (listener != null) {
            listener.onStageComplete(stage,
                    new CompilationListener.StageResult(stage, System.nanoTime() - startNanos, metrics));
        }
    }
}
