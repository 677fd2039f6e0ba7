/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api;

import java.util.Map;

/**
 * Callback interface for flow compilation stage events.
 * Lets the editor and monitoring code follow a compile as it runs.
 *
 * <p>A flow compile runs three stages:
 * <ol>
 *   <li>PATH_TRACING - Trace every action node back to its triggers</li>
 *   <li>PATH_GROUPING - Group paths by signature and emit automations</li>
 *   <li>DISCONNECTED_SCAN - Warn about nodes that contribute nothing</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * CompilationListener listener = new CompilationListener() {
 *     {@literal @}Override
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) {
 *         statusBar.show(stageName + " (" + stageNumber + "/" + totalStages + ")");
 *     }
 *
 *     {@literal @}Override
 *     public void onStageComplete(String stageName, StageResult result) {
 *         statusBar.show(stageName + " done in " + result.durationMicros() + " us");
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String stageName, Exception error) {
 *         statusBar.error(stageName + ": " + error.getMessage());
 *     }
 * };
 *
 * IFlowCompiler compiler = new FlowCompiler();
 * compiler.setCompilationListener(listener);
 * FlowCompilationResult result = compiler.compile(graph, "Porch light", graphJson);
 * </pre>
 */
public interface CompilationListener {

    /**
     * Called when a compilation stage starts.
     *
     * @param stageName Name of the stage (e.g., "PATH_TRACING")
     * @param stageNumber Current stage number (1-based)
     * @param totalStages Total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a compilation stage completes.
     *
     * @param stageName Name of the stage
     * @param result Result containing duration and stage-specific metrics
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a stage fails with an unexpected exception. Graph problems
     * are reported as diagnostics and never reach this method.
     *
     * @param stageName Name of the stage that failed
     * @param error The exception that occurred
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single compilation stage.
     *
     * @param stageName Name of the stage
     * @param durationNanos Duration in nanoseconds
     * @param metrics Stage-specific metrics (e.g., "pathCount", "automationCount")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        /**
         * Returns the duration in microseconds.
         */
        public long durationMicros() {
            return durationNanos / 1_000;
        }
    }
}
