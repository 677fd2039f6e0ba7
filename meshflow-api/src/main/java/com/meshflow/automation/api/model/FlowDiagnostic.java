/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * An error or warning raised while validating or compiling a flow graph.
 *
 * <p>Errors drop the affected path, branch or action from the output.
 * Warnings keep the output but mean something was substituted or ignored.
 * When the offending node is known its id and type are attached so the
 * editor can highlight it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlowDiagnostic(
    @JsonProperty("severity") Severity severity,
    @JsonProperty("message") String message,
    @JsonProperty("node_id") String nodeId,
    @JsonProperty("node_type") String nodeType
) implements Serializable {

    public enum Severity {
        ERROR,
        WARNING
    }

    public FlowDiagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
    }

    public static FlowDiagnostic error(String message) {
        return new FlowDiagnostic(Severity.ERROR, message, null, null);
    }

    public static FlowDiagnostic error(String message, String nodeId, String nodeType) {
        return new FlowDiagnostic(Severity.ERROR, message, nodeId, nodeType);
    }

    public static FlowDiagnostic warning(String message, String nodeId, String nodeType) {
        return new FlowDiagnostic(Severity.WARNING, message, nodeId, nodeType);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        String location = nodeId != null ? " (node: " + nodeId + ", type: " + nodeType + ")" : "";
        return severity + ": " + message + location;
    }
}
