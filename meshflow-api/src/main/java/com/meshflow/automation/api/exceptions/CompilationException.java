/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.exceptions;

/**
 * Thrown when flow input cannot be turned into a graph at all, for example
 * malformed serialized graph JSON.
 *
 * <p>Problems with the graph's content (cycles, missing wires, unknown types)
 * are never thrown; they are reported as diagnostics on the compilation result.
 * This is a RuntimeException so that callers are not forced into checked
 * exception handling around the codec.
 */
public class CompilationException extends RuntimeException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
