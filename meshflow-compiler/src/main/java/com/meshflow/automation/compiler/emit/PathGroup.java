/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.emit;

import com.meshflow.automation.compiler.trace.CompiledPath;

import java.util.List;

/**
 * Actions that share one path signature and therefore one automation.
 *
 * @param signature      shared signature
 * @param representative path the automation is built from; every path in the group is structurally equal to it
 * @param actions        contributing actions in first-seen order
 */
public record PathGroup(PathSignature signature, CompiledPath representative, List<ActionEntry> actions) {

    public PathGroup {
        actions = List.copyOf(actions);
    }
}
