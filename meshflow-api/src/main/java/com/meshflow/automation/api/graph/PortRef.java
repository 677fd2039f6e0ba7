/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.graph;

import java.util.Objects;

/**
 * Non-owning reference from an input port to the output port it is wired to.
 * The referenced node may be missing from the graph; such a reference is
 * treated as broken, never followed.
 *
 * @param nodeId     id of the upstream node
 * @param outputType type of the upstream output port, usually {@code event_out}
 */
public record PortRef(String nodeId, String outputType) {

    public PortRef {
        Objects.requireNonNull(nodeId, "nodeId");
        if (outputType == null) {
            outputType = FlowPorts.EVENT_OUT;
        }
    }

    public static PortRef to(String nodeId) {
        return new PortRef(nodeId, FlowPorts.EVENT_OUT);
    }
}
