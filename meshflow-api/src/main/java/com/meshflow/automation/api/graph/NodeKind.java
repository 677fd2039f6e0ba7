/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.graph;

import com.meshflow.automation.api.model.ActionType;
import com.meshflow.automation.api.model.ConditionType;
import com.meshflow.automation.api.model.TriggerType;

/**
 * Closed set of node kinds the compiler understands.
 *
 * <p>The four gate kinds make up the logic gate family. {@link #UNKNOWN}
 * covers node kinds added by newer editors; the compiler traces through them
 * on a best-effort basis instead of failing.
 */
public enum NodeKind {
    TRIGGER,
    CONDITION,
    AND_GATE("logic_and", "AND"),
    OR_GATE("logic_or", "OR"),
    NOT_GATE("logic_not", "NOT"),
    DELAY_GATE("logic_delay", "Delay"),
    ACTION,
    UNKNOWN;

    private final String gateType;
    private final String gateLabel;

    NodeKind() {
        this(null, null);
    }

    NodeKind(String gateType, String gateLabel) {
        this.gateType = gateType;
        this.gateLabel = gateLabel;
    }

    public boolean isLogicGate() {
        return gateType != null;
    }

    /**
     * Editor type string of a gate kind ({@code logic_and}, ...), or null for
     * non-gate kinds.
     */
    public String gateType() {
        return gateType;
    }

    public String gateLabel() {
        return gateLabel;
    }

    /**
     * Infers a kind from an editor node type string, for graphs serialized
     * without an explicit kind.
     *
     * <p>Gate types are checked first, then conditions (whose node-online and
     * node-offline types carry a {@code cond_} prefix), then triggers and
     * actions.
     */
    public static NodeKind infer(String type) {
        if (type == null) {
            return UNKNOWN;
        }
        for (NodeKind kind : values()) {
            if (kind.isLogicGate() && kind.gateType.equals(type)) {
                return kind;
            }
        }
        if (ConditionType.fromNodeType(type).isPresent()) {
            return CONDITION;
        }
        if (TriggerType.fromWireName(type).isPresent()) {
            return TRIGGER;
        }
        if (ActionType.fromWireName(type).isPresent()) {
            return ACTION;
        }
        return UNKNOWN;
    }
}
