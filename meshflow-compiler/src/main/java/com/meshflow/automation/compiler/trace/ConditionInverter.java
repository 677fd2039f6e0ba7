/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.trace;

import com.meshflow.automation.api.model.AutomationCondition;
import com.meshflow.automation.api.model.ConditionType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Logical negation of conditions, used by NOT gates.
 *
 * <p>Pairs are symmetric. Time range and day of week have no expressible
 * inverse and map to themselves, so a NOT in front of them is a no-op.
 */
public final class ConditionInverter {

    private static final Map<ConditionType, ConditionType> INVERSES;

    static {
        Map<ConditionType, ConditionType> inverses = new EnumMap<>(ConditionType.class);
        pair(inverses, ConditionType.BATTERY_ABOVE, ConditionType.BATTERY_BELOW);
        pair(inverses, ConditionType.NODE_ONLINE, ConditionType.NODE_OFFLINE);
        pair(inverses, ConditionType.WITHIN_GEOFENCE, ConditionType.OUTSIDE_GEOFENCE);
        inverses.put(ConditionType.TIME_RANGE, ConditionType.TIME_RANGE);
        inverses.put(ConditionType.DAY_OF_WEEK, ConditionType.DAY_OF_WEEK);
        INVERSES = Collections.unmodifiableMap(inverses);
    }

    private ConditionInverter() {
    }

    public static ConditionType invert(ConditionType type) {
        return INVERSES.getOrDefault(type, type);
    }

    /**
     * Same configuration, inverse type.
     */
    public static AutomationCondition invert(AutomationCondition condition) {
        return condition.withType(invert(condition.type()));
    }

    /**
     * Whether {@code type} inverts to something other than itself.
     */
    public static boolean hasDistinctInverse(ConditionType type) {
        return invert(type) != type;
    }

    private static void pair(Map<ConditionType, ConditionType> inverses, ConditionType a, ConditionType b) {
        inverses.put(a, b);
        inverses.put(b, a);
    }
}
