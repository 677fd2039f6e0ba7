/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for the untyped configuration maps carried by nodes, triggers,
 * conditions and actions.
 *
 * <p>Config shape is owned by the pluggable trigger/condition/action catalog,
 * so maps stay opaque here. Values may be null (an unset node number is a
 * valid configuration), which rules out {@link Map#copyOf}.
 */
public final class ConfigMaps {

    private ConfigMaps() {}

    /**
     * Immutable, insertion-ordered copy. Accepts maps with non-string keys,
     * which are converted with {@link String#valueOf}. A null map becomes an
     * empty map.
     */
    public static Map<String, Object> copyOf(Map<?, ?> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> copy = new LinkedHashMap<>(source.size() * 2);
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Copy of {@code source} with one additional entry.
     */
    public static Map<String, Object> with(Map<String, Object> source, String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(source);
        copy.put(key, value);
        return Collections.unmodifiableMap(copy);
    }
}
