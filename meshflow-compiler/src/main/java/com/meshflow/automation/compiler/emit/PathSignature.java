/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.emit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.meshflow.automation.api.model.AutomationCondition;
import com.meshflow.automation.compiler.trace.CompiledPath;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Grouping key of a compiled path: trigger type, trigger config, the
 * condition set and the delay.
 *
 * <p>Config maps are rendered as JSON with keys sorted at every depth, and
 * conditions are sorted, so neither map insertion order nor the order in
 * which branches were traced changes the key. Two paths with equal
 * signatures compile into one automation.
 */
public record PathSignature(String key) {

    private static final Logger logger = Logger.getLogger(PathSignature.class.getName());

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();

    public PathSignature {
        Objects.requireNonNull(key, "key");
    }

    public static PathSignature of(CompiledPath path) {
        List<String> conditionKeys = new ArrayList<>(path.conditions().size());
        for (AutomationCondition condition : path.conditions()) {
            conditionKeys.add(condition.type().wireName() + ":" + canonical(condition.config()));
        }
        conditionKeys.sort(null);

        return new PathSignature(path.triggerType()
                + "|" + canonical(path.triggerConfig())
                + "|" + String.join(",", conditionKeys)
                + "|" + path.delaySeconds());
    }

    /**
     * Key-sorted JSON rendering of a config map. Values Jackson cannot
     * serialize fall back to a key-sorted {@code toString}.
     */
    static String canonical(Map<String, Object> config) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            logger.fine("Falling back to toString signature for config " + config.keySet()
                    + ": " + e.getOriginalMessage());
            return new TreeMap<>(config).toString();
        }
    }

    @Override
    public String toString() {
        return key;
    }
}
