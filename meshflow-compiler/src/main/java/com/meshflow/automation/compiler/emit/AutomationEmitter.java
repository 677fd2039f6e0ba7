/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.emit;

import com.meshflow.automation.api.model.ActionType;
import com.meshflow.automation.api.model.Automation;
import com.meshflow.automation.api.model.AutomationAction;
import com.meshflow.automation.api.model.AutomationCondition;
import com.meshflow.automation.api.model.AutomationTrigger;
import com.meshflow.automation.api.model.ConfigMaps;
import com.meshflow.automation.api.model.TriggerType;
import com.meshflow.automation.compiler.config.CompilerConfig;
import com.meshflow.automation.compiler.trace.CompiledPath;
import com.meshflow.automation.compiler.trace.DiagnosticCollector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Turns path groups into automations.
 *
 * <p>Per group: the trigger type must resolve, otherwise the group is
 * dropped with an error. Unknown action types fall back to
 * {@link ActionType#FALLBACK} with a warning so an automation never ends up
 * without actions. A merged delay is stored in the trigger config under
 * {@link CompilerConfig#getDelayConfigKey()}, where the rule engine reads it.
 *
 * <p>Generated text:
 * <pre>
 * name:        Porch light: Node Online → Notify, Vibrate
 *              Porch light 2: Node Online → Notify     (when the graph yields several automations)
 * description: When: Node Online · If: Battery Above AND Time Range · After: 5m delay · Then: Notify
 * </pre>
 */
public final class AutomationEmitter {

    private static final Logger logger = Logger.getLogger(AutomationEmitter.class.getName());

    static final String CLAUSE_SEPARATOR = " · ";

    private final CompilerConfig config;
    private final DiagnosticCollector diagnostics;

    public AutomationEmitter(CompilerConfig config, DiagnosticCollector diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
    }

    /**
     * Automations built from path groups, plus which automations each action
     * node ended up in.
     */
    public record Emission(List<Automation> automations, Map<String, List<String>> actionNodeToAutomationIds) {

        public Emission {
            automations = List.copyOf(automations);
            Map<String, List<String>> mapping = new LinkedHashMap<>();
            actionNodeToAutomationIds.forEach((nodeId, ids) -> mapping.put(nodeId, List.copyOf(ids)));
            actionNodeToAutomationIds = Collections.unmodifiableMap(mapping);
        }
    }

    public Emission emit(List<PathGroup> groups, String flowName) {
        String prefix = flowName == null || flowName.isBlank() ? config.getDefaultFlowName() : flowName;
        boolean indexed = groups.size() > 1;

        List<Automation> automations = new ArrayList<>(groups.size());
        Map<String, List<String>> actionNodeToAutomationIds = new LinkedHashMap<>();

        int index = 0;
        for (PathGroup group : groups) {
            index++;
            CompiledPath path = group.representative();

            Optional<TriggerType> triggerType = TriggerType.fromWireName(path.triggerType());
            if (triggerType.isEmpty()) {
                diagnostics.error("Unknown trigger type \"" + path.triggerType()
                        + "\" encountered during compilation.", path.triggerNodeId(), path.triggerType());
                continue;
            }

            List<AutomationAction> actions = new ArrayList<>(group.actions().size());
            for (ActionEntry entry : group.actions()) {
                actions.add(new AutomationAction(resolveActionType(entry), entry.config()));
            }

            String triggerName = triggerType.get().displayName();
            String actionNames = actionTitles(group.actions());
            String name = indexed
                    ? prefix + " " + index + ": " + triggerName + " → " + actionNames
                    : prefix + ": " + triggerName + " → " + actionNames;

            Map<String, Object> triggerConfig = path.hasDelay()
                    ? ConfigMaps.with(path.triggerConfig(), config.getDelayConfigKey(), path.delaySeconds())
                    : path.triggerConfig();

            Automation automation = Automation.create(
                    name,
                    describe(triggerName, path, actionNames),
                    new AutomationTrigger(triggerType.get(), triggerConfig),
                    actions,
                    path.conditions());
            automations.add(automation);

            for (ActionEntry entry : group.actions()) {
                actionNodeToAutomationIds.computeIfAbsent(entry.nodeId(), id -> new ArrayList<>())
                        .add(automation.id());
            }
            logger.fine("Emitted automation '" + name + "' from signature " + group.signature());
        }

        return new Emission(automations, actionNodeToAutomationIds);
    }

    private ActionType resolveActionType(ActionEntry entry) {
        Optional<ActionType> resolved = ActionType.fromWireName(entry.actionType());
        if (resolved.isPresent()) {
            return resolved.get();
        }
        diagnostics.warning("Unknown action type \"" + entry.actionType() + "\"; using "
                + ActionType.FALLBACK.wireName() + " as fallback.", entry.nodeId(), entry.actionType());
        return ActionType.FALLBACK;
    }

    static String describe(String triggerName, CompiledPath path, String actionNames) {
        List<String> clauses = new ArrayList<>(4);
        clauses.add("When: " + triggerName);
        if (!path.conditions().isEmpty()) {
            List<String> conditionNames = new ArrayList<>(path.conditions().size());
            for (AutomationCondition condition : path.conditions()) {
                conditionNames.add(condition.type().displayName());
            }
            clauses.add("If: " + String.join(" AND ", conditionNames));
        }
        if (path.hasDelay()) {
            clauses.add("After: " + DelayFormat.format(path.delaySeconds()) + " delay");
        }
        clauses.add("Then: " + actionNames);
        return String.join(CLAUSE_SEPARATOR, clauses);
    }

    private static String actionTitles(List<ActionEntry> entries) {
        List<String> titles = new ArrayList<>(entries.size());
        for (ActionEntry entry : entries) {
            titles.add(entry.title());
        }
        return String.join(", ", titles);
    }
}
