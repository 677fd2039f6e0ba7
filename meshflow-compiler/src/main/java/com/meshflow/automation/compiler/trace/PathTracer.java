/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.trace;

import com.meshflow.automation.api.graph.FlowGraph;
import com.meshflow.automation.api.graph.FlowNode;
import com.meshflow.automation.api.graph.FlowPorts;
import com.meshflow.automation.api.graph.InputPort;
import com.meshflow.automation.api.model.AutomationCondition;
import com.meshflow.automation.api.model.ConditionType;
import com.meshflow.automation.compiler.config.CompilerConfig;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Walks a flow graph backwards from the node feeding an action to every
 * trigger that can reach it, collecting conditions and delays on the way.
 *
 * <h2>Gate semantics</h2>
 * <ul>
 *   <li>Condition: prepends its condition to every upstream path</li>
 *   <li>AND: cross product of the branch paths, conditions concatenated,
 *       larger delay kept, first branch's trigger kept</li>
 *   <li>OR: concatenation of the branch paths, one automation per branch later on</li>
 *   <li>NOT: inverts the last condition of every path</li>
 *   <li>Delay: max-merges its delay into every path</li>
 *   <li>Unknown: followed through its first connected input</li>
 * </ul>
 *
 * <p>The visited set holds the nodes on the active walk. A node is added on
 * entry and removed on exit, so two branches that share an ancestor are not
 * mistaken for a cycle. AND and OR trace each branch with a copy of the set;
 * the gate itself stays in it, so a loop back into the gate is still caught.
 *
 * <p>Problems are reported to the {@link DiagnosticCollector}; a failing
 * branch yields no paths and tracing carries on elsewhere. Instances belong
 * to a single compile call.
 *
 * <h2>Work limits</h2>
 * Branches sharing an ancestor re-trace it, so chained gates over a common
 * input cost exponential work. Each call to {@link #tracePaths} is bounded by
 * the configured step budget and trace depth; exceeding either stops the walk
 * with one error. Path count and condition count limits fail the gate that
 * crosses them, reported once per gate.
 */
public final class PathTracer {

    private static final Logger logger = Logger.getLogger(PathTracer.class.getName());

    private final FlowGraph graph;
    private final DiagnosticCollector diagnostics;
    private final int maxPaths;
    private final int maxConditions;
    private final int maxDepth;
    private final int maxSteps;
    private final int defaultDelaySeconds;

    // Per-call state, reset by tracePaths
    private int steps;
    private boolean halted;
    private boolean limitReported;
    private final Set<String> reportedNodes = new HashSet<>();

    public PathTracer(FlowGraph graph, DiagnosticCollector diagnostics, CompilerConfig config) {
        this.graph = graph;
        this.diagnostics = diagnostics;
        this.maxPaths = config.getMaxPathsPerAction();
        this.maxConditions = config.getMaxConditionsPerPath();
        this.maxDepth = config.getMaxTraceDepth();
        this.maxSteps = config.getMaxTraceSteps();
        this.defaultDelaySeconds = config.getDefaultDelaySeconds();
    }

    /**
     * Traces every path from {@code node} back to a trigger. Work limits
     * apply per call.
     *
     * @param node    node to start from, normally the one wired into an action
     * @param visited nodes on the current walk; pass a fresh set per action
     * @return compiled paths, empty when no trigger can be reached
     */
    public List<CompiledPath> tracePaths(FlowNode node, Set<String> visited) {
        steps = 0;
        halted = false;
        limitReported = false;
        reportedNodes.clear();
        List<CompiledPath> paths = trace(node, visited);
        // partial results of a halted walk are dropped
        return halted ? List.of() : paths;
    }

    private List<CompiledPath> trace(FlowNode node, Set<String> visited) {
        if (halted) {
            return List.of();
        }
        if (++steps > maxSteps) {
            halted = true;
            logger.warning("Tracing stopped at node '" + node.id() + "' after " + maxSteps + " steps");
            diagnostics.error("Tracing stopped at node \"" + node.title() + "\" after " + maxSteps
                    + " steps. Gates sharing upstream branches are traced once per route; "
                    + "simplify the flow.", node);
            return List.of();
        }
        if (visited.contains(node.id())) {
            diagnostics.error("Cycle detected at node \"" + node.title()
                    + "\": automation graphs must be acyclic.", node);
            return List.of();
        }
        if (visited.size() >= maxDepth) {
            halted = true;
            diagnostics.error("Node \"" + node.title() + "\" is more than " + maxDepth
                    + " nodes upstream of the action. Shorten the chain of conditions and gates.", node);
            return List.of();
        }
        visited.add(node.id());
        try {
            return switch (node.kind()) {
                case TRIGGER -> List.of(CompiledPath.fromTrigger(node));
                case CONDITION -> traceCondition(node, visited);
                case AND_GATE -> traceAndGate(node, visited);
                case OR_GATE -> traceOrGate(node, visited);
                case NOT_GATE -> traceNotGate(node, visited);
                case DELAY_GATE -> traceDelayGate(node, visited);
                case ACTION, UNKNOWN -> traceUnknown(node, visited);
            };
        } finally {
            visited.remove(node.id());
        }
    }

    private List<CompiledPath> traceCondition(FlowNode node, Set<String> visited) {
        Optional<AutomationCondition> condition = extractCondition(node);

        Optional<FlowNode> upstream = findUpstream(node, FlowPorts.EVENT_IN);
        if (upstream.isEmpty()) {
            diagnostics.error("Condition node \"" + node.title()
                    + "\" has no upstream connection on its event input.", node);
            return List.of();
        }

        List<CompiledPath> upstreamPaths = trace(upstream.get(), visited);
        if (condition.isEmpty()) {
            return upstreamPaths;
        }
        List<AutomationCondition> prefix = List.of(condition.get());
        List<CompiledPath> result = new ArrayList<>(upstreamPaths.size());
        for (CompiledPath path : upstreamPaths) {
            if (path.conditions().size() + 1 > maxConditions) {
                return tooManyConditions(node, path.conditions().size() + 1);
            }
            result.add(path.withConditionsPrepended(prefix));
        }
        return result;
    }

    private List<CompiledPath> traceAndGate(FlowNode node, Set<String> visited) {
        List<FlowNode> inputs = connectedUpstreams(node);
        if (inputs.isEmpty()) {
            reportOnce(node, "AND gate \"" + node.title() + "\" has no connected inputs.");
            return List.of();
        }

        List<List<CompiledPath>> branches = new ArrayList<>(inputs.size());
        for (FlowNode upstream : inputs) {
            List<CompiledPath> branchPaths = trace(upstream, new HashSet<>(visited));
            if (!branchPaths.isEmpty()) {
                branches.add(branchPaths);
            }
        }

        if (branches.isEmpty()) {
            // a limit failure upstream is already reported
            if (!halted && !limitReported) {
                reportOnce(node, "AND gate \"" + node.title() + "\" has no valid upstream paths.");
            }
            return List.of();
        }

        List<CompiledPath> merged = branches.get(0);
        for (int i = 1; i < branches.size(); i++) {
            List<CompiledPath> branchPaths = branches.get(i);
            long combinations = (long) merged.size() * branchPaths.size();
            if (combinations > maxPaths) {
                return tooManyPaths(node, combinations);
            }
            List<CompiledPath> next = new ArrayList<>((int) combinations);
            for (CompiledPath existing : merged) {
                for (CompiledPath branch : branchPaths) {
                    if (!existing.triggerType().equals(branch.triggerType())) {
                        diagnostics.warning("AND gate \"" + node.title()
                                + "\" has inputs from different triggers (\"" + existing.triggerType()
                                + "\" and \"" + branch.triggerType() + "\"). Using the first trigger.", node);
                    }
                    int conditionCount = existing.conditions().size() + branch.conditions().size();
                    if (conditionCount > maxConditions) {
                        return tooManyConditions(node, conditionCount);
                    }
                    next.add(existing.mergedWith(branch));
                }
            }
            merged = next;
        }
        return merged;
    }

    private List<CompiledPath> traceOrGate(FlowNode node, Set<String> visited) {
        List<FlowNode> inputs = connectedUpstreams(node);
        if (inputs.isEmpty()) {
            reportOnce(node, "OR gate \"" + node.title() + "\" has no connected inputs.");
            return List.of();
        }

        List<CompiledPath> all = new ArrayList<>();
        for (FlowNode upstream : inputs) {
            all.addAll(trace(upstream, new HashSet<>(visited)));
            if (all.size() > maxPaths) {
                return tooManyPaths(node, all.size());
            }
        }
        return all;
    }

    private List<CompiledPath> traceNotGate(FlowNode node, Set<String> visited) {
        Optional<FlowNode> upstream = findUpstream(node, FlowPorts.EVENT_IN);
        if (upstream.isEmpty()) {
            diagnostics.error("NOT gate \"" + node.title() + "\" has no upstream connection.", node);
            return List.of();
        }

        List<CompiledPath> upstreamPaths = trace(upstream.get(), visited);
        List<CompiledPath> result = new ArrayList<>(upstreamPaths.size());
        for (CompiledPath path : upstreamPaths) {
            Optional<AutomationCondition> last = path.lastCondition();
            if (last.isEmpty()) {
                diagnostics.warning("NOT gate \"" + node.title()
                        + "\" has no condition to invert; the NOT gate is ignored.", node);
                result.add(path);
                continue;
            }
            result.add(path.withLastConditionReplaced(ConditionInverter.invert(last.get())));
        }
        return result;
    }

    private List<CompiledPath> traceDelayGate(FlowNode node, Set<String> visited) {
        Optional<FlowNode> upstream = findUpstream(node, FlowPorts.EVENT_IN);
        if (upstream.isEmpty()) {
            diagnostics.error("Delay gate \"" + node.title() + "\" has no upstream connection.", node);
            return List.of();
        }

        int delaySeconds = delaySeconds(node);
        List<CompiledPath> upstreamPaths = trace(upstream.get(), visited);
        List<CompiledPath> result = new ArrayList<>(upstreamPaths.size());
        for (CompiledPath path : upstreamPaths) {
            result.add(path.withDelay(delaySeconds));
        }
        return result;
    }

    private List<CompiledPath> traceUnknown(FlowNode node, Set<String> visited) {
        diagnostics.warning("Unknown node type \"" + node.type()
                + "\" encountered during path tracing. Attempting to trace through its first input.", node);
        for (InputPort input : node.inputs()) {
            Optional<FlowNode> upstream = graph.upstreamOf(input);
            if (upstream.isPresent()) {
                return trace(upstream.get(), visited);
            }
        }
        return List.of();
    }

    private List<CompiledPath> tooManyPaths(FlowNode node, long pathCount) {
        limitReported = true;
        if (reportOnce(node, node.kind().gateLabel() + " gate \"" + node.title() + "\" expands to "
                + pathCount + " paths, more than the limit of " + maxPaths
                + ". Split the flow or reduce nested OR gates.")) {
            logger.warning("Gate '" + node.id() + "' expands to " + pathCount
                    + " paths, limit is " + maxPaths);
        }
        return List.of();
    }

    private List<CompiledPath> tooManyConditions(FlowNode node, int conditionCount) {
        limitReported = true;
        if (reportOnce(node, "Node \"" + node.title() + "\" collects " + conditionCount
                + " conditions on one path, more than the limit of " + maxConditions
                + ". Avoid chaining AND gates over the same inputs.")) {
            logger.warning("Node '" + node.id() + "' collects " + conditionCount
                    + " conditions, limit is " + maxConditions);
        }
        return List.of();
    }

    /**
     * Reports an error for {@code node} unless one was already reported for it
     * during this trace. Returns whether the error was recorded.
     */
    private boolean reportOnce(FlowNode node, String message) {
        if (!reportedNodes.add(node.id())) {
            return false;
        }
        diagnostics.error(message, node);
        return true;
    }

    /**
     * Condition carried by a condition node. An unresolvable type yields empty
     * and the node is traced through without adding a condition.
     */
    private Optional<AutomationCondition> extractCondition(FlowNode node) {
        Optional<ConditionType> type = ConditionType.resolve(node.type());
        if (type.isEmpty()) {
            logger.fine("Condition node '" + node.id() + "' has unresolvable type '"
                    + node.type() + "', tracing through it");
            return Optional.empty();
        }
        return Optional.of(new AutomationCondition(type.get(), node.getConfig()));
    }

    private int delaySeconds(FlowNode node) {
        Object raw = node.getConfig().get(FlowPorts.DELAY_SECONDS);
        if (raw == null) {
            return defaultDelaySeconds;
        }
        Integer parsed = null;
        if (raw instanceof Number number) {
            parsed = wholeSeconds(number);
        } else if (raw instanceof String text) {
            try {
                parsed = Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                logger.fine("Delay gate '" + node.id() + "' has non-numeric delay '" + text + "'");
            }
        }
        if (parsed == null || parsed < 0) {
            diagnostics.warning("Delay gate \"" + node.title() + "\" has an invalid delay \"" + raw
                    + "\". Using the default of " + defaultDelaySeconds + " seconds.", node);
            return defaultDelaySeconds;
        }
        return parsed;
    }

    /**
     * Exact int value of {@code number}, or null for fractions, out of range
     * values, NaN and infinities.
     */
    private static Integer wholeSeconds(Number number) {
        try {
            return new BigDecimal(number.toString()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    /**
     * Upstream node wired into the input named {@code portType}. Nodes
     * without such an input fall back to their first connected input.
     */
    private Optional<FlowNode> findUpstream(FlowNode node, String portType) {
        Optional<InputPort> port = node.input(portType);
        if (port.isPresent()) {
            return graph.upstreamOf(port.get());
        }
        for (InputPort input : node.inputs()) {
            Optional<FlowNode> upstream = graph.upstreamOf(input);
            if (upstream.isPresent()) {
                return upstream;
            }
        }
        return Optional.empty();
    }

    private List<FlowNode> connectedUpstreams(FlowNode node) {
        List<FlowNode> upstreams = new ArrayList<>();
        for (InputPort input : node.connectedInputs()) {
            graph.upstreamOf(input).ifPresent(upstreams::add);
        }
        return upstreams;
    }
}
