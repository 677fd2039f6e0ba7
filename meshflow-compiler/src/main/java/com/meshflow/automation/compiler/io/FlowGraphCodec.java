/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.meshflow.automation.api.exceptions.CompilationException;
import com.meshflow.automation.api.graph.FlowGraph;
import com.meshflow.automation.api.graph.FlowNode;
import com.meshflow.automation.api.graph.InputPort;
import com.meshflow.automation.api.graph.NodeKind;
import com.meshflow.automation.api.graph.OutputPort;
import com.meshflow.automation.api.graph.PortRef;
import com.meshflow.automation.api.model.FlowGraphMetadata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * JSON codec for flow graphs and their round-trip metadata.
 *
 * <p>Graph format:
 * <pre>
 * {
 *   "nodes": [
 *     {"id": "t1", "type": "nodeOnline", "title": "Node Online", "kind": "TRIGGER",
 *      "inputs": [], "outputs": [{"type": "event_out", "title": "Event"}], "config": {"nodeNum": 42}},
 *     {"id": "a1", "type": "pushNotification", "title": "Notify",
 *      "inputs": [{"type": "action_in", "connection": {"nodeId": "t1", "outputType": "event_out"}}]}
 *   ]
 * }
 * </pre>
 * {@code kind} may be left out, in which case it is inferred from {@code type}.
 * Unknown fields, such as editor positions, are ignored.
 */
public final class FlowGraphCodec {

    private static final Logger logger = Logger.getLogger(FlowGraphCodec.class.getName());

    private final ObjectMapper objectMapper;

    public FlowGraphCodec() {
        this(JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build());
    }

    public FlowGraphCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(FlowGraph graph) {
        List<NodeJson> nodes = new ArrayList<>(graph.size());
        for (FlowNode node : graph.nodes()) {
            nodes.add(NodeJson.from(node));
        }
        return write(new GraphJson(nodes), "flow graph");
    }

    /**
     * @throws CompilationException if the JSON is malformed or a node lacks its id or type
     */
    public FlowGraph fromJson(String json) {
        GraphJson parsed = read(json, GraphJson.class, "flow graph");
        FlowGraph.Builder builder = FlowGraph.builder();
        if (parsed.nodes() != null) {
            for (NodeJson node : parsed.nodes()) {
                builder.add(node.toNode());
            }
        }
        FlowGraph graph = builder.build();
        logger.fine("Decoded flow graph with " + graph.size() + " nodes");
        return graph;
    }

    public String metadataToJson(FlowGraphMetadata metadata) {
        return write(metadata, "flow graph metadata");
    }

    /**
     * @throws CompilationException if the JSON is malformed
     */
    public FlowGraphMetadata metadataFromJson(String json) {
        return read(json, FlowGraphMetadata.class, "flow graph metadata");
    }

    private String write(Object value, String what) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CompilationException("Failed to serialize " + what + ": " + e.getOriginalMessage(), e);
        }
    }

    private <T> T read(String json, Class<T> type, String what) {
        if (json == null || json.isBlank()) {
            throw new CompilationException("Cannot parse " + what + ": input is empty");
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new CompilationException("Malformed " + what + " JSON: " + e.getOriginalMessage(), e);
        }
    }

    // ========================================================================
    // WIRE FORMAT
    // ========================================================================

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GraphJson(@JsonProperty("nodes") List<NodeJson> nodes) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record NodeJson(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("title") String title,
        @JsonProperty("kind") NodeKind kind,
        @JsonProperty("inputs") List<InputJson> inputs,
        @JsonProperty("outputs") List<OutputJson> outputs,
        @JsonProperty("config") Map<String, Object> config
    ) {
        static NodeJson from(FlowNode node) {
            List<InputJson> inputs = new ArrayList<>(node.inputs().size());
            for (InputPort input : node.inputs()) {
                PortRef ref = input.connection();
                inputs.add(new InputJson(input.type(), input.title(),
                        ref == null ? null : new ConnectionJson(ref.nodeId(), ref.outputType())));
            }
            List<OutputJson> outputs = new ArrayList<>(node.outputs().size());
            for (OutputPort output : node.outputs()) {
                outputs.add(new OutputJson(output.type(), output.title()));
            }
            return new NodeJson(node.id(), node.type(), node.title(), node.kind(), inputs, outputs,
                    new LinkedHashMap<>(node.getConfig()));
        }

        FlowNode toNode() {
            if (id == null || id.isBlank()) {
                throw new CompilationException("Flow graph node is missing its id");
            }
            if (type == null || type.isBlank()) {
                throw new CompilationException("Flow graph node '" + id + "' is missing its type");
            }
            List<InputPort> inputPorts = new ArrayList<>();
            if (inputs != null) {
                for (InputJson input : inputs) {
                    if (input.type() == null) {
                        throw new CompilationException("Node '" + id + "' has an input without a type");
                    }
                    PortRef ref = input.connection() == null || input.connection().nodeId() == null
                            ? null
                            : new PortRef(input.connection().nodeId(), input.connection().outputType());
                    inputPorts.add(new InputPort(input.type(), input.title(), ref));
                }
            }
            List<OutputPort> outputPorts = new ArrayList<>();
            if (outputs != null) {
                for (OutputJson output : outputs) {
                    if (output.type() == null) {
                        throw new CompilationException("Node '" + id + "' has an output without a type");
                    }
                    outputPorts.add(new OutputPort(output.type(), output.title()));
                }
            }
            return new FlowNode(id, type, title, kind, inputPorts, outputPorts, config);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record InputJson(
        @JsonProperty("type") String type,
        @JsonProperty("title") String title,
        @JsonProperty("connection") ConnectionJson connection
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OutputJson(@JsonProperty("type") String type, @JsonProperty("title") String title) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ConnectionJson(@JsonProperty("nodeId") String nodeId, @JsonProperty("outputType") String outputType) {
    }
}
