package com.outagesentinel.aggregator.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.outagesentinel.core.model.NodeStatus;
import com.outagesentinel.core.util.JsonUtils;

import java.io.IOException;

/**
 * Wire format of the node status message:
 * {@code {nodeId, providerHint, state, region, regionWeight, controlOk, presence, ts}}.
 */
public final class NodeStatusCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private NodeStatusCodec() {
    }

    public static NodeStatus decode(String payload) {
        JsonNode node;
        try {
            node = MAPPER.readTree(payload);
        } catch (IOException e) {
            throw new IllegalArgumentException("Node status is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Node status must be a JSON object");
        }
        if (!node.path("nodeId").isTextual() || node.path("nodeId").asText().isBlank()) {
            throw new IllegalArgumentException("Node status is missing nodeId");
        }
        try {
            return MAPPER.treeToValue(node, NodeStatus.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed node status for " + node.path("nodeId").asText(), e);
        }
    }

    public static String encode(NodeStatus status) {
        try {
            return MAPPER.writeValueAsString(status);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize node status", e);
        }
    }
}
